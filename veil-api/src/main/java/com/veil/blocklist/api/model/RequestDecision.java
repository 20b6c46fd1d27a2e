/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

/**
 * Verdict returned to the network-request interception hook.
 */
public enum RequestDecision {
    ALLOW,
    CANCEL;

    public boolean isCancelled() {
        return this == CANCEL;
    }
}
