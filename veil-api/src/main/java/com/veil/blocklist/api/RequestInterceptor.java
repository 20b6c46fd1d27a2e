/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api;

import com.veil.blocklist.api.model.RequestDecision;

/**
 * Hook invoked by the browser's network layer for every outgoing request.
 */
@FunctionalInterface
public interface RequestInterceptor {

    /**
     * @param url absolute URL of the outgoing request
     * @return whether the request may proceed; unparseable URLs are allowed
     */
    RequestDecision onBeforeRequest(String url);
}
