/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api;

import com.veil.blocklist.api.model.BlockDecision;

/**
 * Fire-and-forget receiver of interception decisions.
 *
 * <p>Called on the request path, so implementations must return quickly and
 * must not throw.
 */
@FunctionalInterface
public interface ActivityLogSink {

    ActivityLogSink DISCARD = decision -> { };

    void record(BlockDecision decision);
}
