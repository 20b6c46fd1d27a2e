/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

import java.time.Instant;

/**
 * Record of one interception decision, handed to an activity log sink.
 *
 * @param url       request URL, truncated to {@link #MAX_URL_LENGTH} characters
 * @param host      lowercased host, or {@code null} when the URL did not parse
 * @param blocked   whether the request was cancelled
 * @param reason    which rule set produced the decision
 * @param timestamp when the decision was made
 */
public record BlockDecision(
        String url,
        String host,
        boolean blocked,
        Reason reason,
        Instant timestamp
) {
    public static final int MAX_URL_LENGTH = 100;

    public enum Reason {
        /** Matched a compiled blocklist pattern. */
        PATTERN,
        /** Matched a user-defined custom rule. */
        CUSTOM_RULE,
        /** Nothing matched. */
        NONE
    }

    public static BlockDecision blocked(String url, String host, Reason reason, Instant timestamp) {
        return new BlockDecision(truncate(url), host, true, reason, timestamp);
    }

    public static BlockDecision allowed(String url, String host, Instant timestamp) {
        return new BlockDecision(truncate(url), host, false, Reason.NONE, timestamp);
    }

    private static String truncate(String url) {
        if (url == null || url.length() <= MAX_URL_LENGTH) {
            return url;
        }
        return url.substring(0, MAX_URL_LENGTH);
    }
}
