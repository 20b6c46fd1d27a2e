/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.exceptions;

/**
 * Thrown when bulk initialization cannot complete because of a resource-level
 * fault, such as running out of memory.
 *
 * <p>A partially-built matcher has ill-defined matching semantics, so the
 * matcher is reset before this is thrown.
 */
public class MatcherInitializationException extends RuntimeException {

    public MatcherInitializationException(String message) {
        super(message);
    }

    public MatcherInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
