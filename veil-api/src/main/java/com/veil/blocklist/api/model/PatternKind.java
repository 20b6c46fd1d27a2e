/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

/**
 * Syntactic category assigned to a blocklist pattern by the compiler.
 */
public enum PatternKind {
    /** {@code ||domain^}: the domain and all of its subdomains. */
    DOMAIN_ANCHOR,

    /** Glob with at least one {@code *} and one literal fragment. */
    WILDCARD,

    /** Anything else: a bare domain or an exact substring of the URL. */
    LITERAL
}
