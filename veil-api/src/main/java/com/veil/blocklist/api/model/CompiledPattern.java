/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

/**
 * Typed intermediate form of a blocklist pattern.
 *
 * <p>Produced exactly once by the pattern compiler. Everything downstream of
 * compilation dispatches on the concrete variant and never looks at the raw
 * pattern text again.
 *
 * <h2>Identity</h2>
 * <p>Two raw strings that compile to the same {@link #key()} are the same
 * pattern: adding the second one is a no-op, and removing either removes both.
 * For example {@code ||Tracker.COM^} and {@code ||tracker.com^} share the key
 * {@code ||tracker.com^}.
 */
public sealed interface CompiledPattern permits DomainAnchor, Wildcard, Literal {

    /**
     * @return the trimmed pattern exactly as supplied
     */
    String raw();

    /**
     * @return the category of this pattern
     */
    PatternKind kind();

    /**
     * @return canonical, lowercased identity of this pattern
     */
    String key();
}
