/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Glob-style URL pattern decomposed into literal fragments.
 *
 * <p>{@code *://*.hotjar.com/*} becomes fragments {@code ["://", ".hotjar.com/"]}
 * with both anchor flags set. Characters such as {@code ( ) + |} are plain
 * characters inside a fragment.
 *
 * @param raw              trimmed source text
 * @param fragments        lowercased non-empty literal runs between {@code *} tokens, in order
 * @param leadingWildcard  whether the pattern starts with {@code *}
 * @param trailingWildcard whether the pattern ends with {@code *}
 */
public record Wildcard(String raw,
                       List<String> fragments,
                       boolean leadingWildcard,
                       boolean trailingWildcard) implements CompiledPattern {

    public Wildcard {
        Objects.requireNonNull(raw, "raw");
        fragments = List.copyOf(fragments);
        if (fragments.isEmpty()) {
            throw new IllegalArgumentException("Wildcard pattern needs at least one literal fragment: " + raw);
        }
    }

    @Override
    public PatternKind kind() {
        return PatternKind.WILDCARD;
    }

    @Override
    public String key() {
        StringBuilder key = new StringBuilder();
        if (leadingWildcard) {
            key.append('*');
        }
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                key.append('*');
            }
            key.append(fragments.get(i));
        }
        if (trailingWildcard) {
            key.append('*');
        }
        return key.toString();
    }
}
