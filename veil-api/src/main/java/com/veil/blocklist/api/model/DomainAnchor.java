/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

import java.util.Objects;

/**
 * EasyList domain anchor ({@code ||domain^}).
 *
 * @param raw    trimmed source text
 * @param domain lowercased domain, without a leading {@code *.}
 */
public record DomainAnchor(String raw, String domain) implements CompiledPattern {

    public DomainAnchor {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(domain, "domain");
    }

    @Override
    public PatternKind kind() {
        return PatternKind.DOMAIN_ANCHOR;
    }

    @Override
    public String key() {
        return "||" + domain + "^";
    }
}
