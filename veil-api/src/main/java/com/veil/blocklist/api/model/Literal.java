/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Pattern without wildcard or anchor syntax.
 *
 * <p>When {@code value} is a bare domain it is matched on label boundaries
 * through the domain index, exactly like a domain anchor. Otherwise it matches
 * any URL containing {@code value}.
 *
 * <p>Domain literals are never substring-matched: {@code tracker.com} blocks
 * {@code a.tracker.com} but not {@code mytracker.com}.
 *
 * @param raw    trimmed source text
 * @param value  lowercased pattern text
 * @param domain {@code value} when it parses as a bare domain, otherwise {@code null}
 */
public record Literal(String raw, String value, String domain) implements CompiledPattern {

    public Literal {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(value, "value");
    }

    public Optional<String> domainName() {
        return Optional.ofNullable(domain);
    }

    @Override
    public PatternKind kind() {
        return PatternKind.LITERAL;
    }

    @Override
    public String key() {
        return value;
    }
}
