/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.api;

import com.veil.blocklist.api.model.CompiledPattern;
import io.opentelemetry.api.trace.Tracer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Contract for turning raw blocklist patterns into their typed form.
 */
public interface IPatternCompiler {

    /**
     * Compiles a single pattern.
     *
     * @param raw pattern text, may be {@code null}
     * @return the compiled pattern, or empty if the input is null, blank or too long
     */
    Optional<CompiledPattern> compile(String raw);

    /**
     * Compiles a batch, dropping rejected entries and keeping input order.
     * Duplicates are not removed here.
     *
     * @param raws pattern texts
     * @return compiled patterns in input order
     */
    List<CompiledPattern> compileAll(Collection<String> raws);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
