/*
 * Copyright (c) 2025 Veil Blocklist Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.veil.blocklist.matcher;

import com.veil.blocklist.api.CompilationListener;
import com.veil.blocklist.api.IPatternCompiler;
import com.veil.blocklist.api.IUrlMatcher;
import com.veil.blocklist.api.exceptions.MatcherInitializationException;
import com.veil.blocklist.api.model.CompiledPattern;
import com.veil.blocklist.api.model.DomainAnchor;
import com.veil.blocklist.api.model.Literal;
import com.veil.blocklist.api.model.MatcherStats;
import com.veil.blocklist.api.model.Wildcard;
import com.veil.blocklist.compiler.PatternCompiler;
import com.veil.blocklist.config.MatcherConfig;
import com.veil.blocklist.infra.metrics.MetricsRegistry;
import com.veil.blocklist.infra.telemetry.TracingService;
import com.veil.blocklist.runtime.bloom.BloomFilter;
import com.veil.blocklist.runtime.index.DomainIndex;
import com.veil.blocklist.runtime.url.ParsedUrl;
import com.veil.blocklist.runtime.url.RequestUrlParser;
import com.veil.blocklist.runtime.wildcard.WildcardAutomaton;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Blocklist matcher combining a Bloom pre-check, a label-wise domain index and
 * linear-time wildcard automata.
 *
 * <h2>Lookup</h2>
 * <ol>
 *   <li>Parse the URL and extract the lowercased host. Unparseable input is
 *       not blocked.</li>
 *   <li>Probe the Bloom filter with the host and each parent domain. When none
 *       can be present and no automaton is registered, the URL is clean.</li>
 *   <li>Walk the domain index; an indexed ancestor blocks the host.</li>
 *   <li>Run the wildcard and substring automata in registration order against
 *       the full URL.</li>
 * </ol>
 * Every step is bounded by the input length and the registered pattern count;
 * no step backtracks.
 *
 * <h2>Lifecycle</h2>
 * {@link #initialize(List)} moves the matcher to the initialized state and
 * {@link #clear()} moves it back. Patterns added before initialization are
 * kept but nothing matches until then.
 *
 * <p><b>Thread safety:</b> none. Owners that share a matcher across threads
 * must serialize mutations against lookups, as
 * {@link com.veil.blocklist.privacy.TrackerBlocker} does.
 */
public class PatternMatcher implements IUrlMatcher {
    private static final Logger logger = Logger.getLogger(PatternMatcher.class.getName());

    private final MatcherConfig config;
    private final IPatternCompiler compiler;
    private final MatcherMetrics metrics;
    private Tracer tracer;
    private CompilationListener listener;

    private final BloomFilter bloomFilter;
    private final DomainIndex domainIndex = new DomainIndex();
    private final Object2ObjectLinkedOpenHashMap<String, CompiledPattern> patterns =
            new Object2ObjectLinkedOpenHashMap<>();
    private final Object2ObjectLinkedOpenHashMap<String, WildcardAutomaton> automata =
            new Object2ObjectLinkedOpenHashMap<>();

    private boolean initialized;

    public PatternMatcher() {
        this(MatcherConfig.fromEnvironment(), TracingService.getInstance().getTracer());
    }

    public PatternMatcher(MatcherConfig config, Tracer tracer) {
        this(config, tracer, new PatternCompiler(tracer, config.getMaxPatternLength()), MetricsRegistry.getInstance());
    }

    public PatternMatcher(MatcherConfig config, Tracer tracer, IPatternCompiler compiler, MetricsRegistry metrics) {
        this.config = config;
        this.tracer = tracer;
        this.compiler = compiler;
        this.compiler.setTracer(tracer);
        this.metrics = new MatcherMetrics(metrics);
        this.bloomFilter = config.getBloomFilterBits()
                .map(bits -> BloomFilter.withSize(bits, config.getHashFunctions()))
                .orElseGet(() -> BloomFilter.forExpectedInsertions(
                        config.getExpectedPatterns(), config.getFalsePositiveRate()));
        logger.fine("Created matcher with " + bloomFilter);
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
        compiler.setTracer(tracer);
    }

    /**
     * Receives PARSING and INDEXING stage events from {@link #initialize(List)}.
     *
     * @param listener stage listener, or {@code null} to disable
     */
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
        compiler.setCompilationListener(listener);
    }

    @Override
    public void initialize(List<String> rawPatterns) {
        List<String> input = rawPatterns != null ? rawPatterns : Collections.emptyList();
        Span span = tracer.spanBuilder("initialize-matcher").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("inputCount", input.size());
            long startTime = System.nanoTime();

            List<CompiledPattern> compiled = compiler.compileAll(input);

            notifyStageStart(CompilationListener.STAGE_INDEXING);
            long indexStart = System.nanoTime();
            int added = 0;
            int duplicates = 0;
            int overCapacity = 0;
            for (CompiledPattern pattern : compiled) {
                if (patterns.containsKey(pattern.key())) {
                    duplicates++;
                } else if (patterns.size() >= config.getMaxPatterns()) {
                    overCapacity++;
                } else {
                    register(pattern);
                    added++;
                }
            }
            if (overCapacity > 0) {
                logger.warning(String.format("Pattern limit of %d reached, %d patterns ignored",
                        config.getMaxPatterns(), overCapacity));
            }
            initialized = true;

            MatcherStats stats = getStats();
            long indexDuration = System.nanoTime() - indexStart;
            long totalDuration = System.nanoTime() - startTime;
            notifyStageComplete(new CompilationListener.StageResult(
                    CompilationListener.STAGE_INDEXING,
                    indexDuration,
                    Map.of("added", added,
                            "duplicates", duplicates,
                            "overCapacity", overCapacity,
                            "domains", stats.domains(),
                            "automata", automata.size())));

            metrics.recordInitialize(totalDuration);
            metrics.updateSize(stats);
            span.setAttribute("addedCount", added);
            span.setAttribute("patternCount", stats.patterns());
            span.setAttribute("domainCount", stats.domains());
            span.setAttribute("bloomFilterUsage", stats.bloomFilterUsage());
            logger.info(String.format("Matcher initialized with %d patterns (%d domains, %d automata) in %d ms",
                    stats.patterns(), stats.domains(), automata.size(),
                    TimeUnit.NANOSECONDS.toMillis(totalDuration)));
        } catch (OutOfMemoryError e) {
            clear();
            MatcherInitializationException failure =
                    new MatcherInitializationException("Out of memory while building the matcher", e);
            span.recordException(failure);
            if (listener != null) {
                listener.onError(CompilationListener.STAGE_INDEXING, failure);
            }
            throw failure;
        } finally {
            span.end();
        }
    }

    @Override
    public boolean matches(String url) {
        if (!initialized || url == null || url.isEmpty()) {
            return false;
        }
        try {
            boolean matched = lookup(url);
            metrics.recordLookup(matched);
            return matched;
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Lookup failed, treating URL as not blocked", e);
            return false;
        }
    }

    private boolean lookup(String url) {
        Optional<ParsedUrl> parsed = RequestUrlParser.parse(url);
        if (parsed.isEmpty()) {
            return false;
        }
        ParsedUrl request = parsed.get();
        boolean maybeIndexed = domainIndex.size() > 0 && request.anyHostSuffix(bloomFilter::mightContain);
        if (!maybeIndexed && automata.isEmpty()) {
            return false;
        }
        if (maybeIndexed && domainIndex.query(request.host())) {
            return true;
        }
        for (WildcardAutomaton automaton : automata.values()) {
            if (automaton.matches(request.url())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void addPattern(String pattern) {
        compiler.compile(pattern).ifPresent(compiled -> {
            if (patterns.containsKey(compiled.key())) {
                return;
            }
            if (patterns.size() >= config.getMaxPatterns()) {
                logger.warning("Pattern limit of " + config.getMaxPatterns() + " reached, ignoring: " + compiled.raw());
                return;
            }
            register(compiled);
            metrics.updateSize(getStats());
        });
    }

    @Override
    public void removePattern(String pattern) {
        compiler.compile(pattern).ifPresent(compiled -> {
            CompiledPattern registered = patterns.remove(compiled.key());
            if (registered == null) {
                return;
            }
            unregister(registered);
            metrics.updateSize(getStats());
        });
    }

    @Override
    public void clear() {
        patterns.clear();
        automata.clear();
        domainIndex.clear();
        bloomFilter.clear();
        initialized = false;
        metrics.updateSize(MatcherStats.EMPTY);
    }

    @Override
    public MatcherStats getStats() {
        return new MatcherStats(patterns.size(), domainIndex.size(), bloomFilter.usage());
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /**
     * @return the registered patterns' source text in registration order
     */
    public List<String> patterns() {
        List<String> raws = new ArrayList<>(patterns.size());
        for (CompiledPattern pattern : patterns.values()) {
            raws.add(pattern.raw());
        }
        return raws;
    }

    public MatcherConfig config() {
        return config;
    }

    private void register(CompiledPattern pattern) {
        if (pattern instanceof DomainAnchor anchor) {
            indexDomain(anchor.domain());
        } else if (pattern instanceof Wildcard wildcard) {
            automata.put(wildcard.key(), WildcardAutomaton.compile(wildcard));
        } else if (pattern instanceof Literal literal) {
            if (literal.domain() != null) {
                indexDomain(literal.domain());
            } else {
                automata.put(literal.key(), WildcardAutomaton.substring(literal.value()));
            }
        }
        patterns.put(pattern.key(), pattern);
    }

    // Bloom bits are never cleared here; the domain index has the final say.
    private void unregister(CompiledPattern pattern) {
        if (pattern instanceof DomainAnchor anchor) {
            domainIndex.remove(anchor.domain());
        } else if (pattern instanceof Literal literal && literal.domain() != null) {
            domainIndex.remove(literal.domain());
        } else {
            automata.remove(pattern.key());
        }
    }

    private void indexDomain(String domain) {
        domainIndex.insert(domain);
        bloomFilter.put(domain);
    }

    private void notifyStageStart(String stage) {
        if (listener != null) {
            listener.onStageStart(stage, 2, 2);
        }
    }

    private void notifyStageComplete(CompilationListener.StageResult result) {
        if (listener != null) {
            listener.onStageComplete(result.stageName(), result);
        }
    }
}
