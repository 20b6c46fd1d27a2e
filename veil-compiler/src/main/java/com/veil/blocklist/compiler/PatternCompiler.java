package com.veil.blocklist.compiler;

import com.veil.blocklist.api.CompilationListener;
import com.veil.blocklist.api.IPatternCompiler;
import com.veil.blocklist.api.model.CompiledPattern;
import com.veil.blocklist.api.model.DomainAnchor;
import com.veil.blocklist.api.model.Literal;
import com.veil.blocklist.api.model.Wildcard;
import com.veil.blocklist.runtime.url.DomainNames;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies raw blocklist entries into {@link DomainAnchor}, {@link Wildcard}
 * or {@link Literal}.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>{@code ||domain^} with a syntactically valid domain becomes a domain
 *       anchor. A leading {@code *.} is dropped, so {@code ||*.ads.com^} and
 *       {@code ||ads.com^} are the same pattern. An anchor whose text contains
 *       {@code *}, such as {@code ||ads*.example.com^}, becomes a wildcard over
 *       that text. An anchor around anything else is kept as a literal.</li>
 *   <li>Text containing {@code *} and at least one other character becomes a
 *       wildcard. Runs of {@code *} collapse; every other character, including
 *       {@code ( ) + | ? [ ]}, is literal text.</li>
 *   <li>Everything else is a literal. A literal that reads as a bare domain
 *       with at least two labels is matched like a domain anchor.</li>
 * </ol>
 *
 * <p>Null, blank and over-long input is dropped without an error. Nothing here
 * ever builds a {@link java.util.regex.Pattern}.
 */
public class PatternCompiler implements IPatternCompiler {
    private static final Logger logger = Logger.getLogger(PatternCompiler.class.getName());

    public static final int DEFAULT_MAX_PATTERN_LENGTH = 512;

    private static final String ANCHOR_PREFIX = "||";
    private static final String ANCHOR_SUFFIX = "^";
    private static final String SUBDOMAIN_WILDCARD = "*.";

    private final int maxPatternLength;
    private Tracer tracer;
    private CompilationListener listener;

    public PatternCompiler(Tracer tracer) {
        this(tracer, DEFAULT_MAX_PATTERN_LENGTH);
    }

    public PatternCompiler(Tracer tracer, int maxPatternLength) {
        if (maxPatternLength <= 0) {
            throw new IllegalArgumentException("maxPatternLength must be positive: " + maxPatternLength);
        }
        this.tracer = tracer;
        this.maxPatternLength = maxPatternLength;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    public int maxPatternLength() {
        return maxPatternLength;
    }

    @Override
    public Optional<CompiledPattern> compile(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.length() > maxPatternLength) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Dropping pattern longer than " + maxPatternLength + " chars: "
                        + trimmed.substring(0, Math.min(64, maxPatternLength)) + "...");
            }
            return Optional.empty();
        }

        String normalized = trimmed.toLowerCase(Locale.ROOT);
        if (isDomainAnchor(normalized)) {
            return Optional.of(compileAnchor(trimmed, normalized));
        }
        if (normalized.indexOf('*') >= 0) {
            return Optional.of(compileWildcard(trimmed, normalized));
        }
        return Optional.of(literal(trimmed, normalized));
    }

    @Override
    public List<CompiledPattern> compileAll(Collection<String> raws) {
        Span span = tracer.spanBuilder("compile-patterns").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("inputCount", raws.size());
            notifyStageStart();
            long startTime = System.nanoTime();

            List<CompiledPattern> compiled = new ArrayList<>(raws.size());
            int domainAnchors = 0;
            int wildcards = 0;
            int literals = 0;
            for (String raw : raws) {
                Optional<CompiledPattern> pattern = compile(raw);
                if (pattern.isEmpty()) {
                    continue;
                }
                compiled.add(pattern.get());
                switch (pattern.get().kind()) {
                    case DOMAIN_ANCHOR -> domainAnchors++;
                    case WILDCARD -> wildcards++;
                    case LITERAL -> literals++;
                }
            }

            long duration = System.nanoTime() - startTime;
            int rejected = raws.size() - compiled.size();
            span.setAttribute("compiledCount", compiled.size());
            span.setAttribute("rejectedCount", rejected);
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(duration));
            if (rejected > 0) {
                logger.fine(rejected + " of " + raws.size() + " patterns rejected");
            }

            notifyStageComplete(new CompilationListener.StageResult(
                    CompilationListener.STAGE_PARSING,
                    duration,
                    Map.of("accepted", compiled.size(),
                            "rejected", rejected,
                            "domainAnchors", domainAnchors,
                            "wildcards", wildcards,
                            "literals", literals)));
            return compiled;
        } catch (RuntimeException e) {
            span.recordException(e);
            if (listener != null) {
                listener.onError(CompilationListener.STAGE_PARSING, e);
            }
            throw e;
        } finally {
            span.end();
        }
    }

    private static boolean isDomainAnchor(String normalized) {
        return normalized.length() > ANCHOR_PREFIX.length() + ANCHOR_SUFFIX.length()
                && normalized.startsWith(ANCHOR_PREFIX)
                && normalized.endsWith(ANCHOR_SUFFIX);
    }

    private CompiledPattern compileAnchor(String raw, String normalized) {
        String domain = normalized.substring(ANCHOR_PREFIX.length(), normalized.length() - ANCHOR_SUFFIX.length());
        if (domain.startsWith(SUBDOMAIN_WILDCARD)) {
            domain = domain.substring(SUBDOMAIN_WILDCARD.length());
        }
        if (DomainNames.isValidDomain(domain, false)) {
            return new DomainAnchor(raw, domain);
        }
        if (domain.indexOf('*') >= 0 && hasLiteralText(domain)) {
            return compileWildcard(raw, "*" + domain + "*");
        }
        logger.fine("Anchor does not enclose a valid domain, keeping as literal that will not match URLs: " + raw);
        return new Literal(raw, normalized, null);
    }

    private CompiledPattern compileWildcard(String raw, String normalized) {
        List<String> fragments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= normalized.length(); i++) {
            if (i == normalized.length() || normalized.charAt(i) == '*') {
                if (i > start) {
                    fragments.add(normalized.substring(start, i));
                }
                start = i + 1;
            }
        }
        if (fragments.isEmpty()) {
            // "*", "**", ...: nothing to anchor a search on
            return new Literal(raw, normalized, null);
        }
        return new Wildcard(raw, fragments, normalized.startsWith("*"), normalized.endsWith("*"));
    }

    private static boolean hasLiteralText(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '*') {
                return true;
            }
        }
        return false;
    }

    private static Literal literal(String raw, String normalized) {
        String domain = DomainNames.isValidDomain(normalized, true) ? normalized : null;
        return new Literal(raw, normalized, domain);
    }

    private void notifyStageStart() {
        if (listener != null) {
            listener.onStageStart(CompilationListener.STAGE_PARSING, 1, 2);
        }
    }

    private void notifyStageComplete(CompilationListener.StageResult result) {
        if (listener != null) {
            listener.onStageComplete(CompilationListener.STAGE_PARSING, result);
        }
    }
}
