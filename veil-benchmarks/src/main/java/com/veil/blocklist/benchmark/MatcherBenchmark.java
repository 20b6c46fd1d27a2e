package com.veil.blocklist.benchmark;

import com.veil.blocklist.api.model.MatcherStats;
import com.veil.blocklist.config.MatcherConfig;
import com.veil.blocklist.matcher.PatternMatcher;
import com.veil.blocklist.privacy.TrackerBlocker;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lookup and build cost of {@link PatternMatcher} over synthetic blocklists.
 * <p>
 * The pattern mix is roughly what public tracker lists contain: mostly domain
 * anchors, a tail of path wildcards and a few plain substrings. Lookups rotate
 * through a pool where about a quarter of the URLs are blocked.
 * <p>
 * USAGE:
 * mvn clean install -DskipTests
 * mvn exec:java -pl veil-benchmarks \
 * -Dexec.mainClass="com.veil.blocklist.benchmark.MatcherBenchmark"
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer, shorter iterations
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 2)
public class MatcherBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("noop");
    private static final int URL_POOL_SIZE = 4_096;

    @Param({"1000", "10000", "100000"})
    private int patternCount;

    private List<String> patterns;
    private PatternMatcher matcher;
    private TrackerBlocker blocker;
    private String[] urls;
    private String adversarialUrl;
    private final AtomicInteger urlIndex = new AtomicInteger();

    // ========================================================================
    // SETUP
    // ========================================================================

    @Setup(Level.Trial)
    public void setupTrial() {
        java.util.logging.Logger.getLogger("").setLevel(java.util.logging.Level.WARNING);

        patterns = generatePatterns(patternCount, new Random(42));
        matcher = newMatcher();
        matcher.initialize(patterns);
        blocker = new TrackerBlocker(newMatcher(), null, java.time.Clock.systemUTC(), patterns);

        urls = generateUrls(new Random(7));
        adversarialUrl = "https://" + "a".repeat(50) + ".example.org/" + "a".repeat(10_000);

        MatcherStats stats = matcher.getStats();
        System.out.printf("%nPatterns: %d  Domains: %d  Bloom usage: %.3f%n",
                stats.patterns(), stats.domains(), stats.bloomFilterUsage());
    }

    private PatternMatcher newMatcher() {
        MatcherConfig config = MatcherConfig.defaults().toBuilder()
                .maxPatterns(Math.max(patternCount, MatcherConfig.DEFAULT_MAX_PATTERNS))
                .expectedPatterns(patternCount)
                .build();
        return new PatternMatcher(config, NOOP_TRACER);
    }

    // ========================================================================
    // BENCHMARKS
    // ========================================================================

    @Benchmark
    public boolean lookup_mixed() {
        return matcher.matches(nextUrl());
    }

    @Benchmark
    public boolean lookup_adversarial() {
        return matcher.matches(adversarialUrl);
    }

    @Benchmark
    @Threads(4)
    public boolean blocker_concurrent() {
        return blocker.shouldBlock(nextUrl());
    }

    @Benchmark
    @BenchmarkMode(Mode.SingleShotTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void initialize(Blackhole bh) {
        PatternMatcher fresh = newMatcher();
        fresh.initialize(patterns);
        bh.consume(fresh.getStats());
    }

    // ========================================================================
    // DATA GENERATION
    // ========================================================================

    private String nextUrl() {
        return urls[urlIndex.getAndIncrement() & (URL_POOL_SIZE - 1)];
    }

    private static List<String> generatePatterns(int count, Random rand) {
        List<String> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int kind = rand.nextInt(100);
            if (kind < 80) {
                result.add("||tracker" + i + "." + tld(rand) + "^");
            } else if (kind < 95) {
                result.add("*/pixel" + i + "/*.gif");
            } else {
                result.add("beacon-" + i);
            }
        }
        return result;
    }

    private String[] generateUrls(Random rand) {
        String[] pool = new String[URL_POOL_SIZE];
        for (int i = 0; i < pool.length; i++) {
            int id = rand.nextInt(patternCount);
            switch (rand.nextInt(4)) {
                case 0:
                    pool[i] = "https://cdn.tracker" + id + "." + tld(rand) + "/collect?v=" + i;
                    break;
                case 1:
                    pool[i] = "https://news" + id + ".example.org/article/" + i;
                    break;
                case 2:
                    pool[i] = "https://static.site" + id + ".net/assets/app.js";
                    break;
                default:
                    pool[i] = "https://shop" + id + ".example.com/cart?item=" + i;
                    break;
            }
        }
        return pool;
    }

    private static String tld(Random rand) {
        switch (rand.nextInt(3)) {
            case 0:
                return "com";
            case 1:
                return "net";
            default:
                return "io";
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(MatcherBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(1))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .shouldFailOnError(true)
                .build();
        new Runner(opt).run();
    }
}
