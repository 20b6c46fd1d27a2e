package com.veil.blocklist.privacy;

import com.veil.blocklist.activity.LoggingActivityLogSink;
import com.veil.blocklist.api.ActivityLogSink;
import com.veil.blocklist.api.RequestInterceptor;
import com.veil.blocklist.api.exceptions.MatcherInitializationException;
import com.veil.blocklist.api.model.BlockDecision;
import com.veil.blocklist.api.model.MatcherStats;
import com.veil.blocklist.api.model.RequestDecision;
import com.veil.blocklist.compiler.BlocklistParser;
import com.veil.blocklist.matcher.PatternMatcher;
import com.veil.blocklist.runtime.url.ParsedUrl;
import com.veil.blocklist.runtime.url.RequestUrlParser;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether outgoing requests are blocked as trackers or ads.
 *
 * <p>Owns one {@link PatternMatcher}. Lookups run under the read lock and every
 * mutation under the write lock, so request threads never observe a
 * half-applied change. The matcher starts with the bundled
 * {@value #DEFAULT_BLOCKLIST_RESOURCE}.
 *
 * <p>Custom rules are user-entered strings checked as case-insensitive
 * substrings of the URL. They are kept apart from the matcher, so adding or
 * removing one never touches a blocklist entry with the same text.
 */
public class TrackerBlocker implements RequestInterceptor {
    private static final Logger logger = Logger.getLogger(TrackerBlocker.class.getName());

    public static final String DEFAULT_BLOCKLIST_RESOURCE = "default-blocklist.txt";
    public static final int MAX_CUSTOM_RULE_LENGTH = 200;

    private final PatternMatcher matcher;
    private final ActivityLogSink activityLog;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    // rule -> lowercased rule, insertion ordered
    private final Map<String, String> customRules = new Object2ObjectLinkedOpenHashMap<>();
    private List<String> blocklist;
    private volatile boolean enabled = true;

    public TrackerBlocker() {
        this(new PatternMatcher(), new LoggingActivityLogSink());
    }

    public TrackerBlocker(PatternMatcher matcher, ActivityLogSink activityLog) {
        this(matcher, activityLog, Clock.systemUTC(), loadDefaultBlocklist());
    }

    public TrackerBlocker(PatternMatcher matcher, ActivityLogSink activityLog, Clock clock, List<String> blocklist) {
        this.matcher = matcher;
        this.activityLog = activityLog != null ? activityLog : ActivityLogSink.DISCARD;
        this.clock = clock;
        this.blocklist = List.copyOf(blocklist);
        writeLock.lock();
        try {
            matcher.initialize(this.blocklist);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Reads the bundled blocklist from the classpath.
     */
    public static List<String> loadDefaultBlocklist() {
        InputStream in = TrackerBlocker.class.getClassLoader().getResourceAsStream(DEFAULT_BLOCKLIST_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing classpath resource " + DEFAULT_BLOCKLIST_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return BlocklistParser.parse(reader).patterns();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_BLOCKLIST_RESOURCE, e);
        }
    }

    @Override
    public RequestDecision onBeforeRequest(String url) {
        return shouldBlock(url) ? RequestDecision.CANCEL : RequestDecision.ALLOW;
    }

    /**
     * @return true if the request should be cancelled; false when blocking is
     *         disabled or the URL cannot be parsed
     */
    public boolean shouldBlock(String url) {
        if (!enabled || url == null || url.isEmpty()) {
            return false;
        }
        BlockDecision.Reason reason = null;
        readLock.lock();
        try {
            if (matcher.matches(url)) {
                reason = BlockDecision.Reason.PATTERN;
            } else if (!customRules.isEmpty()) {
                String lowered = url.toLowerCase(Locale.ROOT);
                for (String rule : customRules.values()) {
                    if (lowered.contains(rule)) {
                        reason = BlockDecision.Reason.CUSTOM_RULE;
                        break;
                    }
                }
            }
        } finally {
            readLock.unlock();
        }
        if (reason == null) {
            return false;
        }
        record(url, reason);
        return true;
    }

    private void record(String url, BlockDecision.Reason reason) {
        String host = RequestUrlParser.parse(url).map(ParsedUrl::host).orElse(null);
        BlockDecision decision = BlockDecision.blocked(url, host, reason, clock.instant());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Blocked (" + reason + "): " + decision.url());
        }
        try {
            activityLog.record(decision);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Activity log sink failed", e);
        }
    }

    /**
     * @return false if the rule is blank or longer than {@value #MAX_CUSTOM_RULE_LENGTH} characters
     */
    public boolean addCustomRule(String rule) {
        if (rule == null || rule.isBlank() || rule.length() > MAX_CUSTOM_RULE_LENGTH) {
            logger.fine("Rejected custom rule");
            return false;
        }
        writeLock.lock();
        try {
            customRules.put(rule, rule.toLowerCase(Locale.ROOT));
        } finally {
            writeLock.unlock();
        }
        return true;
    }

    public void removeCustomRule(String rule) {
        if (rule == null) {
            return;
        }
        writeLock.lock();
        try {
            customRules.remove(rule);
        } finally {
            writeLock.unlock();
        }
    }

    public List<String> getCustomRules() {
        readLock.lock();
        try {
            return new ArrayList<>(customRules.keySet());
        } finally {
            readLock.unlock();
        }
    }

    public void addToBlocklist(String pattern) {
        writeLock.lock();
        try {
            matcher.addPattern(pattern);
        } finally {
            writeLock.unlock();
        }
    }

    public void removeFromBlocklist(String pattern) {
        writeLock.lock();
        try {
            matcher.removePattern(pattern);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return the base blocklist the matcher was last built from, without
     *         patterns added or removed one at a time since
     */
    public List<String> getBlocklist() {
        readLock.lock();
        try {
            return blocklist;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Rebuilds the matcher from {@code patterns}. Patterns added with
     * {@link #addToBlocklist(String)} are dropped; custom rules are kept.
     *
     * @throws MatcherInitializationException if the new list cannot be built;
     *         the previous list is restored first
     */
    public void replaceBlocklist(List<String> patterns) {
        List<String> replacement = List.copyOf(patterns);
        writeLock.lock();
        try {
            List<String> previous = blocklist;
            try {
                rebuild(replacement);
                blocklist = replacement;
            } catch (MatcherInitializationException e) {
                logger.log(Level.SEVERE, "Failed to build new blocklist, restoring previous one", e);
                rebuild(previous);
                throw e;
            }
        } finally {
            writeLock.unlock();
        }
        logger.info("Blocklist replaced: " + replacement.size() + " entries");
    }

    private void rebuild(List<String> patterns) {
        matcher.clear();
        matcher.initialize(patterns);
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        logger.info("Tracker blocking " + (enabled ? "enabled" : "disabled"));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public MatcherStats getStats() {
        readLock.lock();
        try {
            return matcher.getStats();
        } finally {
            readLock.unlock();
        }
    }
}
