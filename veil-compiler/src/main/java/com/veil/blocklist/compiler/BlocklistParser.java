package com.veil.blocklist.compiler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads EasyList-style and hosts-file blocklists, one entry per line.
 *
 * <p>Kept: network rules without options. Hosts-file lines such as
 * {@code 0.0.0.0 ads.com} become {@code ||ads.com^}.
 *
 * <p>Counted as comments: lines starting with {@code !} or
 * {@code #}, and {@code [Adblock Plus 2.0]} style headers.
 *
 * <p>Counted as skipped: element hiding rules ({@code ##}, {@code #@#},
 * {@code #?#}), exception rules ({@code @@}) and rules carrying
 * {@code $options}, none of which this matcher evaluates.
 */
public final class BlocklistParser {
    private static final Logger logger = Logger.getLogger(BlocklistParser.class.getName());

    private static final Set<String> HOSTS_SINK_ADDRESSES = Set.of("0.0.0.0", "127.0.0.1");
    private static final Set<String> HOSTS_LOCAL_NAMES = Set.of(
            "localhost", "localhost.localdomain", "local", "broadcasthost", "0.0.0.0", "ip6-localhost");

    private BlocklistParser() {
        throw new AssertionError("No instances");
    }

    public static BlocklistParseResult parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static BlocklistParseResult parse(Reader reader) throws IOException {
        List<String> patterns = new ArrayList<>();
        int comments = 0;
        int skipped = 0;

        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        while ((line = lines.readLine()) != null) {
            String entry = line.trim();
            if (entry.isEmpty()) {
                continue;
            }
            if (isHeader(entry)) {
                comments++;
            } else if (isCosmetic(entry)) {
                skipped++;
            } else if (entry.startsWith("!") || entry.startsWith("#")) {
                comments++;
            } else if (entry.startsWith("@@") || entry.indexOf('$') >= 0) {
                skipped++;
            } else if (isHostsLine(entry)) {
                int before = patterns.size();
                addHostsEntries(entry, patterns);
                if (patterns.size() == before) {
                    skipped++;
                }
            } else {
                patterns.add(entry);
            }
        }

        logger.fine(String.format("Parsed blocklist: %d patterns, %d comments, %d skipped",
                patterns.size(), comments, skipped));
        return new BlocklistParseResult(patterns, comments, skipped);
    }

    private static boolean isHeader(String entry) {
        return entry.startsWith("[") && entry.endsWith("]");
    }

    private static boolean isCosmetic(String entry) {
        return entry.contains("##") || entry.contains("#@#") || entry.contains("#?#");
    }

    private static boolean isHostsLine(String entry) {
        int space = firstWhitespace(entry);
        return space > 0 && HOSTS_SINK_ADDRESSES.contains(entry.substring(0, space));
    }

    private static void addHostsEntries(String entry, List<String> patterns) {
        int comment = entry.indexOf('#');
        String body = comment >= 0 ? entry.substring(0, comment) : entry;
        String[] tokens = body.trim().split("\\s+");
        for (int i = 1; i < tokens.length; i++) {
            String host = tokens[i].toLowerCase(Locale.ROOT);
            if (!HOSTS_LOCAL_NAMES.contains(host)) {
                patterns.add("||" + host + "^");
            }
        }
    }

    private static int firstWhitespace(String entry) {
        for (int i = 0; i < entry.length(); i++) {
            if (Character.isWhitespace(entry.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
