package com.veil.blocklist.runtime.url;

import java.util.Locale;
import java.util.Optional;

/**
 * Lenient, allocation-light extraction of the host from an absolute URL.
 *
 * <p>{@link java.net.URI} rejects many URLs a browser happily sends (spaces or
 * {@code |} in the query, for instance), and only the authority matters here.
 * The parser therefore requires {@code scheme://}, cuts the authority at the
 * first {@code /}, {@code ?}, {@code #} or {@code \}, strips userinfo and port,
 * and validates what remains as a host name or bracketed IPv6 literal.
 */
public final class RequestUrlParser {

    private RequestUrlParser() {
        throw new AssertionError("No instances");
    }

    /**
     * @return the parsed URL, or empty if {@code url} is null, blank or has no usable host
     */
    public static Optional<ParsedUrl> parse(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        int schemeEnd = lower.indexOf("://");
        if (schemeEnd <= 0 || !isValidScheme(lower, schemeEnd)) {
            return Optional.empty();
        }

        int authorityStart = schemeEnd + 3;
        int authorityEnd = lower.length();
        for (int i = authorityStart; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (c == '/' || c == '?' || c == '#' || c == '\\') {
                authorityEnd = i;
                break;
            }
        }
        String authority = lower.substring(authorityStart, authorityEnd);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        String host = authority.startsWith("[") ? ipv6Host(authority) : namedHost(authority);
        if (host == null) {
            return Optional.empty();
        }
        return Optional.of(new ParsedUrl(lower, host));
    }

    private static boolean isValidScheme(String url, int schemeEnd) {
        char first = url.charAt(0);
        if (first < 'a' || first > 'z') {
            return false;
        }
        for (int i = 1; i < schemeEnd; i++) {
            char c = url.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.';
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static String namedHost(String authority) {
        int colon = authority.indexOf(':');
        String host = authority;
        if (colon >= 0) {
            if (!isPort(authority, colon + 1)) {
                return null;
            }
            host = authority.substring(0, colon);
        }
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        return DomainNames.isValidHost(host) ? host : null;
    }

    private static String ipv6Host(String authority) {
        int close = authority.indexOf(']');
        if (close < 2) {
            return null;
        }
        for (int i = 1; i < close; i++) {
            char c = authority.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || c == ':' || c == '.';
            if (!ok) {
                return null;
            }
        }
        if (close + 1 < authority.length()) {
            if (authority.charAt(close + 1) != ':' || !isPort(authority, close + 2)) {
                return null;
            }
        }
        return authority.substring(0, close + 1);
    }

    private static boolean isPort(String authority, int start) {
        if (authority.length() - start > 5) {
            return false;
        }
        for (int i = start; i < authority.length(); i++) {
            char c = authority.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
