package com.veil.blocklist.runtime.url;

import java.util.function.Predicate;

/**
 * Request URL reduced to what the matcher needs.
 *
 * @param url  trimmed, lowercased URL
 * @param host lowercased host without userinfo, port or trailing dot; IPv6 literals keep their brackets
 */
public record ParsedUrl(String url, String host) {

    /**
     * Calls {@code visitor} with the host and every parent domain on a label
     * boundary, longest first: {@code a.b.com}, {@code b.com}, {@code com}.
     *
     * @return true as soon as the visitor returns true
     */
    public boolean anyHostSuffix(Predicate<String> visitor) {
        if (visitor.test(host)) {
            return true;
        }
        if (host.startsWith("[")) {
            return false;
        }
        int dot = host.indexOf('.');
        while (dot >= 0 && dot + 1 < host.length()) {
            if (visitor.test(host.substring(dot + 1))) {
                return true;
            }
            dot = host.indexOf('.', dot + 1);
        }
        return false;
    }
}
