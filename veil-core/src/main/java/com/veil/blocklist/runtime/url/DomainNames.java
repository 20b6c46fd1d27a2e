package com.veil.blocklist.runtime.url;

import java.util.Locale;

/**
 * Syntax checks and label splitting for domain names.
 *
 * <p>Accepts ASCII letters, digits, {@code -} and {@code _} plus any non-ASCII
 * character, so internationalized names in Unicode form pass.
 */
public final class DomainNames {

    public static final int MAX_DOMAIN_LENGTH = 253;
    public static final int MAX_LABEL_LENGTH = 63;

    private DomainNames() {
        throw new AssertionError("No instances");
    }

    /**
     * @param candidate  lowercased text
     * @param requireDot whether a single label such as {@code localhost} is rejected
     */
    public static boolean isValidDomain(String candidate, boolean requireDot) {
        if (candidate == null || candidate.isEmpty() || candidate.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }
        int labelLength = 0;
        int labels = 1;
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (c == '.') {
                if (labelLength == 0) {
                    return false;
                }
                labels++;
                labelLength = 0;
                continue;
            }
            if (!isLabelChar(c) || ++labelLength > MAX_LABEL_LENGTH) {
                return false;
            }
        }
        return labelLength > 0 && (!requireDot || labels > 1);
    }

    /**
     * Host characters are the label characters plus {@code .}.
     */
    public static boolean isValidHost(String host) {
        if (host.isEmpty() || host.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            if (c != '.' && !isLabelChar(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code "ads.tracker.com"} becomes {@code ["com", "tracker", "ads"]}.
     */
    public static String[] labelsTopLevelFirst(String domain) {
        if (domain == null || domain.isEmpty()) {
            throw new IllegalArgumentException("Domain must not be empty");
        }
        String[] labels = domain.toLowerCase(Locale.ROOT).split("\\.", -1);
        for (int i = 0, j = labels.length - 1; i < j; i++, j--) {
            String tmp = labels[i];
            labels[i] = labels[j];
            labels[j] = tmp;
        }
        return labels;
    }

    private static boolean isLabelChar(char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '_'
                || c > 0x7F;
    }
}
