package com.veil.blocklist.runtime.wildcard;

import com.veil.blocklist.api.model.Wildcard;

import java.util.List;

/**
 * Non-backtracking matcher for glob-style URL patterns.
 *
 * <p>A pattern is an ordered list of literal fragments separated by {@code *}.
 * Matching keeps a single forward cursor into the input: each fragment is
 * searched for starting at the cursor, and the cursor moves past the first
 * occurrence. Taking the leftmost occurrence is always safe because a later
 * fragment can only gain room from an earlier cursor, so the cursor never needs
 * to rewind. Worst case is {@code O(|input| * total fragment length)} whatever
 * the fragments look like; text such as {@code (a+)+} is just five characters.
 *
 * <p>Anchors:
 * <ul>
 *   <li>without a leading {@code *} the first fragment must start at index 0</li>
 *   <li>without a trailing {@code *} the last fragment must end at the end of the input</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share.
 */
public final class WildcardAutomaton {

    private final String key;
    private final String[] fragments;
    private final boolean leadingWildcard;
    private final boolean trailingWildcard;
    private final int minLength;

    private WildcardAutomaton(String key, List<String> fragments, boolean leadingWildcard, boolean trailingWildcard) {
        if (fragments.isEmpty()) {
            throw new IllegalArgumentException("At least one fragment is required");
        }
        this.key = key;
        this.fragments = fragments.toArray(new String[0]);
        this.leadingWildcard = leadingWildcard;
        this.trailingWildcard = trailingWildcard;
        int length = 0;
        for (String fragment : this.fragments) {
            length += fragment.length();
        }
        this.minLength = length;
    }

    public static WildcardAutomaton compile(Wildcard pattern) {
        return new WildcardAutomaton(pattern.key(), pattern.fragments(),
                pattern.leadingWildcard(), pattern.trailingWildcard());
    }

    /**
     * Automaton that accepts any input containing {@code literal}.
     */
    public static WildcardAutomaton substring(String literal) {
        return new WildcardAutomaton(literal, List.of(literal), true, true);
    }

    /**
     * @param input lowercased URL
     */
    public boolean matches(String input) {
        if (input == null || input.length() < minLength) {
            return false;
        }
        int last = fragments.length - 1;
        int cursor = 0;
        for (int i = 0; i <= last; i++) {
            String fragment = fragments[i];
            if (i == last && !trailingWildcard) {
                int start = input.length() - fragment.length();
                if (start < cursor || !input.startsWith(fragment, start)) {
                    return false;
                }
                return i > 0 || leadingWildcard || start == 0;
            }
            if (i == 0 && !leadingWildcard) {
                if (!input.startsWith(fragment)) {
                    return false;
                }
                cursor = fragment.length();
                continue;
            }
            int found = input.indexOf(fragment, cursor);
            if (found < 0) {
                return false;
            }
            cursor = found + fragment.length();
        }
        return true;
    }

    public String key() {
        return key;
    }

    public int fragmentCount() {
        return fragments.length;
    }

    @Override
    public String toString() {
        return "WildcardAutomaton{" + key + "}";
    }
}
