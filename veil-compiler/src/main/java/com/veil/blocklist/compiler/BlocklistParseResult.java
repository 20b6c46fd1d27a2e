package com.veil.blocklist.compiler;

import java.util.List;

/**
 * Outcome of reading one blocklist.
 *
 * @param patterns     pattern lines in file order, ready for the compiler
 * @param commentLines comment and header lines
 * @param skippedLines rules the matcher does not support (cosmetic, exception, option filters)
 */
public record BlocklistParseResult(List<String> patterns, int commentLines, int skippedLines) {

    public BlocklistParseResult {
        patterns = List.copyOf(patterns);
    }
}
