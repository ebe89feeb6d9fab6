package org.mapextract.text;

import org.mapextract.api.MapFormatException;
import org.mapextract.api.MapFormatException.Reason;

/**
 * Extracts one balanced {@code {...}} block from the start of a span.
 * <p>
 * Matching counts nesting depth only: every {@code {} opens a level and every
 * {@code }} closes one. Quotes are not special, so a brace inside a quoted value
 * counts like any other.
 */
public final class BlockMatcher {

    private BlockMatcher() {}

    /**
     * Matches the block that opens at the first character of {@code input}.
     *
     * @param input text that must start with {@code {}.
     * @return the inner text of the block and the text after its closing brace.
     * @throws MapFormatException        if {@code input} does not start with {@code {}.
     * @throws UnbalancedBlockException if the input ends before the block is closed.
     */
    public static Block match(TextSpan input) throws MapFormatException {
        if (!input.startsWith('{')) {
            throw new MapFormatException(Reason.MISSING_OPENING_BRACE,
                    "Block on line " + input.lineAt(0) + " doesn't start with '{'",
                    input.lineAt(0), null);
        }
        int depth = 1;
        for (int i = 1; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return new Block(input.subSequence(1, i), input.from(i + 1));
                }
            }
        }
        throw new UnbalancedBlockException(depth, input.lineAt(0));
    }
}
