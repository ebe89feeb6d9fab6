package org.mapextract.text;

import org.mapextract.api.MapFormatException;

/**
 * Thrown when the input ends before a block's braces are balanced.
 */
public class UnbalancedBlockException extends MapFormatException {

    private final int missingClosingBraces;

    /**
     * @param missingClosingBraces how many {@code }} characters would be needed to close the block
     * @param line                 the line of the block's opening brace
     */
    public UnbalancedBlockException(int missingClosingBraces, int line) {
        super(Reason.UNBALANCED_BLOCK,
                "Missing " + missingClosingBraces + " '}' character(s) at the end of the block opened on line " + line,
                line, null);
        this.missingClosingBraces = missingClosingBraces;
    }

    public int getMissingClosingBraces() {
        return missingClosingBraces;
    }
}
