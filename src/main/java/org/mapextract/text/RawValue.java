package org.mapextract.text;

/**
 * The unparsed value of one key, as captured by {@link KeyValueScanner}.
 *
 * @param text  The value text: a block's inner text or a bare token.
 * @param block Whether the value was written as a {@code {...}} block.
 */
public record RawValue(TextSpan text, boolean block) {

    @Override
    public String toString() {
        return text.toString();
    }
}
