package org.mapextract.text;

/**
 * Removes {@code #} line comments from raw asset text.
 * <p>
 * A comment runs from a {@code #} up to the next line feed. The line feed itself is
 * kept, so the stripped text has the same line structure as the input and later
 * stages can report line numbers that match the file. A {@code #} on the last line
 * removes the rest of the text. There is no escape mechanism.
 */
public final class CommentStripper {

    private CommentStripper() {}

    /**
     * Returns {@code text} with every comment removed. Text without a {@code #} is
     * returned as-is.
     *
     * @param text the raw text.
     * @return the comment-free text.
     */
    public static String strip(String text) {
        int hash = text.indexOf('#');
        if (hash < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (hash >= 0) {
            out.append(text, pos, hash);
            int newline = text.indexOf('\n', hash);
            if (newline < 0) {
                return out.toString();
            }
            pos = newline;
            hash = text.indexOf('#', pos);
        }
        out.append(text, pos, text.length());
        return out.toString();
    }
}
