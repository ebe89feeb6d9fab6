package org.mapextract.text;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable, non-owning view of a range of a source string.
 * <p>
 * All extraction stages work on spans of the single comment-stripped buffer: slicing
 * produces a new view onto the same string and never copies or mutates it. Because a
 * span remembers its absolute offset, errors raised deep inside a nested block can
 * still report the line of the fault in the original file.
 * <p>
 * <strong>Thread Safety:</strong> Immutable and therefore thread-safe.
 */
public final class TextSpan implements CharSequence {

    private final String source;
    private final LineIndex lines;
    private final int start;
    private final int end;

    private TextSpan(String source, LineIndex lines, int start, int end) {
        this.source = source;
        this.lines = lines;
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a span covering the whole of {@code text}.
     */
    public static TextSpan of(String text) {
        Objects.requireNonNull(text, "text");
        return new TextSpan(text, new LineIndex(text), 0, text.length());
    }

    /**
     * Returns whether {@code c} is ASCII whitespace: space, tab, line feed, form feed
     * or carriage return. Tokens end at the first such character.
     */
    public static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '\r';
    }

    /**
     * Returns whether {@code c} has the Unicode White_Space property. Unlike
     * {@link Character#isWhitespace(char)} this includes no-break spaces and NEL and
     * excludes the information separators U+001C..U+001F.
     */
    public static boolean isUnicodeWhitespace(char c) {
        return (c >= '\t' && c <= '\r') || c == '\u0085' || Character.isSpaceChar(c);
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public char charAt(int index) {
        Objects.checkIndex(index, length());
        return source.charAt(start + index);
    }

    @Override
    public TextSpan subSequence(int from, int to) {
        Objects.checkFromToIndex(from, to, length());
        return new TextSpan(source, lines, start + from, start + to);
    }

    /**
     * Returns the view from {@code from} (relative) to the end of this span.
     */
    public TextSpan from(int from) {
        return subSequence(from, length());
    }

    /**
     * Returns this span without its leading whitespace.
     */
    public TextSpan trimLeading() {
        int i = start;
        while (i < end && isUnicodeWhitespace(source.charAt(i))) {
            i++;
        }
        return i == start ? this : new TextSpan(source, lines, i, end);
    }

    /**
     * Returns this span without its trailing whitespace.
     */
    public TextSpan trimTrailing() {
        int i = end;
        while (i > start && isUnicodeWhitespace(source.charAt(i - 1))) {
            i--;
        }
        return i == end ? this : new TextSpan(source, lines, start, i);
    }

    /**
     * Returns whether the first character of this span is {@code c}.
     */
    public boolean startsWith(char c) {
        return start < end && source.charAt(start) == c;
    }

    /**
     * Returns the relative index of the first occurrence of {@code c}, or -1.
     */
    public int indexOf(char c) {
        int found = source.indexOf(c, start);
        return found < 0 || found >= end ? -1 : found - start;
    }

    /**
     * Returns the relative index of the first ASCII whitespace character, or
     * {@link #length()} if there is none.
     */
    public int indexOfAsciiWhitespace() {
        for (int i = start; i < end; i++) {
            if (isAsciiWhitespace(source.charAt(i))) {
                return i - start;
            }
        }
        return length();
    }

    /**
     * Returns the 1-based line, within the underlying source, of the character at
     * relative index {@code index}. An index equal to {@link #length()} is allowed and
     * refers to the position just past this span.
     */
    public int lineAt(int index) {
        Objects.checkIndex(index, length() + 1);
        return lines.lineOf(start + index);
    }

    /** Absolute offset of this span within its source. */
    public int start() {
        return start;
    }

    /** Absolute end offset (exclusive) of this span within its source. */
    public int end() {
        return end;
    }

    @Override
    public String toString() {
        return source.substring(start, end);
    }

    /**
     * Offsets of the newlines of one source, shared by every span sliced from it. Built
     * on first use, so spans that never report a line never pay for it.
     */
    private static final class LineIndex {

        private final String source;
        private volatile int[] newlines;

        LineIndex(String source) {
            this.source = source;
        }

        int lineOf(int offset) {
            int[] offsets = newlines;
            if (offsets == null) {
                offsets = build();
                newlines = offsets;
            }
            // newlines strictly before offset, plus one
            int found = Arrays.binarySearch(offsets, offset);
            return (found >= 0 ? found : -found - 1) + 1;
        }

        private int[] build() {
            int count = 0;
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    count++;
                }
            }
            int[] offsets = new int[count];
            int next = 0;
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    offsets[next++] = i;
                }
            }
            return offsets;
        }
    }
}
