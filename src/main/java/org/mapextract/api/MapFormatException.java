package org.mapextract.api;

/**
 * Thrown when an asset violates the expected grammar at a specific point.
 * <p>
 * Every instance names the kind of violation ({@link Reason}) and carries as much
 * positional context as the failing stage has: the 1-based line of the fault and,
 * where one exists, the offending token. Record-based formats report the 0-based
 * record index as the line instead (see {@link #getLine()}).
 */
public class MapFormatException extends MapDataException {

    /** Marker for "no line information available". */
    public static final int UNKNOWN_LINE = -1;

    /**
     * The grammar rule that was violated.
     */
    public enum Reason {
        /** A block was expected but the text does not start with {@code {}. */
        MISSING_OPENING_BRACE,
        /** The input ended before every {@code {} was closed. */
        UNBALANCED_BLOCK,
        /** Text remains but contains no {@code =}. */
        MISSING_ASSIGNMENT,
        /** Nothing but whitespace precedes an {@code =}. */
        EMPTY_KEY,
        /** The same key was assigned twice within one block. */
        DUPLICATE_KEY,
        /** A token of an integer array is not an unsigned 32-bit decimal. */
        INVALID_INTEGER,
        /** A definition record has fewer fields than required. */
        NOT_ENOUGH_FIELDS,
        /** A definition record field does not parse as its numeric type. */
        INVALID_FIELD,
        /** Two definition records use the same color. */
        DUPLICATE_COLOR
    }

    private final Reason reason;
    private final int line;
    private final String token;

    /**
     * @param reason  the violated rule
     * @param message the detail message
     * @param line    the line (or record index) of the fault, or {@link #UNKNOWN_LINE}
     * @param token   the offending token, or {@code null}
     */
    public MapFormatException(Reason reason, String message, int line, String token) {
        super(message);
        this.reason = reason;
        this.line = line;
        this.token = token;
    }

    /**
     * Variant for faults that wrap a lower-level parse failure.
     */
    public MapFormatException(Reason reason, String message, int line, String token, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.line = line;
        this.token = token;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the 1-based line of the fault for brace-delimited text, the 0-based record
     * index for definition tables, or {@link #UNKNOWN_LINE}.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the offending token, or {@code null} if the fault is not tied to one.
     */
    public String getToken() {
        return token;
    }
}
