package org.mapextract.text;

import java.util.ArrayList;
import java.util.List;

import org.mapextract.api.MapFormatException;
import org.mapextract.api.MapFormatException.Reason;

/**
 * Parses a whitespace-separated list of unsigned 32-bit decimal integers.
 * <p>
 * Values are returned as {@code long} so the full {@code 0..4294967295} range stays
 * positive. Only plain digit tokens are accepted: signs, separators and anything that
 * overflows 32 bits fail the whole array.
 */
public final class IntegerArrayScanner {

    /** Largest value representable as an unsigned 32-bit integer. */
    public static final long MAX_UNSIGNED_INT = 0xFFFF_FFFFL;

    private IntegerArrayScanner() {}

    /**
     * Parses every token of {@code input}, preserving source order and duplicates.
     *
     * @param input zero or more whitespace-separated tokens.
     * @return the parsed values.
     * @throws MapFormatException with reason {@link Reason#INVALID_INTEGER} on the first bad token.
     */
    public static List<Long> scan(TextSpan input) throws MapFormatException {
        List<Long> values = new ArrayList<>();
        TextSpan rest = input.trimLeading();
        while (!rest.isEmpty()) {
            int tokenEnd = rest.indexOfAsciiWhitespace();
            TextSpan token = rest.subSequence(0, tokenEnd);
            values.add(parseUnsignedInt(token));
            rest = rest.from(tokenEnd).trimLeading();
        }
        return values;
    }

    /**
     * Parses one unsigned 32-bit decimal token.
     *
     * @throws MapFormatException if the token is empty, contains a non-digit or overflows.
     */
    static long parseUnsignedInt(TextSpan token) throws MapFormatException {
        if (token.isEmpty()) {
            throw invalid(token);
        }
        long value = 0;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c < '0' || c > '9') {
                throw invalid(token);
            }
            value = value * 10 + (c - '0');
            if (value > MAX_UNSIGNED_INT) {
                throw invalid(token);
            }
        }
        return value;
    }

    private static MapFormatException invalid(TextSpan token) {
        int line = token.lineAt(0);
        return new MapFormatException(Reason.INVALID_INTEGER,
                "Invalid unsigned 32-bit integer '" + token + "' on line " + line, line, token.toString());
    }
}
