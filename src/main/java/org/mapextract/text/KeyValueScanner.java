package org.mapextract.text;

import java.util.LinkedHashMap;
import java.util.Map;

import org.mapextract.api.MapFormatException;
import org.mapextract.api.MapFormatException.Reason;

/**
 * Scans a sequence of {@code key = value} pairs into a map of raw values.
 * <p>
 * A value is either a brace block, stored as its unparsed inner text, or a bare token
 * ending at the next ASCII whitespace character. Block values are not descended into;
 * callers run another scan over a block's text when they need its entries. Scanning is
 * strictly left to right and stops at the first error.
 */
public final class KeyValueScanner {

    private KeyValueScanner() {}

    /**
     * Scans all pairs of {@code input}.
     *
     * @param input zero or more {@code key = value} pairs separated by whitespace.
     * @return the raw value of every key, in source order.
     * @throws MapFormatException if a pair is malformed, a block is unbalanced or a key repeats.
     */
    public static Map<String, RawValue> scan(TextSpan input) throws MapFormatException {
        Map<String, RawValue> entries = new LinkedHashMap<>();
        TextSpan rest = input.trimLeading();
        while (!rest.isEmpty()) {
            int assignment = rest.indexOf('=');
            if (assignment < 0) {
                throw new MapFormatException(Reason.MISSING_ASSIGNMENT,
                        "Key on line " + rest.lineAt(0) + " doesn't have a '=' afterwards",
                        rest.lineAt(0), firstToken(rest));
            }
            String key = rest.subSequence(0, assignment).trimTrailing().toString();
            if (key.isEmpty()) {
                int line = rest.lineAt(assignment);
                throw new MapFormatException(Reason.EMPTY_KEY, "Empty key before '=' on line " + line, line, null);
            }
            TextSpan keyEnd = rest.from(assignment);

            rest = rest.from(assignment + 1).trimLeading();
            RawValue value;
            if (rest.startsWith('{')) {
                Block block = BlockMatcher.match(rest);
                value = new RawValue(block.inner(), true);
                rest = block.remainder();
            } else {
                int valueEnd = rest.indexOfAsciiWhitespace();
                value = new RawValue(rest.subSequence(0, valueEnd), false);
                rest = rest.from(valueEnd);
            }

            RawValue previous = entries.putIfAbsent(key, value);
            if (previous != null) {
                throw new DuplicateKeyException(key, previous.text().toString(), value.text().toString(),
                        keyEnd.lineAt(0));
            }
            rest = rest.trimLeading();
        }
        return entries;
    }

    private static String firstToken(TextSpan span) {
        return span.subSequence(0, span.indexOfAsciiWhitespace()).toString();
    }
}
