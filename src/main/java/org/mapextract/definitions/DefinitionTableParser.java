package org.mapextract.definitions;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.mapextract.api.MapFormatException;
import org.mapextract.api.MapFormatException.Reason;

/**
 * Parses the province color table ({@code definition.csv}).
 * <p>
 * Each line is one record {@code <id>;<r>;<g>;<b>[;...]}: an unsigned 32-bit province
 * id followed by the three 8-bit components of the color that marks the province on
 * the region bitmap. Fields after the fourth are ignored. Lines are counted from 0 in
 * error messages. A color used by two records is rejected rather than silently
 * overwritten.
 */
public class DefinitionTableParser {

    /** Field separator of the standard table. */
    public static final String DEFAULT_SEPARATOR = ";";

    private static final int REQUIRED_FIELDS = 4;

    private final String separator;
    private final Pattern splitter;

    /**
     * Creates a parser for {@code ;}-separated records.
     */
    public DefinitionTableParser() {
        this(DEFAULT_SEPARATOR);
    }

    /**
     * @param separator the literal field separator; must not be empty.
     */
    public DefinitionTableParser(String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Field separator must not be empty");
        }
        this.separator = separator;
        this.splitter = Pattern.compile(Pattern.quote(separator));
    }

    /**
     * Parses the whole table.
     *
     * @param text the table content, one record per line.
     * @return the province id of every color, in file order.
     * @throws MapFormatException on the first malformed line or repeated color.
     */
    public Map<ColorKey, Long> parse(String text) throws MapFormatException {
        Map<ColorKey, Long> ids = new LinkedHashMap<>();
        Map<ColorKey, Integer> definedOn = new HashMap<>();
        List<String> lines = text.lines().toList();
        for (int index = 0; index < lines.size(); index++) {
            String[] fields = splitter.split(lines.get(index), REQUIRED_FIELDS + 1);
            if (fields.length < REQUIRED_FIELDS) {
                throw new MapFormatException(Reason.NOT_ENOUGH_FIELDS,
                        "Not enough elements on line " + index + ": expected " + REQUIRED_FIELDS
                                + " '" + separator + "'-separated fields but found " + fields.length,
                        index, null);
            }
            long id = parseField(fields[0], 0xFFFF_FFFFL, "province id", index);
            ColorKey color = new ColorKey(
                    (int) parseField(fields[1], 255, "red component", index),
                    (int) parseField(fields[2], 255, "green component", index),
                    (int) parseField(fields[3], 255, "blue component", index));

            Integer previousLine = definedOn.putIfAbsent(color, index);
            if (previousLine != null) {
                throw new MapFormatException(Reason.DUPLICATE_COLOR,
                        "Color " + color + " on line " + index + " is already used by line " + previousLine,
                        index, lines.get(index));
            }
            ids.put(color, id);
        }
        return ids;
    }

    private static long parseField(String field, long max, String what, int index) throws MapFormatException {
        boolean digitsOnly = !field.isEmpty() && field.chars().allMatch(c -> c >= '0' && c <= '9');
        if (digitsOnly) {
            try {
                long value = Long.parseLong(field);
                if (value <= max) {
                    return value;
                }
            } catch (NumberFormatException e) {
                throw new MapFormatException(Reason.INVALID_FIELD,
                        "Invalid " + what + " '" + field + "' on line " + index, index, field, e);
            }
        }
        throw new MapFormatException(Reason.INVALID_FIELD,
                "Invalid " + what + " '" + field + "' on line " + index + " (expected 0.." + max + ")",
                index, field);
    }
}
