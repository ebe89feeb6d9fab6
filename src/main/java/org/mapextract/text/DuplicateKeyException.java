package org.mapextract.text;

import org.mapextract.api.MapFormatException;

/**
 * Thrown when a key is assigned twice within one key/value scan. Both raw values are
 * kept for diagnostics.
 */
public class DuplicateKeyException extends MapFormatException {

    private final String key;
    private final String previousValue;
    private final String value;

    public DuplicateKeyException(String key, String previousValue, String value, int line) {
        super(Reason.DUPLICATE_KEY,
                "Key '" + key + "' on line " + line + " has two entries with values: '"
                        + previousValue + "' and '" + value + "'",
                line, key);
        this.key = key;
        this.previousValue = previousValue;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getPreviousValue() {
        return previousValue;
    }

    public String getValue() {
        return value;
    }
}
