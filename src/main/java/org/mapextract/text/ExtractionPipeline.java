package org.mapextract.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.mapextract.api.MapDataException;
import org.mapextract.api.MissingKeyException;

/**
 * Walks a fixed key path through brace-delimited text and parses the value found there.
 * <p>
 * The pipeline strips comments, scans the top-level pairs, then for every key of the
 * path looks the key up and scans the raw value as the next level. The value of the
 * last key is handed to a typed parser; {@link #extract(String)} parses it as an
 * integer array. With the default path this yields the province ids of a state file:
 * <pre>{@code
 * state = {
 *     id = 1
 *     provinces = { 10 20 30 }
 * }
 * }</pre>
 * The first failure of any stage is propagated unchanged and no partial result is
 * produced.
 * <p>
 * <strong>Thread Safety:</strong> Stateless after construction; one instance may be
 * shared between threads.
 */
public class ExtractionPipeline {

    /** Key path of the province list in a state definition file. */
    public static final List<String> STATE_PROVINCES = List.of("state", "provinces");

    private final List<String> keyPath;

    /**
     * Creates a pipeline for the province list of a state definition file.
     */
    public ExtractionPipeline() {
        this(STATE_PROVINCES);
    }

    /**
     * Creates a pipeline for an arbitrary key path.
     *
     * @param keyPath the keys to resolve, outermost first; must not be empty.
     * @throws IllegalArgumentException if the path is empty or contains a blank key.
     */
    public ExtractionPipeline(List<String> keyPath) {
        if (keyPath.isEmpty()) {
            throw new IllegalArgumentException("Key path must not be empty");
        }
        for (String key : keyPath) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Key path contains a blank key: " + keyPath);
            }
        }
        this.keyPath = List.copyOf(keyPath);
    }

    /**
     * Extracts the integer array stored under the key path.
     *
     * @param rawText the complete text of the file, comments included.
     * @return the values in source order.
     * @throws MapDataException if the text is malformed or a key of the path is missing.
     */
    public List<Long> extract(String rawText) throws MapDataException {
        return IntegerArrayScanner.scan(resolve(rawText));
    }

    /**
     * Resolves the key path and returns the raw text of the final value, for callers
     * that parse it with something other than {@link IntegerArrayScanner}.
     *
     * @param rawText the complete text of the file, comments included.
     * @return the unparsed value of the last key of the path.
     * @throws MapDataException if the text is malformed or a key of the path is missing.
     */
    public TextSpan resolve(String rawText) throws MapDataException {
        TextSpan current = TextSpan.of(CommentStripper.strip(rawText));
        List<String> resolved = new ArrayList<>(keyPath.size());
        for (String key : keyPath) {
            Map<String, RawValue> entries = KeyValueScanner.scan(current);
            RawValue value = entries.get(key);
            if (value == null) {
                throw new MissingKeyException(key, resolved);
            }
            resolved.add(key);
            if (resolved.size() < keyPath.size() && !value.block()) {
                // a bare token holds no pairs, so the next key cannot be in it
                throw new MissingKeyException(keyPath.get(resolved.size()), resolved);
            }
            current = value.text();
        }
        return current;
    }

    public List<String> getKeyPath() {
        return keyPath;
    }
}
