package org.mapextract.api;

import java.util.List;

/**
 * Thrown when a required key is absent from an otherwise well-formed key/value block.
 * <p>
 * Distinct from {@link MapFormatException}: the surrounding syntax parsed fine, the
 * asset just does not define the requested entry.
 */
public class MissingKeyException extends MapDataException {

    private final String key;
    private final List<String> resolvedPath;

    /**
     * @param key          the key that was looked up and not found
     * @param resolvedPath the keys already resolved before the lookup failed (empty at top level)
     */
    public MissingKeyException(String key, List<String> resolvedPath) {
        super(resolvedPath.isEmpty()
                ? "No '" + key + "' field at top level"
                : "No '" + key + "' field inside '" + String.join(".", resolvedPath) + "'");
        this.key = key;
        this.resolvedPath = List.copyOf(resolvedPath);
    }

    public String getKey() {
        return key;
    }

    public List<String> getResolvedPath() {
        return resolvedPath;
    }
}
