package org.mapextract.api;

/**
 * Base class of every failure raised while extracting data from map assets.
 * <p>
 * This is a checked exception: a malformed asset is an expected condition that
 * callers must decide how to handle (report and abort, or skip the file). The
 * extraction engine itself never recovers from it; the first failure ends the
 * parse of that input and no partial result is returned.
 */
public class MapDataException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MapDataException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public MapDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
