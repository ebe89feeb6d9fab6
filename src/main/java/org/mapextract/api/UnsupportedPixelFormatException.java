package org.mapextract.api;

/**
 * Thrown when a region bitmap decodes fine but its pixels are not 8-bit-per-channel RGB.
 * The loader never converts such images silently.
 */
public class UnsupportedPixelFormatException extends MapDataException {

    private final String pixelFormat;

    /**
     * @param source      the file or logical name of the bitmap
     * @param pixelFormat a short description of the encoding that was found
     */
    public UnsupportedPixelFormatException(String source, String pixelFormat) {
        super("Image format of " + source + " should be RGB8 but was " + pixelFormat);
        this.pixelFormat = pixelFormat;
    }

    public String getPixelFormat() {
        return pixelFormat;
    }
}
