package org.mapextract.image;

import java.util.Objects;

import org.mapextract.definitions.ColorKey;

/**
 * A decoded region bitmap: 8-bit RGB pixels stored row-major, three bytes per pixel.
 * <p>
 * The pixel buffer is owned by this object and not copied on access; callers must not
 * modify the array returned by {@link #rgb()}.
 *
 * @param width  Width in pixels.
 * @param height Height in pixels.
 * @param rgb    Pixel data, {@code width * height * 3} bytes.
 */
public record RegionImage(int width, int height, byte[] rgb) {

    /** Bytes per pixel. */
    public static final int CHANNELS = 3;

    public RegionImage {
        Objects.requireNonNull(rgb, "rgb");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative image dimensions: " + width + "x" + height);
        }
        if ((long) width * height * CHANNELS != rgb.length) {
            throw new IllegalArgumentException("Pixel buffer holds " + rgb.length + " bytes, expected "
                    + ((long) width * height * CHANNELS) + " for " + width + "x" + height);
        }
    }

    /**
     * Returns the color of the pixel at column {@code x}, row {@code y}.
     *
     * @throws IndexOutOfBoundsException if the coordinates are outside the image.
     */
    public ColorKey colorAt(int x, int y) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        int offset = (y * width + x) * CHANNELS;
        return ColorKey.ofBytes(rgb[offset], rgb[offset + 1], rgb[offset + 2]);
    }

    public int pixelCount() {
        return width * height;
    }
}
