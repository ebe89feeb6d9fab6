package org.mapextract.definitions;

/**
 * An RGB color used to identify a province on the region bitmap.
 *
 * @param red   Red component, 0..255.
 * @param green Green component, 0..255.
 * @param blue  Blue component, 0..255.
 */
public record ColorKey(int red, int green, int blue) {

    public ColorKey {
        checkComponent("red", red);
        checkComponent("green", green);
        checkComponent("blue", blue);
    }

    /**
     * Creates a key from three unsigned bytes as stored in an RGB pixel buffer.
     */
    public static ColorKey ofBytes(byte red, byte green, byte blue) {
        return new ColorKey(red & 0xFF, green & 0xFF, blue & 0xFF);
    }

    /**
     * Returns the color packed as {@code 0xRRGGBB}.
     */
    public int packed() {
        return (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toString() {
        return "[" + red + "," + green + "," + blue + "]";
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " component out of range 0..255: " + value);
        }
    }
}
