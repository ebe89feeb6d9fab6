package org.mapextract.image;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import javax.imageio.ImageIO;

import org.mapextract.api.UnsupportedPixelFormatException;

/**
 * Decodes a region bitmap into a {@link RegionImage}.
 * <p>
 * Decoding is delegated to {@link ImageIO}. Only sRGB true-color images with three
 * 8-bit channels and no alpha are accepted. Palette, grayscale, 16-bit, alpha, linear
 * RGB and ICC-profiled images are rejected instead of converted, since converting would
 * change the colors that identify provinces.
 */
public final class RegionImageLoader {

    private RegionImageLoader() {}

    /**
     * Reads and decodes the bitmap at {@code path}.
     *
     * @param path the image file.
     * @return the decoded pixels.
     * @throws IOException                      if the file cannot be read or is not a decodable image.
     * @throws UnsupportedPixelFormatException if the image is not 8-bit RGB.
     */
    public static RegionImage load(Path path) throws IOException, UnsupportedPixelFormatException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("No image decoder recognizes " + path);
        }
        return fromBufferedImage(image, path.toString());
    }

    /**
     * Converts an already decoded image, enforcing the 8-bit RGB requirement.
     *
     * @param image  the decoded image.
     * @param source file or logical name used in error messages.
     * @return the pixels as a packed RGB buffer.
     * @throws UnsupportedPixelFormatException if the image is not 8-bit RGB.
     */
    public static RegionImage fromBufferedImage(BufferedImage image, String source)
            throws UnsupportedPixelFormatException {
        ColorModel model = image.getColorModel();
        if (!isRgb8(model)) {
            throw new UnsupportedPixelFormatException(source, describe(model));
        }
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] rgb = new byte[width * height * RegionImage.CHANNELS];
        int[] row = new int[width];
        int offset = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int pixel : row) {
                rgb[offset++] = (byte) (pixel >> 16);
                rgb[offset++] = (byte) (pixel >> 8);
                rgb[offset++] = (byte) pixel;
            }
        }
        return new RegionImage(width, height, rgb);
    }

    private static boolean isRgb8(ColorModel model) {
        if (model instanceof IndexColorModel || model.hasAlpha()) {
            return false;
        }
        // getRGB converts every other RGB space to sRGB
        if (!model.getColorSpace().isCS_sRGB() || model.getNumComponents() != 3) {
            return false;
        }
        return Arrays.stream(model.getComponentSize()).allMatch(bits -> bits == 8);
    }

    private static String describe(ColorModel model) {
        if (model instanceof IndexColorModel indexed) {
            return "indexed (" + indexed.getMapSize() + " colors)";
        }
        String description = model.getNumComponents() + " components of "
                + Arrays.toString(model.getComponentSize()) + " bits" + (model.hasAlpha() ? " with alpha" : "");
        ColorSpace space = model.getColorSpace();
        if (space.getType() == ColorSpace.TYPE_RGB && !space.isCS_sRGB()) {
            description += " in a non-sRGB color space";
        }
        return description;
    }
}
