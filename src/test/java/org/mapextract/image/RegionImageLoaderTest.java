package org.mapextract.image;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mapextract.api.UnsupportedPixelFormatException;
import org.mapextract.definitions.ColorKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests decoding of region bitmaps and rejection of non-RGB8 encodings.
 */
@Tag("integration")
public class RegionImageLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadsTwentyFourBitBitmap() throws Exception {
        BufferedImage source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        source.setRGB(0, 0, 0xFF0000);
        source.setRGB(1, 0, 0x00FF00);
        source.setRGB(2, 0, 0x0000FF);
        source.setRGB(0, 1, 0x102030);
        Path file = tempDir.resolve("provinces.bmp");
        assertThat(ImageIO.write(source, "bmp", file.toFile())).isTrue();

        RegionImage image = RegionImageLoader.load(file);

        assertThat(image.width()).isEqualTo(3);
        assertThat(image.height()).isEqualTo(2);
        assertThat(image.rgb()).hasSize(18);
        assertThat(image.rgb()).startsWith((byte) 0xFF, (byte) 0, (byte) 0, (byte) 0, (byte) 0xFF, (byte) 0);
        assertThat(image.colorAt(2, 0)).isEqualTo(new ColorKey(0, 0, 255));
        assertThat(image.colorAt(0, 1)).isEqualTo(new ColorKey(0x10, 0x20, 0x30));
        assertThat(image.colorAt(1, 1)).isEqualTo(new ColorKey(0, 0, 0));
    }

    @Test
    void testRejectsAlpha() {
        BufferedImage argb = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);

        assertThatThrownBy(() -> RegionImageLoader.fromBufferedImage(argb, "argb.png"))
                .isInstanceOfSatisfying(UnsupportedPixelFormatException.class,
                        e -> assertThat(e.getPixelFormat()).contains("alpha"));
    }

    @Test
    void testRejectsGrayscaleAndPalette() {
        BufferedImage gray = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
        BufferedImage indexed = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_INDEXED);

        assertThatThrownBy(() -> RegionImageLoader.fromBufferedImage(gray, "gray.bmp"))
                .isInstanceOf(UnsupportedPixelFormatException.class);
        assertThatThrownBy(() -> RegionImageLoader.fromBufferedImage(indexed, "indexed.bmp"))
                .isInstanceOfSatisfying(UnsupportedPixelFormatException.class,
                        e -> assertThat(e.getPixelFormat()).startsWith("indexed"));
    }

    @Test
    void testRejectsLinearRgbInsteadOfConvertingIt() {
        ComponentColorModel model = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_LINEAR_RGB),
                false, false, Transparency.OPAQUE, DataBuffer.TYPE_BYTE);
        WritableRaster raster = model.createCompatibleWritableRaster(1, 1);
        raster.setPixel(0, 0, new int[] {100, 50, 200});
        BufferedImage linear = new BufferedImage(model, raster, false, null);

        assertThatThrownBy(() -> RegionImageLoader.fromBufferedImage(linear, "linear.bmp"))
                .isInstanceOfSatisfying(UnsupportedPixelFormatException.class,
                        e -> assertThat(e.getPixelFormat()).contains("non-sRGB"));
    }

    @Test
    void testAcceptsInMemoryBgrImage() throws Exception {
        BufferedImage bgr = new BufferedImage(1, 1, BufferedImage.TYPE_3BYTE_BGR);
        bgr.setRGB(0, 0, 0xABCDEF);

        RegionImage image = RegionImageLoader.fromBufferedImage(bgr, "memory");

        assertThat(image.rgb()).containsExactly((byte) 0xAB, (byte) 0xCD, (byte) 0xEF);
    }

    @Test
    void testMissingFileIsIoError() {
        Path missing = tempDir.resolve("missing.bmp");

        assertThatThrownBy(() -> RegionImageLoader.load(missing))
                .isInstanceOf(java.io.IOException.class)
                .hasMessageContaining("missing.bmp");
    }

    @Test
    void testNonImageFileIsIoError() throws Exception {
        Path text = Files.writeString(tempDir.resolve("notes.bmp"), "not an image");

        assertThatThrownBy(() -> RegionImageLoader.load(text))
                .isInstanceOf(java.io.IOException.class);
    }
}
