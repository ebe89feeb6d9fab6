package org.mapextract.image;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mapextract.definitions.ColorKey;
import org.mapextract.image.ProvinceColorIndex.Census;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
public class ProvinceColorIndexTest {

    private static final byte X = (byte) 0xFF;

    private final ProvinceColorIndex index = new ProvinceColorIndex(Map.of(
            new ColorKey(255, 0, 0), 1L,
            new ColorKey(0, 255, 0), 2L));

    @Test
    void testLooksUpColors() {
        assertThat(index.provinceOf(new ColorKey(0, 255, 0))).contains(2L);
        assertThat(index.provinceOf(new ColorKey(1, 2, 3))).isEmpty();
    }

    @Test
    void testCountsPixelsPerProvince() {
        RegionImage image = new RegionImage(2, 2, new byte[] {
                X, 0, 0,   X, 0, 0,
                0, X, 0,   0, 0, X
        });

        Census census = index.census(image);

        assertThat(census.pixelsPerProvince()).containsExactly(entry(1L, 2L), entry(2L, 1L));
        assertThat(census.unmatchedPixels()).isEqualTo(1);
        assertThat(census.unmatchedColors()).containsExactly(entry(new ColorKey(0, 0, 255), 1L));
    }

    @Test
    void testImageBufferMustMatchDimensions() {
        assertThatThrownBy(() -> new RegionImage(2, 2, new byte[11]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
