package org.mapextract.image;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.mapextract.definitions.ColorKey;

/**
 * Looks up province ids of bitmap pixels through the color definition table.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction.
 */
public class ProvinceColorIndex {

    /**
     * Pixel counts of one image.
     *
     * @param pixelsPerProvince Number of pixels of every province that appears, by ascending id.
     * @param unmatchedPixels   Number of pixels whose color is not in the table.
     * @param unmatchedColors   Distinct colors not in the table, with their pixel counts.
     */
    public record Census(Map<Long, Long> pixelsPerProvince, long unmatchedPixels,
                         Map<ColorKey, Long> unmatchedColors) {}

    private final Map<Integer, Long> idsByPackedColor;

    /**
     * @param definitions province id by color, as parsed from the definition table.
     */
    public ProvinceColorIndex(Map<ColorKey, Long> definitions) {
        this.idsByPackedColor = new HashMap<>(definitions.size() * 2);
        definitions.forEach((color, id) -> idsByPackedColor.put(color.packed(), id));
    }

    /**
     * Returns the province id of {@code color}, if the table defines one.
     */
    public Optional<Long> provinceOf(ColorKey color) {
        return Optional.ofNullable(idsByPackedColor.get(color.packed()));
    }

    /**
     * Counts the pixels of every province in {@code image}.
     */
    public Census census(RegionImage image) {
        Map<Long, Long> perProvince = new TreeMap<>();
        Map<Integer, Long> unmatched = new HashMap<>();
        long unmatchedPixels = 0;
        byte[] rgb = image.rgb();
        for (int offset = 0; offset < rgb.length; offset += RegionImage.CHANNELS) {
            int packed = ((rgb[offset] & 0xFF) << 16) | ((rgb[offset + 1] & 0xFF) << 8) | (rgb[offset + 2] & 0xFF);
            Long id = idsByPackedColor.get(packed);
            if (id != null) {
                perProvince.merge(id, 1L, Long::sum);
            } else {
                unmatched.merge(packed, 1L, Long::sum);
                unmatchedPixels++;
            }
        }
        Map<ColorKey, Long> unmatchedColors = new HashMap<>();
        unmatched.forEach((packed, count) -> unmatchedColors.put(
                new ColorKey((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF), count));
        return new Census(perProvince, unmatchedPixels, unmatchedColors);
    }
}
