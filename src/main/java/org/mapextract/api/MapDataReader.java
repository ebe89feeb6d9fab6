package org.mapextract.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.mapextract.definitions.ColorKey;
import org.mapextract.definitions.DefinitionTableParser;
import org.mapextract.image.RegionImage;
import org.mapextract.image.RegionImageLoader;
import org.mapextract.io.SourceLoader;
import org.mapextract.io.SourceLoader.LoadResult;
import org.mapextract.text.ExtractionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reading map assets from disk.
 * <p>
 * Each method reads its file completely, then hands the content to the matching
 * parser. I/O failures surface as {@link IOException} naming the file; content
 * failures surface as {@link MapDataException} subclasses. Nothing is cached: every
 * call parses its file anew.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe; the reader holds only immutable
 * configuration.
 */
public class MapDataReader {

    private static final Logger log = LoggerFactory.getLogger(MapDataReader.class);

    private final ExtractionPipeline pipeline;
    private final DefinitionTableParser definitionParser;

    /**
     * Creates a reader for the standard layouts: provinces under {@code state},
     * {@code ;}-separated definition records.
     */
    public MapDataReader() {
        this(new ExtractionPipeline(), new DefinitionTableParser());
    }

    /**
     * Creates a reader for the standard state layout with a custom definition table format.
     */
    public MapDataReader(DefinitionTableParser definitionParser) {
        this(new ExtractionPipeline(), definitionParser);
    }

    /**
     * Creates a reader for a custom key path with {@code ;}-separated definition records.
     */
    public MapDataReader(ExtractionPipeline pipeline) {
        this(pipeline, new DefinitionTableParser());
    }

    public MapDataReader(ExtractionPipeline pipeline, DefinitionTableParser definitionParser) {
        this.pipeline = pipeline;
        this.definitionParser = definitionParser;
    }

    /**
     * Reads the province ids listed by a state definition file.
     *
     * @param path the state file.
     * @return province ids in file order.
     * @throws IOException      if the file cannot be read.
     * @throws MapDataException if the file is malformed or lacks a key of the configured path.
     */
    public List<Long> readStateProvinces(Path path) throws IOException, MapDataException {
        LoadResult source = SourceLoader.loadFile(path);
        log.debug("Extracting {} from {} ({} chars)",
                String.join(".", pipeline.getKeyPath()), source.logicalName(), source.content().length());
        List<Long> provinces = pipeline.extract(source.content());
        log.info("Read {} province id(s) from {}", provinces.size(), source.logicalName());
        return provinces;
    }

    /**
     * Reads the color-to-province table.
     *
     * @param path the definition table, usually {@code definition.csv}.
     * @return province id by color.
     * @throws IOException         if the file cannot be read.
     * @throws MapFormatException if a record is malformed or a color repeats.
     */
    public Map<ColorKey, Long> readProvinceDefinitions(Path path) throws IOException, MapFormatException {
        LoadResult source = SourceLoader.loadFile(path);
        Map<ColorKey, Long> definitions = definitionParser.parse(source.content());
        log.info("Read {} province definition(s) from {}", definitions.size(), source.logicalName());
        return definitions;
    }

    /**
     * Reads the region bitmap.
     *
     * @param path the bitmap, usually {@code provinces.bmp}.
     * @return the decoded 8-bit RGB pixels.
     * @throws IOException                      if the file cannot be read or decoded.
     * @throws UnsupportedPixelFormatException if the bitmap is not 8-bit RGB.
     */
    public RegionImage readRegionImage(Path path) throws IOException, UnsupportedPixelFormatException {
        RegionImage image = RegionImageLoader.load(path);
        log.info("Read {}x{} region image from {}", image.width(), image.height(), path);
        return image;
    }
}
