package org.mapextract.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.mapextract.api.MapDataReader;
import org.mapextract.cli.CommandLineInterface;
import org.mapextract.cli.config.ConfigLoader;
import org.mapextract.definitions.ColorKey;
import org.mapextract.definitions.DefinitionTableParser;
import org.mapextract.image.ProvinceColorIndex;
import org.mapextract.image.ProvinceColorIndex.Census;
import org.mapextract.image.RegionImage;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Reports the size of a region bitmap and, given a definition table, how many pixels
 * each province covers.
 */
@Command(
    name = "image",
    mixinStandardHelpOptions = true,
    description = "Inspect a region bitmap"
)
public class ImageCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Region bitmap, usually provinces.bmp"
    )
    private Path file;

    @Option(
        names = {"-d", "--definitions"},
        description = "Definition table used to map pixel colors to province ids"
    )
    private Path definitionsFile;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return CommandSupport.run(spec, ImageCommand.class, () -> {
            String separator = ConfigLoader.fieldSeparator(parent.getConfig());
            MapDataReader reader = new MapDataReader(new DefinitionTableParser(separator));
            RegionImage image = reader.readRegionImage(file);
            out.println("Size: " + image.width() + "x" + image.height() + " (" + image.pixelCount() + " pixels)");
            if (definitionsFile == null) {
                return;
            }

            Map<ColorKey, Long> definitions = reader.readProvinceDefinitions(definitionsFile);
            Census census = new ProvinceColorIndex(definitions).census(image);
            out.println("Provinces: " + census.pixelsPerProvince().size());
            census.pixelsPerProvince().forEach((id, pixels) -> out.println("  " + id + ": " + pixels));
            out.println("Unmatched pixels: " + census.unmatchedPixels()
                    + " in " + census.unmatchedColors().size() + " color(s)");
        });
    }
}
