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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the color-to-province table, one {@code id;r;g;b} line per record.
 */
@Command(
    name = "definitions",
    mixinStandardHelpOptions = true,
    description = "Parse a province color definition table"
)
public class DefinitionsCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Definition table, usually definition.csv"
    )
    private Path file;

    @Option(
        names = {"--json"},
        description = "Print the result as JSON"
    )
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        return CommandSupport.run(spec, DefinitionsCommand.class, () -> {
            String separator = ConfigLoader.fieldSeparator(parent.getConfig());
            MapDataReader reader = new MapDataReader(new DefinitionTableParser(separator));
            Map<ColorKey, Long> definitions = reader.readProvinceDefinitions(file);

            if (json) {
                JsonArray records = new JsonArray();
                definitions.forEach((color, id) -> {
                    JsonObject record = new JsonObject();
                    record.addProperty("id", id);
                    record.addProperty("r", color.red());
                    record.addProperty("g", color.green());
                    record.addProperty("b", color.blue());
                    records.add(record);
                });
                out.println(CommandSupport.GSON.toJson(records));
            } else {
                definitions.forEach((color, id) ->
                    out.println(id + separator + color.red() + separator + color.green() + separator + color.blue()));
            }
        });
    }
}
