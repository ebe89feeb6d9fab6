package org.mapextract.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.mapextract.api.MapDataReader;
import org.mapextract.cli.CommandLineInterface;
import org.mapextract.cli.config.ConfigLoader;
import org.mapextract.text.ExtractionPipeline;

import com.google.gson.JsonObject;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the province ids listed by a state definition file.
 * <p>
 * The key path defaults to {@code mapextract.extraction.key-path} and can be
 * overridden with {@code --key-path}.
 */
@Command(
    name = "provinces",
    mixinStandardHelpOptions = true,
    description = "List the province ids of a state definition file"
)
public class ProvincesCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "State definition file"
    )
    private Path file;

    @Option(
        names = {"-k", "--key-path"},
        split = ",",
        description = "Comma-separated keys leading to the integer array (default from config: state,provinces)"
    )
    private List<String> keyPath;

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
        return CommandSupport.run(spec, ProvincesCommand.class, () -> {
            List<String> path = keyPath != null ? keyPath : ConfigLoader.keyPath(parent.getConfig());
            MapDataReader reader = new MapDataReader(new ExtractionPipeline(path));
            List<Long> provinces = reader.readStateProvinces(file);

            if (json) {
                JsonObject result = new JsonObject();
                result.addProperty("file", file.toString());
                result.add("keyPath", CommandSupport.GSON.toJsonTree(path));
                result.add("provinces", CommandSupport.GSON.toJsonTree(provinces));
                out.println(CommandSupport.GSON.toJson(result));
            } else {
                provinces.forEach(out::println);
            }
        });
    }
}
