package org.mapextract.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.mapextract.cli.commands.DefinitionsCommand;
import org.mapextract.cli.commands.ImageCommand;
import org.mapextract.cli.commands.ProvincesCommand;
import org.mapextract.cli.config.ConfigLoader;
import org.mapextract.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "mapextract",
    mixinStandardHelpOptions = true,
    version = "mapextract 1.0",
    description = "Extracts province data from strategy-game map assets",
    subcommands = {
        ProvincesCommand.class,
        DefinitionsCommand.class,
        ImageCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/mapextract.conf)"
    )
    private File configFile;

    @Option(
        names = {"-v", "--verbose"},
        description = "Log at DEBUG level"
    )
    private boolean verbose;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("mapextract");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it and applying its logging settings
     * on first use.
     *
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
            LoggingConfigurator.configure(config);
            if (verbose) {
                LoggingConfigurator.setRootLevel(Level.DEBUG);
            }
        }
        return config;
    }
}
