package org.mapextract.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.mapextract.api.MapDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Model.CommandSpec;

/**
 * Shared error handling of the subcommands: every failure ends the command with exit
 * code 1 and a one-line message on stderr; the stack trace goes to the log at DEBUG.
 */
final class CommandSupport {

    static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @FunctionalInterface
    interface Action {
        void run() throws IOException, MapDataException;
    }

    private CommandSupport() {}

    static int run(CommandSpec spec, Class<?> command, Action action) {
        Logger log = LoggerFactory.getLogger(command);
        PrintWriter err = spec.commandLine().getErr();
        try {
            action.run();
            spec.commandLine().getOut().flush();
            return 0;
        } catch (MapDataException e) {
            err.println("Error: invalid input: " + e.getMessage());
            log.debug("Extraction failed", e);
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            log.debug("I/O failure", e);
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            log.debug("Invalid configuration or arguments", e);
        }
        err.flush();
        return 1;
    }
}
