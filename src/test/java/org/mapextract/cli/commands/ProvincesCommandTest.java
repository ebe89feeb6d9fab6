package org.mapextract.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mapextract.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the provinces command.
 */
@Tag("integration")
public class ProvincesCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    private Path writeState(String content) throws Exception {
        return Files.writeString(tempDir.resolve("1-Test.txt"), content);
    }

    @Test
    void testCommandIsRegistered() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands())
                .containsKeys("provinces", "definitions", "image", "help");
    }

    @Test
    void testHelpOutput() {
        execute("provinces", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("provinces");
        assertThat(output).contains("--file");
        assertThat(output).contains("--key-path");
    }

    @Test
    void testPrintsOneIdPerLine() throws Exception {
        Path state = writeState("state={\n  id=1 # comment\n  provinces={ 10 20 30 }\n}\n");

        int exitCode = execute("provinces", "-f", state.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s", err.toString())
            .isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly("10", "20", "30");
    }

    @Test
    void testJsonOutput() throws Exception {
        Path state = writeState("state = { provinces = { 7 } }");

        int exitCode = execute("provinces", "-f", state.toString(), "--json");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("\"provinces\"").contains("\"keyPath\"").contains("7");
    }

    @Test
    void testCustomKeyPath() throws Exception {
        Path state = writeState("state = { history = { victory_points = { 3838 1 } } }");

        int exitCode = execute("provinces", "-f", state.toString(), "--key-path", "state,history,victory_points");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString().lines()).containsExactly("3838", "1");
    }

    @Test
    void testMissingKeyFailsWithMessage() throws Exception {
        Path state = writeState("state = { id = 1 }");

        int exitCode = execute("provinces", "-f", state.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("provinces");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testMissingFileFails() {
        int exitCode = execute("provinces", "-f", tempDir.resolve("none.txt").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("none.txt");
    }

    @Test
    void testMissingConfigFileFails() throws Exception {
        Path state = writeState("state = { provinces = { 1 } }");

        int exitCode = execute("-c", tempDir.resolve("absent.conf").toString(), "provinces", "-f", state.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Configuration file not found");
    }
}
