package com.pathwayloader.cli;

import com.pathwayloader.PathwayLoaderCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("validate command")
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("Should print findings without writing files")
    void shouldPrintFindings() throws IOException {
        Path networks = CliFixtures.writeNetworks(tempDir);
        Path symbols = CliFixtures.writeSymbols(tempDir);

        int exitCode = PathwayLoaderCLI.commandLine().execute("validate",
            networks.resolve("wnt.txt").toString(),
            "-c", tempDir.resolve("absent.yaml").toString(),
            "-g", symbols.toString());

        String console = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(console).contains("✓ wnt.txt");
        assertThat(console).contains("INVALID_GENE_NAME q (FOOBAR123)");
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                .containsExactlyInAnyOrder("networks", "symbols.txt");
        }
    }

    @Test
    @DisplayName("Should print repaired input defects as warnings")
    void shouldPrintWarnings() throws IOException {
        Path file = Files.writeString(tempDir.resolve("dangling.txt"), """
            Dangling
            --NODE_NAME\tNODE_ID\tNODE_TYPE\tPARENT_ID
            DVL1\ta\tGENE\tmissing
            CTNNB1\tc\tGENE\t-1

            --EDGE_ID\tSOURCE\tTARGET\tEDGE_TYPE
            e1\ta\tc\tACTIVATES
            e2\ta\tnowhere\tACTIVATES
            """);

        int exitCode = PathwayLoaderCLI.commandLine().execute("validate", file.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        String console = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(console).contains("WARNING Node a references unknown parent missing");
        assertThat(console).contains("WARNING Dropped edge a -[ACTIVATES]-> nowhere");
    }

    @Test
    @DisplayName("Should exit with 2 when a file cannot be parsed")
    void shouldReportParseFailure() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.txt"), "");

        int exitCode = PathwayLoaderCLI.commandLine().execute("validate", file.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_NETWORK_FAILURES);
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("✗ empty.txt: empty.txt: File is empty");
    }

    @Test
    @DisplayName("Should require at least one file")
    void shouldRequireFiles() {
        int exitCode = PathwayLoaderCLI.commandLine().execute("validate");

        assertThat(exitCode).isNotZero();
    }
}
