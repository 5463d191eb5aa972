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

@DisplayName("load command")
class LoadCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream outputStream;

    private Path networks;
    private Path symbols;
    private Path output;
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        networks = CliFixtures.writeNetworks(tempDir);
        symbols = CliFixtures.writeSymbols(tempDir);
        output = tempDir.resolve("out");
        config = tempDir.resolve("absent.yaml");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    @DisplayName("Should write one CX file per network plus reports")
    void shouldWriteNetworksAndReports() throws IOException {
        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-g", symbols.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(output.resolve("wnt.cx")).exists();
        assertThat(Files.readString(output.resolve("wnt.cx")))
            .contains("\"Wnt Signaling\"")
            .contains("\"member\"");
        assertThat(Files.readString(output.resolve("invalid_gene_names.tsv")))
            .contains("wnt.txt\tq\tFOOBAR123");
        assertThat(output.resolve("nested_complexes.tsv")).exists();
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("✓ wnt.txt");
    }

    @Test
    @DisplayName("Should keep going and exit with 2 when a network fails")
    void shouldIsolateFailedNetworks() throws IOException {
        Files.writeString(networks.resolve("broken.txt"), "Broken\nno node header\n");

        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-g", symbols.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_NETWORK_FAILURES);
        assertThat(output.resolve("wnt.cx")).exists();
        assertThat(output.resolve("broken.cx")).doesNotExist();
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("✗ broken.txt");
    }

    @Test
    @DisplayName("Should skip reports with --no-reports")
    void shouldSkipReports() {
        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-o", output.toString(), "--no-reports");

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(output.resolve("wnt.cx")).exists();
        assertThat(output.resolve("invalid_gene_names.tsv")).doesNotExist();
    }

    @Test
    @DisplayName("Should only list files on a dry run")
    void shouldListFilesOnDryRun() {
        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-o", output.toString(), "--dry-run");

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(output).doesNotExist();
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).contains("wnt.cx");
    }

    @Test
    @DisplayName("Should print file content on dry run when asked")
    void shouldShowContentOnDryRun() {
        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-o", output.toString(), "--dry-run", "--show-content");

        String console = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(output).doesNotExist();
        assertThat(console).contains("wnt.cx").contains("numberVerification");
    }

    @Test
    @DisplayName("Should list file names only on a plain dry run")
    void shouldHideContentOnPlainDryRun() {
        execute("load", networks.toString(), "-c", config.toString(), "-o", output.toString(), "--dry-run");

        assertThat(outputStream.toString(StandardCharsets.UTF_8)).doesNotContain("numberVerification");
    }

    @Test
    @DisplayName("Should load only the networks named in the network list")
    void shouldHonorNetworkList() throws IOException {
        Files.writeString(networks.resolve("other.txt"), CliFixtures.WNT_NETWORK);
        Path list = Files.writeString(tempDir.resolve("networks.list"), "# selection\nother.txt\n");

        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-l", list.toString(), "-o", output.toString(), "--no-reports");

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(output.resolve("other.cx")).exists();
        assertThat(output.resolve("wnt.cx")).doesNotExist();
    }

    @Test
    @DisplayName("Should read input and output directories from the config file")
    void shouldUseConfigFile() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve("pathway-loader.yaml"), """
            input:
              directory: "%s"
            network:
              attributes:
                organism: "Human, 9606, Homo sapiens"
            output:
              directory: "%s"
              writeReports: false
            """.formatted(networks.toString().replace("\\", "/"), output.toString().replace("\\", "/")));

        int exitCode = execute("load", "-c", configFile.toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_OK);
        assertThat(Files.readString(output.resolve("wnt.cx"))).contains("Human, 9606, Homo sapiens");
        assertThat(output.resolve("invalid_gene_names.tsv")).doesNotExist();
    }

    @Test
    @DisplayName("Should exit with 1 when the data directory is missing")
    void shouldFailOnMissingDirectory() {
        int exitCode = execute("load", tempDir.resolve("absent").toString(), "-c", config.toString(),
            "-o", output.toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_ERROR);
    }

    @Test
    @DisplayName("Should exit with 1 when the gene symbol file is missing")
    void shouldFailOnMissingSymbolFile() {
        int exitCode = execute("load", networks.toString(), "-c", config.toString(),
            "-g", tempDir.resolve("absent.tsv").toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(CommandSupport.EXIT_ERROR);
        assertThat(output).doesNotExist();
    }

    private static int execute(String... args) {
        return PathwayLoaderCLI.commandLine().execute(args);
    }
}
