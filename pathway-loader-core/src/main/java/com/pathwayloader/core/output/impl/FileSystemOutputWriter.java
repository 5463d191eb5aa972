package com.pathwayloader.core.output.impl;

import com.pathwayloader.core.output.NetworkOutput;
import com.pathwayloader.core.output.OutputContext;
import com.pathwayloader.core.output.OutputFile;
import com.pathwayloader.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes output files below the output directory, creating directories as needed and
 * overwriting existing files.
 */
public class FileSystemOutputWriter implements OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemOutputWriter.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(NetworkOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (OutputFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, OutputFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
