package com.pathwayloader.core.output.impl;

import com.pathwayloader.core.output.NetworkOutput;
import com.pathwayloader.core.output.OutputContext;
import com.pathwayloader.core.output.OutputFile;
import com.pathwayloader.core.output.OutputWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints output files to a stream instead of writing them, used for dry runs.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.showContent} - print file content, not only the file list (default false)</li>
 * </ul>
 */
public class ConsoleOutputWriter implements OutputWriter {

    public static final String SHOW_CONTENT = "console.showContent";

    private static final Logger logger = LoggerFactory.getLogger(ConsoleOutputWriter.class);

    private final PrintStream out;

    public ConsoleOutputWriter() {
        this(System.out);
    }

    public ConsoleOutputWriter(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(NetworkOutput output, OutputContext context) {
        boolean showContent = Boolean.parseBoolean(context.getSettingOrDefault(SHOW_CONTENT, "false"));
        logger.debug("Printing {} files to console (content: {})", output.files().size(), showContent);

        out.println("Would write " + output.files().size() + " files to " + context.outputDirectory() + ":");
        for (OutputFile file : output.files()) {
            out.println("  " + file.relativePath() + " (" + file.content().length() + " bytes)");
            if (showContent) {
                out.println("---");
                out.println(file.content());
                out.println("---");
            }
        }
    }
}
