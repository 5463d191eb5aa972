package com.pathwayloader.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * File helpers for locating network files.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists regular files directly inside a directory whose name matches a glob.
     *
     * @param directory directory to list
     * @param globPattern file name glob, e.g. {@code *.txt}
     * @return matching files sorted by name
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> findNetworkFiles(Path directory, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.list(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        }
    }

    /**
     * Reads a network list file: one file name per line, blank lines and {@code #} comments ignored.
     *
     * @param listFile list file
     * @return file names in listed order
     * @throws IOException if the file cannot be read
     */
    public static List<String> readNetworkList(Path listFile) throws IOException {
        return Files.readAllLines(listFile, StandardCharsets.UTF_8).stream()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .toList();
    }

    /**
     * Strips the last extension from a file name.
     *
     * @param fileName file name, e.g. {@code wnt.txt}
     * @return base name, e.g. {@code wnt}
     */
    public static String baseName(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }
}
