package com.pathwayloader.core.parser;

/**
 * Thrown when a network file is malformed: empty, missing a section header, or
 * holding rows that do not fit their header.
 *
 * <p>Fatal for the one network being parsed; batch processing continues with the
 * next file.
 */
public class NetworkParseException extends RuntimeException {

    private final String sourceName;
    private final int lineNumber;

    public NetworkParseException(String sourceName, String message) {
        this(sourceName, -1, message);
    }

    public NetworkParseException(String sourceName, int lineNumber, String message) {
        super(format(sourceName, lineNumber, message));
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Returns the 1-based line the problem was found on.
     *
     * @return line number, or -1 when the problem concerns the whole file
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private static String format(String sourceName, int lineNumber, String message) {
        if (lineNumber > 0) {
            return sourceName + ":" + lineNumber + ": " + message;
        }
        return sourceName + ": " + message;
    }
}
