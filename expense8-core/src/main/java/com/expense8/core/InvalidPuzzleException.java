package com.expense8.core;

/**
 * Raised when a puzzle file does not describe a valid 3x3 board.
 */
public final class InvalidPuzzleException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final int line;

    public InvalidPuzzleException(String source, int line, String message) {
        this(source, line, message, null);
    }

    public InvalidPuzzleException(String source, int line, String message, Throwable cause) {
        super(format(source, line, message), cause);
        this.source = source;
        this.line = line;
    }

    public String getSource() {
        return source;
    }

    /**
     * Returns the one-based line the problem was found on, or {@code 0} if it concerns the whole file.
     */
    public int getLine() {
        return line;
    }

    private static String format(String source, int line, String message) {
        return line > 0 ? source + ":" + line + ": " + message : source + ": " + message;
    }
}
