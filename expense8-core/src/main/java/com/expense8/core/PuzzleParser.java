package com.expense8.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads boards from the text format used by the command line tools: three lines of three
 * whitespace-separated integers followed by a line containing {@code END}. Blank lines are ignored.
 */
public final class PuzzleParser {

    public static final String TERMINATOR = "END";

    private PuzzleParser() {
    }

    public static Board parse(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        }
    }

    public static Board parse(Reader input, String source) throws IOException {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(source, "source");
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);

        int[] tiles = new int[Board.CELL_COUNT];
        int rows = 0;
        boolean terminated = false;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (terminated) {
                throw new InvalidPuzzleException(source, lineNumber, "Unexpected content after " + TERMINATOR);
            }
            if (TERMINATOR.equals(trimmed)) {
                if (rows != Board.SIZE) {
                    throw new InvalidPuzzleException(source, lineNumber,
                            TERMINATOR + " found after " + rows + " rows, expected " + Board.SIZE);
                }
                terminated = true;
                continue;
            }
            if (rows == Board.SIZE) {
                throw new InvalidPuzzleException(source, lineNumber,
                        "Expected " + TERMINATOR + " after " + Board.SIZE + " rows");
            }
            String[] tokens = trimmed.split("\\s+");
            if (tokens.length != Board.SIZE) {
                throw new InvalidPuzzleException(source, lineNumber,
                        "Expected " + Board.SIZE + " values but found " + tokens.length);
            }
            for (int col = 0; col < Board.SIZE; col++) {
                try {
                    tiles[Board.index(rows, col)] = Integer.parseInt(tokens[col]);
                } catch (NumberFormatException ex) {
                    throw new InvalidPuzzleException(source, lineNumber, "Not an integer: " + tokens[col], ex);
                }
            }
            rows++;
        }
        if (!terminated) {
            throw new InvalidPuzzleException(source, 0, "Missing " + TERMINATOR + " terminator");
        }
        try {
            return Board.of(tiles);
        } catch (IllegalArgumentException ex) {
            throw new InvalidPuzzleException(source, 0, ex.getMessage(), ex);
        }
    }
}
