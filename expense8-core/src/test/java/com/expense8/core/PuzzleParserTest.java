package com.expense8.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PuzzleParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesBundledPuzzle() throws IOException, URISyntaxException {
        Path path = Paths.get(getClass().getResource("/puzzles/start.txt").toURI());
        assertEquals(Board.of(1, 2, 3, 4, 0, 5, 7, 8, 6), PuzzleParser.parse(path));
    }

    @Test
    void toleratesExtraWhitespaceAndBlankLines() throws IOException {
        String text = "\n  1 2   3\n4\t5 6\n\n7 8 0  \nEND\n\n";
        assertEquals(Board.of(1, 2, 3, 4, 5, 6, 7, 8, 0), parse(text));
    }

    @Test
    void rejectsShortRow() {
        InvalidPuzzleException ex = assertThrows(InvalidPuzzleException.class,
                () -> parse("1 2 3\n4 5\n7 8 0\nEND\n"));
        assertEquals(2, ex.getLine());
    }

    @Test
    void rejectsNonIntegerToken() {
        InvalidPuzzleException ex = assertThrows(InvalidPuzzleException.class,
                () -> parse("1 2 3\n4 x 6\n7 8 0\nEND\n"));
        assertEquals(2, ex.getLine());
        assertTrue(ex.getMessage().contains("Not an integer"));
    }

    @Test
    void rejectsMissingTerminator() {
        InvalidPuzzleException ex = assertThrows(InvalidPuzzleException.class,
                () -> parse("1 2 3\n4 5 6\n7 8 0\n"));
        assertEquals(0, ex.getLine());
    }

    @Test
    void rejectsEarlyOrMisplacedTerminator() {
        assertThrows(InvalidPuzzleException.class, () -> parse("1 2 3\n4 5 6\nEND\n7 8 0\n"));
        assertThrows(InvalidPuzzleException.class, () -> parse("1 2 3\n4 5 6\n7 8 0\n1 2 3\nEND\n"));
        assertThrows(InvalidPuzzleException.class, () -> parse("1 2 3\n4 5 6\n7 8 0\nEND\n1 2 3\n"));
    }

    @Test
    void rejectsDuplicateOrOutOfRangeTiles() {
        InvalidPuzzleException duplicate = assertThrows(InvalidPuzzleException.class,
                () -> parse("1 2 3\n4 5 6\n7 8 8\nEND\n"));
        assertTrue(duplicate.getMessage().contains("Duplicate"));
        assertThrows(InvalidPuzzleException.class, () -> parse("1 2 3\n4 5 6\n7 8 9\nEND\n"));
    }

    @Test
    void reportsSourceInMessage() throws IOException {
        Path file = tempDir.resolve("broken.txt");
        Files.writeString(file, "1 2 3\nEND\n");
        InvalidPuzzleException ex = assertThrows(InvalidPuzzleException.class, () -> PuzzleParser.parse(file));
        assertEquals(file.toString(), ex.getSource());
        assertTrue(ex.getMessage().startsWith(file + ":2:"));
    }

    @Test
    void missingFileIsAnIoError() {
        assertThrows(NoSuchFileException.class, () -> PuzzleParser.parse(tempDir.resolve("absent.txt")));
    }

    private static Board parse(String text) throws IOException {
        return PuzzleParser.parse(new StringReader(text), "test");
    }
}
