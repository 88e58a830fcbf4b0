package com.expense8.core.search;

import com.expense8.core.Board;
import com.expense8.core.InvalidPuzzleException;
import com.expense8.core.Parity;
import com.expense8.core.PuzzleParser;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point printing a side-by-side comparison of all strategies.
 */
public final class ComparisonRunner {

    private static final Logger LOGGER = Logger.getLogger(ComparisonRunner.class.getName());

    private ComparisonRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 4) {
            printUsage();
            System.exit(1);
            return;
        }
        try {
            Path startPath = Paths.get(args[0]);
            Path goalPath = Paths.get(args[1]);
            int dlsLimit = args.length > 2 ? Integer.parseInt(args[2]) : SearchConstraints.DEFAULT_MAX_DEPTH;
            int idsMaxDepth = args.length > 3 ? Integer.parseInt(args[3]) : SearchConstraints.DEFAULT_MAX_DEPTH;

            Board start = PuzzleParser.parse(startPath);
            Board goal = PuzzleParser.parse(goalPath);
            if (!Parity.sameComponent(start, goal)) {
                System.err.println("Goal is unreachable from the start board (permutation parity differs).");
                System.exit(3);
                return;
            }

            Comparison comparison = new Comparison(new GraphSearchEngine(), dlsLimit, idsMaxDepth);
            List<SearchResult> results = comparison.run(start, goal);
            System.out.print(Comparison.formatTable(results));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
            System.exit(1);
        } catch (IOException ex) {
            LOGGER.log(Level.SEVERE, "Failed to read puzzle file", ex);
            System.exit(2);
        } catch (InvalidPuzzleException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.exit(2);
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: ComparisonRunner <start_file> <goal_file> [dlsLimit] [idsMaxDepth]");
    }
}
