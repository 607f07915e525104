package com.eightpuzzle.core;

import com.eightpuzzle.core.search.SearchResult;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end: scrambles a puzzle, lets the user pick a strategy and prints the
 * solution step by step.
 */
public final class PuzzleCLI {

    private static final Logger LOGGER = Logger.getLogger(PuzzleCLI.class.getName());

    private final PuzzleSolver solver;
    private final PrintStream out;
    private Grid current;

    PuzzleCLI(PuzzleSolver solver, PrintStream out) {
        this.solver = solver;
        this.out = out;
        this.current = solver.newPuzzle();
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parseOptions(args);
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
            return;
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            return;
        }

        Shuffler shuffler = options.seed() == null ? new Shuffler() : new Shuffler(new Random(options.seed()));
        PuzzleCLI cli = new PuzzleCLI(new PuzzleSolver(options.config(), shuffler), System.out);
        cli.run(new Scanner(System.in));
    }

    /**
     * Parses {@code --moves=<n>}, {@code --depthLimit=<n>} and {@code --seed=<n>}.
     */
    static Options parseOptions(String[] args) {
        SolverConfig config = SolverConfig.defaults();
        Long seed = null;
        for (String option : args) {
            if (option.startsWith("--moves=")) {
                config = config.withShuffleMoves(Integer.parseInt(option.substring("--moves=".length())));
            } else if (option.startsWith("--depthLimit=")) {
                config = config.withDepthLimit(Integer.parseInt(option.substring("--depthLimit=".length())));
            } else if (option.startsWith("--seed=")) {
                if (seed != null) {
                    throw new IllegalArgumentException("Seed specified more than once");
                }
                seed = Long.parseLong(option.substring("--seed=".length()));
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }
        return new Options(config, seed);
    }

    Grid current() {
        return current;
    }

    void run(Scanner scanner) {
        out.println("8 Puzzle Solver (console edition)");
        printHelp();
        printGrid(current);
        while (true) {
            out.print("> ");
            if (!scanner.hasNextLine()) {
                return;
            }
            if (!execute(scanner.nextLine())) {
                return;
            }
        }
    }

    /**
     * Executes one command line and returns {@code false} when the session should end.
     */
    boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String[] parts = trimmed.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        switch (command) {
            case "quit":
            case "exit":
                return false;
            case "help":
                printHelp();
                break;
            case "show":
                printGrid(current);
                break;
            case "shuffle":
                current = solver.newPuzzle();
                printGrid(current);
                break;
            case "set":
                if (parts.length < 2) {
                    out.println("Usage: set <9 digits>");
                    break;
                }
                try {
                    current = Grid.parse(parts[1]);
                    printGrid(current);
                    if (!solver.isSolvable(current)) {
                        out.println("Warning: this puzzle is not solvable.");
                    }
                } catch (IllegalArgumentException ex) {
                    out.println(ex.getMessage());
                }
                break;
            default:
                solve(command);
                break;
        }
        return true;
    }

    private void solve(String method) {
        SolveOutcome outcome = solver.solve(current, Grid.goal(), method);
        if (!outcome.isSolved()) {
            out.println(outcome.message());
            return;
        }
        List<Grid> path = outcome.path();
        for (int i = 0; i < path.size(); i++) {
            out.printf("Step %d:%n", i + 1);
            printGrid(path.get(i));
        }
        SearchResult result = outcome.result();
        out.printf("%s: %d moves, %d nodes expanded, peak frontier %d, %.2f ms%n", result.strategy(),
                result.moveCount(), result.expandedNodes(), result.peakFrontierSize(), result.elapsedMillis());
    }

    private void printGrid(Grid grid) {
        out.println(grid);
        out.println();
    }

    private void printHelp() {
        out.println("Commands: shuffle | bfs | dfs | ucs | set <9 digits> | show | help | quit");
    }

    private static void printUsage() {
        System.err.println("Usage: PuzzleCLI [--moves=<n>] [--depthLimit=<n>] [--seed=<n>]");
    }

    record Options(SolverConfig config, Long seed) {
    }
}
