package com.eightpuzzle.core;

import com.eightpuzzle.core.search.SearchResult;
import com.eightpuzzle.core.search.Strategy;
import java.util.List;
import java.util.Objects;

/**
 * Explicit outcome of {@link PuzzleSolver#solve}. Rejections and exhausted searches are reported
 * here instead of being thrown, so the caller decides how to present them.
 *
 * @param status what happened
 * @param strategy the strategy that ran, or {@code null} if none was invoked
 * @param result the search result, or {@code null} if no search ran
 * @param message human readable summary
 */
public record SolveOutcome(Status status, Strategy strategy, SearchResult result, String message) {

    public SolveOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }

    public enum Status {
        SOLVED,
        NOT_FOUND,
        UNSOLVABLE,
        UNKNOWN_STRATEGY
    }

    static SolveOutcome fromResult(SearchResult result) {
        if (result.found()) {
            return new SolveOutcome(Status.SOLVED, result.strategy(), result,
                    "Solved in " + result.moveCount() + " moves");
        }
        return new SolveOutcome(Status.NOT_FOUND, result.strategy(), result, "No solution found");
    }

    static SolveOutcome unsolvable() {
        return new SolveOutcome(Status.UNSOLVABLE, null, null, "Puzzle is not solvable!");
    }

    static SolveOutcome unknownStrategy(String name) {
        return new SolveOutcome(Status.UNKNOWN_STRATEGY, null, null, "Unknown method: " + name);
    }

    public boolean isSolved() {
        return status == Status.SOLVED;
    }

    /**
     * Returns the solution path, or an empty list unless {@link #isSolved()}.
     */
    public List<Grid> path() {
        return result == null ? List.of() : result.path();
    }
}
