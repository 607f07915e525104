package com.eightpuzzle.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eightpuzzle.core.search.Strategy;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class PuzzleSolverTest {

    private final PuzzleSolver solver = new PuzzleSolver();

    @Test
    void solvesOneSlideScenarioWithBfsAndUcs() {
        Grid start = Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 0, 8}});
        assertTrue(solver.isSolvable(start));

        SolveOutcome bfs = solver.solve(start, Grid.goal(), Strategy.BFS);
        SolveOutcome ucs = solver.solve(start, Grid.goal(), "ucs");

        assertEquals(SolveOutcome.Status.SOLVED, bfs.status());
        assertEquals(List.of(start, Grid.goal()), bfs.path());
        assertEquals(bfs.path(), ucs.path());
        assertEquals(Strategy.UCS, ucs.strategy());
    }

    @Test
    void reportsUnsolvableStartWithoutSearching() {
        Grid start = Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {8, 7, 0}});
        assertFalse(solver.isSolvable(start));

        for (Strategy strategy : Strategy.values()) {
            SolveOutcome outcome = solver.solve(start, Grid.goal(), strategy);
            assertEquals(SolveOutcome.Status.UNSOLVABLE, outcome.status());
            assertNull(outcome.result(), "No search should have run");
            assertTrue(outcome.path().isEmpty());
        }
    }

    @Test
    void reportsUnknownStrategyWithoutSearching() {
        SolveOutcome outcome = solver.solve(Grid.goal(), Grid.goal(), "A*");

        assertEquals(SolveOutcome.Status.UNKNOWN_STRATEGY, outcome.status());
        assertNull(outcome.strategy());
        assertNull(outcome.result());
        assertEquals(SolveOutcome.Status.UNKNOWN_STRATEGY, solver.solve(Grid.goal(), Grid.goal(), (String) null).status());
    }

    @Test
    void reportsNotFoundWhenDepthCapIsHit() {
        PuzzleSolver shallow = new PuzzleSolver(SolverConfig.defaults().withDepthLimit(0));

        SolveOutcome outcome = shallow.solve(Grid.parse("123456708"), Grid.goal(), "DFS");

        assertEquals(SolveOutcome.Status.NOT_FOUND, outcome.status());
        assertEquals("No solution found", outcome.message());
        assertFalse(outcome.result().found());
    }

    @Test
    void newPuzzleIsSolvable() {
        PuzzleSolver seeded = new PuzzleSolver(SolverConfig.defaults(), new Shuffler(new Random(21)));
        for (int i = 0; i < 20; i++) {
            assertTrue(seeded.isSolvable(seeded.newPuzzle()));
        }
    }

    @Test
    void configValidatesLimits() {
        assertEquals(50, SolverConfig.defaults().depthLimit());
        assertEquals(30, SolverConfig.defaults().shuffleMoves());
        assertThrows(IllegalArgumentException.class, () -> new SolverConfig(-1, 30));
        assertThrows(IllegalArgumentException.class, () -> SolverConfig.defaults().withShuffleMoves(-5));
    }

    @Test
    void strategyNamesAreCaseInsensitive() {
        assertEquals(Strategy.DFS, Strategy.fromName(" dfs ").orElseThrow());
        assertTrue(Strategy.fromName("IDA").isEmpty());
    }
}
