package com.eightpuzzle.core.search;

import static com.eightpuzzle.core.search.PathAssertions.assertValidPath;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eightpuzzle.core.Grid;
import java.util.List;
import org.junit.jupiter.api.Test;

class BreadthFirstSearchTest {

    private final BreadthFirstSearch bfs = new BreadthFirstSearch();

    @Test
    void oneSlideFromGoalYieldsTwoElementPath() {
        Grid start = Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 0, 8}});

        SearchResult result = bfs.search(start, Grid.goal());

        assertTrue(result.found());
        assertEquals(List.of(start, Grid.goal()), result.path());
        assertEquals(1, result.moveCount());
        assertEquals(Strategy.BFS, result.strategy());
    }

    @Test
    void startEqualToGoalYieldsSingleElementPath() {
        SearchResult result = bfs.search(Grid.goal(), Grid.goal());

        assertEquals(List.of(Grid.goal()), result.path());
        assertEquals(0, result.moveCount());
        assertEquals(0L, result.expandedNodes());
    }

    @Test
    void findsShortestPaths() {
        assertEquals(2, bfs.search(Grid.parse("123456078"), Grid.goal()).moveCount());
        assertEquals(3, bfs.search(Grid.parse("123046758"), Grid.goal()).moveCount());
        assertEquals(22, bfs.search(Grid.parse("012345678"), Grid.goal()).moveCount());
    }

    @Test
    void solvesHardestConfiguration() {
        Grid start = Grid.parse("867254301");

        SearchResult result = bfs.search(start, Grid.goal());

        assertEquals(31, result.moveCount());
        assertValidPath(result.path(), start, Grid.goal());
    }

    @Test
    void exhaustsFrontierForUnreachableGoal() {
        Grid unreachable = Grid.parse("123456870");

        SearchResult result = bfs.search(Grid.parse("123456708"), unreachable);

        assertFalse(result.found());
        assertEquals(-1, result.moveCount());
        assertEquals(181_440L, result.expandedNodes());
    }
}
