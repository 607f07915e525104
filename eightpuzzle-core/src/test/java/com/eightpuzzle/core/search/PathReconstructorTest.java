package com.eightpuzzle.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.eightpuzzle.core.Direction;
import com.eightpuzzle.core.Grid;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathReconstructorTest {

    @Test
    void walksPredecessorsBackToStart() {
        Grid goal = Grid.goal();
        Grid middle = goal.slide(Direction.LEFT);
        Grid start = middle.slide(Direction.LEFT);

        Map<Grid, Grid> predecessors = new HashMap<>();
        predecessors.put(start, null);
        predecessors.put(middle, start);
        predecessors.put(goal, middle);

        assertEquals(List.of(start, middle, goal), PathReconstructor.reconstruct(predecessors, goal));
        assertEquals(List.of(start, middle), PathReconstructor.reconstruct(predecessors, middle));
    }

    @Test
    void startAloneYieldsSingleElementPath() {
        Map<Grid, Grid> predecessors = new HashMap<>();
        predecessors.put(Grid.goal(), null);

        assertEquals(List.of(Grid.goal()), PathReconstructor.reconstruct(predecessors, Grid.goal()));
    }

    @Test
    void missingTerminalIsAnInternalError() {
        Map<Grid, Grid> predecessors = new HashMap<>();
        predecessors.put(Grid.goal(), null);

        Grid unknown = Grid.goal().slide(Direction.UP);
        assertThrows(IllegalStateException.class, () -> PathReconstructor.reconstruct(predecessors, unknown));
    }

    @Test
    void detectsCycles() {
        Grid a = Grid.goal();
        Grid b = a.slide(Direction.UP);
        Map<Grid, Grid> predecessors = new HashMap<>();
        predecessors.put(a, b);
        predecessors.put(b, a);

        assertThrows(IllegalStateException.class, () -> PathReconstructor.reconstruct(predecessors, a));
    }
}
