package com.eightpuzzle.core.search;

import java.util.Locale;
import java.util.Optional;

/**
 * Uninformed search strategies offered by the solver.
 */
public enum Strategy {
    BFS,
    DFS,
    UCS;

    /**
     * Resolves a strategy by its case-insensitive name, or returns an empty optional for unknown names.
     */
    public static Optional<Strategy> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (Strategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }
}
