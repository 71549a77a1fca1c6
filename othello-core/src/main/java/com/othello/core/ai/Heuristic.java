package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Color;
import java.util.Locale;
import java.util.function.ToIntBiFunction;

/**
 * Evaluation function selected once from configuration and then called at every search leaf.
 */
public enum Heuristic {
    CORNERS_CAPTURED("corners_captured", Heuristics::cornersCaptured),
    COIN_PARITY("coin_parity", Heuristics::coinParity),
    MOBILITY("mobility", Heuristics::mobility),
    ALL_IN_ONE("all_in_one", Heuristics::allInOne);

    private final String configName;
    private final ToIntBiFunction<Board, Color> function;

    Heuristic(String configName, ToIntBiFunction<Board, Color> function) {
        this.configName = configName;
        this.function = function;
    }

    public int evaluate(Board board, Color maxPlayer) {
        return function.applyAsInt(board, maxPlayer);
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves a configuration value. {@code default} selects {@link #ALL_IN_ONE}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Heuristic fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("default".equals(normalized)) {
            return ALL_IN_ONE;
        }
        for (Heuristic heuristic : values()) {
            if (heuristic.configName.equals(normalized)) {
                return heuristic;
            }
        }
        throw new IllegalArgumentException("Unknown heuristic: " + name);
    }
}
