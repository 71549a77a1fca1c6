package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Color;
import java.util.Locale;

/**
 * Tree walk used below the root. Both return the same score; alpha-beta visits fewer nodes.
 */
public enum SearchAlgorithm {
    MINIMAX("minimax") {
        @Override
        public int score(MinimaxAI ai, Board board, int depth, Color maxPlayer) {
            return ai.minimax(board, depth, maxPlayer);
        }
    },
    ALPHA_BETA("ab") {
        @Override
        public int score(MinimaxAI ai, Board board, int depth, Color maxPlayer) {
            return ai.alphabeta(board, depth, MinimaxAI.NEGATIVE_INFINITY, MinimaxAI.POSITIVE_INFINITY, maxPlayer);
        }
    };

    private final String configName;

    SearchAlgorithm(String configName) {
        this.configName = configName;
    }

    /**
     * Scores {@code board} for {@code maxPlayer}, searching {@code depth} plies with {@code ai}.
     */
    public abstract int score(MinimaxAI ai, Board board, int depth, Color maxPlayer);

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves {@code minimax}, {@code ab} or {@code alphabeta}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SearchAlgorithm fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "minimax":
                return MINIMAX;
            case "ab":
            case "alphabeta":
            case "alpha_beta":
                return ALPHA_BETA;
            default:
                throw new IllegalArgumentException("Unknown search algorithm: " + name);
        }
    }
}
