package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Color;

/**
 * Static position evaluators. Every function scores the board from the point of view of
 * {@code maxPlayer}: higher is better for that player.
 */
public final class Heuristics {

    public static final int CORNER_WEIGHT = 10;
    public static final int MOBILITY_WEIGHT = 4;
    public static final int COIN_WEIGHT = 1;

    private Heuristics() {
    }

    /**
     * Compares the corners held by each player, in [-100, 100]. Returns 0 while no corner is taken.
     */
    public static int cornersCaptured(Board board, Color maxPlayer) {
        checkPlayer(maxPlayer);
        int last = board.getSize().getValue() - 1;
        int[][] corners = {{0, 0}, {last, 0}, {0, last}, {last, last}};
        int mine = 0;
        int theirs = 0;
        for (int[] corner : corners) {
            Color owner = board.colorAt(corner[0], corner[1]);
            if (owner == maxPlayer) {
                mine++;
            } else if (owner == maxPlayer.opposite()) {
                theirs++;
            }
        }
        return normalizedDifference(mine, theirs);
    }

    /**
     * Compares disc counts, in [-100, 100].
     */
    public static int coinParity(Board board, Color maxPlayer) {
        checkPlayer(maxPlayer);
        return normalizedDifference(board.popcount(maxPlayer), board.popcount(maxPlayer.opposite()));
    }

    /**
     * Compares the number of legal moves each player has, in [-100, 100].
     */
    public static int mobility(Board board, Color maxPlayer) {
        checkPlayer(maxPlayer);
        int mine = board.legalMoves(maxPlayer).popcount();
        int theirs = board.legalMoves(maxPlayer.opposite()).popcount();
        return normalizedDifference(mine, theirs);
    }

    /**
     * Weighted sum of the three other heuristics: corners count the most, then mobility, then discs.
     */
    public static int allInOne(Board board, Color maxPlayer) {
        return CORNER_WEIGHT * cornersCaptured(board, maxPlayer)
                + MOBILITY_WEIGHT * mobility(board, maxPlayer)
                + COIN_WEIGHT * coinParity(board, maxPlayer);
    }

    static int normalizedDifference(int mine, int theirs) {
        int total = mine + theirs;
        if (total == 0) {
            return 0;
        }
        return 100 * (mine - theirs) / total;
    }

    private static void checkPlayer(Color maxPlayer) {
        if (maxPlayer == null || maxPlayer == Color.EMPTY) {
            throw new IllegalArgumentException("maxPlayer must be BLACK or WHITE");
        }
    }
}
