package com.othello.core.ai;

import com.othello.core.Move;

/**
 * Outcome of scoring every root move at one depth.
 *
 * @param move          the best root move, {@link Move#PASS} if there was nothing to search
 * @param score         the score of {@code move} for the max player
 * @param visitedNodes  nodes visited below the root
 * @param cutoffs       alpha-beta cutoffs below the root
 */
public record RootEvaluation(Move move, int score, long visitedNodes, long cutoffs) {
}
