package com.othello.core.ai;

import com.othello.core.Move;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move           the chosen move
 * @param score          its score for the player who was to move
 * @param depthEvaluated the deepest fully completed search depth
 * @param visitedNodes   nodes visited over all depths
 * @param timedOut       {@code true} if the time limit stopped the deepening early
 * @param telemetry      per-depth details
 */
public record SearchResult(Move move, int score, int depthEvaluated, long visitedNodes, boolean timedOut,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(move, "move");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }
}
