package com.othello.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits for a single {@link Searcher#search} call. A zero time limit means no time limit; the
 * limit is only checked between two completed depths.
 */
public record SearchConstraints(int depthLimit, Duration timeLimit, SearchMode mode) {

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(mode, "mode");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("depthLimit must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    /**
     * Sequential search to {@code depthLimit} plies without a time limit.
     */
    public static SearchConstraints ofDepth(int depthLimit) {
        return new SearchConstraints(depthLimit, Duration.ZERO, SearchMode.SEQ);
    }

    /**
     * Whether root moves are evaluated one after the other or in parallel.
     */
    public enum SearchMode {
        SEQ,
        PAR
    }
}
