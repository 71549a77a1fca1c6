package com.othello.core;

/**
 * Result of a successful {@link Board#play(int, int)} call.
 */
public enum PlayOutcome {
    /** The opponent is to move next. */
    CONTINUED,
    /** The opponent had no legal move, a pass was recorded and the same player moves again. */
    PASSED,
    /** Neither player can move anymore. */
    GAME_OVER
}
