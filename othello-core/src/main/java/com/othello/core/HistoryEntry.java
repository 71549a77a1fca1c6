package com.othello.core;

import java.util.Objects;

/**
 * Undo-log record pushed by every {@link Board#play(int, int)}: the bitboards as they were before
 * the move, the move itself and who made it.
 *
 * @param black     black discs before the move
 * @param white     white discs before the move
 * @param move      the coordinate played, or {@link Move#PASS}
 * @param mover     the player who moved or passed
 * @param automatic {@code true} for a pass the board recorded on its own after the opponent's move
 */
public record HistoryEntry(Bitboard black, Bitboard white, Move move, Color mover, boolean automatic) {

    public HistoryEntry {
        Objects.requireNonNull(black, "black");
        Objects.requireNonNull(white, "white");
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(mover, "mover");
        if (mover == Color.EMPTY) {
            throw new IllegalArgumentException("mover must be BLACK or WHITE");
        }
    }
}
