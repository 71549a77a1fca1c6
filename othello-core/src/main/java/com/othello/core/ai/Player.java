package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Move;

/**
 * Something that picks moves for the player to move.
 */
@FunctionalInterface
public interface Player {

    /**
     * Returns a legal move for {@link Board#getCurrentPlayer()}. Implementations must not leave the
     * board modified.
     */
    Move chooseMove(Board board);
}
