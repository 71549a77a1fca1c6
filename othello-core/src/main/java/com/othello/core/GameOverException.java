package com.othello.core;

/**
 * Raised when a move is submitted to a board on which neither player can move anymore.
 */
public class GameOverException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public GameOverException() {
        super("The board is in game over");
    }
}
