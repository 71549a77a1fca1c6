package com.othello.core;

/**
 * Raised by {@link Board#pop()} when there is no recorded move left to undo. Seeing this from
 * search code means a {@code play}/{@code pop} pair got out of balance.
 */
public class CannotUndoException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CannotUndoException() {
        super("Cannot pop from this board, the history is empty");
    }
}
