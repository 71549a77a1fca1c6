package com.othello.core;

/**
 * Raised by {@link Board#play(int, int)} when the coordinate is not a legal move for the player to
 * move. The board is left untouched, so callers can simply ask for another move.
 */
public class IllegalMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int x;
    private final int y;
    private final Color player;

    public IllegalMoveException(int x, int y, Color player) {
        super("Move " + x + ":" + y + " from player " + player + " is illegal");
        this.x = x;
        this.y = y;
        this.player = player;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public Color getPlayer() {
        return player;
    }
}
