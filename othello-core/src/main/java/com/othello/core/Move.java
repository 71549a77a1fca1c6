package com.othello.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A board coordinate, 0-indexed from the top-left corner, or {@link #PASS} when the player had no
 * legal move.
 */
public record Move(int x, int y) {

    public static final Move PASS = new Move(-1, -1);

    private static final String PASS_NOTATION = "-1-1";
    private static final Pattern ALGEBRAIC = Pattern.compile("([a-z])(\\d{1,2})");

    public Move {
        boolean pass = x == -1 && y == -1;
        if (!pass && (x < 0 || y < 0)) {
            throw new IllegalArgumentException("Coordinates must be non-negative or (-1,-1): " + x + ":" + y);
        }
    }

    public boolean isPass() {
        return x == -1 && y == -1;
    }

    /**
     * Returns the save-file notation of this move: column letter followed by the 1-based row, or
     * {@code -1-1} for a pass.
     */
    public String toAlgebraic() {
        if (isPass()) {
            return PASS_NOTATION;
        }
        return (char) ('a' + x) + Integer.toString(y + 1);
    }

    /**
     * Parses algebraic notation such as {@code d3} for a board of {@code size} cells per side.
     *
     * @throws IllegalArgumentException if the text is malformed or lies outside the board
     */
    public static Move parse(String text, int size) {
        String trimmed = text.trim();
        if (PASS_NOTATION.equals(trimmed)) {
            return PASS;
        }
        Matcher matcher = ALGEBRAIC.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed move: " + text);
        }
        int x = matcher.group(1).charAt(0) - 'a';
        int y = Integer.parseInt(matcher.group(2)) - 1;
        if (x >= size || y < 0 || y >= size) {
            throw new IllegalArgumentException("Move " + trimmed + " is outside of a " + size + "x" + size + " board");
        }
        return new Move(x, y);
    }

    @Override
    public String toString() {
        return isPass() ? "pass" : toAlgebraic();
    }
}
