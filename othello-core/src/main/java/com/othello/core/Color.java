package com.othello.core;

/**
 * Content of a board cell, doubling as the identity of a player.
 */
public enum Color {
    BLACK('X'),
    WHITE('O'),
    EMPTY('_');

    private final char symbol;

    Color(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the character used for this color in save files and board renderings.
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns the other player. {@link #EMPTY} maps to itself.
     */
    public Color opposite() {
        switch (this) {
            case BLACK:
                return WHITE;
            case WHITE:
                return BLACK;
            default:
                return EMPTY;
        }
    }

    /**
     * Returns the color written as {@code symbol}.
     *
     * @throws IllegalArgumentException if the symbol is not one of {@code X}, {@code O} or {@code _}
     */
    public static Color fromSymbol(char symbol) {
        for (Color color : values()) {
            if (color.symbol == symbol) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown color symbol: " + symbol);
    }
}
