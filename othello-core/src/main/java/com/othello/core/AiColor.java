package com.othello.core;

import java.util.Locale;

/**
 * Which side(s) the computer plays in the console driver.
 */
public enum AiColor {
    BLACK("X"),
    WHITE("O"),
    ALL("A"),
    NONE("N");

    private final String symbol;

    AiColor(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns {@code true} if the computer moves for {@code color}.
     */
    public boolean controls(Color color) {
        switch (this) {
            case BLACK:
                return color == Color.BLACK;
            case WHITE:
                return color == Color.WHITE;
            case ALL:
                return color != Color.EMPTY;
            default:
                return false;
        }
    }

    public static AiColor fromSymbol(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        for (AiColor color : values()) {
            if (color.symbol.equals(normalized) || color.name().equals(normalized)) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown AI color: " + symbol);
    }
}
