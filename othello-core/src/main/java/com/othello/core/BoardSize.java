package com.othello.core;

/**
 * Supported board dimensions.
 */
public enum BoardSize {
    SIX_BY_SIX(6),
    EIGHT_BY_EIGHT(8),
    TEN_BY_TEN(10),
    TWELVE_BY_TWELVE(12);

    private final int value;

    BoardSize(int value) {
        this.value = value;
    }

    /**
     * Returns the number of cells along one side of the board.
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the number of cells on the board.
     */
    public int cellCount() {
        return value * value;
    }

    public static BoardSize fromValue(int value) {
        for (BoardSize size : values()) {
            if (size.value == value) {
                return size;
            }
        }
        throw new IllegalBoardSizeException(value);
    }
}
