package com.othello.core;

/**
 * Raised when a board dimension outside of {6, 8, 10, 12} is requested.
 */
public class IllegalBoardSizeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int size;

    public IllegalBoardSizeException(int size) {
        super("Illegal board size " + size + ", expected one of 6, 8, 10 or 12");
        this.size = size;
    }

    public int getSize() {
        return size;
    }
}
