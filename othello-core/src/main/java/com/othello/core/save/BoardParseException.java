package com.othello.core.save;

/**
 * Raised when a save file cannot be turned back into a board. Carries the 1-based line number the
 * problem was found on.
 */
public class BoardParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int line;

    public BoardParseException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    public BoardParseException(String message, int line, Throwable cause) {
        super(message + " at line " + line, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
