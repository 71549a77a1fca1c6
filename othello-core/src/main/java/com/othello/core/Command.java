package com.othello.core;

import java.util.Locale;
import java.util.Objects;

/**
 * One line of console input, parsed.
 *
 * @param kind     what the user asked for
 * @param move     the move to play for {@link Kind#PLAY_MOVE}, otherwise {@code null}
 * @param argument the file name for the save commands, otherwise {@code null}
 */
public record Command(Kind kind, Move move, String argument) {

    public static final String DEFAULT_SAVE_FILE = "othello.save";

    public enum Kind {
        PLAY_MOVE,
        HELP,
        RULES,
        UNDO,
        RESTART,
        SAVE_HISTORY,
        SAVE_AND_QUIT,
        FORFEIT,
        QUIT
    }

    public Command {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.PLAY_MOVE) != (move != null)) {
            throw new IllegalArgumentException("A move is required for PLAY_MOVE only");
        }
    }

    /**
     * Parses a console line for a board of {@code size} cells per side.
     *
     * @throws IllegalArgumentException if the line is not a known command or a move on the board
     */
    public static Command parse(String line, int size) {
        Objects.requireNonNull(line, "line");
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }
        String[] parts = trimmed.split("\\s+", 2);
        String keyword = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1] : null;

        switch (keyword) {
            case "?":
                return simple(Kind.HELP, argument, line);
            case "r":
                return simple(Kind.RULES, argument, line);
            case "undo":
            case "u":
                return simple(Kind.UNDO, argument, line);
            case "restart":
                return simple(Kind.RESTART, argument, line);
            case "ff":
                return simple(Kind.FORFEIT, argument, line);
            case "q":
            case "quit":
                return simple(Kind.QUIT, argument, line);
            case "sh":
                return new Command(Kind.SAVE_HISTORY, null, argument == null ? DEFAULT_SAVE_FILE : argument);
            case "s":
                return new Command(Kind.SAVE_AND_QUIT, null, argument == null ? DEFAULT_SAVE_FILE : argument);
            default:
                if (argument != null) {
                    throw new IllegalArgumentException("Unrecognized command: " + line);
                }
                try {
                    Move move = Move.parse(keyword, size);
                    if (move.isPass()) {
                        throw new IllegalArgumentException("Unrecognized command: " + line);
                    }
                    return new Command(Kind.PLAY_MOVE, move, null);
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("Unrecognized command: " + line, ex);
                }
        }
    }

    private static Command simple(Kind kind, String argument, String line) {
        if (argument != null) {
            throw new IllegalArgumentException("Unexpected argument in command: " + line);
        }
        return new Command(kind, null, null);
    }
}
