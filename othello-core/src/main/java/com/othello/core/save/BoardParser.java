package com.othello.core.save;

import com.othello.core.Bitboard;
import com.othello.core.Board;
import com.othello.core.BoardSize;
import com.othello.core.Color;
import com.othello.core.GameOverException;
import com.othello.core.HistoryEntry;
import com.othello.core.IllegalBoardSizeException;
import com.othello.core.IllegalMoveException;
import com.othello.core.Move;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the save-file format.
 * <pre>
 * # comments run to the end of the line
 * X                      &lt;- player to move
 * _ _ _ _ _ _ _ _        &lt;- one line per row, X / O / _
 * ...
 * 1. X d3 O c5           &lt;- optional history, -1-1 for a pass
 * 2. X f6 O -1-1
 * </pre>
 * Without a history the board is built from the grid as-is. With a history the moves are replayed
 * from the opening and the result must match the grid and the player to move.
 */
public final class BoardParser {

    private static final char COMMENT = '#';
    private static final Pattern HISTORY_LINE = Pattern.compile("(\\d+)\\.\\s+X\\s+(\\S+)(?:\\s+O\\s+(\\S+))?");

    private final List<String> lines;
    private int cursor;

    public BoardParser(String rawSave) {
        Objects.requireNonNull(rawSave, "rawSave");
        this.lines = new ArrayList<>();
        for (String line : rawSave.split("\n", -1)) {
            this.lines.add(stripComment(line));
        }
    }

    /**
     * Parses the text given at construction.
     *
     * @throws BoardParseException on any malformed or inconsistent input
     */
    public Board parse() throws BoardParseException {
        cursor = 0;
        Board gridBoard = parseGrid();
        Board replayed = parseHistory(gridBoard.getSize());
        if (replayed == null) {
            return gridBoard;
        }
        if (!replayed.equals(gridBoard)) {
            throw new BoardParseException("history does not lead to the saved position", lines.size());
        }
        return replayed;
    }

    private Board parseGrid() throws BoardParseException {
        if (!skipBlankLines()) {
            throw new BoardParseException("trying to parse an empty board", lineNumber());
        }
        String colorLine = lines.get(cursor);
        if (colorLine.length() != 1
                || (colorLine.charAt(0) != Color.BLACK.getSymbol() && colorLine.charAt(0) != Color.WHITE.getSymbol())) {
            throw new BoardParseException("expected to find the color to move", lineNumber());
        }
        Color toMove = Color.fromSymbol(colorLine.charAt(0));
        cursor++;

        if (!skipBlankLines()) {
            throw new BoardParseException("reached end of file before the board", lineNumber());
        }
        List<Color> firstRow = parseRow(lines.get(cursor));
        BoardSize size;
        try {
            size = BoardSize.fromValue(firstRow.size());
        } catch (IllegalBoardSizeException ex) {
            throw new BoardParseException("illegal board size value " + firstRow.size(), lineNumber(), ex);
        }

        int dimension = size.getValue();
        Bitboard black = new Bitboard(dimension);
        Bitboard white = new Bitboard(dimension);
        for (int y = 0; y < dimension; y++) {
            if (!skipBlankLines()) {
                throw new BoardParseException("reached end of file before the board was complete", lineNumber());
            }
            List<Color> row = y == 0 ? firstRow : parseRow(lines.get(cursor));
            if (row.size() != dimension) {
                throw new BoardParseException("line of size " + row.size() + " where it should have been " + dimension,
                        lineNumber());
            }
            for (int x = 0; x < dimension; x++) {
                if (row.get(x) == Color.BLACK) {
                    black = black.with(x, y, true);
                } else if (row.get(x) == Color.WHITE) {
                    white = white.with(x, y, true);
                }
            }
            cursor++;
        }
        return new Board(size, black, white, toMove);
    }

    private Board parseHistory(BoardSize size) throws BoardParseException {
        if (!skipBlankLines()) {
            return null;
        }
        Board board = new Board(size);
        int expectedTurn = 1;
        int replayed = 0;
        boolean lastTurnComplete = true;
        while (skipBlankLines()) {
            int line = lineNumber();
            if (!lastTurnComplete) {
                throw new BoardParseException("only the last turn may omit the white move", line);
            }
            Matcher matcher = HISTORY_LINE.matcher(lines.get(cursor));
            if (!matcher.matches()) {
                throw new BoardParseException("incorrect line format: \"" + lines.get(cursor) + "\"", line);
            }
            if (Integer.parseInt(matcher.group(1)) != expectedTurn) {
                throw new BoardParseException("incorrect turn number in history", line);
            }
            replay(board, Color.BLACK, parseMove(matcher.group(2), size, line), replayed++, line);
            if (matcher.group(3) != null) {
                replay(board, Color.WHITE, parseMove(matcher.group(3), size, line), replayed++, line);
            } else {
                lastTurnComplete = false;
            }
            expectedTurn++;
            cursor++;
        }
        return board;
    }

    private void replay(Board board, Color color, Move move, int index, int line) throws BoardParseException {
        if (board.getHistorySize() > index) {
            HistoryEntry recorded = board.getHistory().get(index);
            if (!move.isPass() || !recorded.move().isPass() || recorded.mover() != color) {
                throw new BoardParseException(color + " had to pass but the history shows " + move, line);
            }
            return;
        }
        if (board.getCurrentPlayer() != color) {
            throw new BoardParseException("history shows a move for " + color + " but " + board.getCurrentPlayer()
                    + " is to move", line);
        }
        try {
            board.play(move);
        } catch (IllegalMoveException | GameOverException ex) {
            throw new BoardParseException(color + " move " + move.toAlgebraic() + " is illegal (" + ex.getMessage()
                    + ")", line, ex);
        }
    }

    private Move parseMove(String text, BoardSize size, int line) throws BoardParseException {
        try {
            return Move.parse(text, size.getValue());
        } catch (IllegalArgumentException ex) {
            throw new BoardParseException("invalid move \"" + text + "\"", line, ex);
        }
    }

    private List<Color> parseRow(String line) throws BoardParseException {
        List<Color> cells = new ArrayList<>();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            if (c != Color.BLACK.getSymbol() && c != Color.WHITE.getSymbol() && c != Color.EMPTY.getSymbol()) {
                throw new BoardParseException("expected to find either a cell or a space, found " + c, lineNumber());
            }
            cells.add(Color.fromSymbol(c));
        }
        return cells;
    }

    /**
     * Moves the cursor to the next non-blank line. Returns {@code false} at the end of the input.
     */
    private boolean skipBlankLines() {
        while (cursor < lines.size() && lines.get(cursor).isEmpty()) {
            cursor++;
        }
        return cursor < lines.size();
    }

    private int lineNumber() {
        return Math.min(cursor, lines.size() - 1) + 1;
    }

    private static String stripComment(String line) {
        int comment = line.indexOf(COMMENT);
        String content = comment >= 0 ? line.substring(0, comment) : line;
        return content.strip();
    }
}
