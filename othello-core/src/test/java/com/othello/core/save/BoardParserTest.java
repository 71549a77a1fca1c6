package com.othello.core.save;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.othello.core.Bitboard;
import com.othello.core.Board;
import com.othello.core.BoardSize;
import com.othello.core.Color;
import com.othello.core.Move;
import com.othello.core.ai.RandomPlayer;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class BoardParserTest {

    private static final String SIMPLE_HISTORY_GRID = "\n"
            + "O\n"
            + "_ _ _ _ _ _ _ _\n"
            + "_ _ _ _ _ _ _ _ # other comment\n"
            + "_ _ _ _ _ _ _ _\n"
            + "_ _ _ O X _ _ _\n"
            + "_ _ _ X X X _ _\n"
            + "_ O O X _ _ _ _\n"
            + "_ _ _ X _ _ _ _\n"
            + "_ _ _ _ _ _ _ _\n"
            + "\n"
            + "# history\n";

    @Test
    void parsesStartingBoardWithComments() throws BoardParseException {
        String raw = "\n"
                + "    \n"
                + "#comment\n"
                + "X\n"
                + "_ _ _ _ _ _ _ _\n"
                + "_ _ _ _ _ _ _ _ # other comment\n"
                + "_ _ _ _ _ _ _ _\n"
                + "_ _ _ O X _ _ _\n"
                + "_ _ _ X O _ _ _\n"
                + "_ _ _ _ _ _ _ _\n"
                + "_ _ _ _ _ _ _ _\n"
                + "_ _ _ _ _ _ _ _";

        assertEquals(new Board(BoardSize.EIGHT_BY_EIGHT), new BoardParser(raw).parse());
    }

    @Test
    void parsesPositionWithoutHistory() throws BoardParseException {
        String raw = "\n"
                + "#comment\n"
                + " # another\n"
                + "O# ---\n"
                + "_ _ _ _ _ _ # other comment\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X X O _\n"
                + "_ O _ X X _\n"
                + "_ _ _ _ _ _\n";
        Board expected = new Board(BoardSize.SIX_BY_SIX,
                new Bitboard(6, new BigInteger("000000011000001100001000000000000000", 2)),
                new Bitboard(6, new BigInteger("000000000010010000000100000000000000", 2)),
                Color.WHITE);

        Board board = new BoardParser(raw).parse();

        assertEquals(expected, board);
        assertFalse(board.isHistoryFromStart());
    }

    @Test
    void rejectsShortRow() {
        String raw = "O\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X X O \n"
                + "_ O _ X X _\n"
                + "_ _ _ _ _ _\n";

        BoardParseException ex = assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
        assertEquals(5, ex.getLine());
    }

    @Test
    void rejectsMissingRows() {
        String raw = "O\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X X O _\n"
                + "_ O _ X X _\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void rejectsMissingOrUnknownColor() {
        String missing = "\n"
                + "#comment\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X O _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n";
        String unknown = "\n"
                + "    \n"
                + "#comment\n"
                + "K\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X O _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(missing).parse());
        BoardParseException ex = assertThrows(BoardParseException.class, () -> new BoardParser(unknown).parse());
        assertEquals(4, ex.getLine());
        assertTrue(ex.getMessage().endsWith("at line 4"));
    }

    @Test
    void rejectsTwoColorLines() {
        String raw = "O\n"
                + "O\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X X O _\n"
                + "_ O _ X X _\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(BoardParseException.class, () -> new BoardParser("").parse());
        assertThrows(BoardParseException.class, () -> new BoardParser("#comment\n # another\nO# ---\n").parse());
    }

    @Test
    void rejectsUnknownCell() {
        String raw = "O\n"
                + "_ _ _ _ _ _\n"
                + "_ R _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n";

        BoardParseException ex = assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
        assertEquals(3, ex.getLine());
    }

    @Test
    void rejectsUnsupportedSize() {
        StringBuilder raw = new StringBuilder("X\n");
        for (int y = 0; y < 14; y++) {
            raw.append("_ ".repeat(14).trim()).append('\n');
        }

        assertThrows(BoardParseException.class, () -> new BoardParser(raw.toString()).parse());
    }

    @Test
    void replaysHistory() throws BoardParseException {
        String raw = SIMPLE_HISTORY_GRID
                + "1. X f5 O d6\n"
                + "2. X c6 O b6\n"
                + "3. X d7\n";

        Board board = new BoardParser(raw).parse();

        assertEquals(5, board.getHistorySize());
        assertTrue(board.isHistoryFromStart());
        assertEquals(Color.WHITE, board.getCurrentPlayer());
        assertEquals(new Move(3, 6), board.getHistory().get(4).move());
    }

    @Test
    void rejectsIncoherentTurnNumbers() {
        String raw = SIMPLE_HISTORY_GRID
                + "1. X f5 O d6\n"
                + "3. X c6 O b6\n"
                + "3. X d7\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void rejectsMissingBlackMove() {
        String raw = SIMPLE_HISTORY_GRID
                + "1. X f5 O d6\n"
                + "2. X  O b6\n"
                + "3. X d7\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void rejectsIllegalHistoryMoves() {
        String illegalBlack = SIMPLE_HISTORY_GRID
                + "1. X f6 O d6\n"
                + "2. X c6 O b6\n"
                + "3. X d7\n";
        String illegalWhite = SIMPLE_HISTORY_GRID
                + "1. X f5 O d7\n"
                + "2. X c6 O b6\n"
                + "3. X d7\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(illegalBlack).parse());
        assertThrows(BoardParseException.class, () -> new BoardParser(illegalWhite).parse());
    }

    @Test
    void rejectsIncompleteTurnBeforeTheLast() {
        String raw = SIMPLE_HISTORY_GRID
                + "1. X f5 O d6\n"
                + "2. X c6\n"
                + "3. O b6 X d7\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void rejectsHistoryThatDoesNotReachTheGrid() {
        String raw = SIMPLE_HISTORY_GRID
                + "1. X f5 O d6\n"
                + "2. X c6 O b6\n";

        assertThrows(BoardParseException.class, () -> new BoardParser(raw).parse());
    }

    @Test
    void exportedGamesParseBack() throws BoardParseException {
        for (long seed = 1L; seed <= 10L; seed++) {
            RandomPlayer player = new RandomPlayer(seed);
            Board board = new Board(BoardSize.SIX_BY_SIX);
            int plies = (int) (seed * 3);
            for (int i = 0; i < plies && !board.isGameOver(); i++) {
                board.play(player.chooseMove(board));
            }

            Board parsed = new BoardParser(board.export()).parse();

            assertEquals(board, parsed);
            assertEquals(board.getHistory(), parsed.getHistory());
            assertEquals(board.export(), parsed.export());
        }
    }
}
