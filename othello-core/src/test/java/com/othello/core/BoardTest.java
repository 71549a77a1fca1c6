package com.othello.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class BoardTest {

    @ParameterizedTest
    @EnumSource(BoardSize.class)
    void startingPositionHasFourCenterDiscs(BoardSize size) {
        Board board = new Board(size);
        int low = size.getValue() / 2 - 1;
        int high = size.getValue() / 2;

        assertEquals(Color.WHITE, board.colorAt(low, low));
        assertEquals(Color.WHITE, board.colorAt(high, high));
        assertEquals(Color.BLACK, board.colorAt(high, low));
        assertEquals(Color.BLACK, board.colorAt(low, high));
        assertEquals(2, board.popcount(Color.BLACK));
        assertEquals(2, board.popcount(Color.WHITE));
        assertEquals(Color.BLACK, board.getCurrentPlayer());
        assertEquals(4, board.legalMoves(Color.BLACK).popcount());
        assertFalse(board.isGameOver());
    }

    @Test
    void legalMovesAtStart() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);

        assertEquals(bits("0000000000000000000100000010000000000100000010000000000000000000"),
                board.legalMoves(Color.BLACK).getBits());
        assertEquals(List.of(new Move(3, 2), new Move(2, 3), new Move(5, 4), new Move(4, 5)),
                board.legalMoveList(Color.BLACK));
        assertEquals(bits("0000000000000000000010000000010000100000000100000000000000000000"),
                board.legalMoves(Color.WHITE).getBits());
        assertEquals(List.of(new Move(4, 2), new Move(5, 3), new Move(2, 4), new Move(3, 5)),
                board.legalMoveList(Color.WHITE));
    }

    @Test
    void legalMovesLaterInTheGame() {
        Bitboard white = new Bitboard(8, bits("0000000000000000000100000001000000011000000000000000000000000000"));
        Bitboard black = new Bitboard(8, bits("0000000000010000000000000000100000100000000000000000000000000000"));
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT, black, white, Color.BLACK);

        assertEquals(bits("0000000000100000000010000010000000000100001110000000000000000000"),
                board.legalMoves(Color.BLACK).getBits());
        assertEquals(bits("0001000000000000000011000000010001000100010000000000000000000000"),
                board.legalMoves(Color.WHITE).getBits());
    }

    @Test
    void legalMovesForWhiteOnSparseBoard() {
        Bitboard white = new Bitboard(8, bits("0000000000000000000000000001000000000000000000000000000000000000"));
        Bitboard black = new Bitboard(8, bits("0000000000000000000000000000100000011100000000000000000000000000"));
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT, black, white, Color.WHITE);

        assertEquals(bits("0000000000000000000000000000010000000000000101000000000000000000"),
                board.legalMoves(Color.WHITE).getBits());
    }

    @Test
    void captureMaskAtStart() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);

        assertEquals(bits("0000000000000000000100000001000000000000000000000000000000000000"),
                board.captureMask(4, 5, Color.BLACK).getBits());
    }

    @Test
    void captureMaskInComplexPosition() {
        Bitboard white = new Bitboard(8, bits("0000100000000100100000001000010010001000100001001000000011110000"));
        Bitboard black = new Bitboard(8, bits("0000000000000000011110000100100001000100010010000111000000000000"));
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT, black, white, Color.WHITE);

        assertEquals(bits("0000000000000000000010000001100000000000000000000000000000000000"),
                board.captureMask(4, 4, Color.WHITE).getBits());
    }

    @Test
    void playFlipsCapturedDiscs() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);

        PlayOutcome outcome = board.play(3, 2);

        assertEquals(PlayOutcome.CONTINUED, outcome);
        assertEquals(Color.BLACK, board.colorAt(3, 2));
        assertEquals(Color.BLACK, board.colorAt(3, 3));
        assertEquals(4, board.popcount(Color.BLACK));
        assertEquals(1, board.popcount(Color.WHITE));
        assertEquals(Color.WHITE, board.getCurrentPlayer());
        assertEquals(1, board.getHistorySize());
    }

    @Test
    void illegalMoveLeavesBoardUnchanged() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);
        Board before = board.copy();

        IllegalMoveException ex = assertThrows(IllegalMoveException.class, () -> board.play(0, 0));

        assertEquals(0, ex.getX());
        assertEquals(0, ex.getY());
        assertEquals(Color.BLACK, ex.getPlayer());
        assertEquals(before, board);
        assertEquals(0, board.getHistorySize());
        assertThrows(IllegalMoveException.class, () -> board.play(3, 3));
        assertThrows(IllegalMoveException.class, () -> board.play(8, 2));
    }

    @Test
    void passIsIllegalWhileAMoveExists() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);

        assertThrows(IllegalMoveException.class, () -> board.play(Move.PASS));
    }

    @Test
    void popRestoresPreviousPosition() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);
        Board start = board.copy();
        board.play(3, 2);
        Board afterFirst = board.copy();
        board.play(2, 2);

        HistoryEntry undone = board.pop();

        assertEquals(new Move(2, 2), undone.move());
        assertEquals(Color.WHITE, undone.mover());
        assertEquals(afterFirst, board);
        board.pop();
        assertEquals(start, board);
        assertThrows(CannotUndoException.class, board::pop);
    }

    @Test
    void opponentWithoutMoveIsPassedAutomatically() {
        Board board = sixBySix(Color.WHITE,
                "X__XXO",
                "OOXXXX",
                "_XXOXO",
                "OXOOOO",
                "OOXXOO",
                "OOOOOO");
        Board before = board.copy();

        PlayOutcome outcome = board.play(0, 2);

        assertEquals(PlayOutcome.PASSED, outcome);
        assertEquals(Color.WHITE, board.getCurrentPlayer());
        assertFalse(board.hasLegalMove(Color.BLACK));
        assertEquals(List.of(new Move(1, 0), new Move(2, 0)), board.legalMoveList(Color.WHITE));
        assertEquals(2, board.getHistorySize());
        HistoryEntry pass = board.getHistory().get(1);
        assertTrue(pass.move().isPass());
        assertTrue(pass.automatic());
        assertEquals(Color.BLACK, pass.mover());

        board.pop();

        assertEquals(before, board);
        assertEquals(0, board.getHistorySize());
    }

    @Test
    void stuckPlayerPassesExplicitly() {
        Board board = sixBySix(Color.BLACK,
                "X__XXO",
                "OOXXXX",
                "OOOOXO",
                "OOOOOO",
                "OOOXOO",
                "OOOOOO");

        assertFalse(board.hasLegalMove(Color.BLACK));
        assertFalse(board.isGameOver());
        assertEquals(PlayOutcome.CONTINUED, board.play(-1, -1));
        assertEquals(Color.WHITE, board.getCurrentPlayer());
        assertFalse(board.getHistory().get(0).automatic());

        board.pop();
        assertEquals(Color.BLACK, board.getCurrentPlayer());
    }

    @Test
    void lastMoveEndsTheGame() {
        Board board = sixBySix(Color.WHITE,
                "OOOOOO",
                "_OXOOO",
                "XXOOOO",
                "XOOOOO",
                "XXXX_O",
                "XXXXX_");

        PlayOutcome outcome = board.play(0, 1);

        assertEquals(PlayOutcome.GAME_OVER, outcome);
        assertTrue(board.isGameOver());
        assertEquals(12, board.popcount(Color.BLACK));
        assertEquals(22, board.popcount(Color.WHITE));
        assertEquals(Color.WHITE, board.winner());
        assertThrows(GameOverException.class, () -> board.play(4, 4));
        assertThrows(GameOverException.class, () -> board.play(Move.PASS));
    }

    @Test
    void boardFullOfOneColorIsOver() {
        Bitboard full = new Bitboard(6).complement();
        Board board = new Board(BoardSize.SIX_BY_SIX, full, new Bitboard(6), Color.WHITE);

        assertTrue(board.isGameOver());
        assertEquals(Color.BLACK, board.winner());
    }

    @ParameterizedTest
    @EnumSource(value = BoardSize.class, names = {"SIX_BY_SIX", "EIGHT_BY_EIGHT"})
    void filledBoardWithOneOpposingCornerIsOver(BoardSize size) {
        int dimension = size.getValue();
        Bitboard corner = Bitboard.singleCell(dimension, 0, 0);
        Bitboard black = new Bitboard(dimension).complement().andNot(corner);
        Board board = new Board(size, black, corner, Color.BLACK);

        assertTrue(board.isGameOver());
        assertEquals(size.cellCount() - 1, board.popcount(Color.BLACK));
        assertEquals(1, board.popcount(Color.WHITE));
        assertEquals(0, board.popcount(Color.EMPTY));
        assertTrue(board.legalMoveList(Color.BLACK).isEmpty());
        assertTrue(board.legalMoveList(Color.WHITE).isEmpty());
        assertEquals(Color.BLACK, board.winner());
        assertThrows(GameOverException.class, () -> board.play(Move.PASS));
    }

    @Test
    void forceGameOverEndsTheGameUntilRestart() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);
        board.forceGameOver();

        assertTrue(board.isGameOver());
        assertThrows(GameOverException.class, () -> board.play(3, 2));

        board.restart();
        assertFalse(board.isGameOver());
    }

    @Test
    void restartClearsHistory() {
        Board board = new Board(BoardSize.TEN_BY_TEN);
        board.play(board.legalMoveList(Color.BLACK).get(0));
        board.play(board.legalMoveList(Color.WHITE).get(0));

        board.restart();

        assertEquals(new Board(BoardSize.TEN_BY_TEN), board);
        assertEquals(0, board.getHistorySize());
        assertTrue(board.isHistoryFromStart());
    }

    @ParameterizedTest
    @EnumSource(BoardSize.class)
    void randomGamesKeepDiscsConsistent(BoardSize size) {
        Random random = new Random(42L + size.getValue());
        Board board = new Board(size);
        int plies = 0;
        while (!board.isGameOver()) {
            Color mover = board.getCurrentPlayer();
            List<Move> moves = board.legalMoveList(mover);
            int discsBefore = board.popcount(Color.BLACK) + board.popcount(Color.WHITE);
            int ownBefore = board.popcount(mover);
            if (moves.isEmpty()) {
                board.play(Move.PASS);
                assertEquals(discsBefore, board.popcount(Color.BLACK) + board.popcount(Color.WHITE));
            } else {
                Move move = moves.get(random.nextInt(moves.size()));
                int captured = board.captureMask(move.x(), move.y(), mover).popcount();
                board.play(move);
                assertEquals(discsBefore + 1, board.popcount(Color.BLACK) + board.popcount(Color.WHITE));
                assertEquals(ownBefore + captured, board.popcount(mover));
                assertTrue(board.getBlack().and(board.getWhite()).isEmpty());
            }
            plies++;
        }

        assertTrue(plies > 0);
        assertTrue(board.isGameOver());
        while (board.getHistorySize() > 0) {
            board.pop();
        }
        assertEquals(new Board(size), board);
    }

    @Test
    void copyIsIndependent() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);
        Board copy = board.copy();

        copy.play(3, 2);

        assertNotEquals(board, copy);
        assertEquals(0, board.getHistorySize());
        assertEquals(1, copy.getHistorySize());
    }

    @Test
    void rejectsOverlappingOrMismatchedBitboards() {
        Bitboard cell = Bitboard.singleCell(6, 1, 1);

        assertThrows(IllegalArgumentException.class,
                () -> new Board(BoardSize.SIX_BY_SIX, cell, cell, Color.BLACK));
        assertThrows(IllegalArgumentException.class,
                () -> new Board(BoardSize.EIGHT_BY_EIGHT, cell, new Bitboard(8), Color.BLACK));
        assertThrows(IllegalArgumentException.class,
                () -> new Board(BoardSize.SIX_BY_SIX, cell, new Bitboard(6), Color.EMPTY));
    }

    @Test
    void turnNumberCountsPairsOfMoves() {
        Board board = new Board(BoardSize.EIGHT_BY_EIGHT);
        assertEquals(1, board.getTurnNumber());

        board.play(3, 2);
        assertEquals(1, board.getTurnNumber());

        board.play(2, 2);
        assertEquals(2, board.getTurnNumber());
    }

    @Test
    void toStringShowsStartingPosition() {
        String expected = "  a b c d e f g h\n"
                + "1 _ _ _ _ _ _ _ _\n"
                + "2 _ _ _ _ _ _ _ _\n"
                + "3 _ _ _ _ _ _ _ _\n"
                + "4 _ _ _ O X _ _ _\n"
                + "5 _ _ _ X O _ _ _\n"
                + "6 _ _ _ _ _ _ _ _\n"
                + "7 _ _ _ _ _ _ _ _\n"
                + "8 _ _ _ _ _ _ _ _";

        assertEquals(expected, new Board(BoardSize.EIGHT_BY_EIGHT).toString());
    }

    @Test
    void renderHighlightsCandidates() {
        Board board = new Board(BoardSize.SIX_BY_SIX);

        String rendered = board.render(board.legalMoves(Color.BLACK));

        assertEquals("  a b c d e f\n"
                + "1 _ _ _ _ _ _\n"
                + "2 _ _ * _ _ _\n"
                + "3 _ * O X _ _\n"
                + "4 _ _ X O * _\n"
                + "5 _ _ _ * _ _\n"
                + "6 _ _ _ _ _ _", rendered);
    }

    @Test
    void twelveByTwelveRendersTwoDigitRows() {
        String rendered = new Board(BoardSize.TWELVE_BY_TWELVE).toString();

        assertTrue(rendered.startsWith("   a b c d e f g h i j k l\n 1 _"));
        assertTrue(rendered.endsWith("\n12 _ _ _ _ _ _ _ _ _ _ _ _"));
    }

    @Test
    void exportWritesGridAndHistory() {
        Board board = new Board(BoardSize.SIX_BY_SIX);
        board.play(2, 1);
        board.play(1, 1);
        board.play(0, 1);

        assertEquals("O\n"
                + "_ _ _ _ _ _\n"
                + "X X X _ _ _\n"
                + "_ _ O X _ _\n"
                + "_ _ X O _ _\n"
                + "_ _ _ _ _ _\n"
                + "_ _ _ _ _ _\n"
                + "1. X c2 O b2\n"
                + "2. X a2\n", board.export());
    }

    @Test
    void exportOmitsHistoryOfArbitraryPosition() {
        Board board = new Board(BoardSize.SIX_BY_SIX, Bitboard.singleCell(6, 0, 0), Bitboard.singleCell(6, 1, 0),
                Color.WHITE);

        assertFalse(board.isHistoryFromStart());
        assertEquals("", board.exportHistory());
        assertTrue(board.export().startsWith("O\nX O _ _ _ _\n"));
    }

    private static Board sixBySix(Color toMove, String... rows) {
        Bitboard black = new Bitboard(6);
        Bitboard white = new Bitboard(6);
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length(); x++) {
                char cell = rows[y].charAt(x);
                if (cell == 'X') {
                    black = black.with(x, y, true);
                } else if (cell == 'O') {
                    white = white.with(x, y, true);
                }
            }
        }
        return new Board(BoardSize.SIX_BY_SIX, black, white, toMove);
    }

    private static BigInteger bits(String binary) {
        return new BigInteger(binary, 2);
    }
}
