package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.BoardSize;
import com.othello.core.Color;
import com.othello.core.Move;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays complete games between two {@link Player}s and keeps a running tally of the results.
 */
public final class SelfPlay {

    private static final Logger LOGGER = Logger.getLogger(SelfPlay.class.getName());

    private final BoardSize size;
    private final Player blackPlayer;
    private final Player whitePlayer;

    private int gamesPlayed;
    private int blackWins;
    private int whiteWins;
    private int draws;
    private long cumulativeDiscDelta;

    public SelfPlay(BoardSize size, Player blackPlayer, Player whitePlayer) {
        this.size = Objects.requireNonNull(size, "size");
        this.blackPlayer = Objects.requireNonNull(blackPlayer, "blackPlayer");
        this.whitePlayer = Objects.requireNonNull(whitePlayer, "whitePlayer");
    }

    /**
     * Plays {@code gameCount} games and returns the tally over every game played so far.
     */
    public Summary playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        for (int i = 0; i < gameCount; i++) {
            playGame();
        }
        return summary();
    }

    /**
     * Plays one game from the opening to the end.
     */
    public MatchResult playGame() {
        Board board = new Board(size);
        int plies = 0;
        while (!board.isGameOver()) {
            Color toMove = board.getCurrentPlayer();
            Move move = board.hasLegalMove(toMove)
                    ? (toMove == Color.BLACK ? blackPlayer : whitePlayer).chooseMove(board)
                    : Move.PASS;
            board.play(move);
            plies++;
        }

        MatchResult result = new MatchResult(board.popcount(Color.BLACK), board.popcount(Color.WHITE),
                board.winner(), plies, board.export());
        record(result);
        return result;
    }

    public Summary summary() {
        return new Summary(gamesPlayed, blackWins, whiteWins, draws,
                gamesPlayed == 0 ? 0.0 : (double) cumulativeDiscDelta / gamesPlayed);
    }

    private void record(MatchResult result) {
        gamesPlayed++;
        switch (result.winner()) {
            case BLACK:
                blackWins++;
                break;
            case WHITE:
                whiteWins++;
                break;
            default:
                draws++;
                break;
        }
        cumulativeDiscDelta += (long) result.blackDiscs() - result.whiteDiscs();

        final int gameNumber = gamesPlayed;
        LOGGER.info(() -> String.format("Completed game %d on %s: black=%d white=%d winner=%s plies=%d", gameNumber,
                size, result.blackDiscs(), result.whiteDiscs(), result.winner(), result.plies()));
    }

    /**
     * Final state of one game.
     *
     * @param winner {@link Color#EMPTY} on a draw
     * @param export the finished game in save-file format
     */
    public record MatchResult(int blackDiscs, int whiteDiscs, Color winner, int plies, String export) {
    }

    /**
     * Running tally; {@code averageDiscDelta} is black discs minus white discs, averaged.
     */
    public record Summary(int gamesPlayed, int blackWins, int whiteWins, int draws, double averageDiscDelta) {

        public double blackWinRate() {
            return gamesPlayed == 0 ? 0.0 : (double) blackWins / gamesPlayed;
        }

        public double whiteWinRate() {
            return gamesPlayed == 0 ? 0.0 : (double) whiteWins / gamesPlayed;
        }
    }
}
