package com.othello.core.ai;

import com.othello.core.BoardSize;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlay} matches between two computer players.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());

    private SelfPlayRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            int depth = Integer.parseInt(args[1]);
            BoardSize size = BoardSize.EIGHT_BY_EIGHT;
            SearchAlgorithm algorithm = SearchAlgorithm.ALPHA_BETA;
            Heuristic blackHeuristic = Heuristic.ALL_IN_ONE;
            Heuristic whiteHeuristic = Heuristic.ALL_IN_ONE;
            Long randomWhiteSeed = null;
            SearchConstraints.SearchMode mode = SearchConstraints.SearchMode.SEQ;

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--size=")) {
                    size = BoardSize.fromValue(Integer.parseInt(option.substring("--size=".length())));
                } else if (option.startsWith("--mode=")) {
                    algorithm = SearchAlgorithm.fromName(option.substring("--mode=".length()));
                } else if (option.startsWith("--black=")) {
                    blackHeuristic = Heuristic.fromName(option.substring("--black=".length()));
                } else if (option.startsWith("--white=")) {
                    whiteHeuristic = Heuristic.fromName(option.substring("--white=".length()));
                } else if (option.startsWith("--randomWhite=")) {
                    randomWhiteSeed = Long.parseLong(option.substring("--randomWhite=".length()));
                } else if ("--parallel".equals(option)) {
                    mode = SearchConstraints.SearchMode.PAR;
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            SearchConstraints constraints = new SearchConstraints(depth, Duration.ZERO, mode);
            MinimaxAI blackAi = new MinimaxAI(algorithm, blackHeuristic);
            MinimaxAI whiteAi = randomWhiteSeed != null ? null : new MinimaxAI(algorithm, whiteHeuristic);
            Player black = new AiPlayer(blackAi, constraints);
            Player white = whiteAi != null
                    ? new AiPlayer(whiteAi, constraints)
                    : new RandomPlayer(randomWhiteSeed);

            SelfPlay.Summary summary;
            try {
                summary = new SelfPlay(size, black, white).playGames(gameCount);
            } finally {
                blackAi.shutdown();
                if (whiteAi != null) {
                    whiteAi.shutdown();
                }
            }
            LOGGER.info(() -> String.format("Played %d games: black wins %.1f%%, white wins %.1f%%, draws %d, "
                    + "average disc delta %.2f", summary.gamesPlayed(), 100 * summary.blackWinRate(),
                    100 * summary.whiteWinRate(), summary.draws(), summary.averageDiscDelta()));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: SelfPlayRunner <gameCount> <depth> [--size=<6|8|10|12>] [--mode=<minimax|ab>] "
                + "[--black=<heuristic>] [--white=<heuristic>] [--randomWhite=<seed>] [--parallel]");
    }
}
