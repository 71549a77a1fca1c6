package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Color;
import com.othello.core.Move;
import com.othello.core.ai.parallel.ForkJoinRootSearch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Minimax and alpha-beta searcher with depth and time controls.
 * <p>
 * The tree is walked depth-first on one board with {@link Board#play(Move)} and {@link Board#pop()},
 * so memory grows with the search depth only. An instance keeps node counters and is meant to be
 * used by one thread at a time.
 */
public final class MinimaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MinimaxAI.class.getName());

    public static final int NEGATIVE_INFINITY = Integer.MIN_VALUE;
    public static final int POSITIVE_INFINITY = Integer.MAX_VALUE;

    private final SearchAlgorithm algorithm;
    private final Heuristic heuristic;
    private ForkJoinRootSearch parallelSearcher;

    private long visitedNodes;
    private long cutoffs;
    private long lastVisitedNodes;
    private boolean lastTimedOut;

    public MinimaxAI(SearchAlgorithm algorithm, Heuristic heuristic) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
    }

    /**
     * Plain minimax. Returns the heuristic value of the best line for {@code maxPlayer} within
     * {@code depth} plies.
     * <p>
     * A player without a legal move passes; the pass does not use up a ply.
     */
    public int minimax(Board board, int depth, Color maxPlayer) {
        visitedNodes++;
        if (depth <= 0 || board.isGameOver()) {
            return heuristic.evaluate(board, maxPlayer);
        }

        List<Move> moves = board.legalMoveList(board.getCurrentPlayer());
        if (moves.isEmpty()) {
            board.play(Move.PASS);
            int score = minimax(board, depth, maxPlayer);
            board.pop();
            return score;
        }

        boolean maximizing = board.getCurrentPlayer() == maxPlayer;
        int evaluation = maximizing ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        for (Move move : moves) {
            board.play(move);
            int score = minimax(board, depth - 1, maxPlayer);
            board.pop();
            evaluation = maximizing ? Math.max(evaluation, score) : Math.min(evaluation, score);
        }
        return evaluation;
    }

    /**
     * Minimax with alpha-beta pruning. Called with {@link #NEGATIVE_INFINITY} and
     * {@link #POSITIVE_INFINITY} it returns exactly what {@link #minimax} returns.
     */
    public int alphabeta(Board board, int depth, int alpha, int beta, Color maxPlayer) {
        visitedNodes++;
        if (depth <= 0 || board.isGameOver()) {
            return heuristic.evaluate(board, maxPlayer);
        }

        List<Move> moves = board.legalMoveList(board.getCurrentPlayer());
        if (moves.isEmpty()) {
            board.play(Move.PASS);
            int score = alphabeta(board, depth, alpha, beta, maxPlayer);
            board.pop();
            return score;
        }

        if (board.getCurrentPlayer() == maxPlayer) {
            int evaluation = NEGATIVE_INFINITY;
            for (Move move : moves) {
                board.play(move);
                int score = alphabeta(board, depth - 1, alpha, beta, maxPlayer);
                board.pop();
                evaluation = Math.max(evaluation, score);
                alpha = Math.max(alpha, evaluation);
                if (beta <= alpha) {
                    cutoffs++;
                    break;
                }
            }
            return evaluation;
        }

        int evaluation = POSITIVE_INFINITY;
        for (Move move : moves) {
            board.play(move);
            int score = alphabeta(board, depth - 1, alpha, beta, maxPlayer);
            board.pop();
            evaluation = Math.min(evaluation, score);
            beta = Math.min(beta, evaluation);
            if (beta <= alpha) {
                cutoffs++;
                break;
            }
        }
        return evaluation;
    }

    /**
     * Returns the move leading to the best score for {@code maxPlayer} at {@code depth} plies, or
     * {@link Move#PASS} if {@code depth} is 0 or the game is over. Ties go to the first move in
     * {@link Board#legalMoveList} order. The board is not modified.
     *
     * @throws IllegalStateException if the player to move has no legal move; record the pass with
     *                               {@code play(-1, -1)} instead of searching
     */
    public Move findBestMove(Board board, int depth, Color maxPlayer) {
        return evaluateRoot(board, depth, maxPlayer).move();
    }

    /**
     * Scores every root move at {@code depth} and returns the best one together with the counters
     * of this evaluation.
     */
    public RootEvaluation evaluateRoot(Board board, int depth, Color maxPlayer) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(maxPlayer, "maxPlayer");
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must not be negative");
        }
        resetCounters();
        if (depth == 0 || board.isGameOver()) {
            return new RootEvaluation(Move.PASS, heuristic.evaluate(board, maxPlayer), 0L, 0L);
        }

        Color toMove = board.getCurrentPlayer();
        List<Move> moves = board.legalMoveList(toMove);
        if (moves.isEmpty()) {
            throw new IllegalStateException("Player " + toMove + " has no legal move, record a pass instead");
        }

        boolean maximizing = maxPlayer == toMove;
        Board scratch = board.copy();
        Move bestMove = null;
        int bestScore = maximizing ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        for (Move move : moves) {
            scratch.play(move);
            int score = algorithm.score(this, scratch, depth - 1, maxPlayer);
            scratch.pop();
            boolean better = maximizing ? score > bestScore : score < bestScore;
            if (bestMove == null || better) {
                bestMove = move;
                bestScore = score;
            }
        }
        return new RootEvaluation(bestMove, bestScore, visitedNodes, cutoffs);
    }

    /**
     * Nodes visited since the last reset. {@link #evaluateRoot} resets the counters.
     */
    public long getVisitedNodes() {
        return visitedNodes;
    }

    public long getCutoffs() {
        return cutoffs;
    }

    public void resetCounters() {
        visitedNodes = 0L;
        cutoffs = 0L;
    }

    /**
     * Number of nodes visited by the last {@link #search} call.
     */
    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSearchTimedOut() {
        return lastTimedOut;
    }

    /**
     * Runs iterative deepening from depth 1 up to the depth limit for the player to move. Once the
     * time limit has passed no further depth is started, and the move of the last completed depth
     * is returned.
     *
     * @throws IllegalStateException if the game is over or the player to move has to pass
     */
    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");

        if (board.isGameOver()) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        Color maxPlayer = board.getCurrentPlayer();
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        long searchStart = System.nanoTime();
        long deadline = timeLimitNanos == Long.MAX_VALUE ? Long.MAX_VALUE : saturatingAdd(searchStart, timeLimitNanos);

        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        RootEvaluation lastComplete = null;
        int completedDepth = 0;
        long totalVisited = 0L;
        boolean timedOut = false;

        for (int depth = 1; depth <= constraints.depthLimit(); depth++) {
            long iterationStart = System.nanoTime();
            RootEvaluation iteration = constraints.mode() == SearchConstraints.SearchMode.SEQ
                    ? evaluateRoot(board, depth, maxPlayer)
                    : getParallelSearcher().evaluateRoot(board, depth, maxPlayer);
            long elapsed = System.nanoTime() - iterationStart;

            lastComplete = iteration;
            completedDepth = depth;
            totalVisited += iteration.visitedNodes();
            iterations.add(new SearchTelemetry.Iteration(depth, iteration.visitedNodes(), iteration.cutoffs(),
                    elapsed, iteration.move(), iteration.score()));

            SearchTelemetry.Iteration finished = iterations.get(iterations.size() - 1);
            LOGGER.fine(() -> String.format("Depth %d: best %s (score=%d, nodes=%d, cutoffs=%d, %.1f ms)",
                    finished.depth(), finished.bestMove(), finished.score(), finished.nodes(), finished.cutoffs(),
                    finished.elapsedMillis()));

            if (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline && depth < constraints.depthLimit()) {
                timedOut = true;
                break;
            }
        }

        SearchTelemetry telemetry = new SearchTelemetry(iterations);
        final int usedDepth = completedDepth;
        LOGGER.info(() -> String.format("%s explored %d nodes with %d cutoffs in %d ms (depth=%d, heuristic=%s, "
                + "mode=%s)", algorithm, telemetry.totalNodes(), telemetry.totalCutoffs(),
                telemetry.totalElapsedNanos() / 1_000_000L, usedDepth, heuristic, constraints.mode()));

        lastVisitedNodes = totalVisited;
        lastTimedOut = timedOut;
        return new SearchResult(lastComplete.move(), lastComplete.score(), completedDepth, totalVisited, timedOut,
                telemetry);
    }

    private long toTimeLimitNanos(Duration timeLimit) {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    private long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    /**
     * Shuts down the parallel searcher, if one was started. A later parallel search starts a new one.
     */
    public void shutdown() {
        if (parallelSearcher != null) {
            parallelSearcher.shutdown();
            parallelSearcher = null;
        }
    }

    private ForkJoinRootSearch getParallelSearcher() {
        if (parallelSearcher == null) {
            parallelSearcher = new ForkJoinRootSearch(algorithm, heuristic);
        }
        return parallelSearcher;
    }
}
