package com.othello.core.ai.parallel;

import com.othello.core.Board;
import com.othello.core.Color;
import com.othello.core.Move;
import com.othello.core.ai.Heuristic;
import com.othello.core.ai.MinimaxAI;
import com.othello.core.ai.RootEvaluation;
import com.othello.core.ai.SearchAlgorithm;
import com.othello.core.ai.SearchConstraints;
import com.othello.core.ai.SearchResult;
import com.othello.core.ai.SearchTelemetry;
import com.othello.core.ai.Searcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveTask;

/**
 * Parallel root splitter: every root move is scored in its own fork-join task on a private copy of
 * the board, then the results are merged in legal-move order so the chosen move is the one the
 * sequential search would pick.
 */
public final class ForkJoinRootSearch implements Searcher {

    private final SearchAlgorithm algorithm;
    private final Heuristic heuristic;
    private final ForkJoinPool pool;

    public ForkJoinRootSearch(SearchAlgorithm algorithm, Heuristic heuristic) {
        this(algorithm, heuristic, Runtime.getRuntime().availableProcessors());
    }

    public ForkJoinRootSearch(SearchAlgorithm algorithm, Heuristic heuristic, int parallelism) {
        this(algorithm, heuristic, newPool(parallelism));
    }

    public ForkJoinRootSearch(SearchAlgorithm algorithm, Heuristic heuristic, ForkJoinPool pool) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Shuts down the underlying {@link ForkJoinPool}.
     */
    public void shutdown() {
        pool.shutdown();
    }

    /**
     * Searches straight to the depth limit, without iterative deepening and without looking at the
     * time limit.
     */
    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        if (board.isGameOver()) {
            throw new IllegalStateException("Cannot search moves in a terminal position");
        }

        int depth = constraints.depthLimit();
        long start = System.nanoTime();
        RootEvaluation evaluation = evaluateRoot(board, depth, board.getCurrentPlayer());
        long elapsed = System.nanoTime() - start;

        SearchTelemetry.Iteration iteration = new SearchTelemetry.Iteration(depth, evaluation.visitedNodes(),
                evaluation.cutoffs(), elapsed, evaluation.move(), evaluation.score());
        return new SearchResult(evaluation.move(), evaluation.score(), depth, evaluation.visitedNodes(), false,
                new SearchTelemetry(List.of(iteration)));
    }

    /**
     * Parallel counterpart of {@link MinimaxAI#evaluateRoot}; returns the same move and score.
     */
    public RootEvaluation evaluateRoot(Board board, int depth, Color maxPlayer) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(maxPlayer, "maxPlayer");
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must not be negative");
        }
        if (depth == 0 || board.isGameOver()) {
            return new RootEvaluation(Move.PASS, heuristic.evaluate(board, maxPlayer), 0L, 0L);
        }
        Color toMove = board.getCurrentPlayer();
        List<Move> moves = board.legalMoveList(toMove);
        if (moves.isEmpty()) {
            throw new IllegalStateException("Player " + toMove + " has no legal move, record a pass instead");
        }
        return pool.invoke(new RootTask(board.copy(), moves, depth, maxPlayer));
    }

    private static ForkJoinPool newPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        return new ForkJoinPool(parallelism);
    }

    private final class RootTask extends RecursiveTask<RootEvaluation> {

        private final Board board;
        private final List<Move> moves;
        private final int depth;
        private final Color maxPlayer;

        RootTask(Board board, List<Move> moves, int depth, Color maxPlayer) {
            this.board = board;
            this.moves = moves;
            this.depth = depth;
            this.maxPlayer = maxPlayer;
        }

        @Override
        protected RootEvaluation compute() {
            List<MoveTask> tasks = new ArrayList<>(moves.size());
            for (Move move : moves) {
                Board child = board.copy();
                child.play(move);
                MoveTask task = new MoveTask(move, child, depth - 1, maxPlayer);
                task.fork();
                tasks.add(task);
            }

            boolean maximizing = board.getCurrentPlayer() == maxPlayer;
            Move bestMove = null;
            int bestScore = maximizing ? MinimaxAI.NEGATIVE_INFINITY : MinimaxAI.POSITIVE_INFINITY;
            long nodes = 0L;
            long cutoffs = 0L;
            for (MoveTask task : tasks) {
                RootEvaluation child = task.join();
                nodes += child.visitedNodes();
                cutoffs += child.cutoffs();
                boolean better = maximizing ? child.score() > bestScore : child.score() < bestScore;
                if (bestMove == null || better) {
                    bestMove = child.move();
                    bestScore = child.score();
                }
            }
            return new RootEvaluation(bestMove, bestScore, nodes, cutoffs);
        }
    }

    private final class MoveTask extends RecursiveTask<RootEvaluation> {

        private final Move move;
        private final Board board;
        private final int depth;
        private final Color maxPlayer;

        MoveTask(Move move, Board board, int depth, Color maxPlayer) {
            this.move = move;
            this.board = board;
            this.depth = depth;
            this.maxPlayer = maxPlayer;
        }

        @Override
        protected RootEvaluation compute() {
            MinimaxAI ai = new MinimaxAI(algorithm, heuristic);
            int score = algorithm.score(ai, board, depth, maxPlayer);
            return new RootEvaluation(move, score, ai.getVisitedNodes(), ai.getCutoffs());
        }
    }
}
