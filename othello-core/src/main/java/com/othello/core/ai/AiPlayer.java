package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Move;
import java.util.Objects;

/**
 * {@link Player} backed by a {@link Searcher} and fixed {@link SearchConstraints}.
 */
public final class AiPlayer implements Player {

    private final Searcher searcher;
    private final SearchConstraints constraints;

    public AiPlayer(Searcher searcher, SearchConstraints constraints) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    @Override
    public Move chooseMove(Board board) {
        return searcher.search(board, constraints).move();
    }
}
