package com.othello.core.ai;

import com.othello.core.Board;
import com.othello.core.Move;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Picks uniformly among the legal moves. Used as a baseline opponent.
 */
public final class RandomPlayer implements Player {

    private final Random random;

    public RandomPlayer(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public RandomPlayer(long seed) {
        this(new Random(seed));
    }

    /**
     * Returns a random legal move, or {@link Move#PASS} if there is none.
     */
    @Override
    public Move chooseMove(Board board) {
        List<Move> moves = board.legalMoveList(board.getCurrentPlayer());
        if (moves.isEmpty()) {
            return Move.PASS;
        }
        return moves.get(random.nextInt(moves.size()));
    }
}
