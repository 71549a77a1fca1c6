package com.othello.core.ai;

import com.othello.core.Board;

/**
 * Picks a move for the player to move on a {@link Board}.
 */
public interface Searcher {

    /**
     * Searches the best move for {@link Board#getCurrentPlayer()} under the supplied
     * {@link SearchConstraints}. The board passed in is left as it was.
     *
     * @param board the position to analyse; the player to move must have a legal move
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     */
    SearchResult search(Board board, SearchConstraints constraints);
}
