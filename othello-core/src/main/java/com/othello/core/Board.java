package com.othello.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable Othello position built on two {@link Bitboard}s, one per color.
 * <p>
 * The board changes only through {@link #play(int, int)} and {@link #pop()}. Every play pushes a
 * {@link HistoryEntry} holding the bitboards from before the move, so search code can walk the game
 * tree depth-first on a single instance and backtrack without copying. A board is not thread-safe;
 * parallel searches work on {@link #copy()}s.
 */
public final class Board {

    private final BoardSize size;
    private final int dimension;
    private final List<HistoryEntry> history = new ArrayList<>();

    private Bitboard black;
    private Bitboard white;
    private Color currentPlayer;
    private boolean forcedGameOver;
    private boolean historyFromStart;

    /**
     * Creates a board with the four starting discs in the center and black to move.
     */
    public Board(BoardSize size) {
        this.size = Objects.requireNonNull(size, "size");
        this.dimension = size.getValue();
        restart();
    }

    /**
     * Creates a board from an arbitrary position. The history of such a board does not start from
     * the opening, so {@link #export()} writes the position only.
     *
     * @throws IllegalArgumentException if the bitboards do not match {@code size} or overlap
     */
    public Board(BoardSize size, Bitboard black, Bitboard white, Color currentPlayer) {
        this.size = Objects.requireNonNull(size, "size");
        this.dimension = size.getValue();
        Objects.requireNonNull(black, "black");
        Objects.requireNonNull(white, "white");
        Objects.requireNonNull(currentPlayer, "currentPlayer");
        if (black.getSize() != dimension || white.getSize() != dimension) {
            throw new IllegalArgumentException("Bitboards must be " + dimension + "x" + dimension);
        }
        if (!black.and(white).isEmpty()) {
            throw new IllegalArgumentException("A cell cannot hold both a black and a white disc");
        }
        if (currentPlayer == Color.EMPTY) {
            throw new IllegalArgumentException("The player to move must be BLACK or WHITE");
        }
        this.black = black;
        this.white = white;
        this.currentPlayer = currentPlayer;
        this.historyFromStart = false;
    }

    private Board(Board other) {
        this.size = other.size;
        this.dimension = other.dimension;
        this.black = other.black;
        this.white = other.white;
        this.currentPlayer = other.currentPlayer;
        this.forcedGameOver = other.forcedGameOver;
        this.historyFromStart = other.historyFromStart;
        this.history.addAll(other.history);
    }

    /**
     * Returns an independent board with the same position and history.
     */
    public Board copy() {
        return new Board(this);
    }

    /**
     * Puts the starting discs back, hands the move to black and clears the history.
     */
    public void restart() {
        int low = dimension / 2 - 1;
        int high = dimension / 2;
        white = new Bitboard(dimension).with(low, low, true).with(high, high, true);
        black = new Bitboard(dimension).with(low, high, true).with(high, low, true);
        currentPlayer = Color.BLACK;
        history.clear();
        forcedGameOver = false;
        historyFromStart = true;
    }

    public BoardSize getSize() {
        return size;
    }

    public Bitboard getBlack() {
        return black;
    }

    public Bitboard getWhite() {
        return white;
    }

    public Color getCurrentPlayer() {
        return currentPlayer;
    }

    /**
     * Returns the discs of {@code color}, or the empty cells for {@link Color#EMPTY}.
     */
    public Bitboard discs(Color color) {
        switch (color) {
            case BLACK:
                return black;
            case WHITE:
                return white;
            default:
                return emptyMask();
        }
    }

    public int popcount(Color color) {
        return discs(color).popcount();
    }

    public Color colorAt(int x, int y) {
        if (black.get(x, y)) {
            return Color.BLACK;
        }
        if (white.get(x, y)) {
            return Color.WHITE;
        }
        return Color.EMPTY;
    }

    /**
     * Returns every cell where {@code player} may place a disc.
     * <p>
     * For each direction, opponent discs adjacent to one of the player's discs are followed step by
     * step; an empty cell reached right after such a run is a legal destination.
     */
    public Bitboard legalMoves(Color player) {
        Bitboard own = ownDiscs(player);
        Bitboard opponent = ownDiscs(player.opposite());
        Bitboard empty = emptyMask();
        Bitboard moves = new Bitboard(dimension);
        for (Direction direction : Direction.values()) {
            Bitboard candidates = opponent.and(own.shift(direction));
            while (!candidates.isEmpty()) {
                Bitboard next = candidates.shift(direction);
                moves = moves.or(empty.and(next));
                candidates = opponent.and(next);
            }
        }
        return moves;
    }

    /**
     * Returns the legal moves of {@code player} in ascending cell order.
     */
    public List<Move> legalMoveList(Color player) {
        return legalMoves(player).coordinates();
    }

    public boolean hasLegalMove(Color player) {
        return !legalMoves(player).isEmpty();
    }

    /**
     * Returns the discs that belong to {@code player} once a disc is placed at {@code x}:{@code y},
     * the placed disc included. Legality is not checked; the mask of an illegal coordinate is
     * meaningless.
     */
    public Bitboard captureMask(int x, int y, Color player) {
        Bitboard own = ownDiscs(player);
        Bitboard opponent = ownDiscs(player.opposite());
        Bitboard position = Bitboard.singleCell(dimension, x, y);
        Bitboard captured = position;
        for (Direction direction : Direction.values()) {
            Bitboard run = new Bitboard(dimension);
            Bitboard cursor = position.shift(direction);
            while (!cursor.isEmpty()) {
                if (!cursor.and(opponent).isEmpty()) {
                    run = run.or(cursor);
                    cursor = cursor.shift(direction);
                    continue;
                }
                if (!cursor.and(own).isEmpty()) {
                    captured = captured.or(run);
                }
                break;
            }
        }
        return captured;
    }

    public PlayOutcome play(Move move) {
        Objects.requireNonNull(move, "move");
        return play(move.x(), move.y());
    }

    /**
     * Plays a disc for the current player, or passes when {@code x} and {@code y} are both
     * {@code -1}.
     * <p>
     * When the opponent is left without a legal move, a pass is recorded for them and the same
     * player moves again ({@link PlayOutcome#PASSED}). When nobody can move anymore the game is over
     * ({@link PlayOutcome#GAME_OVER}).
     *
     * @throws IllegalMoveException if the move is not legal for the current player; the board is
     *                              left unchanged
     * @throws GameOverException    if the game was already over
     */
    public PlayOutcome play(int x, int y) {
        if (x == -1 && y == -1) {
            return pass();
        }
        if (isGameOver()) {
            throw new GameOverException();
        }
        if (x < 0 || x >= dimension || y < 0 || y >= dimension || !legalMoves(currentPlayer).get(x, y)) {
            throw new IllegalMoveException(x, y, currentPlayer);
        }

        Color mover = currentPlayer;
        Color opponent = mover.opposite();
        Bitboard captured = captureMask(x, y, mover);
        history.add(new HistoryEntry(black, white, new Move(x, y), mover, false));
        if (mover == Color.BLACK) {
            black = black.or(captured);
            white = white.andNot(captured);
        } else {
            white = white.or(captured);
            black = black.andNot(captured);
        }
        currentPlayer = opponent;

        if (hasLegalMove(opponent)) {
            return PlayOutcome.CONTINUED;
        }
        if (hasLegalMove(mover)) {
            history.add(new HistoryEntry(black, white, Move.PASS, opponent, true));
            currentPlayer = mover;
            return PlayOutcome.PASSED;
        }
        return PlayOutcome.GAME_OVER;
    }

    private PlayOutcome pass() {
        if (isGameOver()) {
            throw new GameOverException();
        }
        if (hasLegalMove(currentPlayer)) {
            throw new IllegalMoveException(-1, -1, currentPlayer);
        }
        history.add(new HistoryEntry(black, white, Move.PASS, currentPlayer, false));
        currentPlayer = currentPlayer.opposite();
        return PlayOutcome.CONTINUED;
    }

    /**
     * Undoes the last {@link #play(int, int)} call, including the pass it may have recorded for the
     * opponent.
     *
     * @return the history entry of the undone move
     * @throws CannotUndoException if there is nothing to undo
     */
    public HistoryEntry pop() {
        if (history.isEmpty()) {
            throw new CannotUndoException();
        }
        HistoryEntry entry = history.remove(history.size() - 1);
        if (entry.automatic() && !history.isEmpty()) {
            entry = history.remove(history.size() - 1);
        }
        black = entry.black();
        white = entry.white();
        currentPlayer = entry.mover();
        return entry;
    }

    /**
     * Returns {@code true} when neither player has a legal move, or the game was ended through
     * {@link #forceGameOver()}.
     */
    public boolean isGameOver() {
        if (forcedGameOver) {
            return true;
        }
        return !hasLegalMove(currentPlayer) && !hasLegalMove(currentPlayer.opposite());
    }

    /**
     * Ends the game regardless of the position, e.g. when a player runs out of time.
     */
    public void forceGameOver() {
        forcedGameOver = true;
    }

    /**
     * Returns the color with more discs, or {@link Color#EMPTY} on a tie.
     */
    public Color winner() {
        int blackCount = black.popcount();
        int whiteCount = white.popcount();
        if (blackCount == whiteCount) {
            return Color.EMPTY;
        }
        return blackCount > whiteCount ? Color.BLACK : Color.WHITE;
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public int getHistorySize() {
        return history.size();
    }

    /**
     * Returns the 1-based turn number; a turn is one black and one white move.
     */
    public int getTurnNumber() {
        return history.size() / 2 + 1;
    }

    /**
     * Returns {@code true} if the history can be replayed from the starting position.
     */
    public boolean isHistoryFromStart() {
        return historyFromStart;
    }

    /**
     * Serializes the board in the save-file format: the symbol of the player to move, the grid and,
     * if it starts from the opening, the move history.
     */
    public String export() {
        StringBuilder builder = new StringBuilder();
        builder.append(currentPlayer.getSymbol()).append('\n');
        for (int y = 0; y < dimension; y++) {
            for (int x = 0; x < dimension; x++) {
                if (x > 0) {
                    builder.append(' ');
                }
                builder.append(colorAt(x, y).getSymbol());
            }
            builder.append('\n');
        }
        builder.append(exportHistory());
        return builder.toString();
    }

    /**
     * Returns the history as lines of {@code <turn>. X <move> O <move>}, or an empty string when the
     * history does not start from the opening.
     */
    public String exportHistory() {
        if (!historyFromStart) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < history.size(); i += 2) {
            HistoryEntry first = history.get(i);
            builder.append(i / 2 + 1).append(". ")
                    .append(first.mover().getSymbol()).append(' ')
                    .append(first.move().toAlgebraic());
            if (i + 1 < history.size()) {
                HistoryEntry second = history.get(i + 1);
                builder.append(' ')
                        .append(second.mover().getSymbol()).append(' ')
                        .append(second.move().toAlgebraic());
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * Renders the board like {@link #toString()} with the empty cells of {@code highlights} marked
     * {@code *}, e.g. to show the legal moves.
     */
    public String render(Bitboard highlights) {
        Objects.requireNonNull(highlights, "highlights");
        return GridRenderer.render(dimension, (x, y) -> {
            Color color = colorAt(x, y);
            if (color == Color.EMPTY && highlights.get(x, y)) {
                return '*';
            }
            return color.getSymbol();
        });
    }

    /**
     * Two boards are equal when they hold the same discs and the same player is to move. The
     * history is not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return size == other.size && currentPlayer == other.currentPlayer
                && black.equals(other.black) && white.equals(other.white);
    }

    @Override
    public int hashCode() {
        return Objects.hash(size, black, white, currentPlayer);
    }

    @Override
    public String toString() {
        return GridRenderer.render(dimension, (x, y) -> colorAt(x, y).getSymbol());
    }

    private Bitboard ownDiscs(Color player) {
        if (player == Color.EMPTY) {
            throw new IllegalArgumentException("EMPTY is not a player");
        }
        return player == Color.BLACK ? black : white;
    }

    private Bitboard emptyMask() {
        return black.or(white).complement();
    }
}
