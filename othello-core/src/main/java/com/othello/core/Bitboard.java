package com.othello.core;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable set of cells on a square grid, one bit per cell. Bit index is {@code y * size + x}
 * with the origin in the top-left corner. Sizes up to 12 need 144 bits, so the bits are held in a
 * {@link BigInteger}.
 */
public final class Bitboard {

    private static final ConcurrentHashMap<Integer, Masks> MASKS_BY_SIZE = new ConcurrentHashMap<>();

    private final Masks masks;
    private final BigInteger bits;

    /**
     * Creates an empty bitboard.
     */
    public Bitboard(int size) {
        this(size, BigInteger.ZERO);
    }

    /**
     * Creates a bitboard holding the provided bits.
     *
     * @throws IllegalArgumentException if a bit outside of the {@code size * size} grid is set
     */
    public Bitboard(int size, BigInteger bits) {
        Objects.requireNonNull(bits, "bits");
        this.masks = masksFor(size);
        if (bits.signum() < 0 || bits.andNot(masks.full()).signum() != 0) {
            throw new IllegalArgumentException("Bits do not fit on a " + size + "x" + size + " grid");
        }
        this.bits = bits;
    }

    private Bitboard(Masks masks, BigInteger bits) {
        this.masks = masks;
        this.bits = bits;
    }

    /**
     * Creates a bitboard with exactly one cell set.
     */
    public static Bitboard singleCell(int size, int x, int y) {
        return new Bitboard(size).with(x, y, true);
    }

    public int getSize() {
        return masks.size();
    }

    public BigInteger getBits() {
        return bits;
    }

    public BigInteger getFullMask() {
        return masks.full();
    }

    /**
     * Returns the mask of every cell except those in the leftmost column.
     */
    public BigInteger getWestMask() {
        return masks.west();
    }

    /**
     * Returns the mask of every cell except those in the rightmost column.
     */
    public BigInteger getEastMask() {
        return masks.east();
    }

    /**
     * Returns {@code true} if the cell at {@code x}:{@code y} is set.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid
     */
    public boolean get(int x, int y) {
        return bits.testBit(bitIndex(x, y));
    }

    /**
     * Returns a copy of this bitboard with the cell at {@code x}:{@code y} set to {@code value}.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid
     */
    public Bitboard with(int x, int y, boolean value) {
        int index = bitIndex(x, y);
        BigInteger updated = value ? bits.setBit(index) : bits.clearBit(index);
        return new Bitboard(masks, updated);
    }

    /**
     * Returns {@code true} if the bit with the given raw index is set.
     */
    public boolean isSet(int index) {
        if (index < 0 || index >= cellCount()) {
            throw new IndexOutOfBoundsException("Bit index out of range: " + index);
        }
        return bits.testBit(index);
    }

    public boolean isEmpty() {
        return bits.signum() == 0;
    }

    /**
     * Returns the number of set cells.
     */
    public int popcount() {
        return bits.bitCount();
    }

    public int cellCount() {
        int size = masks.size();
        return size * size;
    }

    /**
     * Moves every set cell one step in {@code direction}. Cells pushed over an edge disappear, they
     * never wrap around to the opposite side.
     */
    public Bitboard shift(Direction direction) {
        int size = masks.size();
        int offset = direction.dy() * size + direction.dx();
        BigInteger shifted = offset >= 0 ? bits.shiftLeft(offset) : bits.shiftRight(-offset);
        if (direction.dx() > 0) {
            shifted = shifted.and(masks.west());
        } else if (direction.dx() < 0) {
            shifted = shifted.and(masks.east());
        } else {
            shifted = shifted.and(masks.full());
        }
        return new Bitboard(masks, shifted);
    }

    public Bitboard and(Bitboard other) {
        checkSameSize(other);
        return new Bitboard(masks, bits.and(other.bits));
    }

    public Bitboard or(Bitboard other) {
        checkSameSize(other);
        return new Bitboard(masks, bits.or(other.bits));
    }

    public Bitboard xor(Bitboard other) {
        checkSameSize(other);
        return new Bitboard(masks, bits.xor(other.bits));
    }

    /**
     * Returns the cells set here but not in {@code other}.
     */
    public Bitboard andNot(Bitboard other) {
        checkSameSize(other);
        return new Bitboard(masks, bits.andNot(other.bits));
    }

    /**
     * Returns every cell of the grid that is not set here.
     */
    public Bitboard complement() {
        return new Bitboard(masks, bits.xor(masks.full()));
    }

    /**
     * Returns the set cells as coordinates, in ascending bit-index order (row by row, left to
     * right).
     */
    public List<Move> coordinates() {
        int size = masks.size();
        List<Move> cells = new ArrayList<>(popcount());
        for (int index = bits.getLowestSetBit(); index >= 0 && index < bits.bitLength(); index++) {
            if (bits.testBit(index)) {
                cells.add(new Move(index % size, index / size));
            }
        }
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bitboard)) {
            return false;
        }
        Bitboard other = (Bitboard) o;
        return masks.size() == other.masks.size() && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(masks.size(), bits);
    }

    /**
     * Renders the grid with column letters and row numbers, {@code *} for set cells and {@code _}
     * for the others.
     */
    @Override
    public String toString() {
        return GridRenderer.render(masks.size(), (x, y) -> get(x, y) ? '*' : '_');
    }

    private int bitIndex(int x, int y) {
        int size = masks.size();
        if (x < 0 || x >= size || y < 0 || y >= size) {
            throw new IndexOutOfBoundsException("Cell " + x + ":" + y + " is outside of a " + size + "x" + size
                    + " grid");
        }
        return y * size + x;
    }

    private void checkSameSize(Bitboard other) {
        Objects.requireNonNull(other, "other");
        if (other.masks.size() != masks.size()) {
            throw new IllegalArgumentException("Cannot combine bitboards of sizes " + masks.size() + " and "
                    + other.masks.size());
        }
    }

    private static Masks masksFor(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Bitboard size must be positive: " + size);
        }
        return MASKS_BY_SIZE.computeIfAbsent(size, Masks::compute);
    }

    private record Masks(int size, BigInteger full, BigInteger west, BigInteger east) {

        static Masks compute(int size) {
            BigInteger full = BigInteger.ZERO;
            BigInteger west = BigInteger.ZERO;
            BigInteger east = BigInteger.ZERO;
            for (int i = 0; i < size * size; i++) {
                full = full.setBit(i);
                if (i % size != 0) {
                    west = west.setBit(i);
                }
                if (i % size != size - 1) {
                    east = east.setBit(i);
                }
            }
            return new Masks(size, full, west, east);
        }
    }
}
