package com.othello.core;

/**
 * Shared text layout for boards: a header of column letters, then one numbered line per row.
 */
final class GridRenderer {

    private GridRenderer() {
    }

    static String render(int size, CellGlyph glyph) {
        int labelWidth = Integer.toString(size).length();
        StringBuilder builder = new StringBuilder();
        builder.append(" ".repeat(labelWidth));
        for (int x = 0; x < size; x++) {
            builder.append(' ').append((char) ('a' + x));
        }
        for (int y = 0; y < size; y++) {
            builder.append('\n');
            String label = Integer.toString(y + 1);
            builder.append(" ".repeat(labelWidth - label.length())).append(label);
            for (int x = 0; x < size; x++) {
                builder.append(' ').append(glyph.at(x, y));
            }
        }
        return builder.toString();
    }

    @FunctionalInterface
    interface CellGlyph {

        char at(int x, int y);
    }
}
