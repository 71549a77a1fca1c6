package com.othello.core.save;

import com.othello.core.Board;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes save files in the format produced by {@link Board#export()}.
 */
public final class SaveFiles {

    private static final Logger LOGGER = Logger.getLogger(SaveFiles.class.getName());

    private SaveFiles() {
    }

    public static void save(Board board, Path path) throws IOException {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(path, "path");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, board.export(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save board to " + path, ex);
            throw ex;
        }
        LOGGER.info(() -> String.format("Saved board with %d history entries to %s", board.getHistorySize(), path));
    }

    public static Board load(Path path) throws IOException, BoardParseException {
        Objects.requireNonNull(path, "path");
        String content = Files.readString(path, StandardCharsets.UTF_8);
        Board board = new BoardParser(content).parse();
        LOGGER.info(() -> String.format("Loaded %s board from %s", board.getSize(), path));
        return board;
    }
}
