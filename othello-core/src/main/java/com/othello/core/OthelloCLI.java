package com.othello.core;

import com.othello.core.ai.AiPlayer;
import com.othello.core.ai.MinimaxAI;
import com.othello.core.ai.Player;
import com.othello.core.ai.SearchConstraints;
import com.othello.core.save.BoardParseException;
import com.othello.core.save.SaveFiles;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Console front-end for playing Othello between humans, against the computer, or computer against
 * computer.
 * <p>
 * Usage: {@code OthelloCLI [--config=<file>] [saveFile]}. Without {@code --config} a
 * {@code .othellorc} in the working directory is used when present.
 */
public final class OthelloCLI {

    private static final Logger LOGGER = Logger.getLogger(OthelloCLI.class.getName());
    private static final String DEFAULT_CONFIG_FILE = ".othellorc";
    private static final String CONFIG_OPTION = "--config=";

    private final Scanner scanner;
    private final GameConfig config;
    private final Board board;
    private final Player computer;

    private OthelloCLI(Scanner scanner, GameConfig config, Board board) {
        this.scanner = scanner;
        this.config = config;
        this.board = board;
        SearchConstraints constraints = new SearchConstraints(config.depth(), config.aiTime(),
                SearchConstraints.SearchMode.SEQ);
        this.computer = new AiPlayer(new MinimaxAI(config.algorithm(), config.heuristic()), constraints);
    }

    public static void main(String[] args) {
        configureLogging();
        Path configPath = null;
        Path savePath = null;
        for (String arg : args) {
            if (arg.startsWith(CONFIG_OPTION)) {
                configPath = Paths.get(arg.substring(CONFIG_OPTION.length()));
            } else if (savePath == null && !arg.startsWith("--")) {
                savePath = Paths.get(arg);
            } else {
                printUsage();
                return;
            }
        }

        GameConfig config;
        Board board;
        try {
            config = loadConfig(configPath);
            if (savePath != null) {
                board = SaveFiles.load(savePath);
                config = config.withSize(board.getSize());
            } else {
                board = new Board(config.size());
            }
        } catch (IOException | BoardParseException ex) {
            LOGGER.log(Level.SEVERE, "Failed to start the game", ex);
            System.err.println("Could not start: " + ex.getMessage());
            return;
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.err.println("Invalid configuration: " + ex.getMessage());
            return;
        }

        if (config.debug()) {
            enableDebugLogging();
        }
        new OthelloCLI(new Scanner(System.in), config, board).run();
    }

    private void run() {
        System.out.println("Othello, console edition. Type ? for help.");
        while (!board.isGameOver()) {
            Color toMove = board.getCurrentPlayer();
            if (!board.hasLegalMove(toMove)) {
                System.out.printf("%s has no legal move and passes.%n", toMove);
                board.play(Move.PASS);
                continue;
            }
            if (config.aiColor().controls(toMove)) {
                Move move = computer.chooseMove(board);
                System.out.printf("%s (computer) plays %s%n", toMove, move);
                announce(board.play(move));
                continue;
            }

            System.out.println(board.render(board.legalMoves(toMove)));
            printScores();
            System.out.printf("Turn %d, %s (%c) to move: ", board.getTurnNumber(), toMove, toMove.getSymbol());
            if (!scanner.hasNextLine()) {
                System.out.println();
                return;
            }

            Command command;
            try {
                command = Command.parse(scanner.nextLine(), board.getSize().getValue());
            } catch (IllegalArgumentException ex) {
                System.out.println(ex.getMessage() + ". Type ? for help.");
                continue;
            }
            if (!execute(command)) {
                return;
            }
        }

        System.out.println(board);
        printScores();
        Color winner = board.winner();
        System.out.println(winner == Color.EMPTY ? "Draw." : "Winner: " + winner);
    }

    /**
     * Returns {@code false} when the session should end.
     */
    private boolean execute(Command command) {
        switch (command.kind()) {
            case PLAY_MOVE:
                try {
                    announce(board.play(command.move()));
                } catch (IllegalMoveException ex) {
                    System.out.println("Illegal move " + command.move() + ", cells marked * are legal.");
                }
                return true;
            case HELP:
                printHelp();
                return true;
            case RULES:
                printRules();
                return true;
            case UNDO:
                undo();
                return true;
            case RESTART:
                board.restart();
                System.out.println("New game.");
                return true;
            case SAVE_HISTORY:
                save(command.argument());
                return true;
            case SAVE_AND_QUIT:
                return !save(command.argument());
            case FORFEIT:
                Color loser = board.getCurrentPlayer();
                board.forceGameOver();
                System.out.printf("%s forfeits, %s wins.%n", loser, loser.opposite());
                return false;
            case QUIT:
                return false;
            default:
                throw new IllegalStateException("Unhandled command " + command.kind());
        }
    }

    private void undo() {
        try {
            board.pop();
            while (config.aiColor().controls(board.getCurrentPlayer()) && board.getHistorySize() > 0) {
                board.pop();
            }
            System.out.println("Move undone.");
        } catch (CannotUndoException ex) {
            System.out.println("Nothing to undo.");
        }
    }

    private boolean save(String fileName) {
        Path path = Paths.get(fileName);
        try {
            SaveFiles.save(board, path);
            System.out.println("Game saved to " + path);
            return true;
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save game to " + path, ex);
            System.out.println("Could not save the game: " + ex.getMessage());
            return false;
        }
    }

    private void announce(PlayOutcome outcome) {
        if (outcome == PlayOutcome.PASSED) {
            System.out.printf("%s has no legal move and passes.%n", board.getCurrentPlayer().opposite());
        } else if (outcome == PlayOutcome.GAME_OVER) {
            System.out.println("No player can move anymore.");
        }
    }

    private void printScores() {
        System.out.printf("Discs: X=%d O=%d%n", board.popcount(Color.BLACK), board.popcount(Color.WHITE));
    }

    private static void printHelp() {
        System.out.println("Commands:");
        System.out.println("  d3           play a disc at column d, row 3");
        System.out.println("  ?            show this help");
        System.out.println("  r            show the rules");
        System.out.println("  undo         take back the last move");
        System.out.println("  restart      start a new game");
        System.out.println("  sh [file]    save the game and keep playing");
        System.out.println("  s [file]     save the game and quit");
        System.out.println("  ff           forfeit");
        System.out.println("  q            quit without saving");
    }

    private static void printRules() {
        System.out.println("Place a disc so that it encloses a straight line of opponent discs between");
        System.out.println("it and one of your own discs; the enclosed discs change color. A player");
        System.out.println("without a legal move passes. The game ends when neither player can move,");
        System.out.println("and the player with more discs wins.");
    }

    private static GameConfig loadConfig(Path configPath) throws IOException {
        if (configPath != null) {
            return GameConfig.load(configPath);
        }
        Path local = Paths.get(DEFAULT_CONFIG_FILE);
        return Files.isRegularFile(local) ? GameConfig.load(local) : GameConfig.defaults();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = OthelloCLI.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }

    private static void enableDebugLogging() {
        Logger.getLogger("com.othello").setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
        LOGGER.fine("Debug logging enabled");
    }

    private static void printUsage() {
        System.err.println("Usage: OthelloCLI [--config=<file>] [saveFile]");
    }
}
