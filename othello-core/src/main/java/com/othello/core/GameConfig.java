package com.othello.core;

import com.othello.core.ai.Heuristic;
import com.othello.core.ai.SearchAlgorithm;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Validated settings for a game session. Selectors are resolved to enum constants here so nothing
 * downstream compares strings.
 * <p>
 * Persisted as {@code .othellorc} files of {@code key=value} lines.
 */
public record GameConfig(BoardSize size, AiColor aiColor, int depth, SearchAlgorithm algorithm, Heuristic heuristic,
        Duration aiTime, boolean debug) {

    public static final String KEY_SIZE = "size";
    public static final String KEY_AI_COLOR = "ai_color";
    public static final String KEY_AI_DEPTH = "ai_depth";
    public static final String KEY_AI_MODE = "ai_mode";
    public static final String KEY_AI_HEURISTIC = "ai_heuristic";
    public static final String KEY_AI_TIME = "ai_time";
    public static final String KEY_DEBUG = "debug";

    private static final Logger LOGGER = Logger.getLogger(GameConfig.class.getName());
    private static final Set<String> KNOWN_KEYS = Set.of(KEY_SIZE, KEY_AI_COLOR, KEY_AI_DEPTH, KEY_AI_MODE,
            KEY_AI_HEURISTIC, KEY_AI_TIME, KEY_DEBUG);

    public GameConfig {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(aiColor, "aiColor");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(heuristic, "heuristic");
        Objects.requireNonNull(aiTime, "aiTime");
        if (depth < 1) {
            throw new IllegalArgumentException("AI depth must be positive");
        }
        if (aiTime.isNegative()) {
            throw new IllegalArgumentException("AI time limit must not be negative");
        }
    }

    /**
     * 8x8 board, computer plays black with minimax at depth 3, all-in-one heuristic, 5 seconds.
     */
    public static GameConfig defaults() {
        return new GameConfig(BoardSize.EIGHT_BY_EIGHT, AiColor.BLACK, 3, SearchAlgorithm.MINIMAX,
                Heuristic.ALL_IN_ONE, Duration.ofSeconds(5), false);
    }

    public GameConfig withSize(BoardSize newSize) {
        return new GameConfig(newSize, aiColor, depth, algorithm, heuristic, aiTime, debug);
    }

    /**
     * Reads a configuration file. Missing keys keep their default value.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    public static GameConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        GameConfig config = fromProperties(properties);
        LOGGER.info(() -> String.format("Loaded configuration from %s: %s", path, config));
        return config;
    }

    /**
     * Builds a configuration from {@code properties}, starting from {@link #defaults()}.
     *
     * @throws IllegalArgumentException naming the offending key if a value is invalid
     */
    public static GameConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        for (String key : properties.stringPropertyNames()) {
            if (!KNOWN_KEYS.contains(key)) {
                LOGGER.fine(() -> "Ignoring unknown configuration key " + key);
            }
        }

        GameConfig defaults = defaults();
        try {
            BoardSize size = read(properties, KEY_SIZE, defaults.size(),
                    value -> BoardSize.fromValue(Integer.parseInt(value)));
            AiColor aiColor = read(properties, KEY_AI_COLOR, defaults.aiColor(), AiColor::fromSymbol);
            int depth = read(properties, KEY_AI_DEPTH, defaults.depth(), Integer::parseInt);
            SearchAlgorithm algorithm = read(properties, KEY_AI_MODE, defaults.algorithm(), SearchAlgorithm::fromName);
            Heuristic heuristic = read(properties, KEY_AI_HEURISTIC, defaults.heuristic(), Heuristic::fromName);
            Duration aiTime = read(properties, KEY_AI_TIME, defaults.aiTime(),
                    value -> Duration.ofSeconds(Long.parseLong(value)));
            boolean debug = read(properties, KEY_DEBUG, defaults.debug(), GameConfig::parseBoolean);
            return new GameConfig(size, aiColor, depth, algorithm, heuristic, aiTime, debug);
        } catch (ConfigValueException ex) {
            throw new IllegalArgumentException(ex.getMessage(), ex.getCause());
        }
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(KEY_SIZE, Integer.toString(size.getValue()));
        properties.setProperty(KEY_AI_COLOR, aiColor.getSymbol());
        properties.setProperty(KEY_AI_DEPTH, Integer.toString(depth));
        properties.setProperty(KEY_AI_MODE, algorithm.getConfigName());
        properties.setProperty(KEY_AI_HEURISTIC, heuristic.getConfigName());
        properties.setProperty(KEY_AI_TIME, Long.toString(aiTime.toSeconds()));
        properties.setProperty(KEY_DEBUG, Boolean.toString(debug));
        return properties;
    }

    public void store(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toProperties().store(writer, "Othello configuration");
        }
        LOGGER.info(() -> "Saved configuration to " + path);
    }

    private static <T> T read(Properties properties, String key, T fallback, ValueParser<T> parser)
            throws ConfigValueException {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.parse(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new ConfigValueException("Invalid value for " + key + ": " + raw, ex);
        }
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Expected true or false: " + value);
    }

    @FunctionalInterface
    private interface ValueParser<T> {

        T parse(String value);
    }

    private static final class ConfigValueException extends Exception {

        private static final long serialVersionUID = 1L;

        ConfigValueException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
