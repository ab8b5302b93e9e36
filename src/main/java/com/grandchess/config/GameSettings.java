package com.grandchess.config;

import com.grandchess.ai.MinimaxAI;
import com.grandchess.model.Board;
import com.grandchess.model.SetupMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Random;

/**
 * 游戏配置 - 先读系统属性，再读环境变量，最后用默认值
 */
public final class GameSettings {
    private static final Logger LOG = LoggerFactory.getLogger(GameSettings.class);

    public static final String BOARD_SIZE_PROP = "grandchess.board.size";
    public static final String BOARD_SIZE_ENV = "GRANDCHESS_BOARD_SIZE";
    public static final String SETUP_MODE_PROP = "grandchess.setup.mode";
    public static final String SETUP_MODE_ENV = "GRANDCHESS_SETUP_MODE";
    public static final String DIFFICULTY_PROP = "grandchess.ai.difficulty";
    public static final String DIFFICULTY_ENV = "GRANDCHESS_AI_DIFFICULTY";
    public static final String SEED_PROP = "grandchess.ai.seed";
    public static final String SEED_ENV = "GRANDCHESS_AI_SEED";

    public static final int DEFAULT_BOARD_SIZE = 26;

    private final int boardSize;
    private final SetupMode setupMode;
    private final MinimaxAI.Difficulty difficulty;
    private final Long seed;

    public GameSettings(int boardSize, SetupMode setupMode, MinimaxAI.Difficulty difficulty, Long seed) {
        this.boardSize = clampSize(boardSize);
        this.setupMode = setupMode == null ? SetupMode.TWO_LINES : setupMode;
        this.difficulty = difficulty == null ? MinimaxAI.Difficulty.MEDIUM : difficulty;
        this.seed = seed;
    }

    public static GameSettings defaults() {
        return new GameSettings(DEFAULT_BOARD_SIZE, SetupMode.TWO_LINES, MinimaxAI.Difficulty.MEDIUM, null);
    }

    public static GameSettings load() {
        int size = parseSize(readSetting(BOARD_SIZE_PROP, BOARD_SIZE_ENV, String.valueOf(DEFAULT_BOARD_SIZE)));
        SetupMode mode = parseEnum(SetupMode.class,
            readSetting(SETUP_MODE_PROP, SETUP_MODE_ENV, SetupMode.TWO_LINES.name()), SetupMode.TWO_LINES);
        MinimaxAI.Difficulty difficulty = parseEnum(MinimaxAI.Difficulty.class,
            readSetting(DIFFICULTY_PROP, DIFFICULTY_ENV, MinimaxAI.Difficulty.MEDIUM.name()), MinimaxAI.Difficulty.MEDIUM);
        Long seed = parseSeed(readSetting(SEED_PROP, SEED_ENV, ""));
        GameSettings settings = new GameSettings(size, mode, difficulty, seed);
        LOG.debug("Loaded {}", settings);
        return settings;
    }

    public int getBoardSize() {
        return boardSize;
    }

    public SetupMode getSetupMode() {
        return setupMode;
    }

    public MinimaxAI.Difficulty getDifficulty() {
        return difficulty;
    }

    /**
     * Configured seed, {@code null} when unset.
     */
    public Long getSeed() {
        return seed;
    }

    public Random newRandom() {
        return seed == null ? new Random() : new Random(seed);
    }

    static String readSetting(String prop, String env, String defaultValue) {
        String v = System.getProperty(prop);
        if (v == null || v.trim().isEmpty()) {
            v = System.getenv(env);
        }
        if (v == null || v.trim().isEmpty()) {
            return defaultValue;
        }
        return v.trim();
    }

    static int clampSize(int size) {
        return Math.max(Board.MIN_SIZE, Math.min(Board.MAX_SIZE, size));
    }

    private static int parseSize(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring board size '{}', using {}", raw, DEFAULT_BOARD_SIZE);
            return DEFAULT_BOARD_SIZE;
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, E fallback) {
        String normalized = raw.toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown {} '{}', using {}", type.getSimpleName(), raw, fallback.name());
            return fallback;
        }
    }

    private static Long parseSeed(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring AI seed '{}'", raw);
            return null;
        }
    }

    @Override
    public String toString() {
        return "GameSettings{boardSize=" + boardSize + ", setupMode=" + setupMode.name()
            + ", difficulty=" + difficulty.name() + ", seed=" + seed + "}";
    }
}
