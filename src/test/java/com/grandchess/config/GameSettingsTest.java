package com.grandchess.config;

import com.grandchess.ai.MinimaxAI;
import com.grandchess.model.SetupMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class GameSettingsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(GameSettings.BOARD_SIZE_PROP);
        System.clearProperty(GameSettings.SETUP_MODE_PROP);
        System.clearProperty(GameSettings.DIFFICULTY_PROP);
        System.clearProperty(GameSettings.SEED_PROP);
    }

    @Test
    void shouldUseDefaultsWhenNothingConfigured() {
        GameSettings settings = GameSettings.defaults();

        assertEquals(26, settings.getBoardSize());
        assertEquals(SetupMode.TWO_LINES, settings.getSetupMode());
        assertEquals(MinimaxAI.Difficulty.MEDIUM, settings.getDifficulty());
        assertNull(settings.getSeed());
    }

    @Test
    void shouldReadSystemProperties() {
        System.setProperty(GameSettings.BOARD_SIZE_PROP, "12");
        System.setProperty(GameSettings.SETUP_MODE_PROP, "three-lines");
        System.setProperty(GameSettings.DIFFICULTY_PROP, "hard");
        System.setProperty(GameSettings.SEED_PROP, " 42 ");

        GameSettings settings = GameSettings.load();

        assertEquals(12, settings.getBoardSize());
        assertEquals(SetupMode.THREE_LINES, settings.getSetupMode());
        assertEquals(MinimaxAI.Difficulty.HARD, settings.getDifficulty());
        assertEquals(Long.valueOf(42L), settings.getSeed());
    }

    @Test
    void shouldClampBoardSize() {
        System.setProperty(GameSettings.BOARD_SIZE_PROP, "500");
        assertEquals(99, GameSettings.load().getBoardSize());

        System.setProperty(GameSettings.BOARD_SIZE_PROP, "1");
        assertEquals(3, GameSettings.load().getBoardSize());
    }

    @Test
    void shouldFallBackOnUnparseableValues() {
        System.setProperty(GameSettings.BOARD_SIZE_PROP, "huge");
        System.setProperty(GameSettings.SETUP_MODE_PROP, "four-lines");
        System.setProperty(GameSettings.DIFFICULTY_PROP, "grandmaster");
        System.setProperty(GameSettings.SEED_PROP, "abc");

        GameSettings settings = GameSettings.load();

        assertEquals(GameSettings.DEFAULT_BOARD_SIZE, settings.getBoardSize());
        assertEquals(SetupMode.TWO_LINES, settings.getSetupMode());
        assertEquals(MinimaxAI.Difficulty.MEDIUM, settings.getDifficulty());
        assertNull(settings.getSeed());
    }

    @Test
    void shouldPreferPropertyOverDefault() {
        assertEquals("fallback", GameSettings.readSetting("grandchess.test.unset", "GRANDCHESS_TEST_UNSET", "fallback"));

        System.setProperty(GameSettings.SEED_PROP, "7");
        assertEquals("7", GameSettings.readSetting(GameSettings.SEED_PROP, "GRANDCHESS_TEST_UNSET", "fallback"));
    }

    @Test
    void shouldProduceRepeatableRandomForSeed() {
        GameSettings settings = new GameSettings(8, SetupMode.ONE_LINE, MinimaxAI.Difficulty.EASY, 99L);
        Random a = settings.newRandom();
        Random b = settings.newRandom();

        for (int i = 0; i < 5; i++) {
            assertEquals(a.nextInt(1000), b.nextInt(1000));
        }
    }
}
