package com.grandchess.tools;

import com.grandchess.ai.MinimaxAI;
import com.grandchess.model.PieceColor;
import com.grandchess.model.SetupMode;
import com.grandchess.rules.GameOutcome;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SelfPlayBenchmarkMainTest {

    @Test
    void shouldStopAtPlyCap() {
        EnumMap<MinimaxAI.Difficulty, MinimaxAI> pool = new EnumMap<>(MinimaxAI.Difficulty.class);
        EnumMap<MinimaxAI.Difficulty, SelfPlayBenchmarkMain.SearchStats> stats =
            new EnumMap<>(MinimaxAI.Difficulty.class);
        MinimaxAI easy = new MinimaxAI(new Random(3));
        easy.setDifficulty(MinimaxAI.Difficulty.EASY);
        pool.put(MinimaxAI.Difficulty.EASY, easy);
        stats.put(MinimaxAI.Difficulty.EASY, new SelfPlayBenchmarkMain.SearchStats());

        SelfPlayBenchmarkMain.GameRecord result = SelfPlayBenchmarkMain.runOneGame(pool, stats,
            MinimaxAI.Difficulty.EASY, MinimaxAI.Difficulty.EASY, 6, SetupMode.TWO_LINES, 6, 0, new Random(11));

        assertTrue(result.plies <= 6);
        assertNotNull(result.reason);
        SelfPlayBenchmarkMain.SearchStats easyStats = stats.get(MinimaxAI.Difficulty.EASY);
        assertTrue(easyStats.searches > 0);
        assertTrue(easyStats.avgRootMoves() > 0);
        if (result.outcome == GameOutcome.PLAYING) {
            assertEquals("ply-cap", result.reason);
            assertNull(result.winner());
        }
    }

    @Test
    void shouldReportMissingEngine() {
        EnumMap<MinimaxAI.Difficulty, MinimaxAI> pool = new EnumMap<>(MinimaxAI.Difficulty.class);
        EnumMap<MinimaxAI.Difficulty, SelfPlayBenchmarkMain.SearchStats> stats =
            new EnumMap<>(MinimaxAI.Difficulty.class);

        SelfPlayBenchmarkMain.GameRecord result = SelfPlayBenchmarkMain.runOneGame(pool, stats,
            MinimaxAI.Difficulty.HARD, MinimaxAI.Difficulty.HARD, 8, SetupMode.TWO_LINES, 10, 0, new Random(1));

        assertEquals("ai-missing", result.reason);
        assertEquals(GameOutcome.BLACK_WINS, result.outcome);
        assertEquals(PieceColor.BLACK, result.winner());
        assertEquals(0, result.plies);
    }

    @Test
    void shouldParseArguments() {
        String[] args = {"--size", "12", "--mode", "one-line", "--seed", "oops"};

        assertEquals(12, SelfPlayBenchmarkMain.intArg(args, "--size", 8));
        assertEquals(60, SelfPlayBenchmarkMain.intArg(args, "--maxPlies", 60));
        assertEquals("one-line", SelfPlayBenchmarkMain.argValue(args, "--MODE"));
        assertEquals(8, SelfPlayBenchmarkMain.intArg(args, "--seed", 8));
        assertNull(SelfPlayBenchmarkMain.argValue(null, "--size"));
    }
}
