package com.grandchess.tools;

import com.grandchess.ai.MinimaxAI;
import com.grandchess.model.Move;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import com.grandchess.model.Position;
import com.grandchess.model.SetupMode;
import com.grandchess.rules.GameOutcome;
import com.grandchess.rules.MoveOutcome;
import com.grandchess.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * AI self-play benchmark:
 * - Average thinking time per difficulty
 * - Results across EASY/MEDIUM/HARD pairings on a chosen board size and layout
 * <p>
 * Usage: {@code --size 8 --mode TWO_LINES --gamesPerPair 1 --maxPlies 60 --openingJitter 2 --seed 1 --out report.md}
 */
public class SelfPlayBenchmarkMain {
    private static final Logger LOG = LoggerFactory.getLogger(SelfPlayBenchmarkMain.class);

    private static final MinimaxAI.Difficulty[] DIFFS = MinimaxAI.Difficulty.values();

    /**
     * Search cost of one difficulty: wall time and the number of legal root moves it had to consider.
     */
    static final class SearchStats {
        long searches;
        long rootMoves;
        long searchNanos;
        long slowestNanos;

        void record(int legalRootMoves, long nanos) {
            searches++;
            rootMoves += legalRootMoves;
            searchNanos += nanos;
            slowestNanos = Math.max(slowestNanos, nanos);
        }

        double avgMs() {
            return searches == 0 ? 0.0 : searchNanos / 1_000_000.0 / searches;
        }

        double slowestMs() {
            return slowestNanos / 1_000_000.0;
        }

        double avgRootMoves() {
            return searches == 0 ? 0.0 : rootMoves * 1.0 / searches;
        }
    }

    private static final class PairStats {
        int whiteWins;
        int blackWins;
        int draws;
        long totalPlies;

        void add(PieceColor winner, int plies) {
            totalPlies += plies;
            if (winner == PieceColor.WHITE) {
                whiteWins++;
            } else if (winner == PieceColor.BLACK) {
                blackWins++;
            } else {
                draws++;
            }
        }

        int games() {
            return whiteWins + blackWins + draws;
        }

        double avgPlies() {
            int g = games();
            return g == 0 ? 0.0 : totalPlies * 1.0 / g;
        }
    }

    /**
     * How one self-play game ended. {@code outcome} stays PLAYING when the ply cap stopped the game.
     */
    static final class GameRecord {
        final GameOutcome outcome;
        final int plies;
        final String reason;

        private GameRecord(GameOutcome outcome, int plies, String reason) {
            this.outcome = outcome;
            this.plies = plies;
            this.reason = reason;
        }

        static GameRecord finished(GameOutcome outcome, int plies) {
            return new GameRecord(outcome, plies, outcome.name().toLowerCase(Locale.ROOT));
        }

        static GameRecord forfeit(PieceColor loser, int plies, String reason) {
            return new GameRecord(GameOutcome.winFor(loser.opposite()), plies, reason);
        }

        PieceColor winner() {
            return outcome.getWinner();
        }

        static GameRecord capped(int plies) {
            return new GameRecord(GameOutcome.PLAYING, plies, "ply-cap");
        }
    }

    public static void main(String[] args) throws IOException {
        int size = intArg(args, "--size", 8);
        SetupMode mode = modeArg(args, "--mode", SetupMode.TWO_LINES);
        int gamesPerPair = intArg(args, "--gamesPerPair", 1);
        int maxPlies = intArg(args, "--maxPlies", 60);
        int openingJitter = intArg(args, "--openingJitter", 2);
        long seed = longArg(args, "--seed", 20260220L);
        String out = argValue(args, "--out");

        Random rng = new Random(seed);
        EnumMap<MinimaxAI.Difficulty, MinimaxAI> aiPool = new EnumMap<>(MinimaxAI.Difficulty.class);
        EnumMap<MinimaxAI.Difficulty, SearchStats> thinkStats = new EnumMap<>(MinimaxAI.Difficulty.class);
        EnumMap<MinimaxAI.Difficulty, EnumMap<MinimaxAI.Difficulty, PairStats>> pairStats =
            new EnumMap<>(MinimaxAI.Difficulty.class);
        for (MinimaxAI.Difficulty d : DIFFS) {
            MinimaxAI ai = new MinimaxAI(new Random(rng.nextLong()));
            ai.setDifficulty(d);
            aiPool.put(d, ai);
            thinkStats.put(d, new SearchStats());
            EnumMap<MinimaxAI.Difficulty, PairStats> row = new EnumMap<>(MinimaxAI.Difficulty.class);
            for (MinimaxAI.Difficulty black : DIFFS) {
                row.put(black, new PairStats());
            }
            pairStats.put(d, row);
        }

        int totalGames = DIFFS.length * DIFFS.length * gamesPerPair;
        int gameNo = 0;
        long benchStart = System.currentTimeMillis();
        for (MinimaxAI.Difficulty whiteDiff : DIFFS) {
            for (MinimaxAI.Difficulty blackDiff : DIFFS) {
                for (int i = 0; i < gamesPerPair; i++) {
                    gameNo++;
                    GameRecord r = runOneGame(aiPool, thinkStats, whiteDiff, blackDiff, size, mode, maxPlies,
                        openingJitter, rng);
                    pairStats.get(whiteDiff).get(blackDiff).add(r.winner(), r.plies);
                    LOG.info("[{}/{}] WHITE={} vs BLACK={} -> winner={}, plies={}, reason={}",
                        gameNo, totalGames, whiteDiff.name(), blackDiff.name(),
                        r.winner() == null ? "DRAW" : r.winner().name(), r.plies, r.reason);
                }
            }
        }

        long elapsedMs = System.currentTimeMillis() - benchStart;
        String report = renderReport(size, mode, gamesPerPair, maxPlies, seed, elapsedMs, thinkStats, pairStats);
        LOG.info("Benchmark completed in {} ms\n{}", elapsedMs, report);
        if (out != null) {
            Path path = Paths.get(out);
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, report.getBytes(StandardCharsets.UTF_8));
            LOG.info("Report: {}", path);
        }
    }

    static GameRecord runOneGame(
        EnumMap<MinimaxAI.Difficulty, MinimaxAI> aiPool,
        EnumMap<MinimaxAI.Difficulty, SearchStats> thinkStats,
        MinimaxAI.Difficulty whiteDiff,
        MinimaxAI.Difficulty blackDiff,
        int size,
        SetupMode mode,
        int maxPlies,
        int openingJitter,
        Random rng
    ) {
        Position position = new Position(size);
        RuleEngine rules = new RuleEngine(position);
        rules.setupGame(mode, rng);
        int jitterPlies = openingJitter <= 0 ? 0 : rng.nextInt(openingJitter + 1);
        applyOpeningJitter(rules, jitterPlies, rng);

        while (!rules.getGameOutcome().isTerminal() && position.getMoveCount() < maxPlies) {
            PieceColor turn = position.getSideToMove();
            MinimaxAI.Difficulty sideDiff = turn == PieceColor.WHITE ? whiteDiff : blackDiff;
            MinimaxAI ai = aiPool.get(sideDiff);
            if (ai == null) {
                return GameRecord.forfeit(turn, position.getMoveCount(), "ai-missing");
            }

            int legal = rules.getAllLegalMoves(turn).size();
            long t0 = System.nanoTime();
            Move move = ai.findBestMove(position, turn);
            thinkStats.get(sideDiff).record(legal, System.nanoTime() - t0);

            if (move == null) {
                return GameRecord.forfeit(turn, position.getMoveCount(), "no-legal-move");
            }
            play(rules, move);
        }

        GameOutcome outcome = rules.getGameOutcome();
        if (outcome.isTerminal()) {
            return GameRecord.finished(outcome, position.getMoveCount());
        }
        return GameRecord.capped(position.getMoveCount());
    }

    private static void play(RuleEngine rules, Move move) {
        MoveOutcome outcome = rules.tryMakeMove(move.getFrom(), move.getTo());
        if (outcome.isPromotionPending()) {
            rules.completePromotion(PieceType.QUEEN);
        } else if (!outcome.isSuccess()) {
            throw new IllegalStateException("engine produced an illegal move " + move + ": " + outcome.getReason());
        }
    }

    private static void applyOpeningJitter(RuleEngine rules, int jitterPlies, Random rng) {
        for (int i = 0; i < jitterPlies; i++) {
            if (rules.getGameOutcome().isTerminal()) {
                return;
            }
            List<Move> moves = rules.getAllLegalMoves(rules.getPosition().getSideToMove());
            if (moves.isEmpty()) {
                return;
            }
            play(rules, moves.get(rng.nextInt(moves.size())));
        }
    }

    private static String renderReport(
        int size,
        SetupMode mode,
        int gamesPerPair,
        int maxPlies,
        long seed,
        long elapsedMs,
        EnumMap<MinimaxAI.Difficulty, SearchStats> thinkStats,
        EnumMap<MinimaxAI.Difficulty, EnumMap<MinimaxAI.Difficulty, PairStats>> pairStats
    ) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("# Self-play benchmark\n\n");
        sb.append("- Time: ").append(LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")))
            .append('\n');
        sb.append("- Config: size=").append(size)
            .append(", mode=").append(mode.name())
            .append(" (").append(mode.getDescription()).append(')')
            .append(", gamesPerPair=").append(gamesPerPair)
            .append(", maxPlies=").append(maxPlies)
            .append(", seed=").append(seed).append('\n');
        sb.append("- Elapsed: ").append(String.format(Locale.ROOT, "%.2f", elapsedMs / 1000.0)).append("s\n\n");

        sb.append("## Search cost\n\n");
        sb.append("| Difficulty | Searches | Avg root moves | Avg (ms) | Slowest (ms) |\n");
        sb.append("|---|---:|---:|---:|---:|\n");
        for (MinimaxAI.Difficulty d : DIFFS) {
            SearchStats m = thinkStats.get(d);
            sb.append('|').append(d.getDisplayName())
                .append('|').append(m.searches)
                .append('|').append(String.format(Locale.ROOT, "%.1f", m.avgRootMoves()))
                .append('|').append(String.format(Locale.ROOT, "%.2f", m.avgMs()))
                .append('|').append(String.format(Locale.ROOT, "%.2f", m.slowestMs()))
                .append("|\n");
        }
        sb.append('\n');

        sb.append("## Pairings (white vs black)\n\n");
        sb.append("| White \\\\ Black |");
        for (MinimaxAI.Difficulty black : DIFFS) {
            sb.append(' ').append(black.getDisplayName()).append(" |");
        }
        sb.append("\n|---|---|---|---|\n");
        for (MinimaxAI.Difficulty white : DIFFS) {
            sb.append('|').append(white.getDisplayName());
            for (MinimaxAI.Difficulty black : DIFFS) {
                PairStats p = pairStats.get(white).get(black);
                sb.append('|').append(String.format(Locale.ROOT, "W%d/B%d/D%d, avgPly=%.1f",
                    p.whiteWins, p.blackWins, p.draws, p.avgPlies()));
            }
            sb.append("|\n");
        }
        sb.append("\nGames reaching `maxPlies` count as draws (reason=`ply-cap`).\n");
        return sb.toString();
    }

    private static SetupMode modeArg(String[] args, String key, SetupMode defaultValue) {
        String raw = argValue(args, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return SetupMode.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown setup mode '{}', using {}", raw, defaultValue.name());
            return defaultValue;
        }
    }

    static int intArg(String[] args, String key, int defaultValue) {
        String raw = argValue(args, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Bad value '{}' for {}, using {}", raw, key, defaultValue);
            return defaultValue;
        }
    }

    private static long longArg(String[] args, String key, long defaultValue) {
        String raw = argValue(args, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Bad value '{}' for {}, using {}", raw, key, defaultValue);
            return defaultValue;
        }
    }

    static String argValue(String[] args, String key) {
        if (args == null) {
            return null;
        }
        for (int i = 0; i < args.length - 1; i++) {
            if (key.equalsIgnoreCase(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }
}
