package com.grandchess.controller;

import com.grandchess.ai.BuiltinChessEngine;
import com.grandchess.ai.ChessEngine;
import com.grandchess.ai.MinimaxAI;
import com.grandchess.codec.BoardTranscriptCodec;
import com.grandchess.codec.FenCodec;
import com.grandchess.codec.ImportResult;
import com.grandchess.config.GameSettings;
import com.grandchess.model.Board;
import com.grandchess.model.Move;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import com.grandchess.model.Position;
import com.grandchess.model.SetupManager;
import com.grandchess.model.SetupMode;
import com.grandchess.model.SetupResult;
import com.grandchess.model.Square;
import com.grandchess.rules.GameOutcome;
import com.grandchess.rules.MoveOutcome;
import com.grandchess.rules.PendingPromotion;
import com.grandchess.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * 游戏控制器 - 持有一局棋，分发事件，在后台线程执行 AI 回合
 * <p>
 * All state changes go through synchronized methods. While an AI turn is outstanding the controller refuses moves,
 * promotions and position changes; after the game is decided it refuses moves until a new game starts.
 */
public class GameController implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GameController.class);

    private final Position position;
    private final RuleEngine rules;
    private final ChessEngine engine;
    private final Random random;
    private final MinimaxAI.Difficulty defaultDifficulty;
    private final ExecutorService aiExecutor;
    private final List<GameListener> listeners = new CopyOnWriteArrayList<>();

    private boolean aiThinking;
    private Square checkedKing;

    /**
     * Controller for the configured board, laid out with the configured setup mode. AI turns without an explicit
     * difficulty use the configured one.
     *
     * @throws IllegalArgumentException when the configured board is too small for the configured setup mode
     */
    public GameController(GameSettings settings) {
        this(settings.getBoardSize(), new BuiltinChessEngine(settings.newRandom()), settings.newRandom(),
            settings.getDifficulty());
        newGame(settings.getSetupMode());
    }

    public GameController(int boardSize, ChessEngine engine, Random random) {
        this(boardSize, engine, random, MinimaxAI.Difficulty.MEDIUM);
    }

    public GameController(int boardSize, ChessEngine engine, Random random, MinimaxAI.Difficulty defaultDifficulty) {
        if (engine == null) {
            throw new IllegalArgumentException("engine is required");
        }
        this.position = new Position(boardSize);
        this.rules = new RuleEngine(position);
        this.engine = engine;
        this.random = random == null ? new Random() : random;
        this.defaultDifficulty = defaultDifficulty == null ? MinimaxAI.Difficulty.MEDIUM : defaultDifficulty;
        LOG.info("Engine {} ({}), default difficulty {}", engine.getEngineId(), engine.getEngineText(),
            this.defaultDifficulty.getDisplayName());
        this.aiExecutor = Executors.newSingleThreadExecutor(new ThreadFactory() {
            private int idx = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                Thread t = new Thread(r, "grandchess-ai-" + (++idx));
                t.setDaemon(true);
                return t;
            }
        });
    }

    public void addListener(GameListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(GameListener listener) {
        listeners.remove(listener);
    }

    /**
     * Copy of the live position.
     */
    public synchronized Position getPosition() {
        return new Position(position);
    }

    public synchronized PieceColor getSideToMove() {
        return position.getSideToMove();
    }

    public synchronized GameOutcome getGameOutcome() {
        return rules.getGameOutcome();
    }

    public synchronized boolean isGameOver() {
        return rules.getGameOutcome().isTerminal();
    }

    public synchronized boolean isAiThinking() {
        return aiThinking;
    }

    public synchronized boolean isAwaitingPromotion() {
        return rules.isAwaitingPromotion();
    }

    public MinimaxAI.Difficulty getDefaultDifficulty() {
        return defaultDifficulty;
    }

    public synchronized List<Square> getLegalMoves(Square square) {
        if (aiThinking || isGameOver()) {
            return new ArrayList<>();
        }
        return rules.getLegalMoves(square);
    }

    public synchronized MoveOutcome tryMove(Square from, Square to) {
        MoveOutcome blocked = checkAcceptingInput();
        if (blocked != null) {
            return blocked;
        }
        MoveOutcome outcome = rules.tryMakeMove(from, to);
        publish(outcome, from, to);
        return outcome;
    }

    public synchronized MoveOutcome completePromotion(PieceType type) {
        if (aiThinking) {
            return rejected("AI is thinking");
        }
        PendingPromotion pending = rules.getPendingPromotion();
        MoveOutcome outcome = rules.completePromotion(type);
        if (pending != null) {
            publish(outcome, pending.getFrom(), pending.getTo());
        }
        return outcome;
    }

    public synchronized SetupResult newGame(SetupMode mode) {
        return newGame(mode, position.getSize());
    }

    /**
     * Starts {@code mode} on a {@code size}x{@code size} board. CUSTOM validates whatever is on the board.
     *
     * @throws IllegalArgumentException when the size is out of range or too small for the layout
     * @throws IllegalStateException while an AI turn is outstanding
     */
    public synchronized SetupResult newGame(SetupMode mode, int size) {
        checkIdle();
        if (!Board.isValidSize(size)) {
            throw new IllegalArgumentException("board size must be between " + Board.MIN_SIZE + " and "
                + Board.MAX_SIZE + ", got " + size);
        }
        // 在副本上布局，成功后才替换当前棋局
        Position next = new Position(position);
        if (size != next.getSize()) {
            next.getBoard().resize(size);
        }
        SetupResult result = SetupManager.setup(next, mode, random);
        if (result.isSuccess()) {
            position.copyFrom(next);
            rules.positionReplaced();
            LOG.info("New game: {} on {}x{} ({})", mode.getDisplayName(), size, size, mode.getDescription());
            announcePosition();
        } else {
            LOG.info("Setup rejected: {}", result.getMessage());
        }
        return result;
    }

    /**
     * Starts a game from a hand-made layout. The live position is left alone when the layout is invalid.
     */
    public synchronized SetupResult startCustomGame(Board layout) {
        checkIdle();
        List<String> errors = SetupManager.validateCustom(layout);
        if (!errors.isEmpty()) {
            LOG.info("Custom layout rejected: {}", errors);
            return SetupResult.invalid(errors);
        }
        position.copyFrom(new Position(new Board(layout)));
        SetupResult result = rules.setupGame(SetupMode.CUSTOM, random);
        LOG.info("Custom game on {}x{}", layout.getSize(), layout.getSize());
        announcePosition();
        return result;
    }

    public synchronized ImportResult importFen(String fen) {
        checkIdle();
        ImportResult result = FenCodec.importInto(position, fen);
        if (result.isSuccess()) {
            rules.positionReplaced();
            LOG.info("Imported FEN on {}x{}", position.getSize(), position.getSize());
            announcePosition();
        } else {
            LOG.info("FEN import failed: {}", result.getMessage());
        }
        return result;
    }

    public synchronized String exportFen() {
        return FenCodec.encode(position);
    }

    public synchronized String exportTranscript() {
        return BoardTranscriptCodec.encode(position.getBoard());
    }

    /**
     * Replaces the pieces with a peer's board transcript and restarts the turn sequence with white to move.
     *
     * @return number of pieces placed
     */
    public synchronized int loadTranscript(String transcript, SetupMode mode) {
        checkIdle();
        int placed = BoardTranscriptCodec.decode(transcript, position.getBoard());
        SetupMode tag = mode == null ? SetupMode.CUSTOM : mode;
        position.setSetupMode(tag);
        position.setPawnFirstMoveDistance(tag.getPawnFirstMoveDistance());
        position.resetTurnState();
        rules.positionReplaced();
        LOG.info("Loaded {} pieces from transcript ({})", placed, tag.getDisplayName());
        announcePosition();
        return placed;
    }

    /**
     * Searches a snapshot of the current position on the AI worker. Nothing is played.
     */
    public CompletableFuture<Move> requestBestMove(PieceColor color, MinimaxAI.Difficulty difficulty) {
        Position snapshot = getPosition();
        return CompletableFuture.supplyAsync(() -> engine.findBestMove(snapshot, color, difficulty), aiExecutor);
    }

    public CompletableFuture<MoveOutcome> playAiTurn(PieceColor color) {
        return playAiTurn(color, defaultDifficulty);
    }

    /**
     * Lets the engine play one move for {@code color}. A promotion is completed with a queen. The future holds a
     * rejected outcome when it is not {@code color}'s turn, the game is over, or the engine found no move.
     */
    public CompletableFuture<MoveOutcome> playAiTurn(PieceColor color, MinimaxAI.Difficulty difficulty) {
        Position snapshot;
        synchronized (this) {
            MoveOutcome blocked = checkAcceptingInput();
            if (blocked == null && rules.isAwaitingPromotion()) {
                blocked = rejected("promotion pending");
            }
            if (blocked == null && position.getSideToMove() != color) {
                blocked = rejected("not " + color.getDisplayName() + "'s turn");
            }
            if (blocked != null) {
                return CompletableFuture.completedFuture(blocked);
            }
            aiThinking = true;
            snapshot = new Position(position);
        }
        LOG.debug("AI ({}, {}) thinking", color.getDisplayName(), difficulty);

        long start = System.currentTimeMillis();
        return CompletableFuture
            .supplyAsync(() -> engine.findBestMove(snapshot, color, difficulty), aiExecutor)
            .thenApply(move -> applyAiMove(move, System.currentTimeMillis() - start))
            .whenComplete((outcome, error) -> {
                if (error != null) {
                    LOG.error("AI turn failed", error);
                    finishThinking();
                }
            });
    }

    private synchronized MoveOutcome applyAiMove(Move move, long elapsedMs) {
        try {
            if (move == null) {
                return rejected("no legal move");
            }
            MoveOutcome outcome = rules.tryMakeMove(move.getFrom(), move.getTo());
            if (outcome.isPromotionPending()) {
                outcome = rules.completePromotion(PieceType.QUEEN);
            }
            LOG.info("AI played {} in {} ms", outcome.isSuccess() ? outcome.getNotation() : move, elapsedMs);
            publish(outcome, move.getFrom(), move.getTo());
            return outcome;
        } finally {
            aiThinking = false;
        }
    }

    private synchronized void finishThinking() {
        aiThinking = false;
    }

    private MoveOutcome checkAcceptingInput() {
        if (aiThinking) {
            return rejected("AI is thinking");
        }
        if (isGameOver()) {
            return rejected("game is over");
        }
        return null;
    }

    private void checkIdle() {
        if (aiThinking) {
            throw new IllegalStateException("AI search in progress");
        }
    }

    private MoveOutcome rejected(String reason) {
        return MoveOutcome.rejected(reason, position.getSideToMove(), rules.getGameOutcome());
    }

    private void publish(MoveOutcome outcome, Square from, Square to) {
        if (!outcome.isSuccess()) {
            return;
        }
        if (outcome.isPromotionPending()) {
            PieceColor mover = position.getSideToMove();
            for (GameListener l : listeners) {
                l.promotionRequested(outcome.getPromotionSquare(), mover);
            }
            return;
        }
        for (GameListener l : listeners) {
            l.moveExecuted(from, to, outcome.getNotation());
        }
        for (GameListener l : listeners) {
            l.turnChanged(outcome.getSideToMove());
        }
        updateCheckHighlight();
        if (outcome.isCheck()) {
            for (GameListener l : listeners) {
                l.check(outcome.getSideToMove());
            }
        }
        if (outcome.getGameOutcome().isTerminal()) {
            LOG.info("Game over: {}", outcome.getGameOutcome().getDisplayName());
            for (GameListener l : listeners) {
                l.gameOver(outcome.getGameOutcome());
            }
        }
    }

    private void announcePosition() {
        PieceColor side = position.getSideToMove();
        for (GameListener l : listeners) {
            l.turnChanged(side);
        }
        updateCheckHighlight();
        if (rules.getGameOutcome().isTerminal()) {
            for (GameListener l : listeners) {
                l.gameOver(rules.getGameOutcome());
            }
        }
    }

    // 只在被将军的王变化时通知
    private void updateCheckHighlight() {
        PieceColor side = position.getSideToMove();
        Square king = rules.isInCheck(side) ? position.getBoard().findKing(side) : null;
        boolean changed = king == null ? checkedKing != null : !king.equals(checkedKing);
        checkedKing = king;
        if (changed) {
            for (GameListener l : listeners) {
                l.kingInCheckChanged(king);
            }
        }
    }

    @Override
    public void close() {
        aiExecutor.shutdownNow();
        engine.close();
    }
}
