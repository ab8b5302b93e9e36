package com.grandchess.ai;

import com.grandchess.model.Board;
import com.grandchess.model.Move;
import com.grandchess.model.MoveGenerator;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import com.grandchess.model.Position;
import com.grandchess.model.Square;
import com.grandchess.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 国际象棋AI - 定深 Negamax + Alpha-Beta + MVV-LVA 排序
 * <p>
 * Every explored node works on its own board copy, so the caller's position is never touched and the search can
 * run on any thread.
 */
public class MinimaxAI {
    private static final Logger LOG = LoggerFactory.getLogger(MinimaxAI.class);

    static final int MATE_SCORE = 10_000_000;
    private static final int INF = Integer.MAX_VALUE / 2;

    public enum Difficulty {
        EASY("Easy", 1, 0.30),
        MEDIUM("Medium", 2, 0.0),
        HARD("Hard", 3, 0.0);

        private final String displayName;
        private final int maxDepth;
        private final double randomPickChance;

        Difficulty(String displayName, int maxDepth, double randomPickChance) {
            this.displayName = displayName;
            this.maxDepth = maxDepth;
            this.randomPickChance = randomPickChance;
        }

        public String getDisplayName() {
            return displayName;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public double getRandomPickChance() {
            return randomPickChance;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    private final Random random;
    private Difficulty difficulty = Difficulty.MEDIUM;
    private long nodes;

    public MinimaxAI() {
        this(new Random());
    }

    public MinimaxAI(Random random) {
        this.random = random == null ? new Random() : random;
    }

    public void setDifficulty(Difficulty difficulty) {
        if (difficulty != null) {
            this.difficulty = difficulty;
        }
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    public Move findBestMove(Position position, PieceColor aiColor) {
        List<Move> rootMoves = rootMoves(position, aiColor);
        if (rootMoves.isEmpty()) {
            return null;
        }
        if (difficulty.getRandomPickChance() > 0 && random.nextDouble() < difficulty.getRandomPickChance()) {
            Move pick = rootMoves.get(random.nextInt(rootMoves.size()));
            LOG.debug("{} random pick {}", difficulty, pick);
            return pick;
        }
        return searchRoot(position, aiColor, rootMoves, difficulty.getMaxDepth());
    }

    /**
     * Fixed-depth search with no random shortcut.
     */
    public Move searchBestMove(Position position, PieceColor aiColor, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        List<Move> rootMoves = rootMoves(position, aiColor);
        if (rootMoves.isEmpty()) {
            return null;
        }
        return searchRoot(position, aiColor, rootMoves, depth);
    }

    private static List<Move> rootMoves(Position position, PieceColor aiColor) {
        // 根节点走完整规则：易位、吃过路兵、自将检查
        RuleEngine rules = new RuleEngine(new Position(position));
        return rules.getAllLegalMoves(aiColor);
    }

    private Move searchRoot(Position position, PieceColor aiColor, List<Move> rootMoves, int depth) {
        long start = System.currentTimeMillis();
        nodes = 0;
        Board root = position.getBoard();
        int pawnDistance = position.getPawnFirstMoveDistance();
        orderMoves(rootMoves, root);

        int bestScore = -INF;
        List<Move> best = new ArrayList<>();
        for (Move move : rootMoves) {
            Board next = new Board(root);
            applyMove(next, move, position.getEnPassantTarget());
            int score = -negamax(next, aiColor.opposite(), depth - 1, -INF, INF, pawnDistance);
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(move);
            } else if (score == bestScore) {
                best.add(move);
            }
        }
        Move chosen = best.get(random.nextInt(best.size()));
        LOG.debug("depth {} picked {} score {} ({} ties, {} nodes, {} ms)", depth, chosen, bestScore,
            best.size(), nodes, System.currentTimeMillis() - start);
        return chosen;
    }

    private int negamax(Board board, PieceColor side, int depth, int alpha, int beta, int pawnDistance) {
        nodes++;
        List<Move> moves = generateMoves(board, side, pawnDistance);
        if (moves.isEmpty()) {
            return MoveGenerator.isKingInCheck(board, side) ? -(MATE_SCORE + depth) : 0;
        }
        if (depth <= 0) {
            return Evaluator.evaluate(board, side);
        }
        orderMoves(moves, board);

        int bestScore = -INF;
        for (Move move : moves) {
            Board next = new Board(board);
            applyMove(next, move, null);
            int score = -negamax(next, side.opposite(), depth - 1, -beta, -alpha, pawnDistance);
            if (score > bestScore) {
                bestScore = score;
            }
            if (score > alpha) {
                alpha = score;
            }
            if (alpha >= beta) {
                break;
            }
        }
        return bestScore;
    }

    /**
     * Pseudo-legal moves of {@code side} that do not leave its king attacked. Tried by make/undo on the node's
     * own board.
     */
    static List<Move> generateMoves(Board board, PieceColor side, int pawnDistance) {
        List<Move> moves = new ArrayList<>();
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null || piece.getColor() != side) {
                    continue;
                }
                Square from = new Square(file, rank);
                for (Square to : MoveGenerator.pseudoLegalMoves(board, from, pawnDistance)) {
                    Piece captured = board.getPiece(to);
                    board.setPiece(to, piece);
                    board.setPiece(from, null);
                    boolean safe = !MoveGenerator.isKingInCheck(board, side);
                    board.setPiece(from, piece);
                    board.setPiece(to, captured);
                    if (safe) {
                        moves.add(new Move(from, to));
                    }
                }
            }
        }
        return moves;
    }

    /**
     * Plays {@code move} on {@code board}: castling brings the rook over, en passant removes the passed pawn and
     * a pawn on its last rank becomes a queen.
     */
    static void applyMove(Board board, Move move, Square enPassantTarget) {
        Square from = move.getFrom();
        Square to = move.getTo();
        Piece piece = board.getPiece(from);
        if (piece == null) {
            return;
        }
        PieceColor color = piece.getColor();

        if (piece.getType() == PieceType.PAWN && to.equals(enPassantTarget) && board.getPiece(to) == null) {
            board.removePiece(to.offset(0, -color.getPawnDirection()));
        }
        if (piece.getType() == PieceType.KING && Math.abs(to.getFile() - from.getFile()) == 2) {
            int dir = Integer.signum(to.getFile() - from.getFile());
            Square rook = MoveGenerator.findCastlingRook(board, from, dir);
            if (rook != null) {
                board.movePiece(rook, to.offset(-dir, 0));
            }
        }
        board.movePiece(from, to);
        if (piece.getType() == PieceType.PAWN && to.getRank() == board.lastRank(color)) {
            board.setPiece(to, new Piece(PieceType.QUEEN, color, true));
        }
    }

    private static void orderMoves(List<Move> moves, Board board) {
        List<MoveOrder> scored = new ArrayList<>(moves.size());
        int center = board.getSize() / 2;
        for (Move move : moves) {
            int score = 0;
            Piece captured = board.getPiece(move.getTo());
            Piece attacker = board.getPiece(move.getFrom());
            if (captured != null && attacker != null) {
                score += captured.getType().getValue() * 10 - attacker.getType().getValue();
            }
            score -= Math.abs(move.getTo().getFile() - center) + Math.abs(move.getTo().getRank() - center);
            scored.add(new MoveOrder(move, score));
        }
        scored.sort((a, b) -> Integer.compare(b.score, a.score));
        moves.clear();
        for (MoveOrder moveOrder : scored) {
            moves.add(moveOrder.move);
        }
    }

    private static final class MoveOrder {
        private final Move move;
        private final int score;

        private MoveOrder(Move move, int score) {
            this.move = move;
            this.score = score;
        }
    }
}
