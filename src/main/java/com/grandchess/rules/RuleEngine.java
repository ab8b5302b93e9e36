package com.grandchess.rules;

import com.grandchess.model.Board;
import com.grandchess.model.Move;
import com.grandchess.model.MoveGenerator;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import com.grandchess.model.Position;
import com.grandchess.model.SetupManager;
import com.grandchess.model.SetupMode;
import com.grandchess.model.SetupResult;
import com.grandchess.model.Square;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 规则引擎 - 合法着法过滤、特殊着法执行与终局判定
 * <p>
 * Not thread safe: one owner drives a given instance.
 */
public class RuleEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    public static final int DRAW_HALF_MOVES = 100;

    private final Position position;
    private GameOutcome gameOutcome = GameOutcome.PLAYING;
    private PendingPromotion pendingPromotion;

    public RuleEngine(Position position) {
        if (position == null) {
            throw new IllegalArgumentException("position is required");
        }
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }

    public Board getBoard() {
        return position.getBoard();
    }

    public GameOutcome getGameOutcome() {
        return gameOutcome;
    }

    public boolean isAwaitingPromotion() {
        return pendingPromotion != null;
    }

    public PendingPromotion getPendingPromotion() {
        return pendingPromotion;
    }

    /**
     * Lays out a new game; see {@link SetupManager#setup}.
     */
    public SetupResult setupGame(SetupMode mode, Random random) {
        SetupResult result = SetupManager.setup(position, mode, random);
        if (result.isSuccess()) {
            pendingPromotion = null;
            gameOutcome = GameOutcome.PLAYING;
            LOG.debug("New {} game on {}x{}", mode, position.getSize(), position.getSize());
        }
        return result;
    }

    /**
     * Clears promotion and outcome bookkeeping after the position was replaced wholesale (import, remote sync),
     * then evaluates the loaded position for mate, stalemate or clock draw.
     */
    public void positionReplaced() {
        pendingPromotion = null;
        gameOutcome = GameOutcome.PLAYING;
        updateGameOutcome();
    }

    public List<Square> getLegalMoves(Square square) {
        if (pendingPromotion != null) {
            return new ArrayList<>();
        }
        return getLegalMoves(square, position.getSideToMove());
    }

    /**
     * Legal destinations for the piece on {@code square} if it belongs to {@code color}, whoever is to move.
     */
    public List<Square> getLegalMoves(Square square, PieceColor color) {
        List<Square> legal = new ArrayList<>();
        Board board = position.getBoard();
        Piece piece = board.getPiece(square);
        if (piece == null || piece.getColor() != color) {
            return legal;
        }

        for (Square to : MoveGenerator.pseudoLegalMoves(board, square, position.getPawnFirstMoveDistance())) {
            if (isMoveLegal(square, to)) {
                legal.add(to);
            }
        }

        Square ep = position.getEnPassantTarget();
        if (piece.getType() == PieceType.PAWN && ep != null
            && Math.abs(ep.getFile() - square.getFile()) == 1
            && ep.getRank() == square.getRank() + color.getPawnDirection()
            && isMoveLegal(square, ep)) {
            legal.add(ep);
        }
        return legal;
    }

    public List<Move> getAllLegalMoves(PieceColor color) {
        List<Move> moves = new ArrayList<>();
        Board board = position.getBoard();
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null || piece.getColor() != color) {
                    continue;
                }
                Square from = new Square(file, rank);
                for (Square to : getLegalMoves(from, color)) {
                    moves.add(new Move(from, to));
                }
            }
        }
        return moves;
    }

    public boolean hasAnyLegalMove(PieceColor color) {
        Board board = position.getBoard();
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece != null && piece.getColor() == color
                    && !getLegalMoves(new Square(file, rank), color).isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isInCheck(PieceColor color) {
        return MoveGenerator.isKingInCheck(position.getBoard(), color);
    }

    public boolean isCheckmate(PieceColor color) {
        return isInCheck(color) && !hasAnyLegalMove(color);
    }

    public boolean isStalemate(PieceColor color) {
        return !isInCheck(color) && !hasAnyLegalMove(color);
    }

    private boolean isMoveLegal(Square from, Square to) {
        Board board = position.getBoard();
        Piece piece = board.getPiece(from);
        Piece captured = board.getPiece(to);

        // 在实盘上试走，判定后无条件还原
        board.setPiece(to, piece);
        board.setPiece(from, null);
        Square epVictimSquare = null;
        Piece epVictim = null;
        if (isEnPassantCapture(piece, to)) {
            epVictimSquare = enPassantVictimSquare(piece, to);
            epVictim = board.getPiece(epVictimSquare);
            board.setPiece(epVictimSquare, null);
        }

        boolean legal = !MoveGenerator.isKingInCheck(board, piece.getColor());

        board.setPiece(from, piece);
        board.setPiece(to, captured);
        if (epVictimSquare != null) {
            board.setPiece(epVictimSquare, epVictim);
        }

        if (legal && isCastle(piece, from, to)) {
            int dir = Integer.signum(to.getFile() - from.getFile());
            Square passed = from.offset(dir, 0);
            if (isInCheck(piece.getColor()) || !isMoveLegal(from, passed)) {
                return false;
            }
        }
        return legal;
    }

    private boolean isEnPassantCapture(Piece piece, Square to) {
        return piece.getType() == PieceType.PAWN && to.equals(position.getEnPassantTarget());
    }

    private static Square enPassantVictimSquare(Piece pawn, Square to) {
        return to.offset(0, -pawn.getColor().getPawnDirection());
    }

    private static boolean isCastle(Piece piece, Square from, Square to) {
        return piece.getType() == PieceType.KING && from.getRank() == to.getRank()
            && Math.abs(to.getFile() - from.getFile()) == 2;
    }

    public MoveOutcome tryMakeMove(Square from, Square to) {
        if (pendingPromotion != null) {
            return reject("promotion pending at " + pendingPromotion.getTo());
        }
        if (from == null || to == null || !getLegalMoves(from).contains(to)) {
            return reject("illegal move " + from + "-" + to);
        }

        Board board = position.getBoard();
        Piece piece = board.getPiece(from);
        Piece captured = board.getPiece(to);

        if (isEnPassantCapture(piece, to)) {
            captured = board.removePiece(enPassantVictimSquare(piece, to));
        }

        boolean castle = isCastle(piece, from, to);
        if (castle) {
            int dir = Integer.signum(to.getFile() - from.getFile());
            Square rookFrom = MoveGenerator.findCastlingRook(board, from, dir);
            if (rookFrom != null) {
                board.movePiece(rookFrom, to.offset(-dir, 0));
            }
        }

        position.setEnPassantTarget(null);
        if (piece.getType() == PieceType.PAWN && Math.abs(to.getRank() - from.getRank()) >= 2) {
            position.setEnPassantTarget(to.offset(0, -piece.getColor().getPawnDirection()));
        }

        board.movePiece(from, to);

        if (piece.getType() == PieceType.PAWN && to.getRank() == board.lastRank(piece.getColor())) {
            pendingPromotion = new PendingPromotion(from, to, piece, captured);
            LOG.debug("Promotion pending at {}", to);
            return MoveOutcome.promotionPending(position.getSideToMove(), to);
        }

        position.setMoveCount(position.getMoveCount() + 1);
        if (captured != null || piece.getType() == PieceType.PAWN) {
            position.setHalfMoveClock(0);
        } else {
            position.setHalfMoveClock(position.getHalfMoveClock() + 1);
        }

        String notation = castle
            ? (to.getFile() > from.getFile() ? "O-O" : "O-O-O")
            : moveNotation(piece, from, to, captured != null);
        return finishTurn(notation + checkSuffix(piece.getColor().opposite()));
    }

    /**
     * Replaces the waiting pawn. KING, PAWN and {@code null} fall back to a queen.
     */
    public MoveOutcome completePromotion(PieceType type) {
        if (pendingPromotion == null) {
            return reject("no promotion pending");
        }
        PieceType chosen = type;
        if (chosen == null || chosen == PieceType.KING || chosen == PieceType.PAWN) {
            chosen = PieceType.QUEEN;
        }
        PendingPromotion pending = pendingPromotion;
        pendingPromotion = null;

        Piece pawn = pending.getPawn();
        position.getBoard().setPiece(pending.getTo(), new Piece(chosen, pawn.getColor(), true));
        position.setMoveCount(position.getMoveCount() + 1);
        position.setHalfMoveClock(0);

        StringBuilder sb = new StringBuilder();
        if (pending.isCapture()) {
            sb.append(Square.fileLabel(pending.getFrom().getFile())).append('x');
        }
        sb.append(pending.getTo().toNotation()).append('=').append(chosen.getNotationLetter());
        sb.append(checkSuffix(pawn.getColor().opposite()));
        return finishTurn(sb.toString());
    }

    private MoveOutcome finishTurn(String notation) {
        position.switchSide();
        updateGameOutcome();
        PieceColor side = position.getSideToMove();
        LOG.debug("{} played, {} to move", notation, side.getDisplayName());
        return MoveOutcome.completed(notation, side, isInCheck(side), gameOutcome);
    }

    private MoveOutcome reject(String reason) {
        return MoveOutcome.rejected(reason, position.getSideToMove(), gameOutcome);
    }

    private static String moveNotation(Piece piece, Square from, Square to, boolean capture) {
        StringBuilder sb = new StringBuilder(piece.getType().getNotationLetter());
        if (capture) {
            if (piece.getType() == PieceType.PAWN) {
                sb.append(Square.fileLabel(from.getFile()));
            }
            sb.append('x');
        }
        sb.append(to.toNotation());
        return sb.toString();
    }

    private String checkSuffix(PieceColor opponent) {
        if (!isInCheck(opponent)) {
            return "";
        }
        return hasAnyLegalMove(opponent) ? "+" : "#";
    }

    private void updateGameOutcome() {
        if (gameOutcome.isTerminal()) {
            return;
        }
        PieceColor side = position.getSideToMove();
        boolean inCheck = isInCheck(side);
        boolean canMove = hasAnyLegalMove(side);
        if (inCheck && !canMove) {
            gameOutcome = GameOutcome.winFor(side.opposite());
        } else if (!inCheck && !canMove) {
            gameOutcome = GameOutcome.STALEMATE;
        } else if (position.getHalfMoveClock() >= DRAW_HALF_MOVES) {
            gameOutcome = GameOutcome.DRAW_BY_CLOCK;
        }
        if (gameOutcome.isTerminal()) {
            LOG.info("Game over: {}", gameOutcome.getDisplayName());
        }
    }
}
