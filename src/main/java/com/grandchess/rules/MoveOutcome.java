package com.grandchess.rules;

import com.grandchess.model.PieceColor;
import com.grandchess.model.Square;

/**
 * Result of {@link RuleEngine#tryMakeMove} and {@link RuleEngine#completePromotion}.
 */
public final class MoveOutcome {
    private final boolean success;
    private final String reason;
    private final String notation;
    private final PieceColor sideToMove;
    private final boolean check;
    private final GameOutcome gameOutcome;
    private final Square promotionSquare;

    private MoveOutcome(boolean success, String reason, String notation, PieceColor sideToMove, boolean check,
                        GameOutcome gameOutcome, Square promotionSquare) {
        this.success = success;
        this.reason = reason == null ? "" : reason;
        this.notation = notation == null ? "" : notation;
        this.sideToMove = sideToMove;
        this.check = check;
        this.gameOutcome = gameOutcome;
        this.promotionSquare = promotionSquare;
    }

    public static MoveOutcome rejected(String reason, PieceColor sideToMove, GameOutcome gameOutcome) {
        return new MoveOutcome(false, reason, "", sideToMove, false, gameOutcome, null);
    }

    static MoveOutcome promotionPending(PieceColor sideToMove, Square promotionSquare) {
        return new MoveOutcome(true, "", "", sideToMove, false, GameOutcome.PLAYING, promotionSquare);
    }

    static MoveOutcome completed(String notation, PieceColor sideToMove, boolean check, GameOutcome gameOutcome) {
        return new MoveOutcome(true, "", notation, sideToMove, check, gameOutcome, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Notation of the finished move; empty for rejections and while a promotion is pending.
     */
    public String getNotation() {
        return notation;
    }

    public PieceColor getSideToMove() {
        return sideToMove;
    }

    /**
     * Whether the side to move is now in check.
     */
    public boolean isCheck() {
        return check;
    }

    public GameOutcome getGameOutcome() {
        return gameOutcome;
    }

    public boolean isPromotionPending() {
        return promotionSquare != null;
    }

    public Square getPromotionSquare() {
        return promotionSquare;
    }

    /**
     * True when the side switched, i.e. the move went through and nothing is left pending.
     */
    public boolean isTurnChanged() {
        return success && promotionSquare == null;
    }

    @Override
    public String toString() {
        if (!success) {
            return "rejected: " + reason;
        }
        if (isPromotionPending()) {
            return "promotion pending at " + promotionSquare;
        }
        return notation + " (" + gameOutcome.getDisplayName() + ")";
    }
}
