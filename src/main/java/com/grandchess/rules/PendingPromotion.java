package com.grandchess.rules;

import com.grandchess.model.Piece;
import com.grandchess.model.Square;

/**
 * A pawn that has reached its last rank and is waiting for the promotion piece.
 */
public final class PendingPromotion {
    private final Square from;
    private final Square to;
    private final Piece pawn;
    private final Piece captured;

    PendingPromotion(Square from, Square to, Piece pawn, Piece captured) {
        this.from = from;
        this.to = to;
        this.pawn = pawn;
        this.captured = captured;
    }

    public Square getFrom() {
        return from;
    }

    public Square getTo() {
        return to;
    }

    public Piece getPawn() {
        return pawn;
    }

    public boolean isCapture() {
        return captured != null;
    }
}
