package com.grandchess.controller;

import com.grandchess.model.PieceColor;
import com.grandchess.model.Square;
import com.grandchess.rules.GameOutcome;

/**
 * Observer of a {@link GameController}. Callbacks run on the thread that changed the game, which is the AI worker
 * for computer moves.
 */
public interface GameListener {
    default void turnChanged(PieceColor sideToMove) {
    }

    default void check(PieceColor colorInCheck) {
    }

    default void moveExecuted(Square from, Square to, String notation) {
    }

    default void promotionRequested(Square square, PieceColor color) {
    }

    default void gameOver(GameOutcome outcome) {
    }

    /**
     * Square of the king now in check, or {@code null} when no king is.
     */
    default void kingInCheckChanged(Square kingSquare) {
    }
}
