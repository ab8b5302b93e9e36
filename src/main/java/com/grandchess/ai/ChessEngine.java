package com.grandchess.ai;

import com.grandchess.model.Move;
import com.grandchess.model.PieceColor;
import com.grandchess.model.Position;

public interface ChessEngine {
    /**
     * Best move for {@code aiColor}, or {@code null} when it has no legal move. Must not modify {@code position}.
     */
    Move findBestMove(Position position, PieceColor aiColor, MinimaxAI.Difficulty difficulty);

    String getEngineId();

    String getEngineText();

    default void close() {
        // no-op
    }
}
