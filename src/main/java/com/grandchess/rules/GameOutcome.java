package com.grandchess.rules;

import com.grandchess.model.PieceColor;

public enum GameOutcome {
    PLAYING("Playing"),
    WHITE_WINS("White wins"),
    BLACK_WINS("Black wins"),
    STALEMATE("Stalemate"),
    DRAW_BY_CLOCK("Draw (100 half-moves without capture or pawn move)");

    private final String displayName;

    GameOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this != PLAYING;
    }

    public static GameOutcome winFor(PieceColor winner) {
        return winner == PieceColor.WHITE ? WHITE_WINS : BLACK_WINS;
    }

    /**
     * Winning color, or {@code null} for draws and unfinished games.
     */
    public PieceColor getWinner() {
        if (this == WHITE_WINS) {
            return PieceColor.WHITE;
        }
        if (this == BLACK_WINS) {
            return PieceColor.BLACK;
        }
        return null;
    }
}
