package com.grandchess.model;

/**
 * 棋子颜色枚举
 */
public enum PieceColor {
    WHITE("White", 1), BLACK("Black", -1);

    private final String displayName;
    private final int pawnDirection;

    PieceColor(String displayName, int pawnDirection) {
        this.displayName = displayName;
        this.pawnDirection = pawnDirection;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Rank delta of a forward pawn step: white moves towards higher ranks.
     */
    public int getPawnDirection() {
        return pawnDirection;
    }

    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
