package com.grandchess.model;

/**
 * 开局布置模式
 */
public enum SetupMode {
    TWO_LINES("Two Lines", "Two ranks of major pieces. Slower development, more tactical.", 2, 3),
    ONE_LINE("One Line", "Randomized back rank: king between rooks, bishops on both square colors.", 2, 2),
    THREE_LINES("Three Lines", "Three ranks of major pieces. Dense, chaotic battles; pawns may advance three squares.", 3, 4),
    CUSTOM("Custom Setup", "Pieces placed by hand.", 2, 0);

    private final String displayName;
    private final String description;
    private final int pawnFirstMoveDistance;
    private final int ranksPerSide;

    SetupMode(String displayName, String description, int pawnFirstMoveDistance, int ranksPerSide) {
        this.displayName = displayName;
        this.description = description;
        this.pawnFirstMoveDistance = pawnFirstMoveDistance;
        this.ranksPerSide = ranksPerSide;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public int getPawnFirstMoveDistance() {
        return pawnFirstMoveDistance;
    }

    /**
     * Smallest board on which both armies fit without overlapping ranks.
     */
    public int getMinBoardSize() {
        if (this == ONE_LINE) {
            // king, two rooks and a bishop pair on the back rank
            return 5;
        }
        return Math.max(Board.MIN_SIZE, ranksPerSide * 2);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
