package com.grandchess.model;

/**
 * 局面类 - 棋盘加上行棋方、吃过路兵目标、半回合计数等状态
 */
public class Position {
    private final Board board;
    private PieceColor sideToMove;
    private Square enPassantTarget;
    private int halfMoveClock;
    private int moveCount;
    private SetupMode setupMode;
    private int pawnFirstMoveDistance;

    public Position(int boardSize) {
        this(new Board(boardSize));
    }

    public Position(Board board) {
        this.board = board;
        this.setupMode = SetupMode.CUSTOM;
        this.pawnFirstMoveDistance = SetupMode.CUSTOM.getPawnFirstMoveDistance();
        resetTurnState();
    }

    public Position(Position other) {
        this.board = new Board(other.board);
        copyStateFrom(other);
    }

    /**
     * Replaces this position's grid and state with a copy of {@code other}.
     */
    public void copyFrom(Position other) {
        board.resize(other.board.getSize());
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = other.board.getPiece(file, rank);
                if (piece != null) {
                    board.setPiece(file, rank, piece.copy());
                }
            }
        }
        copyStateFrom(other);
    }

    private void copyStateFrom(Position other) {
        this.sideToMove = other.sideToMove;
        this.enPassantTarget = other.enPassantTarget;
        this.halfMoveClock = other.halfMoveClock;
        this.moveCount = other.moveCount;
        this.setupMode = other.setupMode;
        this.pawnFirstMoveDistance = other.pawnFirstMoveDistance;
    }

    public void resetTurnState() {
        sideToMove = PieceColor.WHITE;
        enPassantTarget = null;
        halfMoveClock = 0;
        moveCount = 0;
    }

    public Board getBoard() {
        return board;
    }

    public int getSize() {
        return board.getSize();
    }

    public Piece getPiece(Square square) {
        return board.getPiece(square);
    }

    public PieceColor getSideToMove() {
        return sideToMove;
    }

    public void setSideToMove(PieceColor sideToMove) {
        this.sideToMove = sideToMove;
    }

    public boolean isWhiteToMove() {
        return sideToMove == PieceColor.WHITE;
    }

    public void switchSide() {
        sideToMove = sideToMove.opposite();
    }

    public Square getEnPassantTarget() {
        return enPassantTarget;
    }

    public void setEnPassantTarget(Square enPassantTarget) {
        this.enPassantTarget = enPassantTarget;
    }

    public int getHalfMoveClock() {
        return halfMoveClock;
    }

    public void setHalfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
    }

    /**
     * Plies played since the game started.
     */
    public int getMoveCount() {
        return moveCount;
    }

    public void setMoveCount(int moveCount) {
        this.moveCount = moveCount;
    }

    public SetupMode getSetupMode() {
        return setupMode;
    }

    public void setSetupMode(SetupMode setupMode) {
        this.setupMode = setupMode;
    }

    public int getPawnFirstMoveDistance() {
        return pawnFirstMoveDistance;
    }

    public void setPawnFirstMoveDistance(int pawnFirstMoveDistance) {
        if (pawnFirstMoveDistance < 1) {
            throw new IllegalArgumentException("pawn first move distance must be positive: " + pawnFirstMoveDistance);
        }
        this.pawnFirstMoveDistance = pawnFirstMoveDistance;
    }
}
