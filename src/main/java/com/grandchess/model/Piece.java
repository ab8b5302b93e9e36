package com.grandchess.model;

/**
 * 棋子类 - 表示棋盘上的单个棋子
 * <p>
 * A piece does not know its square; the {@link Board} cell that holds it is the only record of where it stands.
 */
public class Piece {
    private final PieceType type;
    private final PieceColor color;
    private boolean moved;

    public Piece(PieceType type, PieceColor color) {
        this(type, color, false);
    }

    public Piece(PieceType type, PieceColor color, boolean moved) {
        if (type == null || color == null) {
            throw new IllegalArgumentException("piece type and color are required");
        }
        this.type = type;
        this.color = color;
        this.moved = moved;
    }

    public PieceType getType() {
        return type;
    }

    public PieceColor getColor() {
        return color;
    }

    public boolean isWhite() {
        return color == PieceColor.WHITE;
    }

    public boolean hasMoved() {
        return moved;
    }

    public void setMoved(boolean moved) {
        this.moved = moved;
    }

    public boolean is(PieceType type, PieceColor color) {
        return this.type == type && this.color == color;
    }

    public char toFenChar() {
        char c = type.getFenChar();
        return isWhite() ? Character.toUpperCase(c) : c;
    }

    public Piece copy() {
        return new Piece(type, color, moved);
    }

    @Override
    public String toString() {
        return color.getDisplayName() + " " + type.name().toLowerCase();
    }
}
