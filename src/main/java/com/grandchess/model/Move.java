package com.grandchess.model;

/**
 * 移动类 - 表示一次棋子移动
 */
public final class Move {
    private final Square from;
    private final Square to;

    public Move(Square from, Square to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("move squares are required");
        }
        this.from = from;
        this.to = to;
    }

    public Move(int fromFile, int fromRank, int toFile, int toRank) {
        this(new Square(fromFile, fromRank), new Square(toFile, toRank));
    }

    public Square getFrom() {
        return from;
    }

    public Square getTo() {
        return to;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Move move = (Move) obj;
        return from.equals(move.from) && to.equals(move.to);
    }

    @Override
    public int hashCode() {
        return from.hashCode() * 31 + to.hashCode();
    }

    @Override
    public String toString() {
        return from + "-" + to;
    }
}
