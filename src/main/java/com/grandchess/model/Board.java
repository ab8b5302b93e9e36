package com.grandchess.model;

/**
 * 棋盘类 - 正方形棋盘上的棋子网格
 * <p>
 * Cells are indexed {@code [file][rank]}, rank 0 being white's back rank.
 */
public class Board {
    public static final int MIN_SIZE = 3;
    public static final int MAX_SIZE = 99;
    public static final int STANDARD_SIZE = 8;

    private int size;
    private Piece[][] cells;

    public Board(int size) {
        checkSize(size);
        this.size = size;
        this.cells = new Piece[size][size];
    }

    public Board(Board other) {
        this.size = other.size;
        this.cells = new Piece[size][size];
        for (int file = 0; file < size; file++) {
            for (int rank = 0; rank < size; rank++) {
                Piece piece = other.cells[file][rank];
                if (piece != null) {
                    this.cells[file][rank] = piece.copy();
                }
            }
        }
    }

    public static boolean isValidSize(int size) {
        return size >= MIN_SIZE && size <= MAX_SIZE;
    }

    private static void checkSize(int size) {
        if (!isValidSize(size)) {
            throw new IllegalArgumentException("board size must be between " + MIN_SIZE + " and " + MAX_SIZE + ": " + size);
        }
    }

    public int getSize() {
        return size;
    }

    public boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < size && rank >= 0 && rank < size;
    }

    public boolean isOnBoard(Square square) {
        return square != null && isOnBoard(square.getFile(), square.getRank());
    }

    public Piece getPiece(int file, int rank) {
        if (!isOnBoard(file, rank)) {
            return null;
        }
        return cells[file][rank];
    }

    public Piece getPiece(Square square) {
        return square == null ? null : getPiece(square.getFile(), square.getRank());
    }

    public void setPiece(Square square, Piece piece) {
        setPiece(square.getFile(), square.getRank(), piece);
    }

    public void setPiece(int file, int rank, Piece piece) {
        if (!isOnBoard(file, rank)) {
            throw new IllegalArgumentException("square off board: (" + file + "," + rank + ") on size " + size);
        }
        cells[file][rank] = piece;
    }

    public Piece removePiece(Square square) {
        Piece piece = getPiece(square);
        if (piece != null) {
            cells[square.getFile()][square.getRank()] = null;
        }
        return piece;
    }

    /**
     * Moves whatever stands on {@code from} to {@code to}, replacing any occupant, and marks it as moved.
     */
    public Piece movePiece(Square from, Square to) {
        Piece piece = getPiece(from);
        if (piece == null) {
            return null;
        }
        Piece captured = getPiece(to);
        cells[from.getFile()][from.getRank()] = null;
        cells[to.getFile()][to.getRank()] = piece;
        piece.setMoved(true);
        return captured;
    }

    public void clear() {
        cells = new Piece[size][size];
    }

    /**
     * Changes the board size; the grid is emptied.
     */
    public void resize(int newSize) {
        checkSize(newSize);
        size = newSize;
        cells = new Piece[size][size];
    }

    public Square findKing(PieceColor color) {
        for (int file = 0; file < size; file++) {
            for (int rank = 0; rank < size; rank++) {
                Piece piece = cells[file][rank];
                if (piece != null && piece.is(PieceType.KING, color)) {
                    return new Square(file, rank);
                }
            }
        }
        return null;
    }

    public int countPieces(PieceType type, PieceColor color) {
        int count = 0;
        for (int file = 0; file < size; file++) {
            for (int rank = 0; rank < size; rank++) {
                Piece piece = cells[file][rank];
                if (piece != null && piece.is(type, color)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Promotion rank of the given color's pawns.
     */
    public int lastRank(PieceColor color) {
        return color == PieceColor.WHITE ? size - 1 : 0;
    }

    public int homeRank(PieceColor color) {
        return color == PieceColor.WHITE ? 0 : size - 1;
    }
}
