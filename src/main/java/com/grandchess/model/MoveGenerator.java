package com.grandchess.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 走法生成 - 各棋子的几何走法（不考虑己方王是否被将军）
 */
public final class MoveGenerator {
    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final int[][] DIAGONAL = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    private static final int[][] ALL_DIRECTIONS = {
        {-1, -1}, {-1, 0}, {-1, 1}, {0, -1}, {0, 1}, {1, -1}, {1, 0}, {1, 1}
    };
    private static final int[][] KNIGHT_OFFSETS = {
        {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2}, {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };

    private MoveGenerator() {
    }

    /**
     * Destinations reachable by geometry and occupancy alone. Empty when {@code from} is empty.
     */
    public static List<Square> pseudoLegalMoves(Board board, Square from, int pawnFirstMoveDistance) {
        Piece piece = board.getPiece(from);
        List<Square> moves = new ArrayList<>();
        if (piece == null) {
            return moves;
        }
        switch (piece.getType()) {
            case QUEEN:
                addSlides(board, from, piece, ALL_DIRECTIONS, moves);
                break;
            case ROOK:
                addSlides(board, from, piece, ORTHOGONAL, moves);
                break;
            case BISHOP:
                addSlides(board, from, piece, DIAGONAL, moves);
                break;
            case KNIGHT:
                addSteps(board, from, piece, KNIGHT_OFFSETS, moves);
                break;
            case KING:
                addSteps(board, from, piece, ALL_DIRECTIONS, moves);
                addCastlingCandidates(board, from, piece, moves);
                break;
            case PAWN:
                addPawnMoves(board, from, piece, pawnFirstMoveDistance, moves);
                break;
        }
        return moves;
    }

    private static void addSlides(Board board, Square from, Piece piece, int[][] directions, List<Square> moves) {
        for (int[] d : directions) {
            int file = from.getFile() + d[0];
            int rank = from.getRank() + d[1];
            while (board.isOnBoard(file, rank)) {
                Piece target = board.getPiece(file, rank);
                if (target == null) {
                    moves.add(new Square(file, rank));
                } else {
                    if (target.getColor() != piece.getColor()) {
                        moves.add(new Square(file, rank));
                    }
                    break;
                }
                file += d[0];
                rank += d[1];
            }
        }
    }

    private static void addSteps(Board board, Square from, Piece piece, int[][] offsets, List<Square> moves) {
        for (int[] d : offsets) {
            int file = from.getFile() + d[0];
            int rank = from.getRank() + d[1];
            if (!board.isOnBoard(file, rank)) {
                continue;
            }
            Piece target = board.getPiece(file, rank);
            if (target == null || target.getColor() != piece.getColor()) {
                moves.add(new Square(file, rank));
            }
        }
    }

    private static void addPawnMoves(Board board, Square from, Piece pawn, int firstMoveDistance, List<Square> moves) {
        int dir = pawn.getColor().getPawnDirection();
        int file = from.getFile();
        int nextRank = from.getRank() + dir;

        if (board.isOnBoard(file, nextRank) && board.getPiece(file, nextRank) == null) {
            moves.add(new Square(file, nextRank));
            if (!pawn.hasMoved()) {
                for (int step = 2; step <= firstMoveDistance; step++) {
                    int rank = from.getRank() + dir * step;
                    if (!board.isOnBoard(file, rank) || board.getPiece(file, rank) != null) {
                        break;
                    }
                    moves.add(new Square(file, rank));
                }
            }
        }

        for (int df = -1; df <= 1; df += 2) {
            Piece target = board.getPiece(file + df, nextRank);
            if (target != null && target.getColor() != pawn.getColor()) {
                moves.add(new Square(file + df, nextRank));
            }
        }
    }

    private static void addCastlingCandidates(Board board, Square from, Piece king, List<Square> moves) {
        if (king.hasMoved()) {
            return;
        }
        for (int dir = -1; dir <= 1; dir += 2) {
            if (findCastlingRook(board, from, dir) != null) {
                moves.add(new Square(from.getFile() + 2 * dir, from.getRank()));
            }
        }
    }

    /**
     * First piece along the king's rank in direction {@code dir} (+1 towards higher files), if it is an unmoved
     * rook of the king's color standing at least three files away, so the king's landing square is empty. Everything
     * between is empty by construction.
     */
    public static Square findCastlingRook(Board board, Square kingSquare, int dir) {
        Piece king = board.getPiece(kingSquare);
        if (king == null || king.getType() != PieceType.KING) {
            return null;
        }
        int rank = kingSquare.getRank();
        for (int file = kingSquare.getFile() + dir; board.isOnBoard(file, rank); file += dir) {
            Piece piece = board.getPiece(file, rank);
            if (piece == null) {
                continue;
            }
            boolean rookReady = piece.is(PieceType.ROOK, king.getColor()) && !piece.hasMoved();
            if (rookReady && Math.abs(file - kingSquare.getFile()) >= 3) {
                return new Square(file, rank);
            }
            return null;
        }
        return null;
    }

    /**
     * Whether any piece of {@code byColor} has a pseudo-legal move onto {@code target}. Pawn pushes and castling
     * destinations never land on occupied squares, so only capturing geometry is tested.
     */
    public static boolean isSquareAttacked(Board board, Square target, PieceColor byColor) {
        int tf = target.getFile();
        int tr = target.getRank();

        for (int[] d : KNIGHT_OFFSETS) {
            Piece p = board.getPiece(tf + d[0], tr + d[1]);
            if (p != null && p.is(PieceType.KNIGHT, byColor)) {
                return true;
            }
        }
        for (int[] d : ALL_DIRECTIONS) {
            Piece p = board.getPiece(tf + d[0], tr + d[1]);
            if (p != null && p.is(PieceType.KING, byColor)) {
                return true;
            }
        }
        // 兵从反方向斜线攻击
        int pawnRank = tr - byColor.getPawnDirection();
        for (int df = -1; df <= 1; df += 2) {
            Piece p = board.getPiece(tf + df, pawnRank);
            if (p != null && p.is(PieceType.PAWN, byColor)) {
                return true;
            }
        }
        if (attackedAlong(board, tf, tr, ORTHOGONAL, PieceType.ROOK, byColor)) {
            return true;
        }
        return attackedAlong(board, tf, tr, DIAGONAL, PieceType.BISHOP, byColor);
    }

    private static boolean attackedAlong(Board board, int tf, int tr, int[][] directions, PieceType slider, PieceColor byColor) {
        for (int[] d : directions) {
            int file = tf + d[0];
            int rank = tr + d[1];
            while (board.isOnBoard(file, rank)) {
                Piece p = board.getPiece(file, rank);
                if (p != null) {
                    if (p.getColor() == byColor && (p.getType() == slider || p.getType() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                file += d[0];
                rank += d[1];
            }
        }
        return false;
    }

    /**
     * A missing king counts as not in check.
     */
    public static boolean isKingInCheck(Board board, PieceColor color) {
        Square king = board.findKing(color);
        if (king == null) {
            return false;
        }
        return isSquareAttacked(board, king, color.opposite());
    }
}
