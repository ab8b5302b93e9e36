package com.grandchess.ai;

import com.grandchess.model.Board;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;

/**
 * 静态评估 - 子力价值加位置分，白方为正
 */
public final class Evaluator {
    private static final int KNIGHT_EDGE_PENALTY = 20;
    private static final int ROOK_SEVENTH_BONUS = 20;
    private static final int UNMOVED_QUEEN_PENALTY = 10;

    private Evaluator() {
    }

    /**
     * Score of {@code board} from {@code side}'s point of view.
     */
    public static int evaluate(Board board, PieceColor side) {
        int score = 0;
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null) {
                    continue;
                }
                int pieceScore = piece.getType().getValue() + positionalBonus(piece, file, rank, board.getSize());
                if (piece.isWhite()) {
                    score += pieceScore;
                } else {
                    score -= pieceScore;
                }
            }
        }
        return side == PieceColor.WHITE ? score : -score;
    }

    static int positionalBonus(Piece piece, int file, int rank, int size) {
        int center = size / 2;
        int fileDist = Math.abs(file - center);
        int centerDist = fileDist + Math.abs(rank - center);
        int bonus = 0;

        switch (piece.getType()) {
            case PAWN:
                int advancement = piece.isWhite() ? rank : size - 1 - rank;
                bonus += advancement * 5;
                bonus += (center - fileDist) * 2;
                break;
            case KNIGHT:
                bonus += (size - centerDist) * 3;
                if (file == 0 || file == size - 1 || rank == 0 || rank == size - 1) {
                    bonus -= KNIGHT_EDGE_PENALTY;
                }
                break;
            case BISHOP:
                bonus += (size - centerDist) * 2;
                break;
            case ROOK:
                int seventhRank = piece.isWhite() ? size - 2 : 1;
                if (rank == seventhRank) {
                    bonus += ROOK_SEVENTH_BONUS;
                }
                break;
            case QUEEN:
                if (!piece.hasMoved()) {
                    bonus -= UNMOVED_QUEEN_PENALTY;
                }
                bonus += size - centerDist;
                break;
            case KING:
                int homeRank = piece.isWhite() ? 0 : size - 1;
                bonus -= Math.abs(rank - homeRank) * 3;
                break;
        }
        return bonus;
    }
}
