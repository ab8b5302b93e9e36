package com.grandchess.ai;

import com.grandchess.model.Board;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluatorTest {

    @Test
    void shouldScoreFromRequestedSide() {
        Board board = new Board(8);
        board.setPiece(4, 0, new Piece(PieceType.KING, PieceColor.WHITE));
        board.setPiece(4, 7, new Piece(PieceType.KING, PieceColor.BLACK));
        assertEquals(0, Evaluator.evaluate(board, PieceColor.WHITE));

        board.setPiece(3, 3, new Piece(PieceType.QUEEN, PieceColor.WHITE, true));
        int white = Evaluator.evaluate(board, PieceColor.WHITE);
        assertTrue(white > 900);
        assertEquals(-white, Evaluator.evaluate(board, PieceColor.BLACK));
    }

    @Test
    void shouldPreferCentralKnights() {
        Piece knight = new Piece(PieceType.KNIGHT, PieceColor.WHITE);

        assertEquals(24, Evaluator.positionalBonus(knight, 4, 4, 8));
        assertEquals(-11, Evaluator.positionalBonus(knight, 0, 3, 8));
    }

    @Test
    void shouldRewardAdvancedPawns() {
        assertEquals(38, Evaluator.positionalBonus(new Piece(PieceType.PAWN, PieceColor.WHITE), 4, 6, 8));
        assertEquals(38, Evaluator.positionalBonus(new Piece(PieceType.PAWN, PieceColor.BLACK), 4, 1, 8));
    }

    @Test
    void shouldRewardRookOnSeventh() {
        assertEquals(20, Evaluator.positionalBonus(new Piece(PieceType.ROOK, PieceColor.WHITE), 0, 6, 8));
        assertEquals(0, Evaluator.positionalBonus(new Piece(PieceType.ROOK, PieceColor.WHITE), 0, 5, 8));
        assertEquals(20, Evaluator.positionalBonus(new Piece(PieceType.ROOK, PieceColor.BLACK), 0, 1, 8));
    }

    @Test
    void shouldNudgeQueenAndKing() {
        assertEquals(-2, Evaluator.positionalBonus(new Piece(PieceType.QUEEN, PieceColor.WHITE), 4, 4, 8));
        assertEquals(8, Evaluator.positionalBonus(new Piece(PieceType.QUEEN, PieceColor.WHITE, true), 4, 4, 8));
        assertEquals(-6, Evaluator.positionalBonus(new Piece(PieceType.KING, PieceColor.WHITE), 4, 2, 8));
    }
}
