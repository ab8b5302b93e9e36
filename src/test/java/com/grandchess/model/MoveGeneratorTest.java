package com.grandchess.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MoveGeneratorTest {

    private static void put(Board board, String square, PieceType type, PieceColor color) {
        board.setPiece(Square.parse(square), new Piece(type, color));
    }

    private static List<Square> movesFrom(Board board, String square, int pawnDistance) {
        return MoveGenerator.pseudoLegalMoves(board, Square.parse(square), pawnDistance);
    }

    @Test
    void shouldSlideRookAcrossEmptyBoard() {
        Board board = new Board(8);
        put(board, "d4", PieceType.ROOK, PieceColor.WHITE);

        assertEquals(14, movesFrom(board, "d4", 2).size());
    }

    @Test
    void shouldStopSlidersAtFirstPiece() {
        Board board = new Board(8);
        put(board, "a1", PieceType.ROOK, PieceColor.WHITE);
        put(board, "a3", PieceType.PAWN, PieceColor.WHITE);
        put(board, "c1", PieceType.KNIGHT, PieceColor.BLACK);

        List<Square> moves = movesFrom(board, "a1", 2);
        assertEquals(3, moves.size());
        assertTrue(moves.contains(Square.parse("a2")));
        assertTrue(moves.contains(Square.parse("b1")));
        assertTrue(moves.contains(Square.parse("c1")));
    }

    @Test
    void shouldReachFarSquaresOnLargeBoard() {
        Board board = new Board(40);
        put(board, "a1", PieceType.BISHOP, PieceColor.WHITE);

        List<Square> moves = movesFrom(board, "a1", 2);
        assertEquals(39, moves.size());
        assertTrue(moves.contains(new Square(39, 39)));
    }

    @Test
    void shouldLimitKnightInCorner() {
        Board board = new Board(8);
        put(board, "a1", PieceType.KNIGHT, PieceColor.WHITE);

        List<Square> moves = movesFrom(board, "a1", 2);
        assertEquals(2, moves.size());
        assertTrue(moves.contains(Square.parse("b3")));
        assertTrue(moves.contains(Square.parse("c2")));
    }

    @Test
    void shouldAdvanceUnmovedPawnUpToFirstMoveDistance() {
        Board board = new Board(8);
        put(board, "e2", PieceType.PAWN, PieceColor.WHITE);

        List<Square> moves = movesFrom(board, "e2", 3);
        assertEquals(3, moves.size());
        assertTrue(moves.contains(Square.parse("e5")));

        put(board, "e4", PieceType.KNIGHT, PieceColor.BLACK);
        moves = movesFrom(board, "e2", 3);
        assertEquals(1, moves.size());
        assertTrue(moves.contains(Square.parse("e3")));
    }

    @Test
    void shouldStepMovedPawnOnce() {
        Board board = new Board(8);
        board.setPiece(Square.parse("e3"), new Piece(PieceType.PAWN, PieceColor.WHITE, true));

        List<Square> moves = movesFrom(board, "e3", 2);
        assertEquals(1, moves.size());
        assertTrue(moves.contains(Square.parse("e4")));
    }

    @Test
    void shouldCapturePawnDiagonallyOnlyOntoEnemy() {
        Board board = new Board(8);
        put(board, "d5", PieceType.PAWN, PieceColor.BLACK);
        put(board, "c4", PieceType.ROOK, PieceColor.WHITE);
        put(board, "e4", PieceType.ROOK, PieceColor.BLACK);
        put(board, "d4", PieceType.ROOK, PieceColor.WHITE);

        List<Square> moves = movesFrom(board, "d5", 2);
        assertEquals(1, moves.size());
        assertTrue(moves.contains(Square.parse("c4")));
    }

    @Test
    void shouldOfferCastlingTowardsUnmovedRooks() {
        Board board = new Board(8);
        put(board, "e1", PieceType.KING, PieceColor.WHITE);
        put(board, "a1", PieceType.ROOK, PieceColor.WHITE);
        put(board, "h1", PieceType.ROOK, PieceColor.WHITE);

        List<Square> moves = movesFrom(board, "e1", 2);
        assertTrue(moves.contains(Square.parse("g1")));
        assertTrue(moves.contains(Square.parse("c1")));

        board.getPiece(Square.parse("h1")).setMoved(true);
        put(board, "b1", PieceType.KNIGHT, PieceColor.WHITE);
        moves = movesFrom(board, "e1", 2);
        assertFalse(moves.contains(Square.parse("g1")));
        assertFalse(moves.contains(Square.parse("c1")));
    }

    @Test
    void shouldRequireRookThreeFilesAwayForCastling() {
        Board board = new Board(8);
        put(board, "e1", PieceType.KING, PieceColor.WHITE);
        put(board, "f1", PieceType.ROOK, PieceColor.WHITE);

        assertNull(MoveGenerator.findCastlingRook(board, Square.parse("e1"), 1));
        assertFalse(movesFrom(board, "e1", 2).contains(Square.parse("g1")));

        board.clear();
        put(board, "e1", PieceType.KING, PieceColor.WHITE);
        put(board, "g1", PieceType.ROOK, PieceColor.WHITE);
        put(board, "c1", PieceType.ROOK, PieceColor.WHITE);

        assertNull(MoveGenerator.findCastlingRook(board, Square.parse("e1"), 1));
        assertNull(MoveGenerator.findCastlingRook(board, Square.parse("e1"), -1));
        List<Square> moves = movesFrom(board, "e1", 2);
        assertFalse(moves.contains(Square.parse("g1")));
        assertFalse(moves.contains(Square.parse("c1")));
    }

    @Test
    void shouldCastleAcrossWideBoards() {
        Board board = new Board(12);
        board.setPiece(6, 0, new Piece(PieceType.KING, PieceColor.WHITE));
        board.setPiece(11, 0, new Piece(PieceType.ROOK, PieceColor.WHITE));

        assertEquals(new Square(11, 0), MoveGenerator.findCastlingRook(board, new Square(6, 0), 1));
        assertTrue(MoveGenerator.pseudoLegalMoves(board, new Square(6, 0), 2).contains(new Square(8, 0)));
    }

    @Test
    void shouldDetectPawnAttacksInMovingDirection() {
        Board board = new Board(8);
        put(board, "e4", PieceType.PAWN, PieceColor.WHITE);
        put(board, "d5", PieceType.PAWN, PieceColor.BLACK);

        assertTrue(MoveGenerator.isSquareAttacked(board, Square.parse("f5"), PieceColor.WHITE));
        assertFalse(MoveGenerator.isSquareAttacked(board, Square.parse("e5"), PieceColor.WHITE));
        assertTrue(MoveGenerator.isSquareAttacked(board, Square.parse("c4"), PieceColor.BLACK));
        assertFalse(MoveGenerator.isSquareAttacked(board, Square.parse("d6"), PieceColor.BLACK));
    }

    @Test
    void shouldBlockSliderAttacks() {
        Board board = new Board(8);
        put(board, "e1", PieceType.KING, PieceColor.WHITE);
        put(board, "e8", PieceType.QUEEN, PieceColor.BLACK);
        assertTrue(MoveGenerator.isKingInCheck(board, PieceColor.WHITE));

        put(board, "e4", PieceType.KNIGHT, PieceColor.WHITE);
        assertFalse(MoveGenerator.isKingInCheck(board, PieceColor.WHITE));
    }

    @Test
    void shouldTreatMissingKingAsNotInCheck() {
        Board board = new Board(8);
        put(board, "e8", PieceType.QUEEN, PieceColor.BLACK);

        assertFalse(MoveGenerator.isKingInCheck(board, PieceColor.WHITE));
    }
}
