package com.grandchess.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SetupManagerTest {

    private static int countColor(Board board, PieceColor color) {
        int n = 0;
        for (PieceType type : PieceType.values()) {
            n += board.countPieces(type, color);
        }
        return n;
    }

    @Test
    void shouldLayOutTwoLinesWithKingsFacing() {
        Position position = new Position(8);
        SetupResult result = SetupManager.setup(position, SetupMode.TWO_LINES, new Random(1));
        Board board = position.getBoard();

        assertTrue(result.isSuccess());
        assertEquals(1, board.countPieces(PieceType.KING, PieceColor.WHITE));
        assertEquals(1, board.countPieces(PieceType.KING, PieceColor.BLACK));
        assertEquals(new Square(4, 0), board.findKing(PieceColor.WHITE));
        assertEquals(new Square(4, 7), board.findKing(PieceColor.BLACK));
        assertEquals(24, countColor(board, PieceColor.WHITE));
        for (int file = 0; file < 8; file++) {
            assertTrue(board.getPiece(file, 2).is(PieceType.PAWN, PieceColor.WHITE));
            assertTrue(board.getPiece(file, 5).is(PieceType.PAWN, PieceColor.BLACK));
        }
        assertEquals(SetupMode.TWO_LINES, position.getSetupMode());
        assertEquals(2, position.getPawnFirstMoveDistance());
        assertEquals(PieceColor.WHITE, position.getSideToMove());
    }

    @Test
    void shouldLetThreeLinesPawnsAdvanceThree() {
        Position position = new Position(8);
        SetupManager.setup(position, SetupMode.THREE_LINES, new Random(1));
        Board board = position.getBoard();

        assertEquals(3, position.getPawnFirstMoveDistance());
        assertEquals(1, board.countPieces(PieceType.KING, PieceColor.WHITE));
        assertEquals(8, board.countPieces(PieceType.PAWN, PieceColor.WHITE));
        assertTrue(board.getPiece(0, 3).is(PieceType.PAWN, PieceColor.WHITE));
        assertTrue(board.getPiece(0, 4).is(PieceType.PAWN, PieceColor.BLACK));
    }

    @Test
    void shouldKeepOneLineKingBetweenRooksWithBishopsOnBothColors() {
        for (long seed = 0; seed < 20; seed++) {
            PieceType[] rank = SetupManager.generateOneLineBackRank(26, new Random(seed));
            int king = -1;
            int firstRook = -1;
            int lastRook = -1;
            boolean evenBishop = false;
            boolean oddBishop = false;
            for (int file = 0; file < rank.length; file++) {
                assertNotNull(rank[file]);
                if (rank[file] == PieceType.KING) {
                    assertEquals(-1, king, "one king only");
                    king = file;
                } else if (rank[file] == PieceType.ROOK) {
                    if (firstRook < 0) {
                        firstRook = file;
                    }
                    lastRook = file;
                } else if (rank[file] == PieceType.BISHOP) {
                    if (file % 2 == 0) {
                        evenBishop = true;
                    } else {
                        oddBishop = true;
                    }
                }
            }
            assertTrue(firstRook < king && king < lastRook, "king between rooks, seed " + seed);
            assertTrue(evenBishop && oddBishop, "bishops on both colors, seed " + seed);
        }
    }

    @Test
    void shouldMirrorOneLineForBlack() {
        Position position = new Position(10);
        SetupManager.setup(position, SetupMode.ONE_LINE, new Random(5));
        Board board = position.getBoard();

        for (int file = 0; file < 10; file++) {
            assertEquals(board.getPiece(file, 0).getType(), board.getPiece(file, 9).getType());
            assertTrue(board.getPiece(file, 1).is(PieceType.PAWN, PieceColor.WHITE));
            assertTrue(board.getPiece(file, 8).is(PieceType.PAWN, PieceColor.BLACK));
        }
    }

    @Test
    void shouldFitOneLineOnSmallestBoard() {
        Position position = new Position(5);
        SetupManager.setup(position, SetupMode.ONE_LINE, new Random(3));

        assertEquals(1, position.getBoard().countPieces(PieceType.KING, PieceColor.WHITE));
        assertEquals(2, position.getBoard().countPieces(PieceType.ROOK, PieceColor.WHITE));
    }

    @Test
    void shouldRejectBoardTooSmallForLayout() {
        assertThrows(IllegalArgumentException.class,
            () -> SetupManager.setup(new Position(7), SetupMode.THREE_LINES, new Random(1)));
        assertThrows(IllegalArgumentException.class,
            () -> SetupManager.setup(new Position(5), SetupMode.TWO_LINES, new Random(1)));
    }

    @Test
    void shouldReportMissingKingsOnEmptyCustomBoard() {
        List<String> errors = SetupManager.validateCustom(new Board(8));

        assertTrue(errors.contains("White needs a King"));
        assertTrue(errors.contains("Black needs a King"));
        assertTrue(errors.contains("Place at least one white piece"));
    }

    @Test
    void shouldReportPawnsOnEndRanksAndExtraKings() {
        Board board = new Board(8);
        board.setPiece(Square.parse("e1"), new Piece(PieceType.KING, PieceColor.WHITE));
        board.setPiece(Square.parse("g1"), new Piece(PieceType.KING, PieceColor.WHITE));
        board.setPiece(Square.parse("e8"), new Piece(PieceType.KING, PieceColor.BLACK));
        board.setPiece(Square.parse("a1"), new Piece(PieceType.PAWN, PieceColor.WHITE));

        List<String> errors = SetupManager.validateCustom(board);

        assertTrue(errors.contains("White has 2 Kings (need 1)"));
        assertTrue(errors.contains("Pawn on invalid rank at a1"));
        assertFalse(errors.contains("Black needs a King"));
    }

    @Test
    void shouldKeepValidCustomLayout() {
        Position position = new Position(8);
        position.getBoard().setPiece(Square.parse("e1"), new Piece(PieceType.KING, PieceColor.WHITE));
        position.getBoard().setPiece(Square.parse("e8"), new Piece(PieceType.KING, PieceColor.BLACK));
        position.setSideToMove(PieceColor.BLACK);

        SetupResult result = SetupManager.setup(position, SetupMode.CUSTOM, new Random(1));

        assertTrue(result.isSuccess());
        assertEquals(new Square(4, 0), position.getBoard().findKing(PieceColor.WHITE));
        assertEquals(PieceColor.WHITE, position.getSideToMove());
        assertEquals(SetupMode.CUSTOM, position.getSetupMode());
    }
}
