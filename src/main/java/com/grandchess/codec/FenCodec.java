package com.grandchess.codec;

import com.grandchess.model.Board;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import com.grandchess.model.Position;
import com.grandchess.model.SetupMode;

/**
 * 扩展 FEN 编解码 - {@code size:ranks side castling ep half full}
 * <p>
 * Ranks run from the top (black's home) down, upper case is white, and empty runs may take several digits on
 * wide boards. Without a {@code size:} prefix the board is 8x8.
 */
public final class FenCodec {
    public static final int DEFAULT_SIZE = Board.STANDARD_SIZE;

    private FenCodec() {
    }

    public static String encode(Position position) {
        Board board = position.getBoard();
        int size = board.getSize();
        StringBuilder sb = new StringBuilder(size * size / 2 + 16);
        sb.append(size).append(':');
        for (int rank = size - 1; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < size; file++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    sb.append(empty);
                    empty = 0;
                }
                sb.append(piece.toFenChar());
            }
            if (empty > 0) {
                sb.append(empty);
            }
            if (rank > 0) {
                sb.append('/');
            }
        }
        sb.append(' ').append(position.isWhiteToMove() ? 'w' : 'b');
        sb.append(' ').append(castlingRights(board));
        // en passant and clocks are not carried
        sb.append(" - 0 1");
        return sb.toString();
    }

    /**
     * Castling field, {@code KQkq} style, or {@code -}. Looks at the first unmoved king on each home rank.
     */
    public static String castlingRights(Board board) {
        String rights = sideRights(board, PieceColor.WHITE) + sideRights(board, PieceColor.BLACK);
        return rights.isEmpty() ? "-" : rights;
    }

    private static String sideRights(Board board, PieceColor color) {
        int rank = board.homeRank(color);
        for (int file = 0; file < board.getSize(); file++) {
            Piece king = board.getPiece(file, rank);
            if (king == null || !king.is(PieceType.KING, color) || king.hasMoved()) {
                continue;
            }
            StringBuilder sb = new StringBuilder(2);
            if (hasUnmovedRook(board, color, rank, file + 1, board.getSize(), 1)) {
                sb.append('K');
            }
            if (hasUnmovedRook(board, color, rank, file - 1, -1, -1)) {
                sb.append('Q');
            }
            String s = sb.toString();
            return color == PieceColor.WHITE ? s : s.toLowerCase();
        }
        return "";
    }

    private static boolean hasUnmovedRook(Board board, PieceColor color, int rank, int start, int end, int step) {
        for (int file = start; file != end; file += step) {
            Piece piece = board.getPiece(file, rank);
            if (piece != null && piece.is(PieceType.ROOK, color) && !piece.hasMoved()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses {@code fen} into a fresh position. Nothing outside the returned result is touched.
     */
    public static ImportResult decode(String fen) {
        if (fen == null || fen.trim().isEmpty()) {
            return ImportResult.failure("FEN string is empty");
        }
        String[] parts = fen.trim().split("\\s+");
        String placement = parts[0];

        int size = DEFAULT_SIZE;
        int colon = placement.indexOf(':');
        if (colon >= 0) {
            try {
                size = Integer.parseInt(placement.substring(0, colon).trim());
            } catch (NumberFormatException e) {
                return ImportResult.failure("Invalid board size in FEN: " + placement.substring(0, colon));
            }
            placement = placement.substring(colon + 1);
        }
        if (!Board.isValidSize(size)) {
            return ImportResult.failure("Board size must be between " + Board.MIN_SIZE + " and " + Board.MAX_SIZE);
        }

        String[] ranks = placement.split("/", -1);
        if (ranks.length != size) {
            return ImportResult.failure("Expected " + size + " ranks, got " + ranks.length);
        }

        Position position = new Position(size);
        Board board = position.getBoard();
        for (int i = 0; i < ranks.length; i++) {
            String error = parseRank(ranks[i], size - 1 - i, board);
            if (error != null) {
                return ImportResult.failure(error);
            }
        }

        for (PieceColor color : PieceColor.values()) {
            int kings = board.countPieces(PieceType.KING, color);
            if (kings != 1) {
                return ImportResult.failure(color.getDisplayName() + " has " + kings + " Kings (need 1)");
            }
        }

        PieceColor side = PieceColor.WHITE;
        if (parts.length > 1) {
            if ("w".equalsIgnoreCase(parts[1])) {
                side = PieceColor.WHITE;
            } else if ("b".equalsIgnoreCase(parts[1])) {
                side = PieceColor.BLACK;
            } else {
                return ImportResult.failure("Side to move must be 'w' or 'b', got '" + parts[1] + "'");
            }
        }
        if (parts.length > 2) {
            applyCastlingField(board, parts[2]);
        }

        position.setSetupMode(SetupMode.CUSTOM);
        position.setPawnFirstMoveDistance(SetupMode.CUSTOM.getPawnFirstMoveDistance());
        position.resetTurnState();
        position.setSideToMove(side);
        return ImportResult.success(position);
    }

    /**
     * Decodes {@code fen} and, only if that succeeds, copies the result into {@code target}.
     */
    public static ImportResult importInto(Position target, String fen) {
        ImportResult result = decode(fen);
        if (result.isSuccess()) {
            target.copyFrom(result.getPosition());
        }
        return result;
    }

    private static String parseRank(String data, int rank, Board board) {
        int size = board.getSize();
        int file = 0;
        int i = 0;
        while (i < data.length()) {
            char c = data.charAt(i);
            if (Character.isDigit(c)) {
                int run = 0;
                while (i < data.length() && Character.isDigit(data.charAt(i))) {
                    run = run * 10 + Character.digit(data.charAt(i), 10);
                    // 超过棋盘宽度立即失败，避免长数字溢出
                    if (file + run > size) {
                        return "Rank " + (rank + 1) + " describes more than " + size + " squares";
                    }
                    i++;
                }
                file += run;
                continue;
            }
            PieceType type = PieceType.fromFenChar(c);
            if (type == null) {
                return "Unknown piece '" + c + "' on rank " + (rank + 1);
            }
            if (file >= size) {
                return "Rank " + (rank + 1) + " describes more than " + size + " squares";
            }
            PieceColor color = Character.isUpperCase(c) ? PieceColor.WHITE : PieceColor.BLACK;
            board.setPiece(file, rank, new Piece(type, color));
            file++;
            i++;
        }
        if (file != size) {
            return "Rank " + (rank + 1) + " describes " + file + " squares, expected " + size;
        }
        return null;
    }

    // 缺失的易位权 → 对应一侧的车视为已动
    private static void applyCastlingField(Board board, String field) {
        denyIfAbsent(board, PieceColor.WHITE, field.indexOf('K') < 0, field.indexOf('Q') < 0);
        denyIfAbsent(board, PieceColor.BLACK, field.indexOf('k') < 0, field.indexOf('q') < 0);
    }

    private static void denyIfAbsent(Board board, PieceColor color, boolean noHigh, boolean noLow) {
        int rank = board.homeRank(color);
        int kingFile = -1;
        for (int file = 0; file < board.getSize(); file++) {
            Piece piece = board.getPiece(file, rank);
            if (piece != null && piece.is(PieceType.KING, color)) {
                kingFile = file;
                break;
            }
        }
        for (int file = 0; file < board.getSize(); file++) {
            Piece piece = board.getPiece(file, rank);
            if (piece == null || !piece.is(PieceType.ROOK, color)) {
                continue;
            }
            boolean high = kingFile >= 0 && file > kingFile;
            boolean low = kingFile >= 0 && file < kingFile;
            if ((high && noHigh) || (low && noLow) || kingFile < 0) {
                piece.setMoved(true);
            }
        }
    }
}
