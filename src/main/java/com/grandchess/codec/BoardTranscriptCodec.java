package com.grandchess.codec;

import com.grandchess.model.Board;
import com.grandchess.model.Piece;
import com.grandchess.model.PieceColor;
import com.grandchess.model.PieceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 棋盘快照编解码 - 用于与对端同步完整棋盘（含棋子是否走过）
 * <p>
 * One record per piece, {@code file,rank,colorType,moved}, records joined by {@code ;}. Example:
 * {@code 4,0,wK,0;4,7,bK,1}.
 */
public final class BoardTranscriptCodec {
    private static final Logger LOG = LoggerFactory.getLogger(BoardTranscriptCodec.class);

    private BoardTranscriptCodec() {
    }

    public static String encode(Board board) {
        List<String> records = new ArrayList<>();
        for (int file = 0; file < board.getSize(); file++) {
            for (int rank = 0; rank < board.getSize(); rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null) {
                    continue;
                }
                records.add(file + "," + rank + "," + (piece.isWhite() ? 'w' : 'b') + typeCode(piece.getType())
                    + "," + (piece.hasMoved() ? 1 : 0));
            }
        }
        return String.join(";", records);
    }

    /**
     * Clears {@code board} and places every well-formed record on it. Malformed or off-board records are skipped.
     *
     * @return number of pieces placed
     */
    public static int decode(String transcript, Board board) {
        board.clear();
        if (transcript == null || transcript.isEmpty()) {
            return 0;
        }
        int placed = 0;
        for (String record : transcript.split(";")) {
            if (record.isEmpty()) {
                continue;
            }
            if (placeRecord(record, board)) {
                placed++;
            } else {
                LOG.debug("Skipping malformed board record '{}'", record);
            }
        }
        return placed;
    }

    private static boolean placeRecord(String record, Board board) {
        String[] tokens = record.split(",");
        if (tokens.length < 4 || tokens[2].length() != 2) {
            return false;
        }
        int file;
        int rank;
        try {
            file = Integer.parseInt(tokens[0].trim());
            rank = Integer.parseInt(tokens[1].trim());
        } catch (NumberFormatException e) {
            return false;
        }
        if (!board.isOnBoard(file, rank)) {
            return false;
        }
        char colorCode = tokens[2].charAt(0);
        PieceType type = PieceType.fromFenChar(tokens[2].charAt(1));
        if ((colorCode != 'w' && colorCode != 'b') || type == null) {
            return false;
        }
        PieceColor color = colorCode == 'w' ? PieceColor.WHITE : PieceColor.BLACK;
        board.setPiece(file, rank, new Piece(type, color, "1".equals(tokens[3].trim())));
        return true;
    }

    private static char typeCode(PieceType type) {
        return Character.toUpperCase(type.getFenChar());
    }
}
