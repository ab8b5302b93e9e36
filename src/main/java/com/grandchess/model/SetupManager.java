package com.grandchess.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 开局布置 - 按模式在任意尺寸棋盘上摆放双方棋子
 */
public final class SetupManager {
    // Q, B, N, R
    private static final PieceType[] KING_FLANK_PATTERN = {
        PieceType.QUEEN, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
    };
    private static final PieceType[] TWO_LINES_SECOND_RANK = {
        PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK, PieceType.QUEEN,
        PieceType.QUEEN, PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP
    };
    private static final PieceType[] THREE_LINES_SECOND_RANK = {
        PieceType.QUEEN, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK,
        PieceType.BISHOP, PieceType.KNIGHT, PieceType.QUEEN, PieceType.ROOK
    };

    private SetupManager() {
    }

    /**
     * Lays out {@code mode} on the position's board and resets the turn state. CUSTOM keeps the pieces already on
     * the board and only validates them.
     *
     * @throws IllegalArgumentException when the board is smaller than the mode's layout needs
     */
    public static SetupResult setup(Position position, SetupMode mode, Random random) {
        if (mode == null) {
            throw new IllegalArgumentException("setup mode is required");
        }
        Board board = position.getBoard();
        if (mode == SetupMode.CUSTOM) {
            List<String> errors = validateCustom(board);
            if (!errors.isEmpty()) {
                return SetupResult.invalid(errors);
            }
        } else {
            if (board.getSize() < mode.getMinBoardSize()) {
                throw new IllegalArgumentException(mode.getDisplayName() + " needs a board of at least "
                    + mode.getMinBoardSize() + " squares, got " + board.getSize());
            }
            board.clear();
            switch (mode) {
                case TWO_LINES:
                    setupTwoLines(board, PieceColor.WHITE);
                    setupTwoLines(board, PieceColor.BLACK);
                    break;
                case ONE_LINE:
                    PieceType[] backRank = generateOneLineBackRank(board.getSize(), random);
                    setupOneLine(board, PieceColor.WHITE, backRank);
                    setupOneLine(board, PieceColor.BLACK, backRank);
                    break;
                case THREE_LINES:
                    setupThreeLines(board, PieceColor.WHITE);
                    setupThreeLines(board, PieceColor.BLACK);
                    break;
                default:
                    break;
            }
        }
        position.setSetupMode(mode);
        position.setPawnFirstMoveDistance(mode.getPawnFirstMoveDistance());
        position.resetTurnState();
        return SetupResult.success();
    }

    /**
     * Problems that keep a hand-made layout from being played; empty when the layout is valid.
     */
    public static List<String> validateCustom(Board board) {
        List<String> errors = new ArrayList<>();
        int size = board.getSize();
        boolean hasWhite = false;
        boolean hasBlack = false;
        for (int file = 0; file < size; file++) {
            for (int rank = 0; rank < size; rank++) {
                Piece piece = board.getPiece(file, rank);
                if (piece == null) {
                    continue;
                }
                if (piece.isWhite()) {
                    hasWhite = true;
                } else {
                    hasBlack = true;
                }
                if (piece.getType() == PieceType.PAWN && (rank == 0 || rank == size - 1)) {
                    errors.add("Pawn on invalid rank at " + new Square(file, rank).toNotation());
                }
            }
        }
        checkKingCount(board, PieceColor.WHITE, errors);
        checkKingCount(board, PieceColor.BLACK, errors);
        if (!hasWhite) {
            errors.add("Place at least one white piece");
        }
        if (!hasBlack) {
            errors.add("Place at least one black piece");
        }
        return errors;
    }

    private static void checkKingCount(Board board, PieceColor color, List<String> errors) {
        int kings = board.countPieces(PieceType.KING, color);
        if (kings == 0) {
            errors.add(color.getDisplayName() + " needs a King");
        } else if (kings > 1) {
            errors.add(color.getDisplayName() + " has " + kings + " Kings (need 1)");
        }
    }

    private static int rankFromHome(Board board, PieceColor color, int offset) {
        return color == PieceColor.WHITE ? offset : board.getSize() - 1 - offset;
    }

    private static void place(Board board, int file, int rank, PieceType type, PieceColor color) {
        board.setPiece(file, rank, new Piece(type, color));
    }

    private static void placePawns(Board board, int rank, PieceColor color) {
        for (int file = 0; file < board.getSize(); file++) {
            place(board, file, rank, PieceType.PAWN, color);
        }
    }

    // 王居中，向两侧按 Q B N R 循环
    private static void setupTwoLines(Board board, PieceColor color) {
        int size = board.getSize();
        int backRank = rankFromHome(board, color, 0);
        int secondRank = rankFromHome(board, color, 1);
        int center = size / 2;

        place(board, center, backRank, PieceType.KING, color);
        for (int offset = 1; offset <= center; offset++) {
            PieceType type = KING_FLANK_PATTERN[(offset - 1) % KING_FLANK_PATTERN.length];
            if (center - offset >= 0) {
                place(board, center - offset, backRank, type, color);
            }
            if (center + offset < size) {
                place(board, center + offset, backRank, type, color);
            }
        }
        for (int file = 0; file < size; file++) {
            place(board, file, secondRank, TWO_LINES_SECOND_RANK[file % TWO_LINES_SECOND_RANK.length], color);
        }
        placePawns(board, rankFromHome(board, color, 2), color);
    }

    private static void setupThreeLines(Board board, PieceColor color) {
        int size = board.getSize();
        int backRank = rankFromHome(board, color, 0);
        int secondRank = rankFromHome(board, color, 1);
        int thirdRank = rankFromHome(board, color, 2);
        int center = size / 2;

        place(board, center, backRank, PieceType.KING, color);
        for (int file = 0; file < size; file++) {
            if (file == center) {
                continue;
            }
            place(board, file, backRank, file % 3 == 1 ? PieceType.QUEEN : PieceType.ROOK, color);
        }
        for (int file = 0; file < size; file++) {
            place(board, file, secondRank, THREE_LINES_SECOND_RANK[file % THREE_LINES_SECOND_RANK.length], color);
        }
        for (int file = 0; file < size; file++) {
            place(board, file, thirdRank, file % 2 == 0 ? PieceType.KNIGHT : PieceType.BISHOP, color);
        }
        placePawns(board, rankFromHome(board, color, 3), color);
    }

    private static void setupOneLine(Board board, PieceColor color, PieceType[] backRankPattern) {
        int backRank = rankFromHome(board, color, 0);
        for (int file = 0; file < board.getSize(); file++) {
            place(board, file, backRank, backRankPattern[file], color);
        }
        placePawns(board, rankFromHome(board, color, 1), color);
    }

    /**
     * Randomized back rank scaled to the board width: bishop pairs on opposite square colors, the king somewhere
     * between rooks, a few queens, knights elsewhere. Black mirrors white.
     */
    static PieceType[] generateOneLineBackRank(int size, Random random) {
        PieceType[] pattern = new PieceType[size];
        int bishopPairs = Math.max(1, size / 6);
        int rooks = Math.max(2, size / 6);

        List<Integer> even = new ArrayList<>();
        List<Integer> odd = new ArrayList<>();
        for (int file = 0; file < size; file++) {
            if (file % 2 == 0) {
                even.add(file);
            } else {
                odd.add(file);
            }
        }
        for (int i = 0; i < bishopPairs; i++) {
            pattern[even.remove(random.nextInt(even.size()))] = PieceType.BISHOP;
            pattern[odd.remove(random.nextInt(odd.size()))] = PieceType.BISHOP;
        }

        List<Integer> available = new ArrayList<>(even);
        available.addAll(odd);
        Collections.sort(available);

        List<Integer> kingAndRooks = new ArrayList<>();
        for (int i = 0; i < rooks + 1; i++) {
            kingAndRooks.add(available.remove(random.nextInt(available.size())));
        }
        Collections.sort(kingAndRooks);
        int kingIdx = 1 + random.nextInt(kingAndRooks.size() - 2);
        for (int i = 0; i < kingAndRooks.size(); i++) {
            pattern[kingAndRooks.get(i)] = i == kingIdx ? PieceType.KING : PieceType.ROOK;
        }

        int queens = Math.min(available.size(), Math.max(1, size / 8));
        for (int i = 0; i < queens; i++) {
            pattern[available.remove(random.nextInt(available.size()))] = PieceType.QUEEN;
        }
        for (int file : available) {
            pattern[file] = PieceType.KNIGHT;
        }
        return pattern;
    }
}
