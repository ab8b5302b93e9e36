package com.grandchess.model;

/**
 * 棋子类型枚举
 */
public enum PieceType {
    KING('k', "K", 20000),
    QUEEN('q', "Q", 900),
    ROOK('r', "R", 500),
    BISHOP('b', "B", 330),
    KNIGHT('n', "N", 320),
    PAWN('p', "", 100);

    private final char fenChar;
    private final String notationLetter;
    private final int value;

    PieceType(char fenChar, String notationLetter, int value) {
        this.fenChar = fenChar;
        this.notationLetter = notationLetter;
        this.value = value;
    }

    /**
     * Lower-case FEN letter; white pieces use the upper-case form.
     */
    public char getFenChar() {
        return fenChar;
    }

    public String getNotationLetter() {
        return notationLetter;
    }

    /**
     * Material value in centipawns.
     */
    public int getValue() {
        return value;
    }

    public static PieceType fromFenChar(char c) {
        char lower = Character.toLowerCase(c);
        for (PieceType type : values()) {
            if (type.fenChar == lower) {
                return type;
            }
        }
        return null;
    }
}
