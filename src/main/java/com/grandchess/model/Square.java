package com.grandchess.model;

/**
 * 坐标类 - 0 起始的 (file, rank)
 */
public final class Square {
    private final int file;
    private final int rank;

    public Square(int file, int rank) {
        this.file = file;
        this.rank = rank;
    }

    /**
     * Parses an algebraic name such as {@code e4} or {@code ab12}.
     */
    public static Square parse(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("square name is empty");
        }
        int i = 0;
        while (i < name.length() && Character.isLetter(name.charAt(i))) {
            i++;
        }
        if (i == 0 || i == name.length()) {
            throw new IllegalArgumentException("bad square name: " + name);
        }
        int file = 0;
        for (int k = 0; k < i; k++) {
            char c = Character.toLowerCase(name.charAt(k));
            if (c < 'a' || c > 'z') {
                throw new IllegalArgumentException("bad square name: " + name);
            }
            file = file * 26 + (c - 'a' + 1);
        }
        int rank;
        try {
            rank = Integer.parseInt(name.substring(i));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad square name: " + name, e);
        }
        return new Square(file - 1, rank - 1);
    }

    public int getFile() {
        return file;
    }

    public int getRank() {
        return rank;
    }

    public Square offset(int dFile, int dRank) {
        return new Square(file + dFile, rank + dRank);
    }

    /**
     * File letters: a..z, then aa..az, ba.. for wide boards.
     */
    public static String fileLabel(int file) {
        StringBuilder sb = new StringBuilder(2);
        int n = file + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('a' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    public String toNotation() {
        return fileLabel(file) + (rank + 1);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Square other = (Square) obj;
        return file == other.file && rank == other.rank;
    }

    @Override
    public int hashCode() {
        return file * 131 + rank;
    }

    @Override
    public String toString() {
        return toNotation();
    }
}
