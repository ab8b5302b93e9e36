package com.grandchess.codec;

import com.grandchess.model.Position;

/**
 * Outcome of a FEN import: the decoded position, or the reason it was refused.
 */
public final class ImportResult {
    private final boolean success;
    private final String message;
    private final Position position;

    private ImportResult(boolean success, String message, Position position) {
        this.success = success;
        this.message = message == null ? "" : message;
        this.position = position;
    }

    public static ImportResult success(Position position) {
        return new ImportResult(true, "", position);
    }

    public static ImportResult failure(String message) {
        return new ImportResult(false, message, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Decoded position, {@code null} on failure.
     */
    public Position getPosition() {
        return position;
    }

    @Override
    public String toString() {
        return success ? "imported" : "failed: " + message;
    }
}
