package com.grandchess.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class SetupResult {
    private final boolean success;
    private final List<String> errors;

    private SetupResult(boolean success, List<String> errors) {
        this.success = success;
        this.errors = errors == null ? Collections.<String>emptyList() : Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public static SetupResult success() {
        return new SetupResult(true, null);
    }

    public static SetupResult invalid(List<String> errors) {
        return new SetupResult(false, errors);
    }

    public boolean isSuccess() {
        return success;
    }

    public List<String> getErrors() {
        return errors;
    }

    public String getMessage() {
        return String.join("\n", errors);
    }
}
