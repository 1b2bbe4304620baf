package org.gridiron.lineup;

public record LineupIssue(LineupFailure failure, Stage stage, String message) {

    public boolean isError() {
        return failure.isError();
    }

    /** Display form, e.g. {@code "SLOT_UNFILLABLE [SOLVE]: No eligible player left for TE"}. */
    public String describe() {
        return failure + " [" + stage + "]: " + message;
    }
}
