package org.gridiron.lineup;

public class InvalidStrategyException extends IllegalArgumentException {

    private final String rejectedValue;

    public InvalidStrategyException(String rejectedValue, String allowedValues) {
        super("Unknown strategy '" + rejectedValue + "' (expected one of: " + allowedValues + ")");
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
