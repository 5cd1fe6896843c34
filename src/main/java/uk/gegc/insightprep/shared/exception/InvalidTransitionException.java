package uk.gegc.insightprep.shared.exception;

/**
 * Guard failure inside a session state machine (submitting a locked card,
 * navigating out of range, ...). Sessions catch and log it; it is never
 * propagated to the rendering layer.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String operation;
    private final int index;

    public InvalidTransitionException(String operation, int index, String detail) {
        super("Invalid " + operation + " on question " + index + ": " + detail);
        this.operation = operation;
        this.index = index;
    }

    public String getOperation() {
        return operation;
    }

    public int getIndex() {
        return index;
    }
}
