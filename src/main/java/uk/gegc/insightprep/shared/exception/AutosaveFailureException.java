package uk.gegc.insightprep.shared.exception;

public class AutosaveFailureException extends RuntimeException {

    public AutosaveFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
