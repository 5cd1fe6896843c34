package uk.gegc.insightprep.features.exam.domain.model;

public enum ExitDecision {
    /** The exam is over; leaving needs no confirmation. */
    EXIT_ALLOWED,
    /** The exam is running; the caller must confirm or cancel. */
    CONFIRMATION_REQUIRED
}
