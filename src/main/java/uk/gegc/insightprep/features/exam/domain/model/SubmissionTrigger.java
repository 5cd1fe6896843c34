package uk.gegc.insightprep.features.exam.domain.model;

/**
 * Who ended the exam. {@link #TIME_UP} is system-initiated and must be
 * presented to the user as such.
 */
public enum SubmissionTrigger {
    MANUAL,
    TIME_UP
}
