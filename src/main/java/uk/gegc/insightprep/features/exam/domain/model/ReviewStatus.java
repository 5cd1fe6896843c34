package uk.gegc.insightprep.features.exam.domain.model;

public enum ReviewStatus {
    CORRECT,
    INCORRECT,
    UNANSWERED
}
