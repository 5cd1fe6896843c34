package uk.gegc.insightprep.features.learning.domain.model;

public enum SessionStatus {
    IN_PROGRESS,
    COMPLETE
}
