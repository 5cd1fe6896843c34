package uk.gegc.insightprep.features.learning.domain.model;

public enum CardState {
    DISABLED,
    ACTIVE,
    LOCKED
}
