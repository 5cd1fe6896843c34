package uk.gegc.insightprep.features.learning.domain.model;

/**
 * Whether explanation, reference and correct-answer text are ever shown for a judged question.
 */
public enum ExplanationMode {
    ONLY_WRONG,
    BOTH,
    NONE;

    public boolean appliesTo(boolean correct) {
        return switch (this) {
            case BOTH -> true;
            case ONLY_WRONG -> !correct;
            case NONE -> false;
        };
    }
}
