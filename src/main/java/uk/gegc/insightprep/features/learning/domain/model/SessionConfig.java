package uk.gegc.insightprep.features.learning.domain.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Learning-session settings, fixed for the lifetime of a session.
 *
 * @param showImmediate when false, per-question feedback is withheld until the
 *                      terminal reveal; correctness is still computed at submission
 */
@Builder(toBuilder = true)
public record SessionConfig(
        ExplanationMode explanationMode,
        boolean allowRetry,
        boolean showImmediate,
        boolean showCorrectAnswer,
        boolean showTopicSubtopic
) {

    public SessionConfig {
        Objects.requireNonNull(explanationMode, "explanationMode");
    }

    public static SessionConfig defaults() {
        return new SessionConfig(ExplanationMode.ONLY_WRONG, true, true, true, false);
    }
}
