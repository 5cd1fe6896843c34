package uk.gegc.insightprep.features.question.domain.model;

import java.util.List;

/**
 * Result of validating a candidate question list: the questions a session can
 * be built from, plus every exclusion for optional user-facing review.
 */
public record IntakeReport(List<Question> accepted, List<ExcludedQuestion> excluded, int candidateCount) {

    public IntakeReport {
        accepted = List.copyOf(accepted);
        excluded = List.copyOf(excluded);
    }

    public boolean hasExclusions() {
        return !excluded.isEmpty();
    }

    public String summary() {
        return accepted.size() + " of " + candidateCount + " questions valid, "
                + excluded.size() + " excluded";
    }
}
