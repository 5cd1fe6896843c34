package uk.gegc.insightprep.features.learning.domain.model;

import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;

/**
 * Outcome of the latest judged submission for one question.
 *
 * @param attempts number of submissions judged for the question so far
 */
public record LedgerEntry(boolean correct, SubmittedAnswer userAnswer, int attempts) {
}
