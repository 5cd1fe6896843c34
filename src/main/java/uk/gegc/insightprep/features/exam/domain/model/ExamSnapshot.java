package uk.gegc.insightprep.features.exam.domain.model;

import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Periodically persisted copy of in-progress exam state.
 */
public record ExamSnapshot(
        String sessionId,
        Map<Integer, SubmittedAnswer> answers,
        Set<Integer> bookmarks,
        long remainingSeconds,
        int currentQuestionIndex,
        Instant lastSaved
) {

    public ExamSnapshot {
        answers = answers == null ? Map.of() : Map.copyOf(answers);
        bookmarks = bookmarks == null ? Set.of() : Set.copyOf(bookmarks);
    }
}
