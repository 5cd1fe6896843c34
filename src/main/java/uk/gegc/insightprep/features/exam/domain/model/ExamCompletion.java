package uk.gegc.insightprep.features.exam.domain.model;

import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record ExamCompletion(
        ExamResults results,
        Map<Integer, SubmittedAnswer> answers,
        Set<Integer> bookmarks,
        SubmissionTrigger trigger,
        Instant submittedAt
) {

    public ExamCompletion {
        answers = Map.copyOf(answers);
        bookmarks = Set.copyOf(bookmarks);
    }
}
