package uk.gegc.insightprep.features.exam.domain.model;

import java.util.List;

public record ExamReport(ExamResults results, SubmissionTrigger trigger, int bookmarkedCount,
                         List<QuestionReview> reviews) {

    public ExamReport {
        reviews = List.copyOf(reviews);
    }
}
