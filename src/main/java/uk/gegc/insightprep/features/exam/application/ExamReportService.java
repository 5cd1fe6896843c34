package uk.gegc.insightprep.features.exam.application;

import uk.gegc.insightprep.features.exam.domain.model.ExamCompletion;
import uk.gegc.insightprep.features.exam.domain.model.ExamReport;
import uk.gegc.insightprep.features.exam.domain.model.ExamSession;
import uk.gegc.insightprep.features.question.domain.model.Question;

import java.util.List;

public interface ExamReportService {

    /**
     * Builds the per-question breakdown of a submitted exam.
     *
     * @throws IllegalStateException when the exam has not been submitted
     */
    ExamReport buildReport(ExamSession session);

    ExamReport buildReport(List<Question> questions, ExamCompletion completion);
}
