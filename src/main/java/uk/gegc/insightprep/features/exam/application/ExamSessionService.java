package uk.gegc.insightprep.features.exam.application;

import uk.gegc.insightprep.features.exam.api.dto.ExamSessionStart;
import uk.gegc.insightprep.features.exam.domain.model.ExamConfig;
import uk.gegc.insightprep.features.exam.domain.model.InterruptedExam;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.shared.exception.NoValidQuestionsException;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface ExamSessionService {

    /**
     * Validates the records and starts a timed exam with its countdown and autosave running.
     *
     * @throws NoValidQuestionsException when no record survives intake
     */
    ExamSessionStart startFromRecords(List<QuestionRecord> records, ExamConfig config);

    ExamSessionStart start(List<Question> questions, ExamConfig config);

    Duration resolveDuration(int questionCount, ExamConfig config);

    /**
     * Looks for the snapshot of an exam that was left without submitting or exiting.
     */
    Optional<InterruptedExam> detectInterruptedExam();

    void dismissInterruptedExam();
}
