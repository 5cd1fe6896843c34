package uk.gegc.insightprep.features.question.application;

import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.shared.exception.NoValidQuestionsException;

import java.util.List;

public interface QuestionIntakeService {

    /**
     * Validates raw records, excluding (not failing on) malformed ones.
     */
    IntakeReport intakeRecords(List<QuestionRecord> records);

    /**
     * Validates already-built questions, excluding malformed ones.
     */
    IntakeReport intakeQuestions(List<Question> questions);

    /**
     * Fails with {@link NoValidQuestionsException} when the report has nothing to build a session from.
     */
    IntakeReport requireValid(IntakeReport report) throws NoValidQuestionsException;
}
