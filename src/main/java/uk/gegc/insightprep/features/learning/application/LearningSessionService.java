package uk.gegc.insightprep.features.learning.application;

import uk.gegc.insightprep.features.learning.api.dto.LearningSessionStart;
import uk.gegc.insightprep.features.learning.domain.model.LearningSession;
import uk.gegc.insightprep.features.learning.domain.model.SessionConfig;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.shared.exception.NoValidQuestionsException;

import java.util.List;

public interface LearningSessionService {

    /**
     * Settings from {@code insightprep.learning.defaults}.
     */
    SessionConfig defaultConfig();

    LearningSessionStart startFromRecords(List<QuestionRecord> records, SessionConfig config)
            throws NoValidQuestionsException;

    LearningSessionStart start(List<Question> questions, SessionConfig config) throws NoValidQuestionsException;

    /**
     * Starts a new session over the same source questions and settings, freshly shuffled.
     */
    LearningSession restart(LearningSession previous);
}
