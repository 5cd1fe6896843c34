package uk.gegc.insightprep.features.learning.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.insightprep.features.learning.api.dto.LearningSessionStart;
import uk.gegc.insightprep.features.learning.application.LearningSessionService;
import uk.gegc.insightprep.features.learning.domain.model.LearningSession;
import uk.gegc.insightprep.features.learning.domain.model.SessionConfig;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.application.AnswerNormalizer;
import uk.gegc.insightprep.features.question.application.OptionShuffler;
import uk.gegc.insightprep.features.question.application.QuestionIntakeService;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.shared.config.InsightPrepProperties;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LearningSessionServiceImpl implements LearningSessionService {

    private final QuestionIntakeService intakeService;
    private final AnswerNormalizer answerNormalizer;
    private final OptionShuffler optionShuffler;
    private final ApplicationEventPublisher eventPublisher;
    private final InsightPrepProperties properties;

    @Override
    public SessionConfig defaultConfig() {
        return properties.getLearning().getDefaults().toSessionConfig();
    }

    @Override
    public LearningSessionStart startFromRecords(List<QuestionRecord> records, SessionConfig config) {
        IntakeReport report = intakeService.requireValid(intakeService.intakeRecords(records));
        return new LearningSessionStart(create(report.accepted(), config), report);
    }

    @Override
    public LearningSessionStart start(List<Question> questions, SessionConfig config) {
        IntakeReport report = intakeService.requireValid(intakeService.intakeQuestions(questions));
        return new LearningSessionStart(create(report.accepted(), config), report);
    }

    @Override
    public LearningSession restart(LearningSession previous) {
        log.info("Restarting learning session {} with the same {} questions", previous.getId(),
                previous.getSourceQuestions().size());
        return create(previous.getSourceQuestions(), previous.getConfig());
    }

    private LearningSession create(List<Question> source, SessionConfig config) {
        LearningSession session = new LearningSession(
                source,
                optionShuffler.prepareSessionQuestions(source),
                config,
                answerNormalizer,
                optionShuffler,
                eventPublisher
        );
        log.info("Started learning session {} with {} questions (mode={}, retry={}, immediate={})",
                session.getId(), session.size(), config.explanationMode(), config.allowRetry(),
                config.showImmediate());
        return session;
    }
}
