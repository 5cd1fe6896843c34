package uk.gegc.insightprep.features.exam.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.insightprep.features.exam.api.dto.ExamSessionStart;
import uk.gegc.insightprep.features.exam.application.ExamSessionService;
import uk.gegc.insightprep.features.exam.domain.model.ExamConfig;
import uk.gegc.insightprep.features.exam.domain.model.ExamSession;
import uk.gegc.insightprep.features.exam.domain.model.InterruptedExam;
import uk.gegc.insightprep.features.exam.domain.repository.ProgressStore;
import uk.gegc.insightprep.features.exam.infra.scheduling.ExamTimerScheduler;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.application.AnswerNormalizer;
import uk.gegc.insightprep.features.question.application.OptionShuffler;
import uk.gegc.insightprep.features.question.application.QuestionIntakeService;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.shared.config.InsightPrepProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExamSessionServiceImpl implements ExamSessionService {

    private final QuestionIntakeService intakeService;
    private final AnswerNormalizer answerNormalizer;
    private final OptionShuffler optionShuffler;
    private final ProgressStore progressStore;
    private final ExamTimerScheduler timerScheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final InsightPrepProperties properties;
    private final Clock clock;

    @Override
    public ExamSessionStart startFromRecords(List<QuestionRecord> records, ExamConfig config) {
        IntakeReport report = intakeService.requireValid(intakeService.intakeRecords(records));
        return new ExamSessionStart(create(report.accepted(), config), report);
    }

    @Override
    public ExamSessionStart start(List<Question> questions, ExamConfig config) {
        IntakeReport report = intakeService.requireValid(intakeService.intakeQuestions(questions));
        return new ExamSessionStart(create(report.accepted(), config), report);
    }

    @Override
    public Duration resolveDuration(int questionCount, ExamConfig config) {
        if (config.durationMinutes() != null) {
            return Duration.ofMinutes(config.durationMinutes());
        }
        long minutes = (long) Math.ceil(questionCount * properties.getExam().getMinutesPerQuestion());
        return Duration.ofMinutes(Math.max(1, minutes));
    }

    @Override
    public Optional<InterruptedExam> detectInterruptedExam() {
        try {
            return progressStore.load(ProgressStore.EXAM_PROGRESS_KEY)
                    .map(snapshot -> {
                        log.info("Found interrupted exam {} last saved at {}", snapshot.sessionId(),
                                snapshot.lastSaved());
                        return new InterruptedExam(snapshot, InterruptedExam.REFRESH_MESSAGE);
                    });
        } catch (RuntimeException e) {
            log.error("Could not read saved exam progress, treating it as absent", e);
            return Optional.empty();
        }
    }

    @Override
    public void dismissInterruptedExam() {
        progressStore.remove(ProgressStore.EXAM_PROGRESS_KEY);
        log.debug("Dismissed interrupted exam snapshot");
    }

    private ExamSession create(List<Question> accepted, ExamConfig config) {
        Duration duration = resolveDuration(accepted.size(), config);
        ExamSession session = new ExamSession(
                optionShuffler.prepareFixedOrderQuestions(accepted),
                duration,
                config.autosaveEnabled(),
                answerNormalizer,
                progressStore,
                eventPublisher,
                clock
        );
        timerScheduler.start(session, config.autosaveEnabled());
        log.info("Started exam {} with {} questions, {} minutes, autosave {}", session.getId(), session.size(),
                duration.toMinutes(), config.autosaveEnabled() ? "on" : "off");
        return session;
    }
}
