package uk.gegc.insightprep.features.exam.infra.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.exam.domain.model.ExamSession;
import uk.gegc.insightprep.shared.config.InsightPrepProperties;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Starts the two periodic tasks of an exam: the countdown tick and the autosave.
 * Both are handed to the session, which owns their cancellation.
 */
@Slf4j
@Component
public class ExamTimerScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration autosaveInterval;

    public ExamTimerScheduler(@Qualifier("examTaskScheduler") TaskScheduler taskScheduler,
                              Clock clock,
                              InsightPrepProperties properties) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.tickInterval = properties.getExam().getTickInterval();
        this.autosaveInterval = properties.getExam().getAutosaveInterval();
    }

    public void start(ExamSession session, boolean autosaveEnabled) {
        List<ScheduledFuture<?>> tasks = new ArrayList<>(2);
        tasks.add(taskScheduler.scheduleAtFixedRate(
                guarded(session.getId(), "tick", session::tick),
                clock.instant().plus(tickInterval),
                tickInterval));
        if (autosaveEnabled) {
            tasks.add(taskScheduler.scheduleAtFixedRate(
                    guarded(session.getId(), "autosave", session::autosave),
                    clock.instant().plus(autosaveInterval),
                    autosaveInterval));
        }
        session.bindScheduledTasks(tasks);
        log.debug("Scheduled exam {}: tick every {}, autosave {}", session.getId(), tickInterval,
                autosaveEnabled ? "every " + autosaveInterval : "off");
    }

    private Runnable guarded(String sessionId, String taskName, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // an exception would cancel the periodic task and freeze the countdown
                log.error("Error during scheduled {} of exam {}", taskName, sessionId, e);
            }
        };
    }
}
