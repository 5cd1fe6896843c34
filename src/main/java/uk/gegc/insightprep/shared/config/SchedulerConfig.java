package uk.gegc.insightprep.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler driving exam countdown ticks and autosaves.
 *
 * A single thread runs every exam callback, so one tick always finishes
 * before the next one starts.
 */
@Configuration
@Slf4j
public class SchedulerConfig {

    @Bean(name = "examTaskScheduler", destroyMethod = "shutdown")
    public TaskScheduler examTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("exam-timer-");
        // cancelled timers must not linger in the queue
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in exam timer task", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("Exam Task Scheduler configured - Pool: 1, Prefix: exam-timer-");
        return scheduler;
    }
}
