package uk.gegc.insightprep.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.insightprep.features.learning.domain.model.ExplanationMode;
import uk.gegc.insightprep.features.learning.domain.model.SessionConfig;

import java.time.Duration;

/**
 * Type-safe configuration for the assessment engine.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "insightprep")
public class InsightPrepProperties {

    @Valid
    private Exam exam = new Exam();

    @Valid
    private Learning learning = new Learning();

    @Data
    public static class Exam {

        /**
         * Period of the countdown tick. Each tick takes one second off the clock.
         */
        @NotNull
        private Duration tickInterval = Duration.ofSeconds(1);

        @NotNull
        private Duration autosaveInterval = Duration.ofSeconds(30);

        /**
         * Used to derive the exam length when the caller gives none.
         */
        @DecimalMin(value = "0.1", message = "Property insightprep.exam.minutes-per-question must be at least 0.1")
        private double minutesPerQuestion = 1.5;

        /**
         * Where {@code file} autosave snapshots are written.
         */
        @NotBlank
        private String autosaveDirectory = System.getProperty("java.io.tmpdir") + "/insightprep";

        /**
         * {@code file} or {@code memory}.
         */
        @NotBlank
        private String autosaveStore = "file";
    }

    @Data
    public static class Learning {

        @Valid
        private Defaults defaults = new Defaults();
    }

    @Data
    public static class Defaults {

        @NotNull
        private ExplanationMode explanationMode = ExplanationMode.ONLY_WRONG;
        private boolean allowRetry = true;
        private boolean showImmediate = true;
        private boolean showCorrectAnswer = true;
        private boolean showTopicSubtopic = false;

        public SessionConfig toSessionConfig() {
            return SessionConfig.builder()
                    .explanationMode(explanationMode)
                    .allowRetry(allowRetry)
                    .showImmediate(showImmediate)
                    .showCorrectAnswer(showCorrectAnswer)
                    .showTopicSubtopic(showTopicSubtopic)
                    .build();
        }
    }
}
