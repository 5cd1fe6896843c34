package uk.gegc.insightprep.features.exam.domain.model;

/**
 * @param durationMinutes exam length; {@code null} derives it from the question count
 */
public record ExamConfig(Integer durationMinutes, boolean autosaveEnabled) {

    public ExamConfig {
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new IllegalArgumentException("Exam duration must be positive, got " + durationMinutes);
        }
    }

    public static ExamConfig defaults() {
        return new ExamConfig(null, true);
    }

    public static ExamConfig ofMinutes(int minutes) {
        return new ExamConfig(minutes, true);
    }
}
