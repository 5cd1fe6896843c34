package uk.gegc.insightprep.features.learning.domain.model;

public enum PerformanceBand {
    EXCELLENT(90, "Outstanding performance! You've clearly mastered the material."),
    GOOD(70, "Well done! You have a strong grasp, revise the missed parts."),
    FAIR(50, "Decent effort! Review the gaps and practice more."),
    POOR(0, "Keep trying! Revise basics and practice step by step.");

    private final int minimumPercentage;
    private final String message;

    PerformanceBand(int minimumPercentage, String message) {
        this.minimumPercentage = minimumPercentage;
        this.message = message;
    }

    public static PerformanceBand forPercentage(int percentage) {
        for (PerformanceBand band : values()) {
            if (percentage >= band.minimumPercentage) {
                return band;
            }
        }
        return POOR;
    }

    public int getMinimumPercentage() {
        return minimumPercentage;
    }

    public String getMessage() {
        return message;
    }
}
