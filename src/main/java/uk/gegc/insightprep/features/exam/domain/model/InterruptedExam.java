package uk.gegc.insightprep.features.exam.domain.model;

/**
 * An exam found unfinished on load, detected through its autosave snapshot.
 */
public record InterruptedExam(ExamSnapshot snapshot, String message) {

    public static final String REFRESH_MESSAGE = "Exam ended due to page refresh.";
}
