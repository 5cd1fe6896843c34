package uk.gegc.insightprep.shared.exception;

public enum NoValidQuestionsReason {
    NOTHING_MATCHED("No questions found matching your criteria. Please adjust your filters."),
    ALL_INVALID("Questions matched your filters, but every one of them failed validation. "
            + "Review the invalid questions for details.");

    private final String userMessage;

    NoValidQuestionsReason(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
