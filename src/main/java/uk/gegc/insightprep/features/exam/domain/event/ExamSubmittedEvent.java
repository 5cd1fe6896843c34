package uk.gegc.insightprep.features.exam.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.insightprep.features.exam.domain.model.ExamCompletion;

/**
 * Published exactly once per exam, on manual submission or when time runs out.
 */
public class ExamSubmittedEvent extends ApplicationEvent {

    private final String sessionId;
    private final ExamCompletion completion;

    public ExamSubmittedEvent(Object source, String sessionId, ExamCompletion completion) {
        super(source);
        this.sessionId = sessionId;
        this.completion = completion;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ExamCompletion getCompletion() {
        return completion;
    }
}
