package uk.gegc.insightprep.features.learning.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.insightprep.features.learning.domain.model.LedgerEntry;

import java.util.Map;

/**
 * Published each time the last card of a learning session locks. A retry of
 * the last question reopens the session, so this can fire again for the same session.
 */
public class LearningSessionCompletedEvent extends ApplicationEvent {

    private final String sessionId;
    private final int score;
    private final int total;
    private final Map<Integer, LedgerEntry> ledger;

    public LearningSessionCompletedEvent(Object source, String sessionId, int score, int total,
                                         Map<Integer, LedgerEntry> ledger) {
        super(source);
        this.sessionId = sessionId;
        this.score = score;
        this.total = total;
        this.ledger = Map.copyOf(ledger);
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getScore() {
        return score;
    }

    public int getTotal() {
        return total;
    }

    public Map<Integer, LedgerEntry> getLedger() {
        return ledger;
    }
}
