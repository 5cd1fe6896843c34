package uk.gegc.insightprep.features.learning.domain.model;

import java.util.Map;

/**
 * Score of a learning session, always derived from the ledger.
 */
public record FinalScore(int score, int total, int percentage, PerformanceBand band, Map<Integer, LedgerEntry> ledger) {

    public FinalScore {
        ledger = Map.copyOf(ledger);
    }

    public static FinalScore fromLedger(Map<Integer, LedgerEntry> ledger, int total) {
        int score = (int) ledger.values().stream().filter(LedgerEntry::correct).count();
        int percentage = total == 0 ? 0 : (int) Math.round(score * 100.0 / total);
        return new FinalScore(score, total, percentage, PerformanceBand.forPercentage(percentage), ledger);
    }
}
