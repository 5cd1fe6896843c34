package uk.gegc.insightprep.features.learning.api.dto;

import uk.gegc.insightprep.features.learning.domain.model.LearningSession;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;

/**
 * A freshly started learning session together with the intake report of the
 * questions it was built from.
 */
public record LearningSessionStart(LearningSession session, IntakeReport intake) {
}
