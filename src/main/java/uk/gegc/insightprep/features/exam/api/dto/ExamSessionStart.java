package uk.gegc.insightprep.features.exam.api.dto;

import uk.gegc.insightprep.features.exam.domain.model.ExamSession;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;

/**
 * A running exam plus the intake report listing any excluded questions.
 */
public record ExamSessionStart(ExamSession session, IntakeReport intake) {
}
