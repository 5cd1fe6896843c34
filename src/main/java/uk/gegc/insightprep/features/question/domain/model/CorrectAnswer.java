package uk.gegc.insightprep.features.question.domain.model;

import java.util.List;

/**
 * The correct-answer contract of a question, shaped by its {@link QuestionType}.
 * <ul>
 *   <li>SINGLE_CHOICE / ASSERTION_REASON: {@link SingleOption}</li>
 *   <li>MULTIPLE_CHOICE: {@link OptionSet}</li>
 *   <li>MATCH: {@link PairMapping}</li>
 * </ul>
 */
public interface CorrectAnswer {

    /**
     * Option strings that make up this answer, in declaration order.
     * Empty for pair mappings.
     */
    List<String> optionValues();

    /**
     * Human-readable form used by feedback and reports.
     */
    String describe();
}
