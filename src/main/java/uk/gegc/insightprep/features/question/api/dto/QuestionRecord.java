package uk.gegc.insightprep.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * A candidate question as supplied by a question bank file or assembled from
 * query rows. The shape is loose on purpose; {@code QuestionRecordMapper}
 * is the adapter boundary that turns it into a {@code Question}.
 *
 * @param answer a string, an array of strings, or an object of pairs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionRecord(
        String id,
        @JsonAlias({"question_text", "text"}) String question,
        @JsonAlias("question_type") String type,
        List<String> options,
        @JsonAlias({"correct_answer", "correctAnswer"}) JsonNode answer,
        @JsonAlias("match_pairs") Map<String, String> matchPairs,
        String explanation,
        String reference,
        String topic,
        String subtopic
) {
}
