package uk.gegc.insightprep.features.question.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.api.dto.MatchPairRow;
import uk.gegc.insightprep.features.question.api.dto.OptionRow;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.api.dto.QuestionRow;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assembles question records from the rows of the question query layer
 * ({@code questions}, {@code options}, {@code match_pairs}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionRowAssembler {

    private final ObjectMapper objectMapper;

    public List<QuestionRecord> assemble(List<QuestionRow> questions,
                                         List<OptionRow> options,
                                         List<MatchPairRow> matchPairs) {
        Map<Long, List<OptionRow>> optionsByQuestion = options.stream()
                .sorted(Comparator.comparingLong(OptionRow::id))
                .collect(Collectors.groupingBy(OptionRow::questionId));
        Map<Long, List<MatchPairRow>> pairsByQuestion = matchPairs.stream()
                .sorted(Comparator.comparingLong(MatchPairRow::id))
                .collect(Collectors.groupingBy(MatchPairRow::questionId));

        List<QuestionRecord> records = questions.stream()
                .map(row -> assemble(row,
                        optionsByQuestion.getOrDefault(row.id(), List.of()),
                        pairsByQuestion.getOrDefault(row.id(), List.of())))
                .toList();
        log.debug("Assembled {} question records from {} option rows and {} match pair rows",
                records.size(), options.size(), matchPairs.size());
        return records;
    }

    public QuestionRecord assemble(QuestionRow row, List<OptionRow> options, List<MatchPairRow> matchPairs) {
        String type = row.questionType();
        List<String> optionTexts;
        JsonNode answer;
        Map<String, String> pairs = null;

        if ("match".equalsIgnoreCase(type)) {
            pairs = new LinkedHashMap<>();
            for (MatchPairRow pair : matchPairs) {
                pairs.put(pair.leftText(), pair.rightText());
            }
            optionTexts = List.of();
            answer = null;
        } else if ("truefalse".equalsIgnoreCase(type)) {
            optionTexts = List.of("True", "False");
            answer = options.stream()
                    .filter(OptionRow::correct)
                    .findFirst()
                    .<JsonNode>map(option -> objectMapper.getNodeFactory().textNode(option.optionText()))
                    .orElse(null);
        } else {
            optionTexts = options.stream().map(OptionRow::optionText).toList();
            ArrayNode correct = objectMapper.createArrayNode();
            options.stream().filter(OptionRow::correct).forEach(option -> correct.add(option.optionText()));
            answer = correct;
        }

        return new QuestionRecord(
                String.valueOf(row.id()),
                row.questionText(),
                type,
                optionTexts,
                answer,
                pairs,
                row.explanation(),
                row.reference(),
                row.topic(),
                row.subtopic()
        );
    }
}
