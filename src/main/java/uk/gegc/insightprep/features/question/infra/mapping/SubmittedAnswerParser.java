package uk.gegc.insightprep.features.question.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.LetterRef;
import uk.gegc.insightprep.features.question.domain.model.PairMap;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.features.question.domain.model.TextSet;
import uk.gegc.insightprep.features.question.domain.model.TextValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts untyped answer payloads from the rendering layer into the
 * {@link SubmittedAnswer} union, once, at the boundary:
 * <ul>
 *   <li>a single upper-case letter becomes a {@link LetterRef}</li>
 *   <li>any other string becomes a {@link TextValue}</li>
 *   <li>an array becomes a {@link TextSet}</li>
 *   <li>an object becomes a {@link PairMap}</li>
 * </ul>
 */
@Component
public class SubmittedAnswerParser {

    public SubmittedAnswer parse(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (raw.isArray()) {
            List<String> values = new ArrayList<>(raw.size());
            raw.forEach(node -> values.add(node.asText()));
            return new TextSet(values);
        }
        if (raw.isObject()) {
            Map<String, String> pairs = new LinkedHashMap<>();
            raw.fields().forEachRemaining(e -> pairs.put(e.getKey(), e.getValue().asText()));
            return new PairMap(pairs);
        }
        return parseText(raw.asText());
    }

    public SubmittedAnswer parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof SubmittedAnswer answer) {
            return answer;
        }
        if (raw instanceof JsonNode node) {
            return parse(node);
        }
        if (raw instanceof Iterable<?> values) {
            List<String> texts = new ArrayList<>();
            values.forEach(value -> texts.add(String.valueOf(value)));
            return new TextSet(texts);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, String> pairs = new LinkedHashMap<>();
            map.forEach((left, right) -> pairs.put(String.valueOf(left), right == null ? null : String.valueOf(right)));
            return new PairMap(pairs);
        }
        return parseText(String.valueOf(raw));
    }

    private SubmittedAnswer parseText(String text) {
        if (text.length() == 1 && text.charAt(0) >= 'A' && text.charAt(0) <= 'Z') {
            return new LetterRef(text.charAt(0));
        }
        return new TextValue(text);
    }
}
