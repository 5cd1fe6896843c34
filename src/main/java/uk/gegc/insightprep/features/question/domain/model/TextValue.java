package uk.gegc.insightprep.features.question.domain.model;

import java.util.Objects;

public record TextValue(String value) implements SubmittedAnswer {

    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String describe() {
        return value;
    }
}
