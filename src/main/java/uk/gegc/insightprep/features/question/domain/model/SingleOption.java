package uk.gegc.insightprep.features.question.domain.model;

import java.util.List;
import java.util.Objects;

public record SingleOption(String option) implements CorrectAnswer {

    public SingleOption {
        Objects.requireNonNull(option, "option");
    }

    @Override
    public List<String> optionValues() {
        return List.of(option);
    }

    @Override
    public String describe() {
        return option;
    }
}
