package uk.gegc.insightprep.features.question.domain.model;

/**
 * Positional option code: {@code A} is the first option, {@code B} the second, and so on.
 */
public record LetterRef(char letter) implements SubmittedAnswer {

    public LetterRef {
        letter = Character.toUpperCase(letter);
        if (letter < 'A' || letter > 'Z') {
            throw new IllegalArgumentException("Option letter must be A-Z, got: " + letter);
        }
    }

    public int index() {
        return letter - 'A';
    }

    public static char forIndex(int index) {
        if (index < 0 || index > 25) {
            throw new IllegalArgumentException("No option letter for index " + index);
        }
        return (char) ('A' + index);
    }

    @Override
    public String describe() {
        return String.valueOf(letter);
    }
}
