package uk.gegc.insightprep.features.question.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.question.domain.model.Question;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Randomizes question order and option order for presentation.
 *
 * <p>Option order carries no meaning: letter codes are resolved against the
 * shuffled list at judging time, so a reshuffle never changes which answer is
 * correct.</p>
 *
 * <p>Questions are shuffled at two points:</p>
 * <ul>
 *   <li>1. Session start - question order and every question's options</li>
 *   <li>2. Retry - options of the retried question only</li>
 * </ul>
 */
@Slf4j
@Component
public class OptionShuffler {

    private final Supplier<Random> randomSupplier;

    public OptionShuffler(Supplier<Random> randomSupplier) {
        this.randomSupplier = randomSupplier;
    }

    /**
     * Deep-copies the source list, shuffles the copy's order and each copy's options.
     * The source list and its questions are left untouched.
     */
    public List<Question> prepareSessionQuestions(List<Question> source) {
        Random random = randomSupplier.get();
        List<Question> copies = new ArrayList<>(source.size());
        for (Question question : source) {
            Question copy = question.copy();
            shuffleOptions(copy, random);
            copies.add(copy);
        }
        Collections.shuffle(copies, random);
        log.debug("Prepared {} questions with shuffled order and options", copies.size());
        return copies;
    }

    /**
     * Copies without reordering questions; options are still shuffled. Used by
     * exam sessions, whose question order is fixed once the exam starts.
     */
    public List<Question> prepareFixedOrderQuestions(List<Question> source) {
        Random random = randomSupplier.get();
        List<Question> copies = new ArrayList<>(source.size());
        for (Question question : source) {
            Question copy = question.copy();
            shuffleOptions(copy, random);
            copies.add(copy);
        }
        return copies;
    }

    public void reshuffleOptions(Question question) {
        shuffleOptions(question, randomSupplier.get());
    }

    private void shuffleOptions(Question question, Random random) {
        List<String> options = new ArrayList<>(question.getOptions());
        if (options.size() < 2) {
            log.trace("No shuffling applied for question {} with {} options", question.getId(), options.size());
            return;
        }
        Collections.shuffle(options, random);
        question.setOptions(options);
    }
}
