package uk.gegc.insightprep.features.learning.domain.model;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.insightprep.features.learning.domain.event.AnswerJudgedEvent;
import uk.gegc.insightprep.features.learning.domain.event.LearningSessionCompletedEvent;
import uk.gegc.insightprep.features.question.application.AnswerNormalizer;
import uk.gegc.insightprep.features.question.application.OptionShuffler;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.shared.exception.InvalidTransitionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Untimed, sequential assessment with progressive disclosure.
 *
 * <p>Each question card moves {@code DISABLED -> ACTIVE -> LOCKED}. Exactly one
 * card is active while the session is in progress and none once it is complete.
 * Submitting locks the card and activates the next one regardless of verdict.
 * An incorrect answer may be retried (when allowed) until the next submission;
 * a retry reactivates the card and disables every later one.</p>
 *
 * <p>Not thread-safe: all transitions are reactions to discrete user events on one thread.</p>
 */
@Slf4j
public class LearningSession {

    private final String id;
    private final List<Question> sourceQuestions;
    private final List<Question> questions;
    private final SessionConfig config;
    private final AnswerNormalizer normalizer;
    private final OptionShuffler shuffler;
    private final ApplicationEventPublisher eventPublisher;

    private final CardState[] cards;
    private final Map<Integer, LedgerEntry> ledger = new TreeMap<>();
    private int score;
    private int lastSubmittedIndex = -1;
    private SessionStatus status = SessionStatus.IN_PROGRESS;

    /**
     * @param sourceQuestions validated questions as supplied, kept for restarts
     * @param questions       owned, shuffled copies presented in this session
     */
    public LearningSession(List<Question> sourceQuestions,
                           List<Question> questions,
                           SessionConfig config,
                           AnswerNormalizer normalizer,
                           OptionShuffler shuffler,
                           ApplicationEventPublisher eventPublisher) {
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("A learning session needs at least one question");
        }
        this.id = UUID.randomUUID().toString();
        this.sourceQuestions = List.copyOf(sourceQuestions);
        this.questions = new ArrayList<>(questions);
        this.config = config;
        this.normalizer = normalizer;
        this.shuffler = shuffler;
        this.eventPublisher = eventPublisher;
        this.cards = new CardState[questions.size()];
        Arrays.fill(cards, CardState.DISABLED);
        cards[0] = CardState.ACTIVE;
    }

    /**
     * Judges and records an answer for the active card. Anything else (a locked,
     * disabled or out-of-range card, or a completed session) is logged and ignored.
     *
     * @return the outcome, or empty when the submission was not accepted
     */
    public Optional<SubmissionOutcome> submit(int index, SubmittedAnswer answer) {
        try {
            guardSubmit(index, answer);
        } catch (InvalidTransitionException e) {
            log.warn("Session {}: {}", id, e.getMessage());
            return Optional.empty();
        }

        Question question = questions.get(index);
        boolean verdict = normalizer.judge(question, answer);
        LedgerEntry previous = ledger.get(index);
        int attempts = previous == null ? 1 : previous.attempts() + 1;
        ledger.put(index, new LedgerEntry(verdict, answer, attempts));
        // guardSubmit rules out a previous correct entry, so this awards at most one point per question
        if (verdict) {
            score++;
        }
        lastSubmittedIndex = index;
        cards[index] = CardState.LOCKED;
        advanceFrom(index);

        log.debug("Session {}: question {} judged {} (attempt {})", id, index, verdict ? "correct" : "wrong", attempts);
        eventPublisher.publishEvent(new AnswerJudgedEvent(this, id, index, verdict, answer));

        boolean complete = status == SessionStatus.COMPLETE;
        if (complete) {
            FinalScore finalScore = finalScore();
            log.info("Session {} complete: {}/{} ({}%)", id, finalScore.score(), finalScore.total(),
                    finalScore.percentage());
            eventPublisher.publishEvent(new LearningSessionCompletedEvent(this, id, finalScore.score(),
                    finalScore.total(), ledger));
        }

        return Optional.of(new SubmissionOutcome(
                index,
                verdict,
                answer,
                isRetryAvailable(index),
                complete,
                config.showImmediate() ? FeedbackPolicy.feedbackFor(config, question, index, ledger.get(index)) : null
        ));
    }

    /**
     * Reopens the last submitted question after an incorrect verdict: its
     * options are reshuffled, its feedback is cleared and it becomes the active
     * card again. Later cards are disabled until it is resubmitted.
     *
     * @return the new state of the card, or empty when no retry is available
     */
    public Optional<CardState> retry(int index) {
        try {
            guardRetry(index);
        } catch (InvalidTransitionException e) {
            log.warn("Session {}: {}", id, e.getMessage());
            return Optional.empty();
        }

        shuffler.reshuffleOptions(questions.get(index));
        cards[index] = CardState.ACTIVE;
        for (int i = index + 1; i < cards.length; i++) {
            cards[i] = CardState.DISABLED;
        }
        status = SessionStatus.IN_PROGRESS;
        log.debug("Session {}: retrying question {}", id, index);
        return Optional.of(cards[index]);
    }

    public boolean isRetryAvailable(int index) {
        if (!config.allowRetry() || index != lastSubmittedIndex || !inRange(index)) {
            return false;
        }
        LedgerEntry entry = ledger.get(index);
        return cards[index] == CardState.LOCKED && entry != null && !entry.correct();
    }

    /**
     * Immediate feedback for a locked question. Empty when feedback is delayed,
     * the question is unanswered, or a retry has cleared it.
     */
    public Optional<QuestionFeedback> feedbackFor(int index) {
        if (!config.showImmediate() || !inRange(index) || cards[index] != CardState.LOCKED) {
            return Optional.empty();
        }
        LedgerEntry entry = ledger.get(index);
        return entry == null
                ? Optional.empty()
                : Optional.of(FeedbackPolicy.feedbackFor(config, questions.get(index), index, entry));
    }

    /**
     * Terminal reveal: re-presents the already computed ledger for every
     * answered question. Nothing is judged again.
     */
    public List<QuestionFeedback> reveal() {
        if (status != SessionStatus.COMPLETE) {
            log.warn("Session {}: reveal requested before completion, ignoring", id);
            return List.of();
        }
        List<QuestionFeedback> feedback = new ArrayList<>(ledger.size());
        ledger.forEach((index, entry) ->
                feedback.add(FeedbackPolicy.feedbackFor(config, questions.get(index), index, entry)));
        return feedback;
    }

    public FinalScore finalScore() {
        FinalScore finalScore = FinalScore.fromLedger(ledger, questions.size());
        if (finalScore.score() != score) {
            log.error("Session {}: score counter {} drifted from ledger count {}, using ledger",
                    id, score, finalScore.score());
            score = finalScore.score();
        }
        return finalScore;
    }

    public CardState getCardState(int index) {
        if (!inRange(index)) {
            throw new IndexOutOfBoundsException("No question at index " + index);
        }
        return cards[index];
    }

    public List<CardState> getCardStates() {
        return List.of(cards);
    }

    public OptionalInt activeIndex() {
        for (int i = 0; i < cards.length; i++) {
            if (cards[i] == CardState.ACTIVE) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public Optional<LedgerEntry> ledgerEntry(int index) {
        return Optional.ofNullable(ledger.get(index));
    }

    public Map<Integer, LedgerEntry> getLedger() {
        return Collections.unmodifiableMap(ledger);
    }

    public int getScore() {
        return score;
    }

    public boolean isComplete() {
        return status == SessionStatus.COMPLETE;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public String getId() {
        return id;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public int size() {
        return questions.size();
    }

    public Question getQuestion(int index) {
        return questions.get(index);
    }

    public List<Question> getQuestions() {
        return Collections.unmodifiableList(questions);
    }

    public List<Question> getSourceQuestions() {
        return sourceQuestions;
    }

    private void advanceFrom(int index) {
        if (index + 1 < cards.length) {
            cards[index + 1] = CardState.ACTIVE;
            for (int i = index + 2; i < cards.length; i++) {
                cards[i] = CardState.DISABLED;
            }
        } else {
            status = SessionStatus.COMPLETE;
        }
    }

    private void guardSubmit(int index, SubmittedAnswer answer) {
        if (!inRange(index)) {
            throw new InvalidTransitionException("submit", index, "index out of range 0.." + (cards.length - 1));
        }
        if (status == SessionStatus.COMPLETE) {
            throw new InvalidTransitionException("submit", index, "session is complete");
        }
        if (cards[index] != CardState.ACTIVE) {
            throw new InvalidTransitionException("submit", index, "card is " + cards[index]);
        }
        if (answer == null) {
            throw new InvalidTransitionException("submit", index, "no answer selected");
        }
    }

    private void guardRetry(int index) {
        if (!inRange(index)) {
            throw new InvalidTransitionException("retry", index, "index out of range 0.." + (cards.length - 1));
        }
        if (!config.allowRetry()) {
            throw new InvalidTransitionException("retry", index, "retries are disabled");
        }
        if (!isRetryAvailable(index)) {
            throw new InvalidTransitionException("retry", index,
                    "only the last incorrectly answered question can be retried (card is " + cards[index] + ")");
        }
    }

    private boolean inRange(int index) {
        return index >= 0 && index < cards.length;
    }
}
