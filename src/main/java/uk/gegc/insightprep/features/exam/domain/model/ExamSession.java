package uk.gegc.insightprep.features.exam.domain.model;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.insightprep.features.exam.domain.event.ExamSubmittedEvent;
import uk.gegc.insightprep.features.exam.domain.repository.ProgressStore;
import uk.gegc.insightprep.features.question.application.AnswerNormalizer;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.shared.exception.InvalidTransitionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Timed exam with free navigation. Answers are stored as given and only judged
 * on submission, which happens exactly once: manually or when the timer hits zero.
 *
 * <p>Ticks and autosaves arrive on the scheduler thread while answers arrive from
 * the caller, so every state access is synchronized on the session.</p>
 */
@Slf4j
public class ExamSession {

    private final String id;
    private final List<Question> questions;
    private final long durationSeconds;
    private final boolean autosaveEnabled;
    private final AnswerNormalizer normalizer;
    private final ProgressStore progressStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Instant startedAt;

    private final Map<Integer, SubmittedAnswer> answers = new TreeMap<>();
    private final Set<Integer> bookmarks = new TreeSet<>();
    private final List<ScheduledFuture<?>> scheduledTasks = new ArrayList<>();
    private long remainingSeconds;
    private int currentQuestionIndex;
    private boolean completed;
    private boolean discarded;
    private boolean exitRequested;
    private boolean exitAllowed;
    private ExamCompletion completion;

    public ExamSession(List<Question> questions,
                       Duration duration,
                       boolean autosaveEnabled,
                       AnswerNormalizer normalizer,
                       ProgressStore progressStore,
                       ApplicationEventPublisher eventPublisher,
                       Clock clock) {
        if (questions.isEmpty()) {
            throw new IllegalArgumentException("An exam needs at least one question");
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Exam duration must be positive, got " + duration);
        }
        this.id = UUID.randomUUID().toString();
        this.questions = List.copyOf(questions);
        this.durationSeconds = duration.toSeconds();
        this.remainingSeconds = durationSeconds;
        this.autosaveEnabled = autosaveEnabled;
        this.normalizer = normalizer;
        this.progressStore = progressStore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public synchronized boolean navigate(int index) {
        try {
            requireInRange("navigate", index);
        } catch (InvalidTransitionException e) {
            log.warn("Exam {}: {}", id, e.getMessage());
            return false;
        }
        currentQuestionIndex = index;
        return true;
    }

    /**
     * Stores the latest answer for a question, replacing any earlier one.
     * Correctness is not computed until submission.
     */
    public synchronized boolean answer(int index, SubmittedAnswer answer) {
        try {
            requireOpen("answer", index);
            if (answer == null) {
                throw new InvalidTransitionException("answer", index, "no answer given, use clear instead");
            }
        } catch (InvalidTransitionException e) {
            log.warn("Exam {}: {}", id, e.getMessage());
            return false;
        }
        answers.put(index, answer);
        return true;
    }

    public synchronized boolean clear(int index) {
        try {
            requireOpen("clear", index);
        } catch (InvalidTransitionException e) {
            log.warn("Exam {}: {}", id, e.getMessage());
            return false;
        }
        answers.remove(index);
        return true;
    }

    /**
     * @return whether the question is bookmarked after the toggle, or empty when rejected
     */
    public synchronized Optional<Boolean> toggleBookmark(int index) {
        try {
            requireOpen("bookmark", index);
        } catch (InvalidTransitionException e) {
            log.warn("Exam {}: {}", id, e.getMessage());
            return Optional.empty();
        }
        if (!bookmarks.remove(index)) {
            bookmarks.add(index);
            return Optional.of(true);
        }
        return Optional.of(false);
    }

    /**
     * One second of exam time. Reaching zero submits the exam with {@link SubmissionTrigger#TIME_UP}.
     * Ticks after completion or discard do nothing.
     */
    public synchronized void tick() {
        if (completed || discarded) {
            return;
        }
        remainingSeconds = Math.max(0, remainingSeconds - 1);
        if (remainingSeconds == 0) {
            log.info("Exam {}: time is up", id);
            submit(SubmissionTrigger.TIME_UP);
        }
    }

    /**
     * Writes the current state to the progress store. Failures are logged and
     * skipped, never thrown to the scheduler.
     *
     * @return whether a snapshot was written
     */
    public synchronized boolean autosave() {
        if (!autosaveEnabled || completed || discarded) {
            return false;
        }
        ExamSnapshot snapshot = snapshot();
        try {
            progressStore.save(ProgressStore.EXAM_PROGRESS_KEY, snapshot);
            log.debug("Exam {}: autosaved {} answers, {}s remaining", id, answers.size(), remainingSeconds);
            return true;
        } catch (RuntimeException e) {
            log.error("Exam {}: autosave failed, continuing without it", id, e);
            return false;
        }
    }

    public synchronized Optional<ExamCompletion> submit() {
        return submit(SubmissionTrigger.MANUAL);
    }

    /**
     * Ends the exam, stops the timer and autosave, judges every stored answer and
     * publishes an {@link ExamSubmittedEvent}. Only the first call has any effect.
     */
    public synchronized Optional<ExamCompletion> submit(SubmissionTrigger trigger) {
        if (completed) {
            log.warn("Exam {}: already submitted ({}), ignoring {} submission", id, completion.trigger(), trigger);
            return Optional.empty();
        }
        if (discarded) {
            log.warn("Exam {}: discarded, ignoring {} submission", id, trigger);
            return Optional.empty();
        }
        completed = true;
        cancelScheduledTasks();
        removeSnapshot();

        ExamResults results = computeResults();
        completion = new ExamCompletion(results, answers, bookmarks, trigger, clock.instant());
        log.info("Exam {} submitted ({}): {}/{} correct, {} answered, {}%", id, trigger,
                results.correctCount(), results.totalQuestions(), results.totalAnswered(), results.percentage());
        eventPublisher.publishEvent(new ExamSubmittedEvent(this, id, completion));
        return Optional.of(completion);
    }

    /**
     * Applies a previously saved snapshot. Only ever called explicitly by the owner
     * of the session; construction never restores on its own.
     */
    public synchronized boolean restore(ExamSnapshot snapshot) {
        if (completed || discarded) {
            log.warn("Exam {}: cannot restore into a finished exam", id);
            return false;
        }
        answers.clear();
        snapshot.answers().forEach((index, answer) -> {
            if (inRange(index) && answer != null) {
                answers.put(index, answer);
            }
        });
        bookmarks.clear();
        snapshot.bookmarks().stream().filter(this::inRange).forEach(bookmarks::add);
        remainingSeconds = Math.min(durationSeconds, Math.max(1, snapshot.remainingSeconds()));
        currentQuestionIndex = inRange(snapshot.currentQuestionIndex()) ? snapshot.currentQuestionIndex() : 0;
        log.info("Exam {}: restored snapshot from {} with {} answers", id, snapshot.lastSaved(), answers.size());
        return true;
    }

    /**
     * Current state with option letters resolved to option text. A restoring
     * session may present the options in another order.
     */
    public synchronized ExamSnapshot snapshot() {
        Map<Integer, SubmittedAnswer> resolved = new TreeMap<>();
        answers.forEach((index, answer) -> resolved.put(index, normalizer.resolveLetters(questions.get(index), answer)));
        return new ExamSnapshot(id, resolved, bookmarks, remainingSeconds, currentQuestionIndex, clock.instant());
    }

    public synchronized ExitDecision requestExit() {
        if (completed || discarded) {
            return ExitDecision.EXIT_ALLOWED;
        }
        exitRequested = true;
        return ExitDecision.CONFIRMATION_REQUIRED;
    }

    /**
     * Confirms a pending exit request. The exam is discarded and its progress is lost.
     */
    public synchronized boolean confirmExit() {
        if (!exitRequested && !completed) {
            log.warn("Exam {}: exit confirmed without a pending request, ignoring", id);
            return false;
        }
        exitAllowed = true;
        exitRequested = false;
        discard();
        return true;
    }

    public synchronized void cancelExit() {
        exitRequested = false;
    }

    /**
     * Stops both scheduled tasks and drops the stored snapshot. Idempotent.
     */
    public synchronized void discard() {
        if (discarded) {
            return;
        }
        discarded = true;
        cancelScheduledTasks();
        if (!completed) {
            removeSnapshot();
            log.info("Exam {} discarded with {} of {} answered", id, answers.size(), questions.size());
        }
    }

    /**
     * Hands the timer and autosave tasks to the session, which cancels them on
     * submission or discard. Tasks bound after that are cancelled straight away.
     */
    public synchronized void bindScheduledTasks(List<ScheduledFuture<?>> tasks) {
        scheduledTasks.addAll(tasks);
        if (completed || discarded) {
            cancelScheduledTasks();
        }
    }

    public synchronized ExamProgress progress() {
        int answered = answers.size();
        int total = questions.size();
        return new ExamProgress(answered, total - answered, bookmarks.size(),
                (int) Math.round(answered * 100.0 / total));
    }

    public synchronized Optional<SubmittedAnswer> answerFor(int index) {
        return Optional.ofNullable(answers.get(index));
    }

    public synchronized boolean isBookmarked(int index) {
        return bookmarks.contains(index);
    }

    public synchronized Map<Integer, SubmittedAnswer> getAnswers() {
        return Collections.unmodifiableMap(new TreeMap<>(answers));
    }

    public synchronized Set<Integer> getBookmarks() {
        return Collections.unmodifiableSet(new TreeSet<>(bookmarks));
    }

    public synchronized long getRemainingSeconds() {
        return remainingSeconds;
    }

    public synchronized int getCurrentQuestionIndex() {
        return currentQuestionIndex;
    }

    public synchronized boolean isCompleted() {
        return completed;
    }

    public synchronized boolean isDiscarded() {
        return discarded;
    }

    public synchronized boolean isExitRequested() {
        return exitRequested;
    }

    public synchronized boolean isExitAllowed() {
        return exitAllowed;
    }

    public synchronized Optional<ExamCompletion> getCompletion() {
        return Optional.ofNullable(completion);
    }

    public synchronized boolean hasActiveScheduledTasks() {
        return scheduledTasks.stream().anyMatch(task -> !task.isDone());
    }

    public String getId() {
        return id;
    }

    public List<Question> getQuestions() {
        return questions;
    }

    public Question getQuestion(int index) {
        return questions.get(index);
    }

    public int size() {
        return questions.size();
    }

    public long getDurationSeconds() {
        return durationSeconds;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    private ExamResults computeResults() {
        int correct = 0;
        for (Map.Entry<Integer, SubmittedAnswer> entry : answers.entrySet()) {
            if (normalizer.judge(questions.get(entry.getKey()), entry.getValue())) {
                correct++;
            }
        }
        int total = questions.size();
        int answered = answers.size();
        return new ExamResults(total, answered, correct,
                (int) Math.round(correct * 100.0 / total),
                answered == 0 ? 0 : (int) Math.round(correct * 100.0 / answered),
                durationSeconds - remainingSeconds);
    }

    private void cancelScheduledTasks() {
        scheduledTasks.forEach(task -> task.cancel(false));
        scheduledTasks.clear();
    }

    private void removeSnapshot() {
        if (!autosaveEnabled) {
            return;
        }
        try {
            progressStore.remove(ProgressStore.EXAM_PROGRESS_KEY);
        } catch (RuntimeException e) {
            log.error("Exam {}: could not remove saved progress", id, e);
        }
    }

    private void requireOpen(String operation, int index) {
        requireInRange(operation, index);
        if (completed) {
            throw new InvalidTransitionException(operation, index, "exam is already submitted");
        }
        if (discarded) {
            throw new InvalidTransitionException(operation, index, "exam was discarded");
        }
    }

    private void requireInRange(String operation, int index) {
        if (!inRange(index)) {
            throw new InvalidTransitionException(operation, index, "index out of range 0.." + (questions.size() - 1));
        }
    }

    private boolean inRange(int index) {
        return index >= 0 && index < questions.size();
    }
}
