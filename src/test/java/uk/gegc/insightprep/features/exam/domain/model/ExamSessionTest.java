package uk.gegc.insightprep.features.exam.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.insightprep.features.exam.domain.event.ExamSubmittedEvent;
import uk.gegc.insightprep.features.exam.domain.repository.ProgressStore;
import uk.gegc.insightprep.features.exam.infra.persistence.InMemoryProgressStore;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.shared.exception.AutosaveFailureException;
import uk.gegc.insightprep.testsupport.QuestionFixtures;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExamSession")
class ExamSessionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryProgressStore store;
    private List<Question> questions;

    @BeforeEach
    void setUp() {
        store = new InMemoryProgressStore();
        questions = IntStream.range(0, 5).mapToObj(i -> QuestionFixtures.capital("q" + i)).toList();
    }

    private ExamSession exam(Duration duration) {
        return exam(duration, store);
    }

    private ExamSession exam(Duration duration, ProgressStore progressStore) {
        return new ExamSession(questions, duration, true, QuestionFixtures.normalizer(), progressStore,
                eventPublisher, clock);
    }

    @Test
    @DisplayName("Scenario C: time runs out with 2 of 5 unanswered")
    void scenarioC_timeUpSubmitsExactlyOnce() {
        ExamSession session = exam(Duration.ofSeconds(3));
        ScheduledFuture<?> timer = mock(ScheduledFuture.class);
        ScheduledFuture<?> autosave = mock(ScheduledFuture.class);
        session.bindScheduledTasks(List.of(timer, autosave));
        session.answer(0, SubmittedAnswer.text("Paris"));
        session.answer(1, SubmittedAnswer.letter('A'));
        session.answer(3, SubmittedAnswer.text("Berlin"));

        session.tick();
        session.tick();
        assertThat(session.isCompleted()).isFalse();
        session.tick();

        assertThat(session.isCompleted()).isTrue();
        ExamCompletion completion = session.getCompletion().orElseThrow();
        assertThat(completion.trigger()).isEqualTo(SubmissionTrigger.TIME_UP);
        assertThat(completion.results().totalQuestions()).isEqualTo(5);
        assertThat(completion.results().totalAnswered()).isEqualTo(3);
        assertThat(completion.results().correctCount()).isEqualTo(2);
        assertThat(completion.results().percentage()).isEqualTo(40);
        assertThat(completion.results().answeredPercentage()).isEqualTo(67);
        assertThat(completion.results().timeSpentSeconds()).isEqualTo(3);
        verify(timer).cancel(false);
        verify(autosave).cancel(false);

        session.tick();
        session.tick();
        assertThat(session.getRemainingSeconds()).isZero();
        assertThat(session.submit()).isEmpty();
        assertThat(session.answer(2, SubmittedAnswer.text("Paris"))).isFalse();
        verify(eventPublisher, times(1)).publishEvent(any(ExamSubmittedEvent.class));
    }

    @Nested
    @DisplayName("navigation and answers")
    class Navigation {

        @Test
        void navigateNeverTouchesAnswersOrBookmarks() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.answer(1, SubmittedAnswer.text("Rome"));
            session.toggleBookmark(2);

            assertThat(session.navigate(4)).isTrue();
            assertThat(session.navigate(0)).isTrue();
            assertThat(session.navigate(5)).isFalse();
            assertThat(session.navigate(-1)).isFalse();

            assertThat(session.getCurrentQuestionIndex()).isZero();
            assertThat(session.getAnswers()).containsOnlyKeys(1);
            assertThat(session.getBookmarks()).containsExactly(2);
        }

        @Test
        void answersAreOverwrittenAndCleared() {
            ExamSession session = exam(Duration.ofMinutes(5));

            session.answer(0, SubmittedAnswer.text("Rome"));
            session.answer(0, SubmittedAnswer.text("Paris"));
            assertThat(session.answerFor(0)).contains(SubmittedAnswer.text("Paris"));

            session.clear(0);
            assertThat(session.answerFor(0)).isEmpty();
            assertThat(session.answer(9, SubmittedAnswer.text("Paris"))).isFalse();
        }

        @Test
        void bookmarkToggleIsSymmetric() {
            ExamSession session = exam(Duration.ofMinutes(5));

            assertThat(session.toggleBookmark(3)).contains(true);
            assertThat(session.isBookmarked(3)).isTrue();
            assertThat(session.toggleBookmark(3)).contains(false);
            assertThat(session.isBookmarked(3)).isFalse();
            assertThat(session.toggleBookmark(7)).isEmpty();
        }

        @Test
        void progressCountsAnsweredAndBookmarked() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.answer(0, SubmittedAnswer.text("Paris"));
            session.answer(4, SubmittedAnswer.text("Rome"));
            session.toggleBookmark(4);

            assertThat(session.progress()).isEqualTo(new ExamProgress(2, 3, 1, 40));
        }
    }

    @Nested
    @DisplayName("submission")
    class Submission {

        @Test
        void manualSubmitJudgesWithTheSharedNormalizer() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.answer(0, SubmittedAnswer.text(" paris "));
            session.answer(1, SubmittedAnswer.letter('A'));
            session.toggleBookmark(1);
            session.tick();

            ExamCompletion completion = session.submit().orElseThrow();

            assertThat(completion.trigger()).isEqualTo(SubmissionTrigger.MANUAL);
            assertThat(completion.results()).isEqualTo(new ExamResults(5, 2, 2, 40, 100, 1));
            assertThat(completion.bookmarks()).containsExactly(1);
            assertThat(completion.submittedAt()).isEqualTo(NOW);
        }

        @Test
        void submitRemovesTheSavedSnapshot() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.autosave();
            assertThat(store.load(ProgressStore.EXAM_PROGRESS_KEY)).isPresent();

            session.submit();

            assertThat(store.load(ProgressStore.EXAM_PROGRESS_KEY)).isEmpty();
        }

        @Test
        void tasksBoundAfterSubmissionAreCancelledImmediately() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.submit();
            ScheduledFuture<?> late = mock(ScheduledFuture.class);

            session.bindScheduledTasks(List.of(late));

            verify(late).cancel(false);
        }
    }

    @Nested
    @DisplayName("autosave")
    class Autosave {

        @Test
        void writesAnswersBookmarksAndRemainingTime() {
            ExamSession session = exam(Duration.ofSeconds(120));
            session.answer(2, SubmittedAnswer.selection("A", "B"));
            session.toggleBookmark(0);
            session.navigate(2);
            session.tick();

            assertThat(session.autosave()).isTrue();

            ExamSnapshot snapshot = store.load(ProgressStore.EXAM_PROGRESS_KEY).orElseThrow();
            assertThat(snapshot.sessionId()).isEqualTo(session.getId());
            assertThat(snapshot.answers()).containsEntry(2, SubmittedAnswer.selection("Paris", "Berlin"));
            assertThat(snapshot.bookmarks()).containsExactly(0);
            assertThat(snapshot.remainingSeconds()).isEqualTo(119);
            assertThat(snapshot.currentQuestionIndex()).isEqualTo(2);
            assertThat(snapshot.lastSaved()).isEqualTo(NOW);
        }

        @Test
        void storesLetterAnswersAsOptionText() {
            ExamSession session = exam(Duration.ofSeconds(120));
            session.answer(0, SubmittedAnswer.letter('C'));
            session.answer(1, SubmittedAnswer.letter('Z'));
            session.answer(3, SubmittedAnswer.text("Rome"));

            session.autosave();

            ExamSnapshot snapshot = store.load(ProgressStore.EXAM_PROGRESS_KEY).orElseThrow();
            assertThat(snapshot.answers())
                    .containsEntry(0, SubmittedAnswer.text("Madrid"))
                    .containsEntry(1, SubmittedAnswer.letter('Z'))
                    .containsEntry(3, SubmittedAnswer.text("Rome"));
            assertThat(session.answerFor(0)).contains(SubmittedAnswer.letter('C'));
        }

        @Test
        void failureIsSwallowedAndTheTimerKeepsRunning() {
            ProgressStore failing = mock(ProgressStore.class);
            doThrow(new AutosaveFailureException("disk full", null))
                    .when(failing).save(eq(ProgressStore.EXAM_PROGRESS_KEY), any(ExamSnapshot.class));
            ExamSession session = exam(Duration.ofSeconds(10), failing);

            assertThatCode(session::autosave).doesNotThrowAnyException();
            assertThat(session.autosave()).isFalse();
            session.tick();

            assertThat(session.getRemainingSeconds()).isEqualTo(9);
            assertThat(session.isCompleted()).isFalse();
        }

        @Test
        void disabledAutosaveWritesNothing() {
            ExamSession session = new ExamSession(questions, Duration.ofMinutes(1), false,
                    QuestionFixtures.normalizer(), store, eventPublisher, clock);

            assertThat(session.autosave()).isFalse();
            assertThat(store.load(ProgressStore.EXAM_PROGRESS_KEY)).isEmpty();
        }
    }

    @Nested
    @DisplayName("restore")
    class Restore {

        @Test
        void restoresOnlyWhenAskedAndIgnoresOutOfRangeEntries() {
            ExamSnapshot snapshot = new ExamSnapshot("old",
                    Map.of(1, SubmittedAnswer.text("Paris"), 42, SubmittedAnswer.text("Rome")),
                    Set.of(1, 99), 45, 1, NOW.minusSeconds(30));
            ExamSession session = exam(Duration.ofMinutes(5));
            assertThat(session.getAnswers()).isEmpty();

            assertThat(session.restore(snapshot)).isTrue();

            assertThat(session.getAnswers()).containsOnlyKeys(1);
            assertThat(session.getBookmarks()).containsExactly(1);
            assertThat(session.getRemainingSeconds()).isEqualTo(45);
            assertThat(session.getCurrentQuestionIndex()).isEqualTo(1);
        }

        @Test
        void finishedExamCannotBeRestored() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.submit();

            assertThat(session.restore(session.snapshot())).isFalse();
        }
    }

    @Nested
    @DisplayName("exit")
    class Exit {

        @Test
        void leavingARunningExamNeedsConfirmation() {
            ExamSession session = exam(Duration.ofMinutes(5));
            ScheduledFuture<?> timer = mock(ScheduledFuture.class);
            session.bindScheduledTasks(List.of(timer));
            session.autosave();

            assertThat(session.requestExit()).isEqualTo(ExitDecision.CONFIRMATION_REQUIRED);
            assertThat(session.confirmExit()).isTrue();

            assertThat(session.isExitAllowed()).isTrue();
            assertThat(session.isDiscarded()).isTrue();
            assertThat(session.isCompleted()).isFalse();
            assertThat(store.load(ProgressStore.EXAM_PROGRESS_KEY)).isEmpty();
            verify(timer).cancel(false);
            session.tick();
            assertThat(session.getRemainingSeconds()).isEqualTo(300);
            assertThat(session.submit()).isEmpty();
        }

        @Test
        void cancelledExitKeepsTheExamRunning() {
            ExamSession session = exam(Duration.ofMinutes(5));

            session.requestExit();
            session.cancelExit();

            assertThat(session.isExitRequested()).isFalse();
            assertThat(session.confirmExit()).isFalse();
            assertThat(session.isDiscarded()).isFalse();
        }

        @Test
        void finishedExamMayBeLeftFreely() {
            ExamSession session = exam(Duration.ofMinutes(5));
            session.submit();

            assertThat(session.requestExit()).isEqualTo(ExitDecision.EXIT_ALLOWED);
        }
    }
}
