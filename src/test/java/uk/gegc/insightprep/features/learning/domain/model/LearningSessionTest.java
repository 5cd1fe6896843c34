package uk.gegc.insightprep.features.learning.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.insightprep.features.learning.domain.event.AnswerJudgedEvent;
import uk.gegc.insightprep.features.learning.domain.event.LearningSessionCompletedEvent;
import uk.gegc.insightprep.features.question.application.OptionShuffler;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SingleOption;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.testsupport.QuestionFixtures;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LearningSession")
class LearningSessionTest {

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final OptionShuffler shuffler = new OptionShuffler(() -> new Random(7));

    private LearningSession session(SessionConfig config, Question... questions) {
        List<Question> source = List.of(questions);
        return new LearningSession(source, shuffler.prepareSessionQuestions(source), config,
                QuestionFixtures.normalizer(), shuffler, eventPublisher);
    }

    private static SubmittedAnswer correctFor(Question question) {
        return SubmittedAnswer.text(((SingleOption) question.getCorrectAnswer()).option());
    }

    private static SubmittedAnswer wrongFor(Question question) {
        String correct = ((SingleOption) question.getCorrectAnswer()).option();
        return SubmittedAnswer.text(question.getOptions().stream()
                .filter(option -> !option.equals(correct))
                .findFirst()
                .orElseThrow());
    }

    private static long activeCount(LearningSession session) {
        return session.getCardStates().stream().filter(state -> state == CardState.ACTIVE).count();
    }

    @Test
    @DisplayName("Scenario A: correct, wrong, correct scores 2 of 3")
    void scenarioA() {
        LearningSession session = session(SessionConfig.defaults().toBuilder().allowRetry(false).build(),
                QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"), QuestionFixtures.capital("q3"));

        session.submit(0, correctFor(session.getQuestion(0)));
        session.submit(1, wrongFor(session.getQuestion(1)));
        session.submit(2, correctFor(session.getQuestion(2)));

        assertThat(session.isComplete()).isTrue();
        assertThat(session.getLedger()).hasSize(3);
        assertThat(session.getScore()).isEqualTo(2);
        FinalScore finalScore = session.finalScore();
        assertThat(finalScore.score()).isEqualTo(2);
        assertThat(finalScore.percentage()).isEqualTo(67);
        assertThat(finalScore.band()).isEqualTo(PerformanceBand.FAIR);
        assertThat(session.getCardStates()).containsOnly(CardState.LOCKED);
        verify(eventPublisher, times(1)).publishEvent(any(LearningSessionCompletedEvent.class));
    }

    @Test
    @DisplayName("Scenario B: multiple choice in a session")
    void scenarioB() {
        Question question = QuestionFixtures.multiple("b", List.of("Paris", "Lyon", "Nice"), "Paris", "Lyon");
        LearningSession ordered = session(SessionConfig.defaults(), question);
        LearningSession partial = session(SessionConfig.defaults(), question);

        assertThat(ordered.submit(0, SubmittedAnswer.selection("Lyon", "Paris")).orElseThrow().verdict()).isTrue();
        assertThat(partial.submit(0, SubmittedAnswer.selection("Paris")).orElseThrow().verdict()).isFalse();
    }

    @Nested
    @DisplayName("progression")
    class Progression {

        @Test
        void startsWithFirstCardActive() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"), QuestionFixtures.capital("q3"));

            assertThat(session.getCardStates())
                    .containsExactly(CardState.ACTIVE, CardState.DISABLED, CardState.DISABLED);
        }

        @Test
        void exactlyOneCardIsActiveUntilComplete() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"), QuestionFixtures.capital("q3"));

            for (int i = 0; i < 3; i++) {
                assertThat(activeCount(session)).isEqualTo(1);
                assertThat(session.activeIndex()).hasValue(i);
                session.submit(i, wrongFor(session.getQuestion(i)));
            }

            assertThat(session.isComplete()).isTrue();
            assertThat(activeCount(session)).isZero();
            assertThat(session.activeIndex()).isEmpty();
        }

        @Test
        void submittingADisabledCard_isIgnored() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));

            assertThat(session.submit(1, SubmittedAnswer.text("Paris"))).isEmpty();
            assertThat(session.submit(5, SubmittedAnswer.text("Paris"))).isEmpty();
            assertThat(session.submit(0, null)).isEmpty();
            assertThat(session.getLedger()).isEmpty();
            verify(eventPublisher, never()).publishEvent(any(ApplicationEvent.class));
        }
    }

    @Nested
    @DisplayName("idempotence and scoring")
    class Scoring {

        @Test
        void resubmittingALockedCard_changesNothing() {
            LearningSession session = session(SessionConfig.defaults().toBuilder().allowRetry(false).build(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));
            session.submit(0, wrongFor(session.getQuestion(0)));
            LedgerEntry before = session.ledgerEntry(0).orElseThrow();

            assertThat(session.submit(0, correctFor(session.getQuestion(0)))).isEmpty();
            assertThat(session.submit(0, correctFor(session.getQuestion(0)))).isEmpty();

            assertThat(session.ledgerEntry(0)).contains(before);
            assertThat(session.getScore()).isZero();
        }

        @Test
        void retryThenCorrect_awardsOnePointAndStaysCorrect() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));

            SubmissionOutcome first = session.submit(0, wrongFor(session.getQuestion(0))).orElseThrow();
            assertThat(first.retryOffered()).isTrue();
            assertThat(session.retry(0)).contains(CardState.ACTIVE);
            assertThat(session.getCardStates()).containsExactly(CardState.ACTIVE, CardState.DISABLED);

            SubmissionOutcome second = session.submit(0, correctFor(session.getQuestion(0))).orElseThrow();

            assertThat(second.verdict()).isTrue();
            assertThat(second.retryOffered()).isFalse();
            assertThat(session.ledgerEntry(0).orElseThrow().attempts()).isEqualTo(2);
            assertThat(session.getScore()).isEqualTo(1);
            assertThat(session.retry(0)).isEmpty();
            assertThat(session.ledgerEntry(0).orElseThrow().correct()).isTrue();
        }

        @Test
        void scoreAlwaysMatchesLedger() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"), QuestionFixtures.capital("q3"));

            session.submit(0, wrongFor(session.getQuestion(0)));
            session.retry(0);
            session.submit(0, wrongFor(session.getQuestion(0)));
            session.retry(0);
            session.submit(0, correctFor(session.getQuestion(0)));
            session.submit(1, correctFor(session.getQuestion(1)));
            session.submit(2, wrongFor(session.getQuestion(2)));

            assertThat(session.getScore()).isEqualTo(session.finalScore().score()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("retry")
    class Retry {

        @Test
        void disabledByConfig() {
            LearningSession session = session(SessionConfig.defaults().toBuilder().allowRetry(false).build(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));
            SubmissionOutcome outcome = session.submit(0, wrongFor(session.getQuestion(0))).orElseThrow();

            assertThat(outcome.retryOffered()).isFalse();
            assertThat(session.retry(0)).isEmpty();
        }

        @Test
        void onlyTheLastSubmittedQuestionCanBeRetried() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"), QuestionFixtures.capital("q3"));
            session.submit(0, wrongFor(session.getQuestion(0)));
            session.submit(1, correctFor(session.getQuestion(1)));

            assertThat(session.isRetryAvailable(0)).isFalse();
            assertThat(session.retry(0)).isEmpty();
            assertThat(session.getCardState(2)).isEqualTo(CardState.ACTIVE);
        }

        @Test
        void retryingTheLastQuestion_reopensTheSession() {
            LearningSession session = session(SessionConfig.defaults(),
                    QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));
            session.submit(0, correctFor(session.getQuestion(0)));
            session.submit(1, wrongFor(session.getQuestion(1)));
            assertThat(session.isComplete()).isTrue();

            session.retry(1);

            assertThat(session.isComplete()).isFalse();
            assertThat(session.getStatus()).isEqualTo(SessionStatus.IN_PROGRESS);
            assertThat(session.feedbackFor(1)).isEmpty();
            session.submit(1, correctFor(session.getQuestion(1)));
            assertThat(session.isComplete()).isTrue();
            assertThat(session.finalScore().score()).isEqualTo(2);
        }

        @Test
        void retryKeepsOptionMembers() {
            LearningSession session = session(SessionConfig.defaults(), QuestionFixtures.capital("q1"));
            List<String> before = List.copyOf(session.getQuestion(0).getOptions());
            session.submit(0, wrongFor(session.getQuestion(0)));

            session.retry(0);

            assertThat(session.getQuestion(0).getOptions()).containsExactlyInAnyOrderElementsOf(before);
        }
    }

    @Nested
    @DisplayName("feedback")
    class Feedback {

        @Test
        void immediateFeedbackForWrongAnswerShowsExplanationAndCorrectAnswer() {
            LearningSession session = session(SessionConfig.defaults(), QuestionFixtures.capital("q1"));

            QuestionFeedback feedback = session.submit(0, wrongFor(session.getQuestion(0))).orElseThrow().feedback();

            assertThat(feedback.correct()).isFalse();
            assertThat(feedback.correctAnswerText()).isEqualTo("Paris");
            assertThat(feedback.explanation()).isEqualTo("Explanation for q1");
            assertThat(feedback.topic()).isNull();
        }

        @Test
        void onlyWrongMode_hidesExplanationForCorrectAnswers() {
            LearningSession session = session(SessionConfig.defaults(), QuestionFixtures.capital("q1"));

            QuestionFeedback feedback = session.submit(0, correctFor(session.getQuestion(0))).orElseThrow().feedback();

            assertThat(feedback.correct()).isTrue();
            assertThat(feedback.explanation()).isNull();
            assertThat(feedback.correctAnswerText()).isNull();
        }

        @Test
        void delayedFeedback_stillJudgesAtSubmissionAndRevealsAtTheEnd() {
            SessionConfig delayed = SessionConfig.builder()
                    .explanationMode(ExplanationMode.BOTH)
                    .allowRetry(false)
                    .showImmediate(false)
                    .showCorrectAnswer(true)
                    .showTopicSubtopic(true)
                    .build();
            LearningSession session = session(delayed, QuestionFixtures.capital("q1"), QuestionFixtures.capital("q2"));

            SubmissionOutcome outcome = session.submit(0, correctFor(session.getQuestion(0))).orElseThrow();
            assertThat(outcome.feedback()).isNull();
            assertThat(session.feedbackFor(0)).isEmpty();
            assertThat(session.ledgerEntry(0).orElseThrow().correct()).isTrue();
            assertThat(session.reveal()).isEmpty();

            session.submit(1, wrongFor(session.getQuestion(1)));
            List<QuestionFeedback> revealed = session.reveal();

            assertThat(revealed).extracting(QuestionFeedback::correct).containsExactly(true, false);
            assertThat(revealed).allSatisfy(f -> {
                assertThat(f.explanation()).isNotNull();
                assertThat(f.topic()).isEqualTo(Question.DEFAULT_TOPIC);
            });
        }

        @Test
        void everyAcceptedSubmissionPublishesAnAnswerEvent() {
            LearningSession session = session(SessionConfig.defaults(), QuestionFixtures.capital("q1"));
            SubmittedAnswer answer = correctFor(session.getQuestion(0));

            session.submit(0, answer);

            ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
            AnswerJudgedEvent judged = captor.getAllValues().stream()
                    .filter(AnswerJudgedEvent.class::isInstance)
                    .map(AnswerJudgedEvent.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertThat(judged.getSessionId()).isEqualTo(session.getId());
            assertThat(judged.isVerdict()).isTrue();
            assertThat(judged.getUserAnswer()).isEqualTo(answer);
        }
    }
}
