package uk.gegc.insightprep.features.exam.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.insightprep.features.exam.application.ExamReportService;
import uk.gegc.insightprep.features.exam.domain.model.ExamCompletion;
import uk.gegc.insightprep.features.exam.domain.model.ExamReport;
import uk.gegc.insightprep.features.exam.domain.model.ExamSession;
import uk.gegc.insightprep.features.exam.domain.model.MatchReviewRow;
import uk.gegc.insightprep.features.exam.domain.model.QuestionReview;
import uk.gegc.insightprep.features.exam.domain.model.ReviewStatus;
import uk.gegc.insightprep.features.question.application.AnswerNormalizer;
import uk.gegc.insightprep.features.question.domain.model.PairMap;
import uk.gegc.insightprep.features.question.domain.model.PairMapping;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.domain.model.SubmittedAnswer;
import uk.gegc.insightprep.features.question.infra.handler.QuestionHandler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-derives per-question correctness for the exam report. Verdicts come from
 * {@link AnswerNormalizer}, the same contract that scored the submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExamReportServiceImpl implements ExamReportService {

    private final AnswerNormalizer answerNormalizer;

    @Override
    public ExamReport buildReport(ExamSession session) {
        ExamCompletion completion = session.getCompletion()
                .orElseThrow(() -> new IllegalStateException("Exam " + session.getId() + " has not been submitted"));
        return buildReport(session.getQuestions(), completion);
    }

    @Override
    public ExamReport buildReport(List<Question> questions, ExamCompletion completion) {
        List<QuestionReview> reviews = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            reviews.add(review(i, questions.get(i), completion));
        }
        long correct = reviews.stream().filter(r -> r.status() == ReviewStatus.CORRECT).count();
        if (correct != completion.results().correctCount()) {
            log.error("Report verdicts ({}) disagree with submitted results ({})", correct,
                    completion.results().correctCount());
        }
        return new ExamReport(completion.results(), completion.trigger(), completion.bookmarks().size(), reviews);
    }

    private QuestionReview review(int index, Question question, ExamCompletion completion) {
        SubmittedAnswer answer = completion.answers().get(index);
        ReviewStatus status;
        if (answer == null) {
            status = ReviewStatus.UNANSWERED;
        } else {
            status = answerNormalizer.judge(question, answer) ? ReviewStatus.CORRECT : ReviewStatus.INCORRECT;
        }

        String correctAnswerText = status == ReviewStatus.CORRECT || question.getCorrectAnswer() == null
                ? null
                : question.getCorrectAnswer().describe();

        return new QuestionReview(
                index + 1,
                question.getId(),
                question.getText(),
                status,
                completion.bookmarks().contains(index),
                question.getOptions(),
                answer == null ? null : answerNormalizer.describeResolved(question, answer),
                correctAnswerText,
                matchRows(question, answer)
        );
    }

    private List<MatchReviewRow> matchRows(Question question, SubmittedAnswer answer) {
        if (!(question.getCorrectAnswer() instanceof PairMapping mapping)) {
            return List.of();
        }
        Map<String, String> userByLeft = new HashMap<>();
        if (answer instanceof PairMap pairs) {
            pairs.pairs().forEach((left, right) -> userByLeft.put(QuestionHandler.normalize(left), right));
        }
        List<MatchReviewRow> rows = new ArrayList<>(mapping.pairs().size());
        mapping.pairs().forEach((left, expectedRight) -> {
            String userRight = userByLeft.get(QuestionHandler.normalize(left));
            boolean correct = userRight != null
                    && QuestionHandler.normalize(userRight).equals(QuestionHandler.normalize(expectedRight));
            rows.add(new MatchReviewRow(left, expectedRight, userRight, correct));
        });
        return rows;
    }
}
