package uk.gegc.insightprep.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.insightprep.features.question.api.dto.QuestionRecord;
import uk.gegc.insightprep.features.question.application.QuestionIntakeService;
import uk.gegc.insightprep.features.question.domain.model.ExcludedQuestion;
import uk.gegc.insightprep.features.question.domain.model.IntakeReport;
import uk.gegc.insightprep.features.question.domain.model.Question;
import uk.gegc.insightprep.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.insightprep.features.question.infra.mapping.QuestionRecordMapper;
import uk.gegc.insightprep.shared.exception.MalformedQuestionException;
import uk.gegc.insightprep.shared.exception.NoValidQuestionsException;
import uk.gegc.insightprep.shared.exception.NoValidQuestionsReason;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionIntakeServiceImpl implements QuestionIntakeService {

    private final QuestionRecordMapper recordMapper;
    private final QuestionHandlerFactory handlerFactory;

    @Override
    public IntakeReport intakeRecords(List<QuestionRecord> records) {
        List<Question> accepted = new ArrayList<>();
        List<ExcludedQuestion> excluded = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < records.size(); i++) {
            QuestionRecord record = records.get(i);
            if (record == null) {
                exclude(excluded, "#" + i, i, "Question is null or undefined");
                continue;
            }
            try {
                Question question = recordMapper.toQuestion(record, i);
                accept(question, i, seenIds, accepted);
            } catch (MalformedQuestionException e) {
                exclude(excluded, e.getQuestionId(), i, e.getReason());
            }
        }
        return report(accepted, excluded, records.size());
    }

    @Override
    public IntakeReport intakeQuestions(List<Question> questions) {
        List<Question> accepted = new ArrayList<>();
        List<ExcludedQuestion> excluded = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            if (question == null) {
                exclude(excluded, "#" + i, i, "Question is null or undefined");
                continue;
            }
            try {
                accept(question, i, seenIds, accepted);
            } catch (MalformedQuestionException e) {
                exclude(excluded, e.getQuestionId() == null ? "#" + i : e.getQuestionId(), i, e.getReason());
            }
        }
        return report(accepted, excluded, questions.size());
    }

    @Override
    public IntakeReport requireValid(IntakeReport report) {
        if (!report.accepted().isEmpty()) {
            return report;
        }
        NoValidQuestionsReason reason = report.candidateCount() == 0
                ? NoValidQuestionsReason.NOTHING_MATCHED
                : NoValidQuestionsReason.ALL_INVALID;
        log.info("No valid questions to start a session: {} ({})", reason, report.summary());
        throw new NoValidQuestionsException(reason, report.excluded());
    }

    private void accept(Question question, int position, Set<String> seenIds, List<Question> accepted) {
        if (question.getId() == null || question.getId().isBlank()) {
            question.setId("#" + position);
        }
        if (question.getType() == null) {
            throw new MalformedQuestionException(question.getId(), "Missing question type");
        }
        handlerFactory.findHandler(question.getType())
                .orElseThrow(() -> new MalformedQuestionException(question.getId(),
                        "Unsupported question type: " + question.getType()))
                .validate(question);
        if (!seenIds.add(question.getId())) {
            throw new MalformedQuestionException(question.getId(), "Duplicate question id");
        }
        accepted.add(question);
    }

    private void exclude(List<ExcludedQuestion> excluded, String id, int position, String reason) {
        log.warn("Excluding question {} at position {}: {}", id, position, reason);
        excluded.add(new ExcludedQuestion(id, position, reason));
    }

    private IntakeReport report(List<Question> accepted, List<ExcludedQuestion> excluded, int candidates) {
        IntakeReport report = new IntakeReport(accepted, excluded, candidates);
        log.info("Question intake complete: {}", report.summary());
        return report;
    }
}
