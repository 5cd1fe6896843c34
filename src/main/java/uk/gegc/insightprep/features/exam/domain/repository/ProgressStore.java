package uk.gegc.insightprep.features.exam.domain.repository;

import uk.gegc.insightprep.features.exam.domain.model.ExamSnapshot;
import uk.gegc.insightprep.shared.exception.AutosaveFailureException;

import java.util.Optional;

/**
 * Durable local key-value store for exam autosave snapshots.
 */
public interface ProgressStore {

    String EXAM_PROGRESS_KEY = "examProgress";

    void save(String key, ExamSnapshot snapshot) throws AutosaveFailureException;

    Optional<ExamSnapshot> load(String key) throws AutosaveFailureException;

    void remove(String key) throws AutosaveFailureException;
}
