package uk.gegc.insightprep.features.exam.infra.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.exam.domain.model.ExamSnapshot;
import uk.gegc.insightprep.features.exam.domain.repository.ProgressStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store; snapshots do not survive a restart.
 */
@Component
@ConditionalOnProperty(prefix = "insightprep.exam", name = "autosave-store", havingValue = "memory")
public class InMemoryProgressStore implements ProgressStore {

    private final Map<String, ExamSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(String key, ExamSnapshot snapshot) {
        snapshots.put(key, snapshot);
    }

    @Override
    public Optional<ExamSnapshot> load(String key) {
        return Optional.ofNullable(snapshots.get(key));
    }

    @Override
    public void remove(String key) {
        snapshots.remove(key);
    }
}
