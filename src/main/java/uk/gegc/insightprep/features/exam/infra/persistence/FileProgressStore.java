package uk.gegc.insightprep.features.exam.infra.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import uk.gegc.insightprep.features.exam.domain.model.ExamSnapshot;
import uk.gegc.insightprep.features.exam.domain.repository.ProgressStore;
import uk.gegc.insightprep.shared.config.InsightPrepProperties;
import uk.gegc.insightprep.shared.exception.AutosaveFailureException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keeps each snapshot as a JSON file named after its key. Writes go through a
 * temporary file and an atomic move, so a crash never leaves half a snapshot.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "insightprep.exam", name = "autosave-store", havingValue = "file", matchIfMissing = true)
public class FileProgressStore implements ProgressStore {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileProgressStore(ObjectMapper objectMapper, InsightPrepProperties properties) {
        this(objectMapper, Paths.get(properties.getExam().getAutosaveDirectory()));
    }

    public FileProgressStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    @Override
    public void save(String key, ExamSnapshot snapshot) {
        Path target = fileFor(key);
        Path temp;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key, ".tmp");
        } catch (IOException e) {
            throw new AutosaveFailureException("Failed to write snapshot " + key + " to " + target, e);
        }
        try {
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote snapshot {} to {}", key, target);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new AutosaveFailureException("Failed to write snapshot " + key + " to " + target, e);
        }
    }

    private void deleteQuietly(Path temp, IOException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException deleteFailure) {
            log.warn("Could not remove temporary snapshot file {}", temp, deleteFailure);
            cause.addSuppressed(deleteFailure);
        }
    }

    @Override
    public Optional<ExamSnapshot> load(String key) {
        Path source = fileFor(key);
        if (!Files.exists(source)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(source.toFile(), ExamSnapshot.class));
        } catch (IOException e) {
            throw new AutosaveFailureException("Failed to read snapshot " + key + " from " + source, e);
        }
    }

    @Override
    public void remove(String key) {
        Path target = fileFor(key);
        try {
            if (Files.deleteIfExists(target)) {
                log.debug("Removed snapshot {}", key);
            }
        } catch (IOException e) {
            throw new AutosaveFailureException("Failed to remove snapshot " + key + " at " + target, e);
        }
    }

    private Path fileFor(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid snapshot key: " + key);
        }
        return directory.resolve(key + ".json");
    }
}
