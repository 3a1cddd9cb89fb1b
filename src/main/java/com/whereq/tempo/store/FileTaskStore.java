package com.whereq.tempo.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.tempo.exception.CorruptStateException;
import com.whereq.tempo.exception.DuplicateIdException;
import com.whereq.tempo.exception.InvalidTransitionException;
import com.whereq.tempo.exception.JobNotFoundException;
import com.whereq.tempo.exception.StoreWriteException;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.model.QueueSnapshot;
import com.whereq.tempo.model.QueueStatistics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Task store backed by a single JSON file.
 *
 * Every write goes to a sibling temp file which is forced to disk and then
 * renamed over the queue file, so a crash mid-write leaves the previous
 * version intact. The in-memory view only changes after the write succeeded.
 */
@Slf4j
public class FileTaskStore implements TaskStore {

    private final Path file;
    private final ObjectMapper objectMapper;

    // guarded by this
    private LinkedHashMap<String, Job> jobs = new LinkedHashMap<>();

    public FileTaskStore(Path file) {
        this(file, defaultObjectMapper());
    }

    public FileTaskStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used for the queue file: ISO-8601 instants, duplicate keys rejected
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public synchronized QueueSnapshot load() {
        if (!Files.exists(file)) {
            log.info("No queue file at {}, starting with an empty queue", file);
            jobs = new LinkedHashMap<>();
            return QueueSnapshot.empty();
        }

        QueueSnapshot snapshot = readSnapshot();
        jobs = new LinkedHashMap<>(snapshot.getJobs());

        log.info("Loaded {} jobs from {}", jobs.size(), file);
        return snapshot.copy();
    }

    @Override
    public synchronized void save(QueueSnapshot snapshot) {
        if (snapshot.getVersion() != QueueSnapshot.CURRENT_VERSION) {
            throw new IllegalArgumentException("Cannot save snapshot with version " + snapshot.getVersion());
        }

        for (Map.Entry<String, Job> entry : jobs.entrySet()) {
            Job replacement = snapshot.getJobs().get(entry.getKey());
            JobState from = entry.getValue().getState();
            if (replacement == null) {
                throw new InvalidTransitionException(entry.getKey(), from, null,
                    "Snapshot would drop job " + entry.getKey());
            }
            if (replacement.getState() != from && !isLegal(entry.getValue(), replacement.getState())) {
                throw new InvalidTransitionException(entry.getKey(), from, replacement.getState());
            }
        }

        LinkedHashMap<String, Job> next = snapshot.copy().getJobs();
        write(next);
        jobs = next;
    }

    @Override
    public synchronized Job append(Job job) {
        if (jobs.containsKey(job.getId())) {
            throw new DuplicateIdException(job.getId());
        }

        Job stored = job.copy();
        stored.setState(JobState.PENDING);

        LinkedHashMap<String, Job> next = new LinkedHashMap<>(jobs);
        next.put(stored.getId(), stored);
        write(next);
        jobs = next;

        log.debug("Appended job {}", stored.getId());
        return stored.copy();
    }

    @Override
    public synchronized Job update(String jobId, JobState target, Consumer<Job> mutation) {
        Job current = jobs.get(jobId);
        if (current == null) {
            throw new JobNotFoundException(jobId);
        }
        if (!isLegal(current, target)) {
            throw new InvalidTransitionException(jobId, current.getState(), target);
        }

        Job updated = current.copy();
        mutation.accept(updated);
        updated.setId(jobId);
        updated.setState(target);

        replace(updated);
        log.debug("Job {} state updated: {} → {}", jobId, current.getState(), target);
        return updated.copy();
    }

    @Override
    public synchronized Job amend(String jobId, Consumer<Job> mutation) {
        Job current = jobs.get(jobId);
        if (current == null) {
            throw new JobNotFoundException(jobId);
        }

        Job updated = current.copy();
        mutation.accept(updated);
        if (updated.getState() != current.getState()) {
            throw new InvalidTransitionException(jobId, current.getState(), updated.getState(),
                "State of job " + jobId + " can only change through update()");
        }
        updated.setId(jobId);

        replace(updated);
        return updated.copy();
    }

    @Override
    public synchronized Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(Job::copy);
    }

    @Override
    public synchronized List<Job> list() {
        List<Job> all = new ArrayList<>(jobs.size());
        jobs.values().forEach(job -> all.add(job.copy()));
        return all;
    }

    @Override
    public synchronized List<Job> listByState(JobState state) {
        List<Job> matching = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.getState() == state) {
                matching.add(job.copy());
            }
        }
        return matching;
    }

    @Override
    public synchronized QueueStatistics statistics() {
        return QueueStatistics.of(jobs.values());
    }

    @Override
    public synchronized void quarantineAndReset() {
        if (Files.exists(file)) {
            Path quarantine = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
            try {
                Files.move(file, quarantine);
            } catch (IOException e) {
                throw new StoreWriteException("Failed to move corrupt queue file " + file + " aside", e);
            }
            log.warn("Moved unreadable queue file {} to {}", file, quarantine);
        }
        jobs = new LinkedHashMap<>();
    }

    private static boolean isLegal(Job current, JobState target) {
        if (!current.getState().canTransitionTo(target)) {
            return false;
        }
        // a retry must leave room for one more attempt
        return !(current.getState() == JobState.FAILED && target == JobState.PENDING)
            || current.hasAttemptsRemaining();
    }

    private void replace(Job updated) {
        LinkedHashMap<String, Job> next = new LinkedHashMap<>(jobs);
        next.put(updated.getId(), updated);
        write(next);
        jobs = next;
    }

    private QueueSnapshot readSnapshot() {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new CorruptStateException("Queue file " + file + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CorruptStateException("Failed to read queue file " + file, e);
        }

        if (root == null || !root.isObject()) {
            throw new CorruptStateException("Queue file " + file + " does not contain a queue snapshot");
        }

        JsonNode version = root.get("version");
        if (version == null || !version.canConvertToInt() || version.asInt() != QueueSnapshot.CURRENT_VERSION) {
            throw new CorruptStateException("Unsupported queue file version " + version
                + " in " + file + " (expected " + QueueSnapshot.CURRENT_VERSION + ")");
        }

        QueueSnapshot snapshot;
        try {
            snapshot = objectMapper.treeToValue(root, QueueSnapshot.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptStateException("Queue file " + file + " has an invalid job record: " + e.getMessage(), e);
        }
        if (snapshot.getJobs() == null) {
            throw new CorruptStateException("Queue file " + file + " has no job table");
        }

        for (Map.Entry<String, Job> entry : snapshot.getJobs().entrySet()) {
            validateRecord(entry.getKey(), entry.getValue());
        }
        return snapshot;
    }

    private void validateRecord(String key, Job job) {
        if (job == null || job.getId() == null || !job.getId().equals(key)) {
            throw new CorruptStateException("Job record under key " + key + " has a mismatching id");
        }
        if (job.getState() == null) {
            throw new CorruptStateException("Job " + key + " has no state");
        }
        if (job.getMaxAttempts() < 1 || job.getAttemptCount() < 0 || job.getAttemptCount() > job.getMaxAttempts()) {
            throw new CorruptStateException("Job " + key + " has inconsistent attempts "
                + job.getAttemptCount() + "/" + job.getMaxAttempts());
        }
        if (job.getCreatedAt() == null) {
            throw new CorruptStateException("Job " + key + " has no creation time");
        }
    }

    private void write(LinkedHashMap<String, Job> next) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(new QueueSnapshot(QueueSnapshot.CURRENT_VERSION, next));
        } catch (JsonProcessingException e) {
            throw new StoreWriteException("Failed to serialize queue snapshot", e);
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreWriteException("Failed to write queue file " + file, e);
        }
    }
}
