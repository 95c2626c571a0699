package com.brutesearch.orchestrator.service.checkpoint;

import com.brutesearch.orchestrator.entity.SearchJob;
import com.brutesearch.orchestrator.exception.CheckpointCorruptException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-backed persistence for {@link SearchJob} checkpoints.
 *
 * <p>Each job is written twice: {@code <jobId>.json} (pretty-printed JSON, the primary)
 * and {@code <jobId>.bak} (Smile binary mirror, written after the primary). Both writes go
 * to a temp file first and are moved into place, so a crash never leaves a half-written
 * document under the real name. Loading falls back from primary to mirror; if both are
 * unreadable the job starts fresh.
 */
@Slf4j
public class CheckpointStore {

    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path directory;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper smileMapper;

    public CheckpointStore(Path directory, ObjectMapper jsonMapper, ObjectMapper smileMapper) {
        this.directory = directory;
        this.jsonMapper = jsonMapper;
        this.smileMapper = smileMapper;
    }

    public static boolean isValidJobId(String jobId) {
        return jobId != null && JOB_ID.matcher(jobId).matches();
    }

    // ============================================
    // Write
    // ============================================

    public void save(SearchJob job) throws IOException {
        requireValid(job.getJobId());
        Files.createDirectories(directory);
        writeAtomically(primaryPath(job.getJobId()),
                jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(job));
        writeAtomically(backupPath(job.getJobId()), smileMapper.writeValueAsBytes(job));
        log.debug("Checkpoint saved: {}", job.getJobId());
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    // ============================================
    // Read
    // ============================================

    /**
     * @return the stored job, or empty when none exists or nothing readable survives
     */
    public Optional<SearchJob> load(String jobId) {
        requireValid(jobId);
        Path primary = primaryPath(jobId);
        Path backup = backupPath(jobId);

        if (Files.exists(primary)) {
            try {
                return Optional.of(read(primary, jsonMapper, jobId));
            } catch (CheckpointCorruptException e) {
                log.warn("Primary checkpoint for {} unreadable, trying backup: {}", jobId, e.getMessage());
            }
        }
        if (Files.exists(backup)) {
            try {
                SearchJob job = read(backup, smileMapper, jobId);
                log.info("Recovered checkpoint {} from binary backup", jobId);
                return Optional.of(job);
            } catch (CheckpointCorruptException e) {
                log.warn("Backup checkpoint for {} unreadable: {}", jobId, e.getMessage());
            }
        }
        if (Files.exists(primary) || Files.exists(backup)) {
            log.warn("No readable checkpoint for {}, starting fresh", jobId);
        }
        return Optional.empty();
    }

    private SearchJob read(Path path, ObjectMapper mapper, String jobId) {
        SearchJob job;
        try {
            job = mapper.readValue(Files.readAllBytes(path), SearchJob.class);
        } catch (IOException e) {
            throw new CheckpointCorruptException("Cannot parse " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (job == null || !jobId.equals(job.getJobId())) {
            throw new CheckpointCorruptException("Checkpoint " + path.getFileName() + " does not belong to job " + jobId);
        }
        return job;
    }

    public boolean exists(String jobId) {
        requireValid(jobId);
        return Files.exists(primaryPath(jobId)) || Files.exists(backupPath(jobId));
    }

    public void delete(String jobId) throws IOException {
        requireValid(jobId);
        Files.deleteIfExists(primaryPath(jobId));
        Files.deleteIfExists(backupPath(jobId));
    }

    Path primaryPath(String jobId) {
        return directory.resolve(jobId + ".json");
    }

    Path backupPath(String jobId) {
        return directory.resolve(jobId + ".bak");
    }

    private static void requireValid(String jobId) {
        if (!isValidJobId(jobId)) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
    }
}
