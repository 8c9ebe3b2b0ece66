package foldrun.coordinator.service;

import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.model.ArtifactNotAvailableException;
import foldrun.coordinator.model.JobIds;
import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.JobNotFoundException;
import foldrun.coordinator.model.JobParams;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.JobValidationException;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.repository.JobStore;
import foldrun.coordinator.scheduler.ExecutionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Public job contract: submit, query status, fetch artifact.
 * Submission validates, persists the input and hands off to the dispatcher;
 * it never waits for the engine.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    /** One-letter codes of the 20 standard amino acids */
    private static final String RESIDUE_LETTERS = "ACDEFGHIKLMNPQRSTVWY";

    private final JobStore store;
    private final ExecutionDispatcher dispatcher;
    private final CoordinatorConfig config;

    public JobService(JobStore store, ExecutionDispatcher dispatcher, CoordinatorConfig config) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    /**
     * Submit a job.
     *
     * @param jobId      caller-chosen id, or null to generate one
     * @param sequence   residue sequence, case-insensitive
     * @param directions direction tokens, may be null
     * @param params     loosely-typed protocol options, may be null
     * @return the job id
     * @throws JobValidationException                               if the submission is malformed
     * @throws foldrun.coordinator.model.DispatchRejectedException if the admission queue is full
     */
    public String submit(String jobId, String sequence, List<String> directions, Map<String, ?> params) {
        String id = jobId == null || jobId.isBlank() ? store.generateId() : JobIds.requireValid(jobId.trim());
        String normalized = normalizeSequence(sequence);
        List<String> tokens = normalizeDirections(directions);
        JobParams typed = JobParams.from(params);

        JobInput input = JobInput.builder()
                .jobId(id)
                .sequence(normalized)
                .directions(tokens)
                .params(typed)
                .submittedAt(Instant.now())
                .build();

        store.putInput(input);
        log.info("Submitted job {}: {} residues, {} direction tokens, protocol {}",
                id, normalized.length(), tokens.size(), typed.protocol().wireName());

        dispatcher.dispatch(id);
        return id;
    }

    /**
     * Current status of a job.
     *
     * @throws JobNotFoundException                                 if nothing was ever submitted under this id
     * @throws foldrun.coordinator.model.StatusUnreadableException if the status record is corrupt
     */
    public StatusRecord getStatus(String jobId) {
        if (!JobIds.isValid(jobId)) {
            throw new JobNotFoundException("job not found: " + jobId);
        }

        Optional<StatusRecord> status = store.getStatus(jobId);
        if (status.isPresent()) {
            return status.get();
        }
        if (store.hasInput(jobId)) {
            // input written by an older layout that never persisted queued
            return new StatusRecord(jobId, JobStatus.RUNNING, null, null);
        }
        throw new JobNotFoundException("job not found: " + jobId);
    }

    /**
     * Artifact bytes of a job.
     *
     * @throws ArtifactNotAvailableException if no artifact has been written
     */
    public byte[] getArtifact(String jobId) {
        if (!JobIds.isValid(jobId)) {
            throw new ArtifactNotAvailableException("artifact not available for job " + jobId);
        }
        return store.getArtifact(jobId)
                .orElseThrow(() -> new ArtifactNotAvailableException("artifact not available for job " + jobId));
    }

    private String normalizeSequence(String sequence) {
        if (sequence == null || sequence.isBlank()) {
            throw new JobValidationException("sequence is required");
        }
        String s = sequence.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (s.length() > config.maxSequenceLength()) {
            throw new JobValidationException("sequence is longer than " + config.maxSequenceLength() + " residues");
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (RESIDUE_LETTERS.indexOf(c) < 0) {
                throw new JobValidationException("invalid residue '" + c + "' at position " + (i + 1));
            }
        }
        return s;
    }

    private static List<String> normalizeDirections(List<String> directions) {
        if (directions == null) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>(directions.size());
        for (String token : directions) {
            if (token == null) {
                throw new JobValidationException("directions must not contain null");
            }
            tokens.add(token.trim());
        }
        return tokens;
    }
}
