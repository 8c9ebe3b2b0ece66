package foldrun.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.model.InputUnreadableException;
import foldrun.coordinator.model.JobIds;
import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.JobNotFoundException;
import foldrun.coordinator.model.JobParams;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.JobStoreException;
import foldrun.coordinator.model.JobValidationException;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.model.StatusUnreadableException;
import foldrun.coordinator.repository.JobStore;
import foldrun.coordinator.store.model.InputDocument;
import foldrun.coordinator.store.model.StatusDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Filesystem implementation of JobStore.
 *
 * <pre>
 * &lt;root&gt;/inputs/&lt;jobId&gt;/input.json
 * &lt;root&gt;/results/&lt;jobId&gt;/status.json
 * &lt;root&gt;/results/&lt;jobId&gt;/output.pdb
 * </pre>
 *
 * Every file is written to a temp file in its target directory and moved into
 * place, so readers see either the old or the new complete document.
 */
public class FileJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    static final String INPUTS_DIR = "inputs";
    static final String RESULTS_DIR = "results";
    static final String INPUT_FILE = "input.json";
    static final String STATUS_FILE = "status.json";
    static final String ARTIFACT_FILE = "output.pdb";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final Path inputsRoot;
    private final Path resultsRoot;

    public FileJobStore(CoordinatorConfig config) {
        this(config.workDir());
    }

    public FileJobStore(Path root) {
        this.inputsRoot = root.resolve(INPUTS_DIR);
        this.resultsRoot = root.resolve(RESULTS_DIR);
        try {
            Files.createDirectories(inputsRoot);
            Files.createDirectories(resultsRoot);
        } catch (IOException e) {
            throw new JobStoreException("Failed to create job store under " + root, e);
        }
        log.info("Job store initialized at {}", root.toAbsolutePath());
    }

    @Override
    public void putInput(JobInput input) {
        InputDocument doc = new InputDocument(
                input.jobId(),
                input.sequence(),
                input.directions(),
                input.params().toMap(),
                input.submittedAt());
        writeAtomically(inputFile(input.jobId()), toJson(doc));
        log.debug("Saved input for job {}", input.jobId());
    }

    @Override
    public JobInput getInput(String jobId) {
        Path file = inputFile(jobId);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new JobNotFoundException("job not found: " + jobId);
        } catch (IOException e) {
            throw new InputUnreadableException("Failed to read input of job " + jobId, e);
        }

        try {
            InputDocument doc = MAPPER.readValue(bytes, InputDocument.class);
            if (doc.sequence() == null || doc.sequence().isBlank()) {
                throw new InputUnreadableException("Input of job " + jobId + " has no sequence");
            }
            return JobInput.builder()
                    .jobId(jobId)
                    .sequence(doc.sequence())
                    .directions(doc.directions())
                    .params(JobParams.from(doc.params()))
                    .submittedAt(doc.submittedAt())
                    .build();
        } catch (IOException | JobValidationException e) {
            throw new InputUnreadableException("Input of job " + jobId + " is corrupt: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasInput(String jobId) {
        return Files.isRegularFile(inputFile(jobId));
    }

    @Override
    public void putStatus(StatusRecord status) {
        StatusDocument doc = new StatusDocument(
                status.jobId(),
                status.status().wireName(),
                status.errorMessage(),
                status.updatedAt());
        writeAtomically(statusFile(status.jobId()), toJson(doc));
        log.debug("Job {} status -> {}", status.jobId(), status.status().wireName());
    }

    @Override
    public Optional<StatusRecord> getStatus(String jobId) {
        Path file = statusFile(jobId);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StatusUnreadableException("Status of job " + jobId + " cannot be read", e);
        }

        try {
            StatusDocument doc = MAPPER.readValue(bytes, StatusDocument.class);
            JobStatus status = JobStatus.fromWire(doc.status());
            return Optional.of(new StatusRecord(jobId, status, doc.errorMessage(), doc.updatedAt()));
        } catch (IOException | IllegalArgumentException e) {
            throw new StatusUnreadableException("Status of job " + jobId + " is corrupt", e);
        }
    }

    @Override
    public void putArtifact(String jobId, byte[] artifact) {
        writeAtomically(artifactFile(jobId), artifact);
        log.debug("Saved artifact for job {} ({} bytes)", jobId, artifact.length);
    }

    @Override
    public Optional<byte[]> getArtifact(String jobId) {
        try {
            return Optional.of(Files.readAllBytes(artifactFile(jobId)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new JobStoreException("Failed to read artifact of job " + jobId, e);
        }
    }

    @Override
    public void deleteArtifact(String jobId) {
        try {
            if (Files.deleteIfExists(artifactFile(jobId))) {
                log.debug("Removed previous artifact of job {}", jobId);
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to remove artifact of job " + jobId, e);
        }
    }

    @Override
    public List<String> listJobIds() {
        TreeSet<String> ids = new TreeSet<>();
        collectIds(inputsRoot, ids);
        collectIds(resultsRoot, ids);
        return new ArrayList<>(ids);
    }

    @Override
    public boolean isHealthy() {
        return Files.isDirectory(inputsRoot) && Files.isWritable(inputsRoot)
                && Files.isDirectory(resultsRoot) && Files.isWritable(resultsRoot);
    }

    private void collectIds(Path root, TreeSet<String> ids) {
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                String name = dir.getFileName().toString();
                if (JobIds.isValid(name)) {
                    ids.add(name);
                }
            }
        } catch (IOException e) {
            throw new JobStoreException("Failed to list " + root, e);
        }
    }

    private Path inputFile(String jobId) {
        return inputsRoot.resolve(JobIds.requireValid(jobId)).resolve(INPUT_FILE);
    }

    private Path statusFile(String jobId) {
        return resultsRoot.resolve(JobIds.requireValid(jobId)).resolve(STATUS_FILE);
    }

    private Path artifactFile(String jobId) {
        return resultsRoot.resolve(JobIds.requireValid(jobId)).resolve(ARTIFACT_FILE);
    }

    private static byte[] toJson(Object doc) {
        try {
            return MAPPER.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize " + doc.getClass().getSimpleName(), e);
        }
    }

    /**
     * Write to a temp file next to the target, then move it over the target.
     */
    private static void writeAtomically(Path target, byte[] bytes) {
        Path dir = target.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new JobStoreException("Failed to write " + target, e);
        }
    }
}
