package foldrun.coordinator.scheduler;

import foldrun.coordinator.engine.EngineInitializationException;
import foldrun.coordinator.engine.EngineRequest;
import foldrun.coordinator.engine.EngineResult;
import foldrun.coordinator.engine.EngineUnavailableException;
import foldrun.coordinator.engine.FoldingEngine;
import foldrun.coordinator.model.JobCompletion;
import foldrun.coordinator.model.JobInput;
import foldrun.coordinator.model.JobNotFoundException;
import foldrun.coordinator.model.JobStoreException;
import foldrun.coordinator.model.StatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * One execution of one job:
 * running -> load input -> resolve engine -> execute -> artifact -> succeeded -> mirror.
 *
 * Every failure becomes a terminal failed status with a readable message;
 * nothing escapes to the worker thread.
 */
final class JobRun implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobRun.class);

    private final String jobId;
    private final ExecutionDispatcher dispatcher;
    private boolean interrupted;

    JobRun(String jobId, ExecutionDispatcher dispatcher) {
        this.jobId = jobId;
        this.dispatcher = dispatcher;
    }

    @Override
    public void run() {
        dispatcher.markStarted(jobId);
        long started = System.currentTimeMillis();
        try {
            boolean ok = execute();
            dispatcher.recordOutcome(ok);
            log.info("Job {} {} in {}ms", jobId, ok ? "succeeded" : "failed",
                    System.currentTimeMillis() - started);
        } catch (Throwable t) {
            log.error("Job {} crashed", jobId, t);
            interrupted |= Thread.interrupted();
            dispatcher.recordOutcome(false);
            failQuietly(describe(t));
        } finally {
            dispatcher.markFinished(jobId);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return true if the job reached succeeded
     */
    private boolean execute() {
        if (!dispatcher.transition(StatusRecord.running(jobId))) {
            return false;
        }

        JobInput input;
        try {
            input = dispatcher.store().getInput(jobId);
        } catch (JobNotFoundException | JobStoreException e) {
            return fail("Input unreadable: " + e.getMessage());
        }

        log.info("Processing job {}: {} residues, protocol {}",
                jobId, input.sequence().length(), input.params().protocol().wireName());

        FoldingEngine engine = dispatcher.engines().resolve();
        EngineResult result = null;
        String failure = null;
        try {
            try {
                result = invoke(engine, input);
            } catch (EngineUnavailableException e) {
                FoldingEngine fallback = dispatcher.engines().fallback();
                log.warn("Engine '{}' unavailable for job {}, falling back to '{}'",
                        engine.name(), jobId, fallback.name());
                engine = fallback;
                result = invoke(engine, input);
            }
        } catch (EngineInitializationException e) {
            failure = "Engine initialization failed: " + e.getMessage();
        } catch (Exception e) {
            log.warn("Job {} failed on engine '{}': {}", jobId, engine.name(), describe(e));
            failure = describe(e);
        }

        // file channels refuse I/O while interrupted; restored when the run ends
        interrupted = Thread.interrupted();
        if (failure != null) {
            return fail(failure);
        }

        if (result == null || result.artifact() == null || result.artifact().length == 0) {
            return fail("Engine '" + engine.name() + "' produced no structure");
        }

        // artifact strictly before succeeded
        try {
            dispatcher.store().putArtifact(jobId, result.artifact());
        } catch (JobStoreException e) {
            return fail("Failed to store artifact: " + e.getMessage());
        }

        if (!dispatcher.transition(StatusRecord.succeeded(jobId))) {
            return false;
        }
        log.info("Job {} finished on engine '{}' with energy {}", jobId, engine.name(), result.energy());

        publish(new JobCompletion(input, new String(result.artifact(), StandardCharsets.UTF_8),
                result.energy(), engine.name(), Instant.now()));
        return true;
    }

    private EngineResult invoke(FoldingEngine engine, JobInput input) {
        engine.initialize();
        return engine.execute(EngineRequest.from(input));
    }

    private void publish(JobCompletion completion) {
        try {
            dispatcher.completionListener().onJobSucceeded(completion);
        } catch (Exception e) {
            log.warn("Result mirror handoff failed for job {}: {}", jobId, e.getMessage());
        }
    }

    private boolean fail(String message) {
        log.warn("Job {} failed: {}", jobId, message);
        dispatcher.transition(StatusRecord.failed(jobId, message));
        return false;
    }

    private void failQuietly(String message) {
        try {
            dispatcher.transition(StatusRecord.failed(jobId, message));
        } catch (Exception e) {
            log.error("Could not record failure of job {}", jobId, e);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg != null && !msg.isBlank() ? msg : t.getClass().getSimpleName();
    }
}
