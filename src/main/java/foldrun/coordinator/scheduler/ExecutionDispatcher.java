package foldrun.coordinator.scheduler;

import foldrun.coordinator.config.CoordinatorConfig;
import foldrun.coordinator.engine.EngineResolver;
import foldrun.coordinator.model.DispatchRejectedException;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.model.StatusUnreadableException;
import foldrun.coordinator.repository.JobStore;
import foldrun.coordinator.sink.JobCompletionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs engine invocations off the request path.
 *
 * <ul>
 * <li>A fixed pool of {@code maxConcurrentJobs} workers takes runs from a
 * bounded admission queue; a full queue rejects the dispatch.</li>
 * <li>At most one run per job id is queued or running at a time. A dispatch
 * for an id with a queued run is coalesced into it; a dispatch for an id
 * with a running run schedules exactly one follow-up run.</li>
 * <li>The dispatcher is the only writer of status and artifact. Every new
 * lifecycle starts by removing the previous run's artifact.</li>
 * </ul>
 */
public class ExecutionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final JobStore store;
    private final EngineResolver engines;
    private final JobCompletionListener completionListener;
    private final ThreadPoolExecutor executor;
    private final Duration shutdownGracePeriod;

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private enum SlotState {
        PENDING,
        RUNNING
    }

    /** Per-id admission state, only touched inside {@code slots.compute*} */
    private static final class Slot {
        SlotState state = SlotState.PENDING;
        boolean rerun;
    }

    public ExecutionDispatcher(JobStore store, EngineResolver engines,
            JobCompletionListener completionListener, CoordinatorConfig config) {
        this.store = store;
        this.engines = engines;
        this.completionListener = completionListener;
        this.shutdownGracePeriod = config.shutdownGracePeriod();

        AtomicInteger threadIds = new AtomicInteger(1);
        this.executor = new ThreadPoolExecutor(
                config.maxConcurrentJobs(),
                config.maxConcurrentJobs(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(config.queueCapacity()),
                r -> {
                    Thread t = new Thread(r, "foldrun-worker-" + threadIds.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());

        log.info("Dispatcher started: {} workers, admission queue of {}",
                config.maxConcurrentJobs(), config.queueCapacity());
    }

    /**
     * Schedule execution of a job whose input is already persisted.
     * Never blocks on the engine.
     *
     * @throws DispatchRejectedException if the admission queue is full
     */
    public DispatchOutcome dispatch(String jobId) {
        DispatchOutcome[] outcome = new DispatchOutcome[1];
        try {
            slots.compute(jobId, (id, slot) -> {
                if (slot == null) {
                    store.deleteArtifact(id);
                    store.putStatus(StatusRecord.queued(id));
                    executor.execute(new JobRun(id, this));
                    outcome[0] = DispatchOutcome.ADMITTED;
                    return new Slot();
                }
                if (slot.state == SlotState.PENDING) {
                    outcome[0] = DispatchOutcome.COALESCED;
                } else {
                    slot.rerun = true;
                    outcome[0] = DispatchOutcome.RERUN_SCHEDULED;
                }
                return slot;
            });
        } catch (RejectedExecutionException e) {
            reject(jobId);
        }

        log.debug("Dispatch of job {}: {}", jobId, outcome[0]);
        return outcome[0];
    }

    private void reject(String jobId) {
        String reason = executor.isShutdown()
                ? "rejected: dispatcher is shutting down"
                : "rejected: dispatch queue is full";
        log.warn("Job {} {}", jobId, reason);
        store.putStatus(StatusRecord.failed(jobId, reason));
        throw new DispatchRejectedException("job " + jobId + " " + reason);
    }

    /** Called by a worker before it touches the job's input */
    void markStarted(String jobId) {
        slots.computeIfPresent(jobId, (id, slot) -> {
            slot.state = SlotState.RUNNING;
            return slot;
        });
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
    }

    /** Called by a worker after the terminal status has been written */
    void markFinished(String jobId) {
        active.decrementAndGet();
        slots.compute(jobId, (id, slot) -> {
            if (slot == null || !slot.rerun) {
                return null;
            }
            slot.rerun = false;
            slot.state = SlotState.PENDING;
            try {
                store.deleteArtifact(id);
                store.putStatus(StatusRecord.queued(id));
                executor.execute(new JobRun(id, this));
                log.info("Job {} re-submitted while running, starting follow-up run", id);
                return slot;
            } catch (RejectedExecutionException e) {
                log.warn("Follow-up run of job {} rejected: {}", id, e.getMessage());
                store.putStatus(StatusRecord.failed(id, "rejected: dispatch queue is full"));
                return null;
            } catch (RuntimeException e) {
                log.error("Failed to schedule follow-up run of job {}", id, e);
                return null;
            }
        });
    }

    /**
     * Write a status produced by a run, refusing transitions the lifecycle
     * does not allow (a terminal status is never overwritten by a run).
     *
     * @return true if written
     */
    boolean transition(StatusRecord next) {
        Optional<StatusRecord> current;
        try {
            current = store.getStatus(next.jobId());
        } catch (StatusUnreadableException e) {
            log.warn("Status of job {} unreadable, overwriting with {}", next.jobId(), next.status().wireName());
            current = Optional.empty();
        }

        if (current.isPresent() && !current.get().status().canTransitionTo(next.status())) {
            log.warn("Refusing status transition of job {}: {} -> {}",
                    next.jobId(), current.get().status().wireName(), next.status().wireName());
            return false;
        }
        store.putStatus(next);
        return true;
    }

    void recordOutcome(boolean success) {
        if (success) {
            succeeded.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }

    JobStore store() {
        return store;
    }

    EngineResolver engines() {
        return engines;
    }

    JobCompletionListener completionListener() {
        return completionListener;
    }

    /**
     * Whether a run for this id is queued or in progress.
     */
    public boolean isInFlight(String jobId) {
        return slots.containsKey(jobId);
    }

    public int activeCount() {
        return active.get();
    }

    public int queuedCount() {
        return executor.getQueue().size();
    }

    public int peakConcurrency() {
        return peakActive.get();
    }

    public long succeededCount() {
        return succeeded.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * Stop admitting runs, wait for in-flight ones up to the grace period,
     * then interrupt whatever is left.
     */
    public void shutdown() {
        if (executor.isShutdown()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = executor.shutdownNow().size();
                log.warn("Dispatcher forcefully stopped, {} queued runs not started", dropped);
            } else {
                log.info("Dispatcher stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
