package foldrun.coordinator.scheduler;

import foldrun.coordinator.model.DispatchRejectedException;
import foldrun.coordinator.model.JobStatus;
import foldrun.coordinator.model.StatusRecord;
import foldrun.coordinator.model.StatusUnreadableException;
import foldrun.coordinator.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Startup pass over the job store that settles jobs left behind by a
 * previous process.
 *
 * <ul>
 * <li>running: the run died with the process, mark failed</li>
 * <li>queued, or input without any status: dispatch again</li>
 * <li>terminal: left alone</li>
 * </ul>
 */
public class JobRecovery {

    private static final Logger log = LoggerFactory.getLogger(JobRecovery.class);

    static final String INTERRUPTED_MESSAGE = "interrupted by service restart";

    private final JobStore store;
    private final ExecutionDispatcher dispatcher;

    public JobRecovery(JobStore store, ExecutionDispatcher dispatcher) {
        this.store = store;
        this.dispatcher = dispatcher;
    }

    /**
     * @return number of jobs re-dispatched or marked failed
     */
    public int recover() {
        int requeued = 0;
        int interrupted = 0;
        int skipped = 0;

        for (String jobId : store.listJobIds()) {
            try {
                Optional<StatusRecord> status = store.getStatus(jobId);
                JobStatus state = status.map(StatusRecord::status).orElse(null);

                if (state == JobStatus.RUNNING) {
                    store.putStatus(StatusRecord.failed(jobId, INTERRUPTED_MESSAGE));
                    interrupted++;
                    log.warn("Job {} was running when the service stopped, marked failed", jobId);
                } else if (state == null || state == JobStatus.QUEUED) {
                    if (store.hasInput(jobId)) {
                        dispatcher.dispatch(jobId);
                        requeued++;
                        log.info("Re-dispatched job {} left {}", jobId, state == null ? "without status" : "queued");
                    } else if (state == JobStatus.QUEUED) {
                        store.putStatus(StatusRecord.failed(jobId, "Input unreadable: input missing"));
                        interrupted++;
                    }
                }
            } catch (StatusUnreadableException e) {
                skipped++;
                log.warn("Skipping job {} during recovery: {}", jobId, e.getMessage());
            } catch (DispatchRejectedException e) {
                skipped++;
                log.warn("Could not re-dispatch job {}: {}", jobId, e.getMessage());
            }
        }

        log.info("Job recovery: {} re-dispatched, {} marked failed, {} skipped", requeued, interrupted, skipped);
        return requeued + interrupted;
    }
}
