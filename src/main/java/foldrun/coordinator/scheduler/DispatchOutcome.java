package foldrun.coordinator.scheduler;

/**
 * What the dispatcher did with a dispatch request.
 */
public enum DispatchOutcome {
    /** A new run was queued for the job */
    ADMITTED,

    /** A run for the job is queued but not started; it will read the newest input */
    COALESCED,

    /** A run is in progress; another run follows once it has finished */
    RERUN_SCHEDULED
}
