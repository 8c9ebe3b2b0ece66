package foldrun.coordinator.sink;

import foldrun.coordinator.model.JobCompletion;

/**
 * Receives successful job outcomes from the dispatcher.
 * Implementations must not block and must not throw.
 */
@FunctionalInterface
public interface JobCompletionListener {

    JobCompletionListener NONE = completion -> {
    };

    void onJobSucceeded(JobCompletion completion);
}
