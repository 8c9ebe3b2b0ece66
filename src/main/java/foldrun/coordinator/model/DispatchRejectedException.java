package foldrun.coordinator.model;

/**
 * The dispatcher admission queue is full; the caller should retry later.
 */
public class DispatchRejectedException extends RuntimeException {

    public DispatchRejectedException(String message) {
        super(message);
    }
}
