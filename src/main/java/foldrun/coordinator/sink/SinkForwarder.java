package foldrun.coordinator.sink;

import foldrun.coordinator.model.JobCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbound queue between the dispatcher and the result mirror.
 *
 * {@link #onJobSucceeded} never blocks: when the queue is full the completion
 * is dropped with a warning. A single daemon thread drains the queue; sink
 * failures are logged and never reach the dispatcher.
 */
public final class SinkForwarder implements JobCompletionListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SinkForwarder.class);

    private final PersistenceSink sink;
    private final BlockingQueue<JobCompletion> queue;
    private final Thread worker;
    private final AtomicLong forwarded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running = true;

    public SinkForwarder(PersistenceSink sink, int capacity) {
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.worker = new Thread(this::drain, "foldrun-sink");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void onJobSucceeded(JobCompletion completion) {
        if (!running || !queue.offer(completion)) {
            dropped.incrementAndGet();
            log.warn("Result mirror queue unavailable, dropping result of job {}", completion.jobId());
        }
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            JobCompletion next;
            try {
                next = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next != null) {
                forward(next);
            }
        }
    }

    private void forward(JobCompletion completion) {
        try {
            sink.upsert(completion);
            forwarded.incrementAndGet();
        } catch (Exception e) {
            failed.incrementAndGet();
            log.warn("Failed to mirror result of job {}: {}", completion.jobId(), e.getMessage());
        }
    }

    public long forwardedCount() {
        return forwarded.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pending() {
        return queue.size();
    }

    /**
     * Stop accepting completions and flush what is queued (bounded wait).
     */
    @Override
    public void close() {
        running = false;
        try {
            worker.join(5000);
            if (worker.isAlive()) {
                worker.interrupt();
                log.warn("Result mirror forwarder stopped with {} pending results", queue.size());
            }
        } catch (InterruptedException e) {
            worker.interrupt();
            Thread.currentThread().interrupt();
        }
    }
}
