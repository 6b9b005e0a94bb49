package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.progress.ProgressEvent;

import java.util.List;
import java.util.Optional;

/**
 * Bounded side channel that streams progress events from a running workflow to a consumer.
 *
 * <p>The producer side is the {@link ProgressSink} contract: the run thread calls
 * {@link #accept(ProgressEvent)}. The consumer side polls or drains events from another thread.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Bounded: the buffer has a fixed capacity</li>
 *   <li>Non-blocking for the producer: when the buffer is full, non-terminal events may be dropped;
 *       START and terminal events may wait for space only within a bounded timeout</li>
 *   <li>Dropped events are counted and exposed through {@link #droppedCount()}</li>
 *   <li>Thread-safe for one producer and any number of consumers</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface ProgressChannel extends ProgressSink {

    /**
     * Waits up to the given timeout for the next event.
     *
     * @param timeoutMs maximum wait in milliseconds
     * @return next event, or empty on timeout or when closed and drained
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<ProgressEvent> poll(long timeoutMs) throws InterruptedException;

    /**
     * Removes and returns every buffered event without waiting.
     *
     * @return buffered events in arrival order
     */
    List<ProgressEvent> drain();

    /**
     * Returns the number of events dropped because the buffer was full.
     *
     * @return dropped event count
     */
    long droppedCount();

    /**
     * Marks the channel as complete. Later events are discarded.
     */
    void close();

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return true when closed
     */
    boolean isClosed();
}
