package com.ryuqq.pipeline.adapter.inmemory.channel;

import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.spi.ProgressChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link ProgressChannel} backed by an {@link ArrayBlockingQueue}.
 *
 * <p><strong>Backpressure Policy:</strong></p>
 * <ul>
 *   <li><strong>PROGRESS events:</strong> offered without waiting; dropped when the buffer is full</li>
 *   <li><strong>START and terminal events:</strong> evict the oldest buffered PROGRESS event when the buffer
 *       is full; if only lifecycle events are buffered, wait up to {@code offerTimeoutMs} for space, then dropped</li>
 *   <li><strong>After close:</strong> events are discarded and not counted as dropped</li>
 * </ul>
 *
 * <p>A slow consumer therefore delays the producing run by at most {@code offerTimeoutMs}
 * per lifecycle event. The complete event list stays available in the run report.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * BoundedProgressChannel channel = new BoundedProgressChannel(64, 500);
 * engine.execute(workflow, input, RunOptions.defaults().withListener(channel));
 *
 * // consumer thread
 * Optional&lt;ProgressEvent&gt; next = channel.poll(100);
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class BoundedProgressChannel implements ProgressChannel {

    private static final Logger log = LoggerFactory.getLogger(BoundedProgressChannel.class);

    /**
     * Default buffer capacity: 256 events.
     */
    public static final int DEFAULT_CAPACITY = 256;

    /**
     * Default wait for START and terminal events: 1 second.
     */
    public static final long DEFAULT_OFFER_TIMEOUT_MS = 1_000L;

    private final BlockingQueue<ProgressEvent> queue;
    private final int capacity;
    private final long offerTimeoutMs;
    private final AtomicLong dropped;
    private final AtomicBoolean closed;

    /**
     * Creates a channel with the default capacity and offer timeout.
     */
    public BoundedProgressChannel() {
        this(DEFAULT_CAPACITY, DEFAULT_OFFER_TIMEOUT_MS);
    }

    /**
     * Creates a channel.
     *
     * @param capacity buffer capacity
     * @param offerTimeoutMs maximum wait for START and terminal events
     * @throws IllegalArgumentException if capacity is not positive or offerTimeoutMs is negative
     */
    public BoundedProgressChannel(int capacity, long offerTimeoutMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, but was: " + capacity);
        }
        if (offerTimeoutMs < 0) {
            throw new IllegalArgumentException("offerTimeoutMs cannot be negative, but was: " + offerTimeoutMs);
        }

        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.offerTimeoutMs = offerTimeoutMs;
        this.dropped = new AtomicLong();
        this.closed = new AtomicBoolean(false);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Never blocks longer than {@code offerTimeoutMs}</li>
     *   <li>Interruption while waiting drops the event and restores the interrupt flag</li>
     * </ul>
     */
    @Override
    public void accept(ProgressEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (closed.get()) {
            log.debug("Channel closed, discarding {} event for {}", event.kind(), event.key());
            return;
        }

        boolean offered;
        if (mustDeliver(event.kind())) {
            offered = queue.offer(event) || (evictOldestProgress() && queue.offer(event));
            if (!offered) {
                try {
                    offered = queue.offer(event, offerTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    offered = false;
                }
            }
        } else {
            offered = queue.offer(event);
        }

        if (!offered) {
            long total = dropped.incrementAndGet();
            if (mustDeliver(event.kind())) {
                log.warn("Progress buffer full, dropped {} event for {} (dropped so far: {})",
                    event.kind(), event.key(), total);
            } else {
                log.debug("Progress buffer full, dropped {} event for {} (dropped so far: {})",
                    event.kind(), event.key(), total);
            }
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns immediately when the channel is closed and empty.</p>
     */
    @Override
    public Optional<ProgressEvent> poll(long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative, but was: " + timeoutMs);
        }
        if (closed.get() && queue.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.poll(timeoutMs, TimeUnit.MILLISECONDS));
    }

    @Override
    public List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && dropped.get() > 0) {
            log.info("Progress channel closed with {} dropped event(s)", dropped.get());
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Returns the number of buffered events. Used for test assertions.
     *
     * @return buffered event count
     */
    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    private boolean evictOldestProgress() {
        for (ProgressEvent buffered : queue) {
            if (buffered.kind() == ProgressKind.PROGRESS && queue.remove(buffered)) {
                long total = dropped.incrementAndGet();
                log.debug("Progress buffer full, evicted PROGRESS event for {} to admit a lifecycle event "
                    + "(dropped so far: {})", buffered.key(), total);
                return true;
            }
        }
        return false;
    }

    private static boolean mustDeliver(ProgressKind kind) {
        return kind == ProgressKind.START || kind.isTerminal();
    }
}
