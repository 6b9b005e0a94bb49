package com.ryuqq.pipeline.adapter.inmemory.channel;

import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BoundedProgressChannel tests.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class BoundedProgressChannelTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private long sequence;

    @Test
    @DisplayName("events are delivered in arrival order")
    void deliversInOrder() throws InterruptedException {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(8, 10);

        // when
        channel.accept(event(ProgressKind.START));
        channel.accept(event(ProgressKind.PROGRESS));
        channel.accept(event(ProgressKind.COMPLETE));

        // then
        assertThat(channel.poll(10)).map(ProgressEvent::kind).contains(ProgressKind.START);
        assertThat(channel.drain()).extracting(ProgressEvent::kind)
            .containsExactly(ProgressKind.PROGRESS, ProgressKind.COMPLETE);
        assertThat(channel.droppedCount()).isZero();
    }

    @Test
    @DisplayName("progress events are dropped without waiting when the buffer is full")
    void dropsProgressWhenFull() {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(2, 5_000);
        channel.accept(event(ProgressKind.START));
        channel.accept(event(ProgressKind.PROGRESS));

        // when
        long started = System.nanoTime();
        channel.accept(event(ProgressKind.PROGRESS));
        channel.accept(event(ProgressKind.PROGRESS));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        assertThat(channel.droppedCount()).isEqualTo(2);
        assertThat(channel.size()).isEqualTo(2);
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    @DisplayName("terminal events wait at most the offer timeout, then are counted as dropped")
    void terminalEventWaitsBounded() {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(1, 50);
        channel.accept(event(ProgressKind.START));

        // when
        long started = System.nanoTime();
        channel.accept(event(ProgressKind.COMPLETE));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        assertThat(channel.droppedCount()).isEqualTo(1);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(40).isLessThan(2_000);
    }

    @Test
    @DisplayName("a lifecycle event evicts the oldest progress event instead of being dropped")
    void lifecycleEventEvictsOldestProgress() {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(3, 5_000);
        channel.accept(event(ProgressKind.START));
        channel.accept(event(ProgressKind.PROGRESS));
        ProgressEvent newerProgress = event(ProgressKind.PROGRESS);
        channel.accept(newerProgress);

        // when
        long started = System.nanoTime();
        channel.accept(event(ProgressKind.COMPLETE));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        List<ProgressEvent> drained = channel.drain();
        assertThat(drained).extracting(ProgressEvent::kind)
            .containsExactly(ProgressKind.START, ProgressKind.PROGRESS, ProgressKind.COMPLETE);
        assertThat(drained.get(1)).isEqualTo(newerProgress);
        assertThat(channel.droppedCount()).isEqualTo(1);
        assertThat(elapsedMs).isLessThan(1_000);
    }

    @Test
    @DisplayName("a terminal event is delivered once a consumer frees space")
    void terminalEventDeliveredAfterConsumerFreesSpace() throws Exception {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(1, 5_000);
        channel.accept(event(ProgressKind.START));
        CountDownLatch consumed = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                Thread.sleep(50);
                channel.poll(1_000);
                consumed.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // when
        consumer.start();
        channel.accept(event(ProgressKind.ERROR));
        consumer.join(5_000);

        // then
        assertThat(consumed.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(channel.droppedCount()).isZero();
        assertThat(channel.drain()).extracting(ProgressEvent::kind).containsExactly(ProgressKind.ERROR);
    }

    @Test
    @DisplayName("after close, new events are discarded and poll returns empty once drained")
    void closeDiscardsLaterEvents() throws InterruptedException {
        // given
        BoundedProgressChannel channel = new BoundedProgressChannel(4, 10);
        channel.accept(event(ProgressKind.START));

        // when
        channel.close();
        channel.accept(event(ProgressKind.COMPLETE));

        // then
        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.poll(10)).isPresent();
        assertThat(channel.poll(5_000)).isEqualTo(Optional.empty());
        assertThat(channel.droppedCount()).isZero();
    }

    @Test
    @DisplayName("poll times out with empty on an open, empty channel")
    void pollTimesOut() throws InterruptedException {
        BoundedProgressChannel channel = new BoundedProgressChannel();

        assertThat(channel.poll(20)).isEmpty();
        assertThat(channel.capacity()).isEqualTo(BoundedProgressChannel.DEFAULT_CAPACITY);
    }

    @Test
    @DisplayName("invalid configuration is rejected")
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new BoundedProgressChannel(0, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("capacity must be positive");
        assertThatThrownBy(() -> new BoundedProgressChannel(1, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("offerTimeoutMs");
        assertThatThrownBy(() -> new BoundedProgressChannel().accept(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("drain on an empty channel returns an empty list")
    void drainEmpty() {
        assertThat(new BoundedProgressChannel().drain()).isEqualTo(List.of());
    }

    private ProgressEvent event(ProgressKind kind) {
        return new ProgressEvent(sequence++, "step", 1, kind, Map.of(), NOW);
    }
}
