package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.progress.ProgressEvent;

/**
 * Downstream consumer SPI for progress events.
 *
 * <p>The engine validates event ordering first and then hands each event to the sink
 * on the run thread.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Must not block indefinitely: a slow consumer may delay the pipeline only within a bounded buffer</li>
 *   <li>Exceptions are logged by the engine and never fail the run</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressSink {

    /**
     * Sink that discards every event.
     */
    ProgressSink NONE = event -> {
        // NoOp
    };

    /**
     * Receives a validated progress event.
     *
     * @param event progress event
     */
    void accept(ProgressEvent event);
}
