/**
 * In-memory progress channel adapter package.
 *
 * <p>Provides {@link com.ryuqq.pipeline.adapter.inmemory.channel.BoundedProgressChannel},
 * a bounded buffer that streams progress events from a run to a consumer on another thread
 * without letting a slow consumer stall the run.</p>
 *
 * @see com.ryuqq.pipeline.core.spi.ProgressChannel
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.channel;
