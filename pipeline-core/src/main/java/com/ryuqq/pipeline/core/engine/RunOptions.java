package com.ryuqq.pipeline.core.engine;

import com.ryuqq.pipeline.core.context.CancellationSignal;
import com.ryuqq.pipeline.core.context.RequestScope;
import com.ryuqq.pipeline.core.spi.ProgressSink;

/**
 * 실행 한 건의 옵션.
 *
 * @param runId 실행 ID (null이면 엔진이 생성)
 * @param scope 요청 범위
 * @param cancellation 취소 신호
 * @param listener 진행 이벤트 하위 소비자
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RunOptions(
    String runId,
    RequestScope scope,
    CancellationSignal cancellation,
    ProgressSink listener
) {

    public RunOptions {
        if (runId != null && runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be blank");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
    }

    /**
     * 기본 옵션 (익명 범위, 취소 없음, 소비자 없음).
     *
     * @return RunOptions
     */
    public static RunOptions defaults() {
        return new RunOptions(null, RequestScope.anonymous(), CancellationSignal.NONE, ProgressSink.NONE);
    }

    public RunOptions withRunId(String runId) {
        return new RunOptions(runId, scope, cancellation, listener);
    }

    public RunOptions withScope(RequestScope scope) {
        return new RunOptions(runId, scope, cancellation, listener);
    }

    public RunOptions withCancellation(CancellationSignal cancellation) {
        return new RunOptions(runId, scope, cancellation, listener);
    }

    public RunOptions withListener(ProgressSink listener) {
        return new RunOptions(runId, scope, cancellation, listener);
    }
}
