package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.progress.ProgressLog;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import io.micrometer.tracing.Tracer;

/**
 * 실행 한 건의 공유 상태.
 *
 * <p>실행마다 새로 만들어지며 다른 실행과 공유되지 않습니다.
 * Step마다 이 값을 바탕으로 {@link ExecutionContext}가 생성됩니다.</p>
 *
 * @param runId 실행 ID
 * @param workflowId Workflow ID
 * @param progressLog 실행별 진행 이벤트 로그
 * @param scope 요청 범위
 * @param capabilities 협력자 레지스트리
 * @param cancellation 취소 신호
 * @param tracer 실행의 Span을 내보낼 Micrometer Tracer
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RunContext(
    String runId,
    String workflowId,
    ProgressLog progressLog,
    RequestScope scope,
    CapabilityRegistry capabilities,
    CancellationSignal cancellation,
    Tracer tracer
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 비어 있는 경우
     */
    public RunContext {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId cannot be null or blank");
        }
        if (progressLog == null) {
            throw new IllegalArgumentException("progressLog cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer cannot be null");
        }
    }

    /**
     * Span을 내보내지 않는 실행 상태 생성.
     */
    public RunContext(String runId, String workflowId, ProgressLog progressLog, RequestScope scope,
                      CapabilityRegistry capabilities, CancellationSignal cancellation) {
        this(runId, workflowId, progressLog, scope, capabilities, cancellation, Tracer.NOOP);
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
