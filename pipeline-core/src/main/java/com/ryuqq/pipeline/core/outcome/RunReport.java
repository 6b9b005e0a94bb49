package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.tracing.Span;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 실행 한 건의 관측 기록.
 *
 * <p>성공/실패와 관계없이 전체 진행 이벤트, 닫힌 루트 Span, 루프 요약을 포함합니다.</p>
 *
 * @param runId 실행 ID
 * @param workflowId Workflow ID
 * @param events 진행 이벤트 (발생 순서)
 * @param rootSpan 루트 Span (닫힌 상태)
 * @param loops 완료된 루프 요약 (실행 순서)
 * @param duration 전체 소요 시간
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RunReport(
    String runId,
    String workflowId,
    List<ProgressEvent> events,
    Span rootSpan,
    List<LoopReport> loops,
    Duration duration
) {

    public RunReport {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId cannot be null or blank");
        }
        if (rootSpan == null) {
            throw new IllegalArgumentException("rootSpan cannot be null");
        }
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        events = events == null ? List.of() : List.copyOf(events);
        loops = loops == null ? List.of() : List.copyOf(loops);
    }

    /**
     * 특정 Step의 이벤트 조회.
     *
     * @param stepId Step ID
     * @return 이벤트 목록 (발생 순서)
     */
    public List<ProgressEvent> eventsFor(String stepId) {
        return events.stream().filter(event -> event.stepId().equals(stepId)).toList();
    }

    /**
     * 특정 종류의 이벤트 조회.
     *
     * @param kind 이벤트 종류
     * @return 이벤트 목록
     */
    public List<ProgressEvent> eventsOf(ProgressKind kind) {
        return events.stream().filter(event -> event.kind() == kind).toList();
    }

    /**
     * 이름으로 루프 요약 조회.
     *
     * @param stageName 루프 이름
     * @return 루프 요약 (없으면 empty)
     */
    public Optional<LoopReport> loop(String stageName) {
        return loops.stream().filter(loop -> loop.stageName().equals(stageName)).findFirst();
    }

    /**
     * 수렴하지 못한 루프가 있는지 확인.
     *
     * @return 하나라도 exhausted이면 true
     */
    public boolean hasExhaustedLoop() {
        return loops.stream().anyMatch(LoopReport::exhausted);
    }
}
