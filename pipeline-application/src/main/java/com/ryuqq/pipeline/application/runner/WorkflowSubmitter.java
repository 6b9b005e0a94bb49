package com.ryuqq.pipeline.application.runner;

import com.ryuqq.pipeline.core.engine.RunOptions;

/**
 * 비동기 Workflow 실행 포트.
 *
 * <p>실행을 백그라운드로 넘기고 즉시 {@link RunHandle}을 반환합니다. 호출자는 핸들로
 * 진행 이벤트를 스트리밍하고, 취소를 요청하고, 결과를 기다릴 수 있습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>runId 결정 (옵션에 없으면 UUID)</li>
 *   <li>실행 전용 진행 채널과 취소 토큰 생성</li>
 *   <li>작업 스레드에 실행 위임</li>
 *   <li>RunHandle 반환</li>
 * </ol>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface WorkflowSubmitter {

    /**
     * Workflow 실행 제출.
     *
     * @param workflowId 실행할 Workflow ID
     * @param input Workflow 입력
     * @param options 실행 옵션 (listener는 진행 채널 뒤에 연결됨)
     * @param <O> 출력 타입
     * @return 실행 핸들
     * @throws IllegalArgumentException workflowId가 등록되지 않은 경우
     * @throws java.util.concurrent.RejectedExecutionException 실행기가 종료된 경우
     */
    <O> RunHandle<O> submit(String workflowId, Object input, RunOptions options);
}
