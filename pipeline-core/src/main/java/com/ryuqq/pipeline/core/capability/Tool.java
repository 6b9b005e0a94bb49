package com.ryuqq.pipeline.core.capability;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.schema.Schema;

/**
 * 입출력 Schema를 가진 외부 호출 (예: HTTP 조회, 벡터 색인).
 *
 * <p>{@code ExecutionContext.invokeTool(...)}이 호출 전후로 입력과 출력을 Schema로 검증합니다.</p>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface Tool<I, O> {

    /**
     * Tool ID (레지스트리 키).
     *
     * @return ID
     */
    String id();

    /**
     * 설명.
     *
     * @return 설명 (기본값: ID)
     */
    default String description() {
        return id();
    }

    Schema<I> inputSchema();

    Schema<O> outputSchema();

    /**
     * Tool 실행.
     *
     * @param input 검증된 입력
     * @param context 호출한 Step의 실행 컨텍스트
     * @return 출력 (호출 측에서 검증됨)
     * @throws Exception 실행 실패 시 (Step 재시도 정책이 적용됨)
     */
    O execute(I input, ExecutionContext context) throws Exception;
}
