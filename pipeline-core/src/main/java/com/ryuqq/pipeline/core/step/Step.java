package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.schema.Schema;

/**
 * 입출력 Schema를 가진 작업 단위.
 *
 * <p>Step 실행기가 입력을 검증한 뒤 {@link #execute}를 호출하고, 반환값을 출력 Schema로 검증합니다.
 * Step은 호출 간에 상태를 가지지 않아야 합니다.</p>
 *
 * <p><strong>재시도:</strong></p>
 * <ul>
 *   <li>최대 {@code retries() + 1}회 시도</li>
 *   <li>Schema 위반, 취소, 협력자 부재는 재시도하지 않음</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface Step<I, O> {

    /**
     * Step ID (Workflow 내 식별자, 진행 이벤트와 Span 이름에 사용).
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
     * 추가 재시도 횟수.
     *
     * @return 0 이상 (기본값 0)
     */
    default int retries() {
        return 0;
    }

    /**
     * Step 실행.
     *
     * @param input 검증된 입력
     * @param context 실행 컨텍스트
     * @return 출력 (실행기가 검증함)
     * @throws Exception 실행 실패 시
     */
    O execute(I input, ExecutionContext context) throws Exception;
}
