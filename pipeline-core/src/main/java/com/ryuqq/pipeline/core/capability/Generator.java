package com.ryuqq.pipeline.core.capability;

import com.ryuqq.pipeline.core.schema.Schema;

import java.util.List;

/**
 * 텍스트/구조화 결과를 생성하는 외부 협력자 (예: 언어 모델).
 *
 * <p>Step은 Generator를 직접 호출하지 않고 {@code ExecutionContext.generate(...)}를 통해 호출하며,
 * 컨텍스트가 자식 Span, 취소 확인, 결과 검증을 담당합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>여러 실행에서 동시에 호출될 수 있으므로 thread-safe해야 함</li>
 *   <li>실패는 RuntimeException으로 전달 (Step 재시도 정책이 적용됨)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface Generator {

    /**
     * Generator ID (레지스트리 키).
     *
     * @return ID
     */
    String id();

    /**
     * 텍스트 생성.
     *
     * @param prompt 프롬프트
     * @return 생성 결과
     */
    Generation<String> generate(String prompt);

    /**
     * 구조화 결과 생성.
     *
     * @param prompt 프롬프트
     * @param schema 결과가 따라야 할 Schema
     * @param <T> 결과 타입
     * @return 생성 결과 (object는 호출 측에서 다시 검증됨)
     */
    <T> Generation<T> generate(String prompt, Schema<T> schema);

    /**
     * 스트리밍 생성.
     *
     * <p>기본 구현은 버퍼링된 결과를 한 조각으로 전달합니다.</p>
     *
     * @param prompt 프롬프트
     * @return 텍스트 조각 스트림
     */
    default GenerationStream stream(String prompt) {
        return GenerationStream.of(List.of(generate(prompt).text()));
    }
}
