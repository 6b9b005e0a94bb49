/**
 * Tracing - 실행 한 건의 계층형 Span 트리.
 *
 * <p>엔진은 모든 종료 경로(성공, 실패, 취소)에서 Span을 닫으므로,
 * 실행 결과 보고서의 루트 Span 아래에는 열린 Span이 남지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.tracing;
