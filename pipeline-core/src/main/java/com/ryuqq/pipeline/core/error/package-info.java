/**
 * Workflow 실행 오류 분류 체계.
 *
 * <p>{@link com.ryuqq.pipeline.core.error.WorkflowException} 하위 예외는 모두 unchecked이며
 * {@link com.ryuqq.pipeline.core.error.ErrorKind}로 분류됩니다.
 * 엔진은 이 예외들을 호출자에게 던지지 않고 {@code WorkflowResult.Failed}로 변환합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.error;
