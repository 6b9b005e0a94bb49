/**
 * Outcome - Workflow 실행 결과와 관측 기록.
 *
 * <p>{@link com.ryuqq.pipeline.core.outcome.WorkflowResult}는 sealed interface로,
 * {@link com.ryuqq.pipeline.core.outcome.Succeeded}와 {@link com.ryuqq.pipeline.core.outcome.Failed}
 * 두 경우만 존재합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.outcome;
