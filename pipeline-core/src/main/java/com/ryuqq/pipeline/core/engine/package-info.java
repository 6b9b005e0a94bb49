/**
 * Engine - Step 실행기와 Workflow 엔진.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.engine.WorkflowEngine} - Stage 그래프 해석, 결과/보고서 생성</li>
 *   <li>{@link com.ryuqq.pipeline.core.engine.StepExecutor} - 검증, 재시도, 진행 이벤트, Span</li>
 *   <li>{@link com.ryuqq.pipeline.core.engine.RetryBackoff} - FIXED / EXPONENTIAL(jitter) 간격</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.engine;
