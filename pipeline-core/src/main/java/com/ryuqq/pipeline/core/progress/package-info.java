/**
 * Progress Event - Step 단위 진행 이벤트와 순서 불변식.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.progress.ProgressLog} - 실행별 추가 전용 이벤트 로그</li>
 *   <li>{@link com.ryuqq.pipeline.core.progress.ProgressTransition} - START → PROGRESS* → 종료 검증</li>
 *   <li>{@link com.ryuqq.pipeline.core.progress.StepKey} - Step ID + 실행 순번</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.progress;
