/**
 * Execution Context - 실행 단위 상태와 Step 호출 컨텍스트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.context.RunContext} - 실행 한 건의 공유 상태</li>
 *   <li>{@link com.ryuqq.pipeline.core.context.ExecutionContext} - Step 호출별 뷰</li>
 *   <li>{@link com.ryuqq.pipeline.core.context.RequestScope} - 불변 요청 범위</li>
 *   <li>{@link com.ryuqq.pipeline.core.context.CancellationToken} - 협조적 취소</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.context;
