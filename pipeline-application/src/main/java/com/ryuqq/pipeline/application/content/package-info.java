/**
 * 콘텐츠 리뷰 Workflow (수렴 루프).
 *
 * <p>주제 조사, 초안 작성 후 품질 점수가 기준에 도달하거나 요청된 반복 횟수에 닿을 때까지
 * 리뷰 Step을 반복합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.content.ContentReviewWorkflow} - Workflow 정의</li>
 *   <li>{@link com.ryuqq.pipeline.application.content.ContentRequest} - 입력</li>
 *   <li>{@link com.ryuqq.pipeline.application.content.ReviewState} - 루프 상태</li>
 *   <li>{@link com.ryuqq.pipeline.application.content.FinalContent} - 출력</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.content;
