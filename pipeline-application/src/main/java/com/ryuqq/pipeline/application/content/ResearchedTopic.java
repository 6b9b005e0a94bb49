package com.ryuqq.pipeline.application.content;

/**
 * research-topic Step 출력.
 *
 * @param request 원본 요청
 * @param research 조사 결과
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ResearchedTopic(ContentRequest request, Research research) {
}
