package com.ryuqq.pipeline.application.content;

/**
 * 콘텐츠 리뷰 Workflow 입력.
 *
 * <p>값 범위는 생성 시점이 아니라 Workflow 입력 Schema({@link ContentSchemas#REQUEST})에서
 * 검증되며, 위반 시 실행은 CONTRACT_VIOLATION으로 실패합니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>qualityThreshold: 80 (0 ~ 100)</li>
 *   <li>maxIterations: 10 (1 ~ 10)</li>
 * </ul>
 *
 * @param topic 주제
 * @param contentType 콘텐츠 종류
 * @param targetAudience 대상 독자 (null 허용)
 * @param qualityThreshold 승인 기준 점수
 * @param maxIterations 최대 리뷰 반복 횟수
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ContentRequest(
    String topic,
    ContentType contentType,
    String targetAudience,
    int qualityThreshold,
    int maxIterations
) {

    public static final int DEFAULT_QUALITY_THRESHOLD = 80;
    public static final int DEFAULT_MAX_ITERATIONS = 10;

    /**
     * 기본 기준 점수와 반복 횟수로 생성.
     *
     * @param topic 주제
     * @param contentType 콘텐츠 종류
     * @return ContentRequest
     */
    public static ContentRequest of(String topic, ContentType contentType) {
        return new ContentRequest(topic, contentType, null, DEFAULT_QUALITY_THRESHOLD, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * targetAudience만 변경한 새 인스턴스 생성.
     */
    public ContentRequest withTargetAudience(String targetAudience) {
        return new ContentRequest(topic, contentType, targetAudience, qualityThreshold, maxIterations);
    }

    /**
     * qualityThreshold만 변경한 새 인스턴스 생성.
     */
    public ContentRequest withQualityThreshold(int qualityThreshold) {
        return new ContentRequest(topic, contentType, targetAudience, qualityThreshold, maxIterations);
    }

    /**
     * maxIterations만 변경한 새 인스턴스 생성.
     */
    public ContentRequest withMaxIterations(int maxIterations) {
        return new ContentRequest(topic, contentType, targetAudience, qualityThreshold, maxIterations);
    }
}
