package com.ryuqq.pipeline.application.content;

import java.util.ArrayList;
import java.util.List;

/**
 * 리뷰 루프 상태.
 *
 * <p>draft-content가 iteration 0 상태를 만들고, review-content가 실행될 때마다
 * iteration이 1 증가하며 scoreHistory에 점수가 추가됩니다.</p>
 *
 * @param request 원본 요청
 * @param research 조사 결과
 * @param content 현재 콘텐츠
 * @param wordCount 단어 수
 * @param score 최근 점수 (iteration 0에서는 0)
 * @param feedback 최근 피드백
 * @param iteration 완료된 리뷰 횟수
 * @param scoreHistory 리뷰별 점수 (추가만 가능)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ReviewState(
    ContentRequest request,
    Research research,
    String content,
    int wordCount,
    int score,
    List<String> feedback,
    int iteration,
    List<Integer> scoreHistory
) {

    public ReviewState {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
        scoreHistory = scoreHistory == null ? List.of() : List.copyOf(scoreHistory);
    }

    /**
     * 초안 상태 생성.
     *
     * @param topic 조사된 주제
     * @param content 초안
     * @return iteration 0 상태
     */
    public static ReviewState draft(ResearchedTopic topic, String content) {
        return new ReviewState(topic.request(), topic.research(), content, ContentText.wordCount(content),
            0, List.of(), 0, List.of());
    }

    /**
     * 리뷰 1회 결과를 반영한 다음 상태 생성.
     *
     * @param revisedContent 리뷰 대상이 된 콘텐츠
     * @param newScore 점수
     * @param newFeedback 피드백
     * @return iteration + 1 상태
     */
    public ReviewState reviewed(String revisedContent, int newScore, List<String> newFeedback) {
        List<Integer> history = new ArrayList<>(scoreHistory);
        history.add(newScore);
        return new ReviewState(request, research, revisedContent, ContentText.wordCount(revisedContent),
            newScore, newFeedback, iteration + 1, history);
    }

    public boolean isApproved() {
        return iteration > 0 && score >= request.qualityThreshold();
    }

    /**
     * 루프 계속 조건.
     *
     * @return 기준 미달이고 요청된 최대 반복에 도달하지 않았으면 true
     */
    public boolean needsAnotherReview() {
        return score < request.qualityThreshold() && iteration < request.maxIterations();
    }
}
