package com.ryuqq.pipeline.application.content;

import java.util.List;

/**
 * 평가 Generator의 구조화 출력.
 *
 * @param score 점수 (범위 밖의 값은 리뷰 단계에서 0 ~ 100으로 보정)
 * @param feedback 개선 의견
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Evaluation(int score, List<String> feedback) {

    public Evaluation {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }
}
