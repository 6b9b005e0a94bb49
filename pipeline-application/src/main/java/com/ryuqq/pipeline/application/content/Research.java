package com.ryuqq.pipeline.application.content;

import java.util.List;

/**
 * 주제 조사 결과.
 *
 * @param summary 요약
 * @param keyPoints 핵심 포인트
 * @param sources 출처 (없으면 빈 목록)
 * @param facts 참고 사실 (없으면 빈 목록)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Research(String summary, List<String> keyPoints, List<String> sources, List<String> facts) {

    public Research {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        sources = sources == null ? List.of() : List.copyOf(sources);
        facts = facts == null ? List.of() : List.copyOf(facts);
    }
}
