package com.ryuqq.pipeline.core.schema;

import java.util.List;

/**
 * 검증 실패.
 *
 * @param violations 위반 목록 (1개 이상)
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Invalid<T>(List<Violation> violations) implements Validation<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException violations가 null이거나 비어 있는 경우
     */
    public Invalid {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        violations = List.copyOf(violations);
    }

    /**
     * 위반 목록을 한 줄 요약으로 변환.
     *
     * @return "path: message; path: message" 형식의 요약
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Violation violation : violations) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(violation);
        }
        return sb.toString();
    }
}
