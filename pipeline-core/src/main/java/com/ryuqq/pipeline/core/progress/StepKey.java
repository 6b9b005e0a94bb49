package com.ryuqq.pipeline.core.progress;

/**
 * 한 실행 내에서 Step 실행 한 건을 식별하는 키.
 *
 * <p>루프 본문처럼 같은 Step이 여러 번 실행되면 occurrence가 1, 2, 3... 으로 증가하며,
 * 진행 이벤트 순서 불변식은 이 키 단위로 적용됩니다.</p>
 *
 * @param stepId Step ID
 * @param occurrence 실행 순번 (1부터 시작)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record StepKey(String stepId, int occurrence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException stepId가 비어 있거나 occurrence가 양수가 아닌 경우
     */
    public StepKey {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId cannot be null or blank");
        }
        if (occurrence < 1) {
            throw new IllegalArgumentException("occurrence must be positive (current: " + occurrence + ")");
        }
    }

    @Override
    public String toString() {
        return stepId + "#" + occurrence;
    }
}
