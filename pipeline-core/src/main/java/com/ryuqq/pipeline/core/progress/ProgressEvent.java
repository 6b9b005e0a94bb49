package com.ryuqq.pipeline.core.progress;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 구조화된 진행 이벤트.
 *
 * @param sequence 실행 내 일련번호 (0부터 단조 증가)
 * @param stepId Step ID
 * @param occurrence Step 실행 순번 (1부터 시작)
 * @param kind 이벤트 종류
 * @param payload 이벤트 속성 (percent, message, durationMs, error 등)
 * @param timestamp 발생 시각
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ProgressEvent(
    long sequence,
    String stepId,
    int occurrence,
    ProgressKind kind,
    Map<String, Object> payload,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 유효하지 않은 경우
     */
    public ProgressEvent {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId cannot be null or blank");
        }
        if (occurrence < 1) {
            throw new IllegalArgumentException("occurrence must be positive (current: " + occurrence + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        // payload 값은 null을 허용하므로 Map.copyOf 대신 LinkedHashMap 복사
        payload = payload == null || payload.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * 이벤트가 속한 Step 실행 키.
     *
     * @return StepKey
     */
    public StepKey key() {
        return new StepKey(stepId, occurrence);
    }

    /**
     * payload 값 조회.
     *
     * @param name 속성 이름
     * @return 속성 값 (없으면 null)
     */
    public Object attribute(String name) {
        return payload.get(name);
    }
}
