package com.ryuqq.pipeline.core.schema;

import java.util.List;

/**
 * 검증 통과.
 *
 * @param value 검증된 값 (optional Schema의 경우 null 가능)
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Valid<T>(T value) implements Validation<T> {

    @Override
    public List<Violation> violations() {
        return List.of();
    }
}
