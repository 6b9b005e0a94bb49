package com.ryuqq.pipeline.core.capability;

import java.util.List;
import java.util.function.Consumer;

/**
 * Generator의 스트리밍 출력.
 *
 * <p>텍스트 조각을 생성 순서대로 소비자에게 전달합니다. 한 번만 소비한다고 가정합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GenerationStream {

    /**
     * 각 텍스트 조각을 순서대로 전달.
     *
     * @param consumer 조각 소비자
     */
    void forEach(Consumer<String> consumer);

    /**
     * 모든 조각을 이어 붙인 전체 텍스트.
     *
     * @return 전체 텍스트
     */
    default String text() {
        StringBuilder builder = new StringBuilder();
        forEach(builder::append);
        return builder.toString();
    }

    /**
     * 미리 준비된 조각으로 스트림 생성.
     *
     * @param chunks 텍스트 조각
     * @return GenerationStream
     */
    static GenerationStream of(List<String> chunks) {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }
        List<String> copy = List.copyOf(chunks);
        return consumer -> copy.forEach(consumer);
    }
}
