package com.ryuqq.pipeline.core.composition;

import java.util.List;

/**
 * 하위 단계를 순서대로 실행하는 단계.
 *
 * @param name 이름
 * @param stages 하위 단계 (1개 이상)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record SequenceStage(String name, List<Stage> stages) implements Stage {

    public SequenceStage {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("stages cannot be null or empty");
        }
        stages = List.copyOf(stages);
    }
}
