package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

import java.util.List;
import java.util.Optional;

/**
 * 조건 분기 단계.
 *
 * <p>분기 후보를 선언 순서대로 평가하여 처음 일치한 Step만 실행합니다.
 * 일치하는 후보가 없으면 otherwise Step을 실행하고, 그마저 없으면 설정 오류입니다.</p>
 *
 * @param name 이름
 * @param cases 분기 후보 (1개 이상, 선언 순서)
 * @param otherwise 기본 Step (null 가능)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record BranchStage(String name, List<BranchCase> cases, Step<?, ?> otherwise) implements Stage {

    /**
     * otherwise가 선택되었을 때의 {@code branch.selected} 값.
     */
    public static final String OTHERWISE = "otherwise";

    public BranchStage {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (cases == null || cases.isEmpty()) {
            throw new IllegalArgumentException("cases cannot be null or empty");
        }
        cases = List.copyOf(cases);
        long distinct = cases.stream().map(BranchCase::name).distinct().count();
        if (distinct != cases.size()) {
            throw new IllegalArgumentException("case names must be unique in branch '" + name + "'");
        }
        // otherwise는 null 허용
    }

    public Optional<Step<?, ?>> otherwiseStep() {
        return Optional.ofNullable(otherwise);
    }
}
