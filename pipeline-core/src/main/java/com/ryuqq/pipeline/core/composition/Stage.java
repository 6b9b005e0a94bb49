package com.ryuqq.pipeline.core.composition;

/**
 * Workflow를 구성하는 실행 단계.
 *
 * <p>Sealed interface이므로 엔진은 모든 단계 종류를 컴파일 타임에 열거할 수 있습니다:</p>
 * <ul>
 *   <li>{@link StepStage}: Step 하나 실행</li>
 *   <li>{@link SequenceStage}: 하위 단계를 순서대로 실행하며 출력을 다음 입력으로 전달</li>
 *   <li>{@link BranchStage}: 첫 번째로 일치한 분기의 Step 실행</li>
 *   <li>{@link LoopStage}: 본문을 최소 1회, 최대 maxIterations회 반복</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public sealed interface Stage permits StepStage, SequenceStage, BranchStage, LoopStage {

    /**
     * 단계 이름 (Span 이름과 로그에 사용).
     *
     * @return 이름
     */
    String name();
}
