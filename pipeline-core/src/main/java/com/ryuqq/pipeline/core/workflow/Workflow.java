package com.ryuqq.pipeline.core.workflow;

import com.ryuqq.pipeline.core.composition.Branch;
import com.ryuqq.pipeline.core.composition.BranchStage;
import com.ryuqq.pipeline.core.composition.ExhaustionPolicy;
import com.ryuqq.pipeline.core.composition.LoopStage;
import com.ryuqq.pipeline.core.composition.SequenceStage;
import com.ryuqq.pipeline.core.composition.Stage;
import com.ryuqq.pipeline.core.composition.Stages;
import com.ryuqq.pipeline.core.composition.StepStage;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.step.Step;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 커밋된(불변) Workflow 정의.
 *
 * <p>입력 Schema, 출력 Schema, 그리고 루트 {@link SequenceStage}로 구성됩니다.
 * 하나의 Workflow 정의는 여러 실행에서 동시에 재사용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Workflow&lt;ContentRequest, FinalContent&gt; workflow = Workflow.builder("content-review", requestSchema)
 *     .then(researchTopic)
 *     .then(draftContent)
 *     .repeatUntil(reviewContent, state -&gt; state.shouldContinue(), 10)
 *     .then(finalizeContent)
 *     .commit(finalContentSchema);
 * </pre>
 *
 * @param <I> Workflow 입력 타입
 * @param <O> Workflow 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Workflow<I, O> {

    private final String id;
    private final String description;
    private final Schema<I> inputSchema;
    private final Schema<O> outputSchema;
    private final SequenceStage root;

    private Workflow(String id, String description, Schema<I> inputSchema, Schema<O> outputSchema, SequenceStage root) {
        this.id = id;
        this.description = description;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.root = root;
    }

    /**
     * Workflow 빌더 생성.
     *
     * @param id Workflow ID
     * @param inputSchema 입력 Schema
     * @param <I> 입력 타입
     * @return Builder (현재 출력 타입 = 입력 타입)
     * @throws IllegalArgumentException id가 비어 있거나 inputSchema가 null인 경우
     */
    public static <I> Builder<I, I> builder(String id, Schema<I> inputSchema) {
        return new Builder<>(id, inputSchema);
    }

    public String id() {
        return id;
    }

    public String description() {
        return description;
    }

    public Schema<I> inputSchema() {
        return inputSchema;
    }

    public Schema<O> outputSchema() {
        return outputSchema;
    }

    public SequenceStage root() {
        return root;
    }

    /**
     * Workflow에 포함된 모든 Step ID (선언 순서, 중복 제거).
     *
     * @return Step ID 집합
     */
    public Set<String> stepIds() {
        Set<String> ids = new LinkedHashSet<>();
        collectStepIds(root, ids);
        return ids;
    }

    private static void collectStepIds(Stage stage, Set<String> ids) {
        if (stage instanceof StepStage stepStage) {
            ids.add(stepStage.step().id());
        } else if (stage instanceof SequenceStage sequence) {
            sequence.stages().forEach(child -> collectStepIds(child, ids));
        } else if (stage instanceof BranchStage branch) {
            branch.cases().forEach(branchCase -> ids.add(branchCase.step().id()));
            branch.otherwiseStep().ifPresent(step -> ids.add(step.id()));
        } else if (stage instanceof LoopStage loop) {
            ids.add(loop.body().id());
        }
    }

    @Override
    public String toString() {
        return "Workflow{id='" + id + "', stages=" + root.stages().size() + "}";
    }

    /**
     * 타입을 추적하는 Workflow 빌더.
     *
     * <p>각 단계를 추가할 때마다 현재 출력 타입 {@code C}가 다음 단계의 입력 타입이 됩니다.</p>
     *
     * @param <I> Workflow 입력 타입
     * @param <C> 현재까지의 출력 타입
     */
    public static final class Builder<I, C> {

        private final String id;
        private final Schema<I> inputSchema;
        private final List<Stage> stages = new ArrayList<>();
        private String description;

        private Builder(String id, Schema<I> inputSchema) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id cannot be null or blank");
            }
            if (inputSchema == null) {
                throw new IllegalArgumentException("inputSchema cannot be null");
            }
            this.id = id;
            this.inputSchema = inputSchema;
        }

        public Builder<I, C> description(String description) {
            this.description = description;
            return this;
        }

        /**
         * 다음 Step 추가.
         *
         * @param step Step
         * @param <N> Step 출력 타입
         * @return Builder (현재 출력 타입 = N)
         */
        public <N> Builder<I, N> then(Step<? super C, N> step) {
            return advance(Stages.step(step));
        }

        /**
         * 분기 추가.
         *
         * @param branch 분기
         * @param <N> 분기 출력 타입
         * @return Builder (현재 출력 타입 = N)
         */
        public <N> Builder<I, N> branch(Branch<? super C, N> branch) {
            return advance(Stages.branch(branch));
        }

        /**
         * 수렴 루프 추가 ({@link ExhaustionPolicy#FLAG}).
         *
         * @param body 반복 본문
         * @param continueWhile 계속 조건
         * @param maxIterations 최대 반복 횟수
         * @return Builder
         */
        public Builder<I, C> repeatUntil(Step<C, C> body, Predicate<? super C> continueWhile, int maxIterations) {
            return repeatUntil(body, continueWhile, maxIterations, ExhaustionPolicy.FLAG);
        }

        /**
         * 수렴 루프 추가.
         *
         * @param body 반복 본문
         * @param continueWhile 계속 조건
         * @param maxIterations 최대 반복 횟수
         * @param policy 최대 반복 도달 시 처리 방식
         * @return Builder
         */
        public Builder<I, C> repeatUntil(Step<C, C> body, Predicate<? super C> continueWhile,
                                         int maxIterations, ExhaustionPolicy policy) {
            return advance(Stages.repeatUntil(body, continueWhile, maxIterations, policy));
        }

        /**
         * 미리 구성한 단계 추가.
         *
         * @param stage 단계
         * @param <N> 단계 출력 타입
         * @return Builder
         */
        public <N> Builder<I, N> stage(Stage stage) {
            if (stage == null) {
                throw new IllegalArgumentException("stage cannot be null");
            }
            return advance(stage);
        }

        /**
         * Workflow 확정.
         *
         * @param outputSchema 최종 출력 Schema
         * @return 불변 Workflow
         * @throws IllegalStateException 단계가 하나도 없는 경우
         */
        public Workflow<I, C> commit(Schema<C> outputSchema) {
            if (outputSchema == null) {
                throw new IllegalArgumentException("outputSchema cannot be null");
            }
            if (stages.isEmpty()) {
                throw new IllegalStateException("workflow '" + id + "' has no stages");
            }
            String resolved = description == null || description.isBlank() ? id : description;
            return new Workflow<>(id, resolved, inputSchema, outputSchema, Stages.sequence(id, stages));
        }

        @SuppressWarnings("unchecked")
        private <N> Builder<I, N> advance(Stage stage) {
            stages.add(stage);
            return (Builder<I, N>) this;
        }
    }
}
