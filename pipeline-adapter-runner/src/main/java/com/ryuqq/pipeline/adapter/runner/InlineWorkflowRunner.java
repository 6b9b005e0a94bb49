package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.application.runner.WorkflowRunner;
import com.ryuqq.pipeline.core.engine.RunOptions;
import com.ryuqq.pipeline.core.engine.WorkflowEngine;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.spi.WorkflowCatalog;
import com.ryuqq.pipeline.core.workflow.Workflow;

/**
 * 호출 스레드에서 Workflow를 실행하는 Runner.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>카탈로그에서 workflowId로 Workflow 조회</li>
 *   <li>호출 스레드에서 {@link WorkflowEngine#execute} 실행</li>
 *   <li>결과(성공/실패) 반환</li>
 * </ol>
 *
 * <p>상태가 없으므로 여러 스레드에서 동시에 호출해도 안전합니다.
 * 각 실행은 자신의 진행 로그와 Span 트리를 가집니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class InlineWorkflowRunner implements WorkflowRunner {

    private final WorkflowCatalog catalog;
    private final WorkflowEngine engine;

    /**
     * 생성자.
     *
     * @param catalog Workflow 카탈로그
     * @param engine 실행 엔진
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public InlineWorkflowRunner(WorkflowCatalog catalog, WorkflowEngine engine) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.catalog = catalog;
        this.engine = engine;
    }

    @Override
    public <O> WorkflowResult<O> run(String workflowId, Object input, RunOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Workflow<Object, O> workflow = resolve(workflowId);
        return engine.execute(workflow, input, options);
    }

    /**
     * 카탈로그에서 Workflow 조회.
     *
     * <p>입력은 엔진이 Workflow 입력 Schema로 검증하므로 입력 타입은 Object로 취급합니다.</p>
     *
     * @param workflowId Workflow ID
     * @param <O> 출력 타입
     * @return Workflow
     * @throws IllegalArgumentException 등록되지 않은 ID인 경우
     */
    @SuppressWarnings("unchecked")
    <O> Workflow<Object, O> resolve(String workflowId) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflowId cannot be null or blank");
        }
        Workflow<?, ?> workflow = catalog.find(workflowId).orElseThrow(() ->
            new IllegalArgumentException("Unknown workflow: " + workflowId + " (registered: " + catalog.ids() + ")")
        );
        return (Workflow<Object, O>) workflow;
    }

    WorkflowEngine engine() {
        return engine;
    }
}
