package com.ryuqq.pipeline.application.runner;

import com.ryuqq.pipeline.core.engine.RunOptions;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;

/**
 * 등록된 Workflow 실행 포트.
 *
 * <p>Workflow ID로 카탈로그에서 정의를 찾아 실행하고 결과를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowResult&lt;FinalContent&gt; result = runner.run(
 *     ContentReviewWorkflow.ID,
 *     ContentRequest.of("Java virtual threads", ContentType.BLOG),
 *     RunOptions.defaults()
 * );
 *
 * if (result instanceof Succeeded&lt;FinalContent&gt; succeeded) {
 *     FinalContent content = succeeded.value();
 * }
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface WorkflowRunner {

    /**
     * Workflow를 실행하고 완료까지 대기.
     *
     * <p>Step 실패, Schema 위반, 취소는 예외가 아닌
     * {@link com.ryuqq.pipeline.core.outcome.Failed}로 반환됩니다.</p>
     *
     * @param workflowId 실행할 Workflow ID
     * @param input Workflow 입력
     * @param options 실행 옵션
     * @param <O> 출력 타입
     * @return 실행 결과
     * @throws IllegalArgumentException workflowId가 등록되지 않았거나 options가 null인 경우
     */
    <O> WorkflowResult<O> run(String workflowId, Object input, RunOptions options);
}
