package com.ryuqq.pipeline.application.runner;

import com.ryuqq.pipeline.core.context.CancellationToken;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.spi.ProgressChannel;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 제출된 Workflow 실행 핸들.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>runId: 실행 ID</li>
 *   <li>result: 실행 결과 Future (엔진은 실패도 결과로 반환하므로 정상 완료)</li>
 *   <li>progress: 진행 이벤트 채널 (bounded, 느린 소비자는 중간 이벤트를 잃을 수 있음)</li>
 *   <li>cancellation: 협조적 취소 토큰</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunHandle&lt;IndexedDocument&gt; handle = submitter.submit(DocumentProcessingWorkflow.ID, request, options);
 *
 * Optional&lt;ProgressEvent&gt; event;
 * while ((event = handle.progress().poll(100)).isPresent() || !handle.isDone()) {
 *     event.ifPresent(this::render);
 * }
 * WorkflowResult&lt;IndexedDocument&gt; result = handle.await(5, TimeUnit.SECONDS);
 * </pre>
 *
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class RunHandle<O> {

    private final String runId;
    private final CompletableFuture<WorkflowResult<O>> result;
    private final ProgressChannel progress;
    private final CancellationToken cancellation;

    /**
     * 생성자.
     *
     * @param runId 실행 ID
     * @param result 실행 결과 Future
     * @param progress 진행 이벤트 채널
     * @param cancellation 취소 토큰
     * @throws IllegalArgumentException 인자가 null이거나 runId가 비어 있는 경우
     */
    public RunHandle(String runId, CompletableFuture<WorkflowResult<O>> result,
                     ProgressChannel progress, CancellationToken cancellation) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be null or blank");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (progress == null) {
            throw new IllegalArgumentException("progress cannot be null");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation cannot be null");
        }
        this.runId = runId;
        this.result = result;
        this.progress = progress;
        this.cancellation = cancellation;
    }

    public String runId() {
        return runId;
    }

    public ProgressChannel progress() {
        return progress;
    }

    public CompletableFuture<WorkflowResult<O>> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * 완료된 경우 결과 조회.
     *
     * @return 결과 또는 empty (진행 중)
     */
    public Optional<WorkflowResult<O>> resultIfDone() {
        if (!result.isDone() || result.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(result.join());
    }

    /**
     * 협조적 취소 요청.
     *
     * <p>실행 중인 Step은 다음 취소 확인 지점에서 중단되고 CANCELLED 이벤트를 남깁니다.</p>
     *
     * @param reason 취소 사유
     * @return 이번 호출로 취소가 요청된 경우 true (이미 요청된 경우 false)
     */
    public boolean cancel(String reason) {
        return cancellation.cancel(reason);
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancelled();
    }

    /**
     * 결과 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 실행 결과
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws TimeoutException 시간 내 완료되지 않은 경우
     * @throws IllegalStateException 실행 스레드에서 예상하지 못한 예외가 발생한 경우
     */
    public WorkflowResult<O> await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("run '" + runId + "' terminated abnormally", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "RunHandle{runId='" + runId + "', done=" + result.isDone()
            + ", cancelled=" + cancellation.isCancelled() + "}";
    }
}
