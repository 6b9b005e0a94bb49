package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.adapter.inmemory.channel.BoundedProgressChannel;
import com.ryuqq.pipeline.application.runner.RunHandle;
import com.ryuqq.pipeline.application.runner.WorkflowRunner;
import com.ryuqq.pipeline.application.runner.WorkflowSubmitter;
import com.ryuqq.pipeline.core.context.CancellationSignal;
import com.ryuqq.pipeline.core.context.CancellationToken;
import com.ryuqq.pipeline.core.engine.RunOptions;
import com.ryuqq.pipeline.core.engine.WorkflowEngine;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.spi.ProgressSink;
import com.ryuqq.pipeline.core.spi.WorkflowCatalog;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 스레드 풀에서 독립 실행을 동시에 처리하는 Runner.
 *
 * <p><strong>동작 방식 (submit):</strong></p>
 * <ol>
 *   <li>카탈로그에서 Workflow 조회 (미등록 ID는 즉시 예외)</li>
 *   <li>runId 결정 (옵션에 없으면 UUID)</li>
 *   <li>실행 전용 {@link BoundedProgressChannel}과 {@link CancellationToken} 생성</li>
 *   <li>스레드 풀에 실행 위임, 종료 시 채널 close</li>
 *   <li>{@link RunHandle} 반환</li>
 * </ol>
 *
 * <p><strong>격리:</strong> 실행 간 공유 상태가 없습니다. 진행 로그, Span 트리, 채널,
 * 취소 토큰은 모두 실행마다 새로 만들어집니다.</p>
 *
 * <p><strong>취소:</strong> 핸들의 취소 요청과 옵션의 취소 신호 중 하나라도 켜지면
 * 다음 관측 지점에서 실행이 CANCELLED로 종료됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class AsyncWorkflowRunner implements WorkflowRunner, WorkflowSubmitter {

    private static final Logger log = LoggerFactory.getLogger(AsyncWorkflowRunner.class);

    private final InlineWorkflowRunner inline;
    private final RunnerConfig config;
    private final ExecutorService runExecutor;
    private final AtomicInteger activeRuns;

    /**
     * 기본 설정 생성자.
     *
     * @param catalog Workflow 카탈로그
     * @param engine 실행 엔진
     */
    public AsyncWorkflowRunner(WorkflowCatalog catalog, WorkflowEngine engine) {
        this(catalog, engine, new RunnerConfig());
    }

    /**
     * 생성자.
     *
     * @param catalog Workflow 카탈로그
     * @param engine 실행 엔진
     * @param config Runner 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public AsyncWorkflowRunner(WorkflowCatalog catalog, WorkflowEngine engine, RunnerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.inline = new InlineWorkflowRunner(catalog, engine);
        this.config = config;
        this.runExecutor = Executors.newFixedThreadPool(config.concurrency());
        this.activeRuns = new AtomicInteger();
    }

    /**
     * {@inheritDoc}
     *
     * <p>호출 스레드에서 실행합니다 (스레드 풀을 거치지 않음).</p>
     */
    @Override
    public <O> WorkflowResult<O> run(String workflowId, Object input, RunOptions options) {
        return inline.run(workflowId, input, options);
    }

    @Override
    public <O> RunHandle<O> submit(String workflowId, Object input, RunOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        Workflow<Object, O> workflow = inline.resolve(workflowId);

        String runId = options.runId() != null ? options.runId() : UUID.randomUUID().toString();
        BoundedProgressChannel channel = new BoundedProgressChannel(
            config.progressCapacity(), config.progressOfferTimeoutMs());
        CancellationToken token = new CancellationToken();
        RunOptions runOptions = options
            .withRunId(runId)
            .withCancellation(either(token, options.cancellation()))
            .withListener(fanOut(channel, options.listener()));

        WorkflowEngine engine = inline.engine();
        CompletableFuture<WorkflowResult<O>> future = CompletableFuture.supplyAsync(() -> {
            activeRuns.incrementAndGet();
            try {
                return engine.execute(workflow, input, runOptions);
            } finally {
                channel.close();
                activeRuns.decrementAndGet();
            }
        }, runExecutor);

        log.debug("Submitted workflow {} (run={})", workflowId, runId);
        return new RunHandle<>(runId, future, channel, token);
    }

    /**
     * 현재 실행 중인 Run 수. 테스트 검증용.
     *
     * @return 실행 중인 Run 수
     */
    public int activeRuns() {
        return activeRuns.get();
    }

    /**
     * Runner 종료.
     *
     * <p>새 제출을 거부하고, 진행 중인 실행이 shutdownTimeoutMs 안에 끝나지 않으면
     * 작업 스레드를 인터럽트합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        runExecutor.shutdown();
        if (!runExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Runs still active after {}ms, interrupting {} run(s)",
                config.shutdownTimeoutMs(), activeRuns.get());
            runExecutor.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return runExecutor.isShutdown();
    }

    private static CancellationSignal either(CancellationSignal first, CancellationSignal second) {
        return () -> first.isCancelled() || second.isCancelled();
    }

    private static ProgressSink fanOut(ProgressSink channel, ProgressSink downstream) {
        if (downstream == ProgressSink.NONE) {
            return channel;
        }
        return event -> {
            channel.accept(event);
            downstream.accept(event);
        };
    }
}
