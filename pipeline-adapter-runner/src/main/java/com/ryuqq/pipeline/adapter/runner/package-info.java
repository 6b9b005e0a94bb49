/**
 * Runner Adapter Layer - Workflow 실행 포트 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.InlineWorkflowRunner} - 호출 스레드 실행</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.AsyncWorkflowRunner} - 스레드 풀 실행, 진행 채널 스트리밍</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (InlineWorkflowRunner, AsyncWorkflowRunner)
 *   ↓ implements
 * application (WorkflowRunner, WorkflowSubmitter)
 *   ↓ depends on
 * core (WorkflowEngine, Workflow, WorkflowResult)
 *   ↓ uses
 * adapter-inmemory (BoundedProgressChannel)
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.runner;
