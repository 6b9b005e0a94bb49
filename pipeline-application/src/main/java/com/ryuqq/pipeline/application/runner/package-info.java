/**
 * Pipeline Application Layer - Workflow 실행 포트.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.runner.WorkflowRunner} - 동기 실행</li>
 *   <li>{@link com.ryuqq.pipeline.application.runner.WorkflowSubmitter} - 비동기 제출</li>
 *   <li>{@link com.ryuqq.pipeline.application.runner.RunHandle} - 제출된 실행 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.runner;
