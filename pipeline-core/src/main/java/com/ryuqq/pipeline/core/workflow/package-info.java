/**
 * Workflow - 입력 Schema에서 출력 Schema까지 타입이 이어진 단계 그래프.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.workflow;
