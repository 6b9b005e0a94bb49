/**
 * Capability - Step이 외부 협력자에 접근하는 유일한 경로.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.capability.Generator} - 텍스트/구조화 생성, 스트리밍</li>
 *   <li>{@link com.ryuqq.pipeline.core.capability.Tool} - Schema가 있는 외부 호출</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.capability;
