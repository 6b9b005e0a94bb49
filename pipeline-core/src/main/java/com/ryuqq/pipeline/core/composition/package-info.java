/**
 * Composition Layer - sequence, branch, repeatUntil.
 *
 * <p>동적 분기/반복을 sealed {@link com.ryuqq.pipeline.core.composition.Stage} 변형으로 표현하여
 * 엔진이 단계 종류를 정적으로 열거합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.composition;
