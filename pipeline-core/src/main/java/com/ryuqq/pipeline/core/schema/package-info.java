/**
 * Schema Contract - Step 경계 값 검증.
 *
 * <p>이 패키지는 Step, Tool, Workflow의 입출력 값 구조를 기술하고 검증하는 타입을 제공합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.schema.Schema} - 검증 계약</li>
 *   <li>{@link com.ryuqq.pipeline.core.schema.Validation} - 검증 결과 (Valid / Invalid)</li>
 *   <li>{@link com.ryuqq.pipeline.core.schema.Schemas} - 문자열, 정수, 열거형, 목록, 구조체 Schema 팩토리</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>예외 없는 검증:</strong> validate()는 결과 값을 반환하고, 예외 변환은 엔진이 담당</li>
 *   <li><strong>불변:</strong> 모든 Schema는 불변이며 프로세스 시작 시 한 번 구성</li>
 *   <li><strong>경로 보고:</strong> 중첩 위반은 {@code field.list[2]} 형식의 경로를 가짐</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.schema;
