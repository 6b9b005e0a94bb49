package com.ryuqq.pipeline.application.content;

/**
 * 최종 콘텐츠 상태.
 *
 * <ul>
 *   <li>APPROVED: 기준 점수 도달</li>
 *   <li>LOOP_EXCEEDED: 최대 반복까지 기준 미달 (승인으로 취급하지 않음)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ContentStatus {

    APPROVED,
    LOOP_EXCEEDED
}
