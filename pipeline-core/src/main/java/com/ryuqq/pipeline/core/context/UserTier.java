package com.ryuqq.pipeline.core.context;

/**
 * 요청자 등급.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum UserTier {
    FREE,
    PRO,
    ENTERPRISE
}
