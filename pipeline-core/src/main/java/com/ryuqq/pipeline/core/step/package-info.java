/**
 * Step - Schema로 경계가 정해진 작업 단위.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.step;
