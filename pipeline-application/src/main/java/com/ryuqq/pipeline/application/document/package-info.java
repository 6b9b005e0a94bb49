/**
 * 문서 처리 Workflow (형식별 분기, 분할, 색인).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.document;
