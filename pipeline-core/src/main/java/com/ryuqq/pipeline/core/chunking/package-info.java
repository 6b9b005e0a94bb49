/**
 * Text Chunker - 고정 창, 문단, 재귀, 문장 전략과 overlap.
 *
 * <p>Step 내부에서 호출되는 독립 구성요소이며 엔진에 의존하지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.chunking;
