package com.ryuqq.pipeline.application.document;

import java.util.List;

/**
 * vector-index Tool 출력.
 *
 * @param vectorIds 청크 순서대로 부여된 벡터 ID
 * @author Pipeline Team
 * @since 1.0.0
 */
public record IndexReceipt(List<String> vectorIds) {

    public IndexReceipt {
        vectorIds = vectorIds == null ? List.of() : List.copyOf(vectorIds);
    }
}
