package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.chunking.ChunkStrategy;
import com.ryuqq.pipeline.core.chunking.ChunkingOptions;

/**
 * 문서 처리 Workflow 입력.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>chunking: RECURSIVE, size 512, overlap 50</li>
 *   <li>indexName: "documents"</li>
 * </ul>
 *
 * @param source 문서 출처
 * @param chunking 분할 설정
 * @param indexName 인덱스 이름
 * @author Pipeline Team
 * @since 1.0.0
 */
public record DocumentRequest(DocumentSource source, ChunkingOptions chunking, String indexName) {

    public static final String DEFAULT_INDEX_NAME = "documents";

    /**
     * 기본 분할 설정과 인덱스 이름으로 생성.
     *
     * @param source 문서 출처
     * @return DocumentRequest
     */
    public static DocumentRequest of(DocumentSource source) {
        return new DocumentRequest(source, new ChunkingOptions(), DEFAULT_INDEX_NAME);
    }

    /**
     * chunking만 변경한 새 인스턴스 생성.
     */
    public DocumentRequest withChunking(ChunkingOptions chunking) {
        return new DocumentRequest(source, chunking, indexName);
    }

    /**
     * 분할 전략만 변경한 새 인스턴스 생성.
     */
    public DocumentRequest withStrategy(ChunkStrategy strategy) {
        return new DocumentRequest(source, chunking.withStrategy(strategy), indexName);
    }

    /**
     * indexName만 변경한 새 인스턴스 생성.
     */
    public DocumentRequest withIndexName(String indexName) {
        return new DocumentRequest(source, chunking, indexName);
    }
}
