package com.ryuqq.pipeline.application.document;

/**
 * 문서 처리 Workflow 출력.
 *
 * @param documentId 문서 ID
 * @param chunksCount 청크 수
 * @param indexed 색인 여부
 * @param indexName 인덱스 이름
 * @param summary 요약 (청크 미리보기 포함)
 * @param metadata 메타데이터
 * @author Pipeline Team
 * @since 1.0.0
 */
public record IndexedDocument(
    String documentId,
    int chunksCount,
    boolean indexed,
    String indexName,
    String summary,
    IndexMetadata metadata
) {
}
