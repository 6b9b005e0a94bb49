package com.ryuqq.pipeline.application.document;

/**
 * load-document 출력.
 *
 * <p>PDF는 본문 대신 URL 또는 경로를 content로 가집니다.</p>
 *
 * @param request 원본 요청
 * @param content 원문 (PDF는 위치)
 * @param format 감지된 형식
 * @param sourceUrl URL 출처인 경우 URL, 아니면 null
 * @param wordCount 단어 수
 * @author Pipeline Team
 * @since 1.0.0
 */
public record LoadedDocument(
    DocumentRequest request,
    String content,
    DocumentFormat format,
    String sourceUrl,
    int wordCount
) {
}
