package com.ryuqq.pipeline.application.document;

/**
 * Markdown으로 정규화된 문서 (branch 출력).
 *
 * @param request 원본 요청
 * @param content Markdown 또는 일반 텍스트
 * @param convertedFrom 원래 형식
 * @param title 첫 번째 "# " 제목 (없으면 null)
 * @param sourceUrl URL 출처인 경우 URL, 아니면 null
 * @param wordCount 단어 수
 * @param pageCount PDF 페이지 수 (알 수 없으면 null)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record MarkdownDocument(
    DocumentRequest request,
    String content,
    DocumentFormat convertedFrom,
    String title,
    String sourceUrl,
    int wordCount,
    Integer pageCount
) {
}
