package com.ryuqq.pipeline.application.document;

/**
 * document-processor Generator의 PDF 변환 결과.
 *
 * @param markdown 변환된 Markdown
 * @param pageCount 페이지 수 (알 수 없으면 null)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record PdfConversion(String markdown, Integer pageCount) {
}
