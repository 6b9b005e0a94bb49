package com.ryuqq.pipeline.application.document;

import java.util.Locale;

/**
 * 로드된 문서 형식.
 *
 * <p><strong>감지 규칙:</strong></p>
 * <ul>
 *   <li>URL: Content-Type 헤더 (application/pdf, text/html, text/markdown, 그 외 TEXT)</li>
 *   <li>PATH: 확장자 (.pdf, .md, .html/.htm, 그 외 TEXT)</li>
 *   <li>CONTENT: "%PDF" 시작, "&lt;!DOCTYPE html&gt;" 또는 "&lt;html" 포함, "# " 포함 순</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum DocumentFormat {

    PDF,
    HTML,
    MARKDOWN,
    TEXT;

    /**
     * Markdown 변환이 필요한 형식인지 확인.
     *
     * @return PDF, HTML이면 true
     */
    public boolean requiresConversion() {
        return this == PDF || this == HTML;
    }

    /**
     * Content-Type 헤더로 형식 감지.
     *
     * @param contentType 헤더 값 (null 허용)
     * @return DocumentFormat
     */
    public static DocumentFormat fromContentType(String contentType) {
        String value = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (value.contains("application/pdf")) {
            return PDF;
        }
        if (value.contains("text/html")) {
            return HTML;
        }
        if (value.contains("text/markdown")) {
            return MARKDOWN;
        }
        return TEXT;
    }

    /**
     * 파일 확장자로 형식 감지.
     *
     * @param path 파일 경로
     * @return DocumentFormat
     */
    public static DocumentFormat fromPath(String path) {
        String value = path.toLowerCase(Locale.ROOT);
        if (value.endsWith(".pdf")) {
            return PDF;
        }
        if (value.endsWith(".md")) {
            return MARKDOWN;
        }
        if (value.endsWith(".html") || value.endsWith(".htm")) {
            return HTML;
        }
        return TEXT;
    }

    /**
     * 본문 내용으로 형식 감지.
     *
     * @param content 본문
     * @return DocumentFormat
     */
    public static DocumentFormat sniff(String content) {
        if (content.startsWith("%PDF")) {
            return PDF;
        }
        if (content.contains("<!DOCTYPE html>") || content.contains("<html")) {
            return HTML;
        }
        if (content.contains("# ")) {
            return MARKDOWN;
        }
        return TEXT;
    }
}
