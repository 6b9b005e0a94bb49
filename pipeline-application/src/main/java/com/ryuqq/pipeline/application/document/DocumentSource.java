package com.ryuqq.pipeline.application.document;

/**
 * 문서 출처.
 *
 * @param type 출처 종류
 * @param value URL, 파일 경로 또는 본문
 * @author Pipeline Team
 * @since 1.0.0
 */
public record DocumentSource(SourceType type, String value) {

    public static DocumentSource url(String url) {
        return new DocumentSource(SourceType.URL, url);
    }

    public static DocumentSource path(String path) {
        return new DocumentSource(SourceType.PATH, path);
    }

    public static DocumentSource content(String content) {
        return new DocumentSource(SourceType.CONTENT, content);
    }
}
