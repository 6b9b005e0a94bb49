package com.ryuqq.pipeline.application.document;

/**
 * http-fetch Tool 응답.
 *
 * @param body 응답 본문
 * @param contentType Content-Type 헤더 (없으면 빈 문자열)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record FetchedResource(String body, String contentType) {

    public FetchedResource {
        body = body == null ? "" : body;
        contentType = contentType == null ? "" : contentType;
    }
}
