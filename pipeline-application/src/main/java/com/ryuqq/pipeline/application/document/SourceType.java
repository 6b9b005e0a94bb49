package com.ryuqq.pipeline.application.document;

/**
 * 문서 출처 종류.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum SourceType {

    /**
     * http-fetch Tool로 가져오는 URL.
     */
    URL,

    /**
     * 로컬 파일 경로.
     */
    PATH,

    /**
     * 요청에 직접 포함된 본문.
     */
    CONTENT
}
