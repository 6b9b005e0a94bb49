package com.ryuqq.pipeline.application.content;

import java.util.Locale;

/**
 * 생성할 콘텐츠 종류.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ContentType {

    BLOG,
    REPORT,
    SCRIPT,
    SOCIAL;

    /**
     * 프롬프트에 쓰이는 소문자 이름.
     *
     * @return 예: "blog"
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
