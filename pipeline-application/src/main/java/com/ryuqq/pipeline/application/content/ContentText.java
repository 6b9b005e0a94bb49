package com.ryuqq.pipeline.application.content;

/**
 * 콘텐츠 문자열 유틸리티.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
final class ContentText {

    private ContentText() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static int wordCount(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        return content.trim().split("\\s+").length;
    }
}
