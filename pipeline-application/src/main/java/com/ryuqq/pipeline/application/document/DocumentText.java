package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.chunking.Chunk;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 문서 텍스트 처리 유틸리티.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
final class DocumentText {

    static final int PREVIEW_CHUNKS = 3;
    static final int PREVIEW_LENGTH = 500;

    private static final Pattern SCRIPT = Pattern.compile(
        "<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile(
        "<style\\b[^<]*(?:(?!</style>)<[^<]*)*</style>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TITLE = Pattern.compile("^#\\s+(.+)$", Pattern.MULTILINE);

    /**
     * script, style 블록과 태그를 제거하고 공백을 정리.
     *
     * @param html HTML
     * @return 일반 텍스트
     */
    static String stripHtml(String html) {
        String text = SCRIPT.matcher(html).replaceAll("");
        text = STYLE.matcher(text).replaceAll("");
        text = TAG.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * 첫 번째 1단계 Markdown 제목.
     *
     * @param markdown Markdown
     * @return 제목 또는 null
     */
    static String title(String markdown) {
        Matcher matcher = TITLE.matcher(markdown);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(text.trim()).length;
    }

    /**
     * 색인 요약 생성.
     *
     * @param chunks 청크 목록
     * @return "Document indexed with N chunks. Preview: ..."
     */
    static String summary(List<Chunk> chunks) {
        String preview = chunks.stream()
            .limit(PREVIEW_CHUNKS)
            .map(Chunk::content)
            .collect(Collectors.joining(" "));
        if (preview.length() > PREVIEW_LENGTH) {
            preview = preview.substring(0, PREVIEW_LENGTH);
        }
        return "Document indexed with " + chunks.size() + " chunks. Preview: " + preview + "...";
    }

    // Utility class - prevent instantiation
    private DocumentText() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
