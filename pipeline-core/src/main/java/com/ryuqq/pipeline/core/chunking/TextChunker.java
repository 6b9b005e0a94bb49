package com.ryuqq.pipeline.core.chunking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 다중 전략 텍스트 분할기.
 *
 * <p><strong>전략별 동작:</strong></p>
 * <ul>
 *   <li>FIXED_WINDOW: 길이 size 창을 {@code size - overlap}씩 이동, 창이 끝에 닿으면 종료</li>
 *   <li>PARAGRAPH: 빈 줄로 나눈 문단을 {@code "\n\n"}으로 누적, size를 넘기면 청크를 닫고
 *       닫힌 청크의 마지막 overlap 문자 + 해당 문단으로 다음 청크 시작</li>
 *   <li>RECURSIVE: PARAGRAPH와 같되 size보다 긴 문단은 문장으로, 긴 문장은 고정 창으로 먼저 분할</li>
 *   <li>SENTENCE: 문장 누적, overlap 미적용, 내용은 원문 구간과 정확히 일치</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>chunkIndex는 0부터 연속</li>
 *   <li>startOffset, endOffset은 감소하지 않음</li>
 *   <li>빈 청크 없음, 마지막 버퍼는 항상 배출</li>
 *   <li>빈 입력은 빈 목록</li>
 * </ul>
 *
 * <p>상태가 없으므로 thread-safe합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class TextChunker {

    private static final Logger log = LoggerFactory.getLogger(TextChunker.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n\\s*");
    private static final String PARAGRAPH_JOIN = "\n\n";

    /**
     * 텍스트 분할.
     *
     * @param content 원문
     * @param strategy 분할 전략
     * @param size 목표 청크 크기 (양수)
     * @param overlap 중복 문자 수 (0 이상, size 미만)
     * @return 청크 목록
     * @throws IllegalArgumentException 설정이 유효하지 않은 경우
     */
    public List<Chunk> chunk(String content, ChunkStrategy strategy, int size, int overlap) {
        return chunk(content, new ChunkingOptions(strategy, size, overlap));
    }

    /**
     * 텍스트 분할.
     *
     * @param content 원문
     * @param options 분할 설정
     * @return 청크 목록 (빈 입력이면 빈 목록)
     * @throws IllegalArgumentException content 또는 options가 null인 경우
     */
    public List<Chunk> chunk(String content, ChunkingOptions options) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (content.isEmpty()) {
            return List.of();
        }

        List<Chunk> chunks = switch (options.strategy()) {
            case FIXED_WINDOW -> fixedWindow(content, options.size(), options.overlap());
            case PARAGRAPH -> accumulate(paragraphs(content), options.size(), options.overlap());
            case RECURSIVE -> accumulate(recursiveUnits(content, options.size()), options.size(), options.overlap());
            case SENTENCE -> accumulate(sentences(content, 0, content.length(), false), options.size(), 0);
        };
        log.debug("Chunked {} chars into {} chunks (strategy={}, size={}, overlap={})",
            content.length(), chunks.size(), options.strategy(), options.size(), options.overlap());
        return chunks;
    }

    /**
     * 텍스트 분할 후 요약 포함 결과 반환.
     *
     * @param content 원문
     * @param options 분할 설정
     * @return ChunkingResult
     */
    public ChunkingResult split(String content, ChunkingOptions options) {
        return ChunkingResult.of(chunk(content, options));
    }

    // ========================================
    // FIXED_WINDOW
    // ========================================

    private static List<Chunk> fixedWindow(String content, int size, int overlap) {
        List<Chunk> chunks = new ArrayList<>();
        int advance = size - overlap;
        int start = 0;
        while (start < content.length()) {
            int end = Math.min(start + size, content.length());
            chunks.add(Chunk.of(chunks.size(), content.substring(start, end), start, end));
            if (end == content.length()) {
                break;
            }
            start += advance;
        }
        return chunks;
    }

    // ========================================
    // Unit extraction
    // ========================================

    private static List<Unit> paragraphs(String content) {
        List<Unit> units = new ArrayList<>();
        Matcher matcher = PARAGRAPH_BREAK.matcher(content);
        int segmentStart = 0;
        while (matcher.find()) {
            addTrimmed(units, content, segmentStart, matcher.start());
            segmentStart = matcher.end();
        }
        addTrimmed(units, content, segmentStart, content.length());
        return units;
    }

    private static List<Unit> recursiveUnits(String content, int size) {
        List<Unit> units = new ArrayList<>();
        for (Unit paragraph : paragraphs(content)) {
            if (paragraph.length() <= size) {
                units.add(paragraph);
                continue;
            }
            for (Unit sentence : sentences(content, paragraph.start(), paragraph.end(), true)) {
                if (sentence.length() <= size) {
                    units.add(sentence);
                } else {
                    units.addAll(windows(content, sentence, size));
                }
            }
        }
        return units;
    }

    /**
     * [from, to) 구간을 문장 단위로 분할.
     *
     * <p>문장은 종결 부호({@code . ! ?}) 연속 뒤에서 끊기며, 앞쪽 공백은 문장에 포함됩니다.
     * 종결 부호가 없는 마지막 조각도 유지합니다.</p>
     */
    private static List<Unit> sentences(String content, int from, int to, boolean firstStartsParagraph) {
        List<Unit> units = new ArrayList<>();
        int segmentStart = from;
        for (int i = from; i < to; i++) {
            boolean boundary = isTerminator(content.charAt(i))
                && (i + 1 == to || !isTerminator(content.charAt(i + 1)));
            if (boundary) {
                addSentence(units, content, segmentStart, i + 1, firstStartsParagraph);
                segmentStart = i + 1;
            }
        }
        if (segmentStart < to) {
            int end = to;
            while (end > segmentStart && Character.isWhitespace(content.charAt(end - 1))) {
                end--;
            }
            addSentence(units, content, segmentStart, end, firstStartsParagraph);
        }
        return units;
    }

    private static List<Unit> windows(String content, Unit sentence, int size) {
        List<Unit> units = new ArrayList<>();
        for (int start = sentence.start(); start < sentence.end(); start += size) {
            int end = Math.min(start + size, sentence.end());
            if (!content.substring(start, end).isBlank()) {
                boolean paragraphStart = sentence.paragraphStart() && units.isEmpty();
                units.add(new Unit(content.substring(start, end), start, end, paragraphStart));
            }
        }
        return units;
    }

    private static void addTrimmed(List<Unit> units, String content, int from, int to) {
        int start = from;
        int end = to;
        while (start < end && Character.isWhitespace(content.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(content.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            units.add(new Unit(content.substring(start, end), start, end, true));
        }
    }

    private static void addSentence(List<Unit> units, String content, int start, int end, boolean firstStartsParagraph) {
        if (start >= end || content.substring(start, end).isBlank()) {
            return;
        }
        boolean paragraphStart = firstStartsParagraph && units.isEmpty();
        units.add(new Unit(content.substring(start, end), start, end, paragraphStart));
    }

    private static boolean isTerminator(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    // ========================================
    // Accumulation
    // ========================================

    private static List<Chunk> accumulate(List<Unit> units, int size, int overlap) {
        Accumulator accumulator = new Accumulator(size, overlap);
        for (Unit unit : units) {
            accumulator.add(unit);
        }
        accumulator.close();
        return accumulator.chunks;
    }

    /**
     * 원문 구간 [start, end)와 그 텍스트.
     *
     * @param paragraphStart 문단의 첫 조각이면 true (앞에 "\n\n"으로 연결됨)
     */
    private record Unit(String text, int start, int end, boolean paragraphStart) {

        int length() {
            return text.length();
        }
    }

    /**
     * 누적 중인 청크의 조각과 원문 위치.
     */
    private record Piece(String text, int sourceStart, int sourceEnd, int contentStart) {
    }

    private static final class Accumulator {

        private final int size;
        private final int overlap;
        private final List<Chunk> chunks = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();
        private final List<Piece> pieces = new ArrayList<>();

        private Accumulator(int size, int overlap) {
            this.size = size;
            this.overlap = overlap;
        }

        void add(Unit unit) {
            String separator = separatorFor(unit);
            if (text.length() > 0 && text.length() + separator.length() + unit.length() > size) {
                Piece tail = overlap > 0 ? tail() : null;
                close();
                if (tail != null) {
                    append(tail.text(), tail.sourceStart(), tail.sourceEnd());
                }
                separator = separatorFor(unit);
            }
            appendUnit(unit, separator);
        }

        void close() {
            if (text.length() == 0) {
                return;
            }
            int trailing = trailingWhitespace(text);
            String content = text.substring(0, text.length() - trailing);
            if (!content.isEmpty()) {
                Piece first = pieces.get(0);
                Piece last = pieces.get(pieces.size() - 1);
                int end = Math.max(first.sourceStart(), last.sourceEnd() - trailing);
                chunks.add(Chunk.of(chunks.size(), content, first.sourceStart(), end));
            }
            text.setLength(0);
            pieces.clear();
        }

        private String separatorFor(Unit unit) {
            if (text.length() == 0) {
                return "";
            }
            return unit.paragraphStart() ? PARAGRAPH_JOIN : "";
        }

        private void appendUnit(Unit unit, String separator) {
            if (text.length() == 0) {
                int leading = 0;
                while (leading < unit.length() && Character.isWhitespace(unit.text().charAt(leading))) {
                    leading++;
                }
                if (leading == unit.length()) {
                    return;
                }
                append(unit.text().substring(leading), unit.start() + leading, unit.end());
                return;
            }
            text.append(separator);
            append(unit.text(), unit.start(), unit.end());
        }

        private void append(String pieceText, int sourceStart, int sourceEnd) {
            pieces.add(new Piece(pieceText, sourceStart, sourceEnd, text.length()));
            text.append(pieceText);
        }

        /**
         * 닫히는 청크의 마지막 overlap 문자 (앞쪽 공백 제외).
         */
        private Piece tail() {
            int effectiveLength = text.length() - trailingWhitespace(text);
            int position = Math.max(0, effectiveLength - overlap);
            while (position < effectiveLength && Character.isWhitespace(text.charAt(position))) {
                position++;
            }
            if (position >= effectiveLength) {
                return null;
            }
            Piece last = pieces.get(pieces.size() - 1);
            int closedEnd = last.sourceEnd() - trailingWhitespace(text);
            int sourceStart = Math.min(sourceOffsetAt(position), closedEnd);
            return new Piece(text.substring(position, effectiveLength), sourceStart, closedEnd, 0);
        }

        private int sourceOffsetAt(int position) {
            for (Piece piece : pieces) {
                if (position < piece.contentStart()) {
                    return piece.sourceStart();
                }
                if (position < piece.contentStart() + piece.text().length()) {
                    return Math.min(piece.sourceStart() + (position - piece.contentStart()), piece.sourceEnd());
                }
            }
            return pieces.get(pieces.size() - 1).sourceEnd();
        }

        private static int trailingWhitespace(CharSequence value) {
            int count = 0;
            for (int i = value.length() - 1; i >= 0 && Character.isWhitespace(value.charAt(i)); i--) {
                count++;
            }
            return count;
        }
    }
}
