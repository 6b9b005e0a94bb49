package com.ryuqq.pipeline.core.schema;

/**
 * 단일 검증 위반.
 *
 * @param path 위반 위치 (예: {@code research.keyPoints[2]}, 루트는 빈 문자열)
 * @param message 위반 내용
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Violation(String path, String message) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public Violation {
        if (path == null) {
            path = "";
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 상위 경로 아래로 이동한 위반 생성.
     *
     * @param parent 상위 경로 (필드명 또는 인덱스 표기)
     * @return 경로가 결합된 Violation
     */
    public Violation under(String parent) {
        if (parent == null || parent.isEmpty()) {
            return this;
        }
        if (path.isEmpty()) {
            return new Violation(parent, message);
        }
        if (path.startsWith("[")) {
            return new Violation(parent + path, message);
        }
        return new Violation(parent + "." + path, message);
    }

    @Override
    public String toString() {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
