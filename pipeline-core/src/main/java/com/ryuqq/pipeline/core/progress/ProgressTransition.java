package com.ryuqq.pipeline.core.progress;

/**
 * 진행 이벤트 전이 검증.
 *
 * <p>Step 실행 한 건(StepKey)에 대해 이벤트가 허용된 순서를 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>(없음) → START</li>
 *   <li>START, PROGRESS → PROGRESS</li>
 *   <li>START, PROGRESS → COMPLETE, ERROR, CANCELLED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 이벤트 이후에는 어떤 이벤트도 허용되지 않음</li>
 *   <li>START는 Step 실행당 정확히 한 번</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ProgressTransition {

    // Utility class - prevent instantiation
    private ProgressTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 이벤트 전이가 유효한지 확인.
     *
     * @param last 마지막으로 발행된 이벤트 종류 (아직 없으면 null)
     * @param next 발행하려는 이벤트 종류
     * @return 허용되면 true
     * @throws IllegalArgumentException next가 null인 경우
     */
    public static boolean isAllowed(ProgressKind last, ProgressKind next) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (last == null) {
            return next == ProgressKind.START;
        }
        if (last.isTerminal()) {
            return false;
        }
        return next != ProgressKind.START;
    }

    /**
     * 이벤트 전이 검증.
     *
     * @param key Step 실행 키 (오류 메시지용)
     * @param last 마지막 이벤트 종류 (없으면 null)
     * @param next 발행하려는 이벤트 종류
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public static void validate(StepKey key, ProgressKind last, ProgressKind next) {
        if (!isAllowed(last, next)) {
            throw new IllegalStateException(
                String.format("Invalid progress transition for %s: %s → %s", key, last, next)
            );
        }
    }
}
