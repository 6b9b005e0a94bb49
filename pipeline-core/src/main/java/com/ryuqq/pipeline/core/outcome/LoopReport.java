package com.ryuqq.pipeline.core.outcome;

/**
 * 완료된 repeatUntil 루프 요약.
 *
 * @param stageName 루프 이름 (본문 Step ID)
 * @param iterations 본문 실행 횟수
 * @param exhausted 수렴하지 못하고 maxIterations에 도달했으면 true
 * @author Pipeline Team
 * @since 1.0.0
 */
public record LoopReport(String stageName, int iterations, boolean exhausted) {

    public LoopReport {
        if (stageName == null || stageName.isBlank()) {
            throw new IllegalArgumentException("stageName cannot be null or blank");
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive (current: " + iterations + ")");
        }
    }

    /**
     * 조건이 거짓이 되어 정상 수렴했는지 확인.
     *
     * @return 수렴했으면 true
     */
    public boolean converged() {
        return !exhausted;
    }
}
