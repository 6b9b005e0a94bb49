package com.ryuqq.pipeline.core.error;

import com.ryuqq.pipeline.core.schema.Violation;

import java.util.List;

/**
 * Schema Contract 위반.
 *
 * <p>잘못 구성된 Workflow 또는 잘못 구현된 Step을 의미하므로 재시도하지 않고
 * 실행 전체를 실패시킵니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class ContractViolationException extends WorkflowException {

    private final String schemaName;
    private final List<Violation> violations;

    /**
     * 생성자.
     *
     * @param stepId 위반이 발생한 Step ID (모르면 null)
     * @param boundary 위반 경계 설명 (예: "input", "output")
     * @param schemaName 위반된 Schema 이름
     * @param violations 위반 목록
     */
    public ContractViolationException(String stepId, String boundary, String schemaName, List<Violation> violations) {
        super(ErrorKind.CONTRACT_VIOLATION, stepId, describe(stepId, boundary, schemaName, violations), null);
        this.schemaName = schemaName;
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    /**
     * 단일 메시지 위반 생성 (Branch 미일치 등 구성 오류).
     *
     * @param stepId 관련 Stage 이름
     * @param message 위반 메시지
     * @return ContractViolationException
     */
    public static ContractViolationException configuration(String stepId, String message) {
        return new ContractViolationException(stepId, "configuration", "-", List.of(new Violation("", message)));
    }

    public String schemaName() {
        return schemaName;
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String describe(String stepId, String boundary, String schemaName, List<Violation> violations) {
        StringBuilder sb = new StringBuilder();
        sb.append(boundary).append(" of '").append(stepId).append("' violates schema '").append(schemaName).append("'");
        if (violations != null && !violations.isEmpty()) {
            sb.append(": ");
            for (int i = 0; i < violations.size(); i++) {
                if (i > 0) {
                    sb.append("; ");
                }
                sb.append(violations.get(i));
            }
        }
        return sb.toString();
    }
}
