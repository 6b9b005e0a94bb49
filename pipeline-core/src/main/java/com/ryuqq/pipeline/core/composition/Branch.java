package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 타입이 지정된 분기 빌더.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Branch&lt;LoadedDocument, MarkdownDocument&gt; convert = Branch.&lt;LoadedDocument, MarkdownDocument&gt;named("format")
 *     .when("pdf-or-html", doc -&gt; doc.format().needsConversion(), convertToMarkdown)
 *     .when("text-or-markdown", doc -&gt; !doc.format().needsConversion(), passTextThrough);
 * </pre>
 *
 * @param <I> 분기 입력 타입
 * @param <O> 분기 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Branch<I, O> {

    private final String name;
    private final List<BranchCase> cases = new ArrayList<>();
    private Step<?, ?> otherwise;

    private Branch(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    /**
     * 분기 빌더 생성.
     *
     * @param name 분기 이름 (Span 이름 {@code branch:<name>})
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return Branch
     */
    public static <I, O> Branch<I, O> named(String name) {
        return new Branch<>(name);
    }

    /**
     * 분기 후보 추가 (선언 순서대로 평가).
     *
     * @param caseName 후보 이름
     * @param predicate 선택 조건
     * @param step 선택 시 실행할 Step
     * @return this
     */
    public Branch<I, O> when(String caseName, Predicate<? super I> predicate, Step<? super I, ? extends O> step) {
        cases.add(new BranchCase(caseName, erase(predicate), step));
        return this;
    }

    /**
     * 기본 Step 지정.
     *
     * @param step 일치하는 후보가 없을 때 실행할 Step
     * @return this
     * @throws IllegalStateException 이미 지정된 경우
     */
    public Branch<I, O> otherwise(Step<? super I, ? extends O> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        if (otherwise != null) {
            throw new IllegalStateException("otherwise already set for branch '" + name + "'");
        }
        this.otherwise = step;
        return this;
    }

    public String name() {
        return name;
    }

    /**
     * 실행 가능한 단계로 변환.
     *
     * @return BranchStage
     */
    public BranchStage toStage() {
        return new BranchStage(name, cases, otherwise);
    }

    @SuppressWarnings("unchecked")
    static <T> Predicate<Object> erase(Predicate<? super T> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return value -> ((Predicate<Object>) predicate).test(value);
    }
}
