package com.ryuqq.pipeline.application.content;

import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 콘텐츠 생성 및 반복 품질 리뷰 Workflow.
 *
 * <p><strong>Stage 구성:</strong></p>
 * <pre>
 * research-topic → draft-content → repeatUntil(review-content) → finalize-content
 * </pre>
 *
 * <p><strong>리뷰 루프:</strong></p>
 * <ul>
 *   <li>첫 실행은 초안을 평가하고, 이후 실행은 피드백으로 콘텐츠를 다시 쓴 뒤 재평가</li>
 *   <li>계속 조건: {@code score < qualityThreshold && iteration < maxIterations}</li>
 *   <li>루프 자체의 최대 반복은 {@value #MAX_ITERATIONS}회</li>
 *   <li>기준 미달로 끝나면 {@link ContentStatus#LOOP_EXCEEDED}로 표시 (승인과 구분)</li>
 * </ul>
 *
 * <p><strong>Generator (모두 선택):</strong></p>
 * <ul>
 *   <li>{@value #RESEARCHER}: 주제 조사 (없으면 템플릿 조사 결과)</li>
 *   <li>{@value #COPYWRITER}: 초안 작성, 재작성 (없으면 템플릿 초안)</li>
 *   <li>{@value #EDITOR}: 재작성/평가 대체</li>
 *   <li>{@value #EVALUATOR}: 평가 (없으면 첫 점수 70, 이후 +5)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ContentReviewWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ContentReviewWorkflow.class);

    public static final String ID = "content-review";

    public static final String RESEARCH_TOPIC = "research-topic";
    public static final String DRAFT_CONTENT = "draft-content";
    public static final String REVIEW_CONTENT = "review-content";
    public static final String FINALIZE_CONTENT = "finalize-content";

    public static final String RESEARCHER = "researcher";
    public static final String COPYWRITER = "copywriter";
    public static final String EDITOR = "editor";
    public static final String EVALUATOR = "evaluator";

    public static final int MAX_ITERATIONS = 10;

    static final int NEUTRAL_SCORE = 70;
    static final int SCORE_STEP = 5;

    private ContentReviewWorkflow() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 시스템 시계로 Workflow 생성.
     *
     * @return 커밋된 Workflow
     */
    public static Workflow<ContentRequest, FinalContent> create() {
        return create(Clock.systemUTC());
    }

    /**
     * Workflow 생성.
     *
     * @param clock generatedAt 시각용 시계
     * @return 커밋된 Workflow
     */
    public static Workflow<ContentRequest, FinalContent> create(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return Workflow.builder(ID, ContentSchemas.REQUEST)
            .description("Content creation with iterative quality review")
            .then(researchTopic())
            .then(draftContent())
            .repeatUntil(reviewContent(), ReviewState::needsAnotherReview, MAX_ITERATIONS)
            .then(finalizeContent(clock))
            .commit(ContentSchemas.FINAL);
    }

    // ========================================
    // Steps
    // ========================================

    static Step<ContentRequest, ResearchedTopic> researchTopic() {
        return Steps.define(RESEARCH_TOPIC)
            .description("Researches the topic")
            .input(ContentSchemas.REQUEST)
            .output(ContentSchemas.RESEARCHED)
            .handle((request, ctx) -> {
                ctx.progress(20, "Researching topic: " + request.topic());
                Optional<Generator> researcher = ctx.generator(RESEARCHER);
                Research research;
                if (researcher.isPresent()) {
                    ctx.progress(50, "Generating research");
                    research = ctx.generate(researcher.get(), ContentPrompts.research(request),
                        ContentSchemas.RESEARCH).object();
                } else {
                    research = templatedResearch(request);
                }
                ctx.progress(90, "Research complete", Map.of("keyPoints", research.keyPoints().size()));
                return new ResearchedTopic(request, research);
            });
    }

    static Step<ResearchedTopic, ReviewState> draftContent() {
        return Steps.define(DRAFT_CONTENT)
            .description("Creates the initial content draft")
            .input(ContentSchemas.RESEARCHED)
            .output(ContentSchemas.REVIEW_STATE)
            .handle((topic, ctx) -> {
                ctx.progress(20, "Drafting " + topic.request().contentType().label());
                Optional<Generator> copywriter = ctx.generator(COPYWRITER);
                String content;
                if (copywriter.isPresent()) {
                    ctx.progress(50, "Generating draft");
                    content = ctx.generate(copywriter.get(), ContentPrompts.draft(topic)).text();
                } else {
                    content = templatedDraft(topic);
                }
                ReviewState draft = ReviewState.draft(topic, content);
                ctx.progress(90, "Draft complete", Map.of("wordCount", draft.wordCount()));
                return draft;
            });
    }

    static Step<ReviewState, ReviewState> reviewContent() {
        return Steps.define(REVIEW_CONTENT)
            .description("Reviews the content, refining it from earlier feedback")
            .input(ContentSchemas.REVIEW_STATE)
            .output(ContentSchemas.REVIEW_STATE)
            .handle((state, ctx) -> {
                int iteration = state.iteration() + 1;
                String content = state.content();
                if (state.iteration() > 0) {
                    ctx.progress(20, "Refining content (iteration " + iteration + ")");
                    content = refine(state, ctx);
                }

                ctx.progress(60, "Evaluating content (iteration " + iteration + ")");
                Evaluation evaluation = evaluate(state, content, ctx);
                ReviewState reviewed = state.reviewed(content, clamp(evaluation.score()), evaluation.feedback());

                int threshold = state.request().qualityThreshold();
                ctx.progress(90, "Iteration " + iteration + ": score " + reviewed.score() + "/" + threshold,
                    Map.of("iteration", iteration, "score", reviewed.score(), "approved", reviewed.isApproved()));
                log.debug("Review iteration {} scored {} (threshold {}, run={})",
                    iteration, reviewed.score(), threshold, ctx.runId());
                return reviewed;
            });
    }

    static Step<ReviewState, FinalContent> finalizeContent(Clock clock) {
        return Steps.define(FINALIZE_CONTENT)
            .description("Finalizes the reviewed content")
            .input(ContentSchemas.REVIEW_STATE)
            .output(ContentSchemas.FINAL)
            .handle((state, ctx) -> {
                ctx.progress(50, "Finalizing content");
                ContentRequest request = state.request();
                ContentStatus status = state.isApproved() ? ContentStatus.APPROVED : ContentStatus.LOOP_EXCEEDED;
                if (status == ContentStatus.LOOP_EXCEEDED) {
                    log.warn("Content for '{}' not approved after {} iteration(s): score {} < {} (run={})",
                        request.topic(), state.iteration(), state.score(), request.qualityThreshold(), ctx.runId());
                }
                ContentMetadata metadata = new ContentMetadata(request.topic(), request.contentType(),
                    request.targetAudience(), state.wordCount(), request.qualityThreshold(),
                    state.scoreHistory(), clock.instant());
                return new FinalContent(state.content(), state.score(), state.iteration(), state.feedback(),
                    status, metadata);
            });
    }

    // ========================================
    // Review helpers
    // ========================================

    private static String refine(ReviewState state, ExecutionContext ctx) {
        Optional<Generator> writer = ctx.generator(COPYWRITER).or(() -> ctx.generator(EDITOR));
        if (writer.isEmpty()) {
            return state.content();
        }
        return ctx.generate(writer.get(), ContentPrompts.refine(state)).text();
    }

    private static Evaluation evaluate(ReviewState state, String content, ExecutionContext ctx) {
        Optional<Generator> evaluator = ctx.generator(EVALUATOR).or(() -> ctx.generator(EDITOR));
        if (evaluator.isPresent()) {
            return ctx.generate(evaluator.get(), ContentPrompts.evaluate(state, content),
                ContentSchemas.EVALUATION).object();
        }
        if (state.iteration() == 0) {
            return new Evaluation(NEUTRAL_SCORE,
                List.of("Consider adding more detail", "Improve transitions between sections"));
        }
        int score = Math.min(100, state.score() + SCORE_STEP);
        List<String> feedback = score >= state.request().qualityThreshold()
            ? List.of()
            : List.of("Minor improvements still possible");
        return new Evaluation(score, feedback);
    }

    static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }

    private static Research templatedResearch(ContentRequest request) {
        List<String> keyPoints = new ArrayList<>();
        keyPoints.add("Key point 1 about " + request.topic());
        keyPoints.add("Key point 2 about " + request.topic());
        return new Research("Research summary for " + request.topic(), keyPoints, List.of(), List.of());
    }

    private static String templatedDraft(ResearchedTopic topic) {
        String keyPoints = topic.research().keyPoints().stream()
            .map(point -> "- " + point)
            .collect(Collectors.joining("\n"));
        return "# " + topic.request().topic() + "\n\n" + topic.research().summary()
            + "\n\n## Key Points\n\n" + keyPoints;
    }
}
