package com.ryuqq.pipeline.application.content;

import com.ryuqq.pipeline.core.schema.ObjectSchema;
import com.ryuqq.pipeline.core.schema.Schemas;

/**
 * 콘텐츠 리뷰 Workflow의 Step 경계 Schema.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ContentSchemas {

    public static final ObjectSchema<ContentRequest> REQUEST = Schemas.object("content-request", ContentRequest.class)
        .field("topic", ContentRequest::topic, Schemas.string("topic").nonBlank())
        .field("contentType", ContentRequest::contentType, Schemas.enumOf("contentType", ContentType.class))
        .optionalField("targetAudience", ContentRequest::targetAudience, Schemas.string("targetAudience"))
        .field("qualityThreshold", ContentRequest::qualityThreshold, Schemas.integer("qualityThreshold").range(0, 100))
        .field("maxIterations", ContentRequest::maxIterations,
            Schemas.integer("maxIterations").range(1, ContentReviewWorkflow.MAX_ITERATIONS))
        .build();

    public static final ObjectSchema<Research> RESEARCH = Schemas.object("research", Research.class)
        .field("summary", Research::summary, Schemas.string("summary").nonBlank())
        .field("keyPoints", Research::keyPoints, Schemas.listOf("keyPoints", Schemas.string("keyPoint")))
        .build();

    public static final ObjectSchema<ResearchedTopic> RESEARCHED = Schemas.object("researched-topic", ResearchedTopic.class)
        .field("request", ResearchedTopic::request, REQUEST)
        .field("research", ResearchedTopic::research, RESEARCH)
        .build();

    public static final ObjectSchema<Evaluation> EVALUATION = Schemas.object("evaluation", Evaluation.class)
        .field("feedback", Evaluation::feedback, Schemas.listOf("feedback", Schemas.string("item")))
        .build();

    public static final ObjectSchema<ReviewState> REVIEW_STATE = Schemas.object("review-state", ReviewState.class)
        .field("request", ReviewState::request, REQUEST)
        .field("content", ReviewState::content, Schemas.string("content").nonBlank())
        .field("score", ReviewState::score, Schemas.integer("score").range(0, 100))
        .field("iteration", ReviewState::iteration, Schemas.integer("iteration").min(0))
        .field("scoreHistory", ReviewState::scoreHistory,
            Schemas.listOf("scoreHistory", Schemas.integer("score").range(0, 100)))
        .rule("scoreHistory", state -> state.scoreHistory().size() == state.iteration(),
            "must hold one score per iteration")
        .build();

    public static final ObjectSchema<FinalContent> FINAL = Schemas.object("final-content", FinalContent.class)
        .field("content", FinalContent::content, Schemas.string("content").nonBlank())
        .field("score", FinalContent::score, Schemas.integer("score").range(0, 100))
        .field("iterations", FinalContent::iterations, Schemas.integer("iterations").min(1))
        .field("status", FinalContent::status, Schemas.enumOf("status", ContentStatus.class))
        .field("metadata", FinalContent::metadata, Schemas.type("metadata", ContentMetadata.class))
        .build();

    // Utility class - prevent instantiation
    private ContentSchemas() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
