package com.ryuqq.pipeline.application.content;

import java.util.stream.Collectors;

/**
 * 콘텐츠 리뷰 Generator 프롬프트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
final class ContentPrompts {

    private ContentPrompts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String research(ContentRequest request) {
        return "Research the topic \"" + request.topic() + "\" for a " + request.contentType().label()
            + audienceClause(request, " targeting ")
            + ".\nProvide a summary, key points, relevant sources, and interesting facts.";
    }

    static String draft(ResearchedTopic topic) {
        ContentRequest request = topic.request();
        return "Write a " + request.contentType().label() + " about \"" + request.topic() + "\".\n\n"
            + "Research Summary: " + topic.research().summary() + "\n"
            + "Key Points to Cover: " + String.join(", ", topic.research().keyPoints()) + "\n"
            + audienceClause(request, "Target Audience: ")
            + "\nCreate engaging, well-structured content.";
    }

    static String evaluate(ReviewState state, String content) {
        String verb = state.iteration() == 0 ? "Evaluate" : "Re-evaluate";
        return verb + " this " + state.request().contentType().label() + " about \"" + state.request().topic()
            + "\". Rate it 0-100 and provide specific feedback.\n\nContent:\n" + content;
    }

    static String refine(ReviewState state) {
        String feedback = state.feedback().stream()
            .map(item -> "- " + item)
            .collect(Collectors.joining("\n"));
        return "Improve this " + state.request().contentType().label() + " based on feedback:\n\n"
            + "Feedback:\n" + feedback + "\n\n"
            + "Current Content:\n" + state.content() + "\n\n"
            + "Rewrite with improvements.";
    }

    private static String audienceClause(ContentRequest request, String prefix) {
        String audience = request.targetAudience();
        return audience == null || audience.isBlank() ? "" : prefix + audience;
    }
}
