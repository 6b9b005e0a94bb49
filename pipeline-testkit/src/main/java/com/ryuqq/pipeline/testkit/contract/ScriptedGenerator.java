package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.capability.Generation;
import com.ryuqq.pipeline.core.capability.GenerationStream;
import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generator double that replays a fixed script of responses.
 *
 * <p>Text responses and structured responses are scripted independently. Each call consumes
 * the next scripted entry; once the script runs out, the last entry is repeated so that
 * "always returns X" collaborators need a single entry.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedGenerator evaluator = ScriptedGenerator.named("evaluator")
 *     .thenReturnObject(new Evaluation(70, List.of("Needs examples")))
 *     .thenReturnObject(new Evaluation(82, List.of()));
 * capabilities.registerGenerator(evaluator);
 * </pre>
 *
 * <p>Every prompt is recorded for later assertions. Thread-safe.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ScriptedGenerator implements Generator {

    private final String id;
    private final List<String> texts = new ArrayList<>();
    private final List<Object> objects = new ArrayList<>();
    private final List<String> prompts = new ArrayList<>();
    private int textCursor;
    private int objectCursor;

    private ScriptedGenerator(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
    }

    /**
     * Creates an empty script for the given generator id.
     *
     * @param id the generator id
     * @return a new scripted generator
     */
    public static ScriptedGenerator named(String id) {
        return new ScriptedGenerator(id);
    }

    /**
     * Appends a text response.
     *
     * @param text the text to return
     * @return this generator
     */
    public synchronized ScriptedGenerator thenReturn(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        texts.add(text);
        return this;
    }

    /**
     * Appends a structured response. The object is validated by the caller's schema.
     *
     * @param object the object to return
     * @return this generator
     */
    public synchronized ScriptedGenerator thenReturnObject(Object object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        objects.add(object);
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized Generation<String> generate(String prompt) {
        prompts.add(prompt);
        if (texts.isEmpty()) {
            throw new IllegalStateException("No text scripted for generator '" + id + "'");
        }
        String text = texts.get(Math.min(textCursor, texts.size() - 1));
        textCursor++;
        return Generation.text(text);
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized <T> Generation<T> generate(String prompt, Schema<T> schema) {
        prompts.add(prompt);
        if (objects.isEmpty()) {
            throw new IllegalStateException("No object scripted for generator '" + id + "'");
        }
        Object object = objects.get(Math.min(objectCursor, objects.size() - 1));
        objectCursor++;
        return new Generation<>(String.valueOf(object), (T) object);
    }

    /**
     * Streams the next text response word by word.
     */
    @Override
    public GenerationStream stream(String prompt) {
        String text = generate(prompt).text();
        List<String> pieces = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == ' ') {
                pieces.add(text.substring(start, i));
                start = i;
            }
        }
        return GenerationStream.of(pieces);
    }

    public synchronized List<String> prompts() {
        return Collections.unmodifiableList(new ArrayList<>(prompts));
    }

    public synchronized int callCount() {
        return prompts.size();
    }

    @Override
    public String toString() {
        return "ScriptedGenerator{id='" + id + "', texts=" + texts.size() + ", objects=" + objects.size() + "}";
    }
}
