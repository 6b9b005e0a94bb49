package com.ryuqq.pipeline.core.tracing;

import io.micrometer.tracing.Tracer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 계층형 추적 Span.
 *
 * <p>실행 한 건은 하나의 루트 Span을 가지며, Step/Branch/Loop/Generator/Tool 호출마다
 * 자식 Span이 열립니다. 실행 스레드 하나가 소유하며 여러 스레드에서 동시에 수정하지 않습니다.</p>
 *
 * <p>모든 Span은 Micrometer {@link Tracer}로 같은 계층의 {@link io.micrometer.tracing.Span}을
 * 함께 열고 닫습니다. 속성은 tag, 예외는 error로 전달되며 종료 상태는 {@code pipeline.status} tag로 기록됩니다.
 * 이 클래스가 유지하는 트리는 실행 보고서({@code RunReport})가 노출하는 사본입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@link #end(SpanStatus)}는 정확히 한 번만 호출 가능</li>
 *   <li>열린 자식이 있는 Span은 종료할 수 없음</li>
 *   <li>자식 구간은 부모 구간에 포함됨 (단조 시계 기준)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Span {

    private final String name;
    private final Span parent;
    private final Clock clock;
    private final Tracer tracer;
    private final io.micrometer.tracing.Span delegate;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<Span> children = new ArrayList<>();
    private final Instant startedAt;
    private final long startNanos;

    private Instant endedAt;
    private long endNanos;
    private SpanStatus status = SpanStatus.UNSET;
    private Throwable exception;

    private Span(String name, Span parent, Clock clock, Tracer tracer) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.parent = parent;
        this.clock = clock;
        this.tracer = tracer;
        io.micrometer.tracing.Span next = parent == null ? tracer.nextSpan() : tracer.nextSpan(parent.delegate);
        this.delegate = next.name(name).start();
        this.startedAt = clock.instant();
        this.startNanos = System.nanoTime();
    }

    /**
     * 루트 Span 시작.
     *
     * @param name Span 이름
     * @return 열린 루트 Span
     */
    public static Span root(String name) {
        return root(name, Tracer.NOOP, Clock.systemUTC());
    }

    /**
     * 루트 Span 시작.
     *
     * @param name Span 이름
     * @param tracer Micrometer Tracer (내보내지 않으려면 {@link Tracer#NOOP})
     * @param clock 시각 기록용 시계
     * @return 열린 루트 Span
     * @throws IllegalArgumentException tracer 또는 clock이 null인 경우
     */
    public static Span root(String name, Tracer tracer, Clock clock) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new Span(name, null, clock, tracer);
    }

    /**
     * 자식 Span 시작.
     *
     * @param childName 자식 Span 이름
     * @return 열린 자식 Span
     * @throws IllegalStateException 이 Span이 이미 종료된 경우
     */
    public Span startChild(String childName) {
        ensureOpen("start child '" + childName + "'");
        Span child = new Span(childName, this, clock, tracer);
        children.add(child);
        return child;
    }

    /**
     * 속성 설정.
     *
     * @param key 속성 이름
     * @param value 속성 값
     * @return this
     * @throws IllegalStateException 이 Span이 이미 종료된 경우
     */
    public Span setAttribute(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        ensureOpen("set attribute '" + key + "'");
        attributes.put(key, value);
        delegate.tag(key, String.valueOf(value));
        return this;
    }

    /**
     * 예외 기록.
     *
     * @param throwable 기록할 예외
     * @return this
     */
    public Span recordException(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        ensureOpen("record exception");
        this.exception = throwable;
        delegate.error(throwable);
        return this;
    }

    /**
     * Span 종료.
     *
     * @param endStatus 종료 상태 (UNSET 불가)
     * @throws IllegalStateException 이미 종료되었거나 열린 자식이 있는 경우
     */
    public void end(SpanStatus endStatus) {
        if (endStatus == null || endStatus == SpanStatus.UNSET) {
            throw new IllegalArgumentException("endStatus must be OK, ERROR or CANCELLED (current: " + endStatus + ")");
        }
        ensureOpen("end");
        for (Span child : children) {
            if (!child.isEnded()) {
                throw new IllegalStateException(
                    "Span '" + name + "' cannot end while child '" + child.name + "' is open"
                );
            }
        }
        this.endNanos = System.nanoTime();
        this.endedAt = clock.instant();
        this.status = endStatus;
        delegate.tag("pipeline.status", endStatus.name());
        delegate.end();
    }

    /**
     * 오류 상태로 종료.
     *
     * @param throwable 원인 예외
     */
    public void endWithError(Throwable throwable) {
        recordException(throwable);
        end(SpanStatus.ERROR);
    }

    /**
     * 열린 하위 Span을 모두 지정 상태로 종료.
     *
     * <p>가장 깊은 Span부터 닫습니다. 이 Span 자체는 종료하지 않습니다.</p>
     *
     * @param closeStatus 하위 Span에 적용할 종료 상태
     * @return 종료한 Span 수
     */
    public int endOpenDescendants(SpanStatus closeStatus) {
        int closed = 0;
        for (Span child : children) {
            closed += child.endOpenDescendants(closeStatus);
            if (!child.isEnded()) {
                child.end(closeStatus);
                closed++;
            }
        }
        return closed;
    }

    public String name() {
        return name;
    }

    /**
     * 부모 Span 조회.
     *
     * @return 부모 Span (루트면 empty)
     */
    public Optional<Span> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isEnded() {
        return status != SpanStatus.UNSET;
    }

    public SpanStatus status() {
        return status;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * 종료 시각 조회.
     *
     * @return 종료 시각 (열려 있으면 null)
     */
    public Instant endedAt() {
        return endedAt;
    }

    public long startNanos() {
        return startNanos;
    }

    /**
     * 단조 시계 기준 종료 시점.
     *
     * @return 종료 나노초 (열려 있으면 0)
     */
    public long endNanos() {
        return endNanos;
    }

    /**
     * 소요 시간 (나노초).
     *
     * @return 종료된 경우 소요 시간, 열려 있으면 -1
     */
    public long durationNanos() {
        return isEnded() ? endNanos - startNanos : -1;
    }

    public Optional<Throwable> exception() {
        return Optional.ofNullable(exception);
    }

    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public List<Span> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * 이 Span과 모든 하위 Span을 전위 순회 순서로 반환.
     *
     * @return Span 목록
     */
    public List<Span> flatten() {
        List<Span> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    /**
     * 이름으로 하위 Span 검색 (자신 포함, 전위 순회 첫 번째).
     *
     * @param spanName Span 이름
     * @return 찾은 Span
     */
    public Optional<Span> find(String spanName) {
        return flatten().stream().filter(span -> span.name.equals(spanName)).findFirst();
    }

    /**
     * 이름으로 모든 하위 Span 검색 (자신 포함).
     *
     * @param spanName Span 이름
     * @return 찾은 Span 목록
     */
    public List<Span> findAll(String spanName) {
        return flatten().stream().filter(span -> span.name.equals(spanName)).toList();
    }

    private static void collect(Span span, List<Span> out) {
        out.add(span);
        for (Span child : span.children) {
            collect(child, out);
        }
    }

    private void ensureOpen(String action) {
        if (isEnded()) {
            throw new IllegalStateException("Cannot " + action + " on ended span '" + name + "'");
        }
    }

    @Override
    public String toString() {
        return "Span{name='" + name + "', status=" + status + ", children=" + children.size() + "}";
    }
}
