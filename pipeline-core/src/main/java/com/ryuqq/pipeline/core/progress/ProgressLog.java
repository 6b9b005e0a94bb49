package com.ryuqq.pipeline.core.progress;

import com.ryuqq.pipeline.core.spi.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow 실행 한 건의 추가 전용(append-only) 진행 이벤트 로그.
 *
 * <p>실행마다 새로 생성되며 다른 실행과 공유되지 않습니다. 모든 이벤트는
 * {@link ProgressTransition}으로 검증된 뒤 기록되고, 이후 외부 {@link ProgressSink}로 전달됩니다.</p>
 *
 * <p><strong>Sink 오류 처리:</strong> 하위 소비자의 예외는 경고 로그만 남기고 실행을 중단시키지 않습니다.
 * 로그에 기록된 이벤트 목록이 원본이며, 실행 결과 보고서에 그대로 포함됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ProgressLog {

    private static final Logger log = LoggerFactory.getLogger(ProgressLog.class);

    private final ProgressSink sink;
    private final Clock clock;
    private final List<ProgressEvent> events = new ArrayList<>();
    private final Map<StepKey, ProgressKind> lastKinds = new HashMap<>();
    private final Map<String, Integer> occurrences = new HashMap<>();

    /**
     * 생성자 (시스템 시계 사용).
     *
     * @param sink 하위 소비자 (없으면 {@link ProgressSink#NONE})
     */
    public ProgressLog(ProgressSink sink) {
        this(sink, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param sink 하위 소비자
     * @param clock 이벤트 시각용 시계
     * @throws IllegalArgumentException sink 또는 clock이 null인 경우
     */
    public ProgressLog(ProgressSink sink, Clock clock) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * 새 Step 실행 키 발급.
     *
     * <p>같은 Step ID에 대해 호출할 때마다 occurrence가 1씩 증가합니다.</p>
     *
     * @param stepId Step ID
     * @return StepKey
     */
    public synchronized StepKey open(String stepId) {
        int next = occurrences.merge(stepId, 1, Integer::sum);
        return new StepKey(stepId, next);
    }

    public ProgressEvent start(StepKey key, Map<String, Object> payload) {
        return emit(key, ProgressKind.START, payload);
    }

    public ProgressEvent progress(StepKey key, Map<String, Object> payload) {
        return emit(key, ProgressKind.PROGRESS, payload);
    }

    public ProgressEvent complete(StepKey key, Map<String, Object> payload) {
        return emit(key, ProgressKind.COMPLETE, payload);
    }

    public ProgressEvent fail(StepKey key, Map<String, Object> payload) {
        return emit(key, ProgressKind.ERROR, payload);
    }

    public ProgressEvent cancel(StepKey key, Map<String, Object> payload) {
        return emit(key, ProgressKind.CANCELLED, payload);
    }

    /**
     * 이벤트 기록 및 전달.
     *
     * @param key Step 실행 키
     * @param kind 이벤트 종류
     * @param payload 이벤트 속성 (null 가능)
     * @return 기록된 이벤트
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public ProgressEvent emit(StepKey key, ProgressKind kind, Map<String, Object> payload) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        ProgressEvent event;
        synchronized (this) {
            ProgressTransition.validate(key, lastKinds.get(key), kind);
            event = new ProgressEvent(events.size(), key.stepId(), key.occurrence(), kind, payload, clock.instant());
            events.add(event);
            lastKinds.put(key, kind);
        }
        deliver(event);
        return event;
    }

    /**
     * Step 실행의 마지막 이벤트 종류 조회.
     *
     * @param key Step 실행 키
     * @return 마지막 이벤트 종류 (없으면 null)
     */
    public synchronized ProgressKind lastKind(StepKey key) {
        return lastKinds.get(key);
    }

    /**
     * 종료 이벤트가 기록되었는지 확인.
     *
     * @param key Step 실행 키
     * @return 종료되었으면 true
     */
    public synchronized boolean isTerminated(StepKey key) {
        ProgressKind last = lastKinds.get(key);
        return last != null && last.isTerminal();
    }

    /**
     * 기록된 모든 이벤트 스냅샷.
     *
     * @return 불변 이벤트 목록 (기록 순서)
     */
    public synchronized List<ProgressEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    private void deliver(ProgressEvent event) {
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.warn("Progress sink rejected event {} for {}#{}: {}",
                event.kind(), event.stepId(), event.occurrence(), e.getMessage());
        }
    }
}
