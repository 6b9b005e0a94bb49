package com.ryuqq.pipeline.core.context;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 호출자가 취소를 요청할 수 있는 신호.
 *
 * <p>thread-safe합니다. 한 번 취소되면 되돌릴 수 없습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class CancellationToken implements CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * 취소 요청.
     *
     * @param cancelReason 취소 사유 (로그와 이벤트에 사용)
     * @return 이번 호출로 취소되었으면 true, 이미 취소된 상태였으면 false
     */
    public boolean cancel(String cancelReason) {
        String value = cancelReason == null || cancelReason.isBlank() ? "cancelled by caller" : cancelReason;
        return reason.compareAndSet(null, value);
    }

    /**
     * 사유 없이 취소 요청.
     *
     * @return 이번 호출로 취소되었으면 true
     */
    public boolean cancel() {
        return cancel(null);
    }

    @Override
    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * 취소 사유 조회.
     *
     * @return 취소 사유 (취소되지 않았으면 null)
     */
    public String reason() {
        return reason.get();
    }
}
