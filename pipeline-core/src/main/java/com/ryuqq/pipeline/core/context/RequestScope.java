package com.ryuqq.pipeline.core.context;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 요청 범위 정보 (불변).
 *
 * <p>테넌트, 사용자 등급, 로케일처럼 실행 전체에 걸쳐 참조되는 값을 담습니다.
 * 전역 상태가 아니라 {@link ExecutionContext}를 통해 모든 Step에 전달됩니다.</p>
 *
 * @param tenantId 테넌트 ID
 * @param tier 사용자 등급
 * @param locale 로케일
 * @param attributes 추가 속성
 * @author Pipeline Team
 * @since 1.0.0
 */
public record RequestScope(
    String tenantId,
    UserTier tier,
    Locale locale,
    Map<String, String> attributes
) {

    private static final String ANONYMOUS_TENANT = "anonymous";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException tenantId가 비어 있거나 tier/locale이 null인 경우
     */
    public RequestScope {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("tier cannot be null");
        }
        if (locale == null) {
            throw new IllegalArgumentException("locale cannot be null");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 익명 요청 범위 (FREE 등급, 영어 로케일).
     *
     * @return RequestScope
     */
    public static RequestScope anonymous() {
        return new RequestScope(ANONYMOUS_TENANT, UserTier.FREE, Locale.ENGLISH, Map.of());
    }

    /**
     * 테넌트와 등급으로 생성.
     *
     * @param tenantId 테넌트 ID
     * @param tier 사용자 등급
     * @return RequestScope
     */
    public static RequestScope of(String tenantId, UserTier tier) {
        return new RequestScope(tenantId, tier, Locale.ENGLISH, Map.of());
    }

    /**
     * 속성을 추가한 새 인스턴스 생성.
     *
     * @param key 속성 이름
     * @param value 속성 값
     * @return 새 RequestScope
     */
    public RequestScope withAttribute(String key, String value) {
        Map<String, String> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new RequestScope(tenantId, tier, locale, copy);
    }

    /**
     * locale만 변경한 새 인스턴스 생성.
     */
    public RequestScope withLocale(Locale locale) {
        return new RequestScope(tenantId, tier, locale, attributes);
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
