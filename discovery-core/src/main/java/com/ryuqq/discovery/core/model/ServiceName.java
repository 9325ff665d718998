package com.ryuqq.discovery.core.model;

import java.util.Locale;

/**
 * 쿼터가 걸린 외부 서비스의 이름 (예: gemini, groq, materials_project, arxiv).
 *
 * <p>값은 소문자로 정규화되며, 자격 증명 풀과 타임아웃/레이트 리밋 정책의 키로 쓰입니다.</p>
 *
 * @param value 서비스 이름 (소문자, 영숫자/하이픈/언더스코어)
 * @author Discovery Team
 * @since 1.0.0
 */
public record ServiceName(String value) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null, 공백이거나 허용되지 않는 문자를 포함한 경우
     */
    public ServiceName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("service name cannot be null or blank");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!value.matches("^[a-z0-9\\-_]+$")) {
            throw new IllegalArgumentException("service name contains invalid characters: " + value);
        }
    }

    /**
     * ServiceName 생성.
     *
     * @param value 서비스 이름
     * @return ServiceName 인스턴스
     */
    public static ServiceName of(String value) {
        return new ServiceName(value);
    }

    /**
     * 환경 변수 접두사 (예: materials_project → MATERIALS_PROJECT).
     *
     * @return 대문자 접두사
     */
    public String envPrefix() {
        return value.replace('-', '_').toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return value;
    }
}
