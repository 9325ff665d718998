package com.ryuqq.discovery.core.credential;

import com.ryuqq.discovery.core.model.ServiceName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 서비스 이름 → 비밀 값 목록(순서 유지) 매핑.
 *
 * <p>프로세스 시작 시 한 번 만들어 {@link CredentialPool#load}에 명시적으로 전달합니다.
 * 호출 지점마다 환경 변수를 직접 읽지 않습니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class CredentialConfig {

    private final Map<ServiceName, List<String>> secretsByService;

    private CredentialConfig(Map<ServiceName, List<String>> secretsByService) {
        this.secretsByService = secretsByService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<ServiceName> services() {
        return secretsByService.keySet();
    }

    /**
     * 서비스의 비밀 값 목록.
     *
     * @param service 서비스
     * @return 설정된 순서의 비밀 값 (없으면 빈 목록)
     */
    public List<String> secrets(ServiceName service) {
        return secretsByService.getOrDefault(service, List.of());
    }

    /**
     * CredentialConfig 빌더.
     */
    public static final class Builder {

        private final Map<ServiceName, List<String>> secretsByService = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder service(ServiceName service, List<String> secrets) {
            if (service == null) {
                throw new IllegalArgumentException("service cannot be null");
            }
            if (secrets == null) {
                throw new IllegalArgumentException("secrets cannot be null");
            }
            secretsByService.put(service, List.copyOf(secrets));
            return this;
        }

        public Builder service(String service, String... secrets) {
            return service(ServiceName.of(service), List.of(secrets));
        }

        public CredentialConfig build() {
            return new CredentialConfig(Collections.unmodifiableMap(new LinkedHashMap<>(secretsByService)));
        }
    }
}
