package com.ryuqq.discovery.adapter.runner.config;

import com.ryuqq.discovery.core.credential.CredentialConfig;
import com.ryuqq.discovery.core.model.ServiceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 환경 변수에서 자격 증명 설정을 읽습니다.
 *
 * <p>서비스 {@code gemini}라면 {@code GEMINI_API_KEY_1}, {@code GEMINI_API_KEY_2}, ...
 * ({@code maxKeysPerService}개까지)를 순서대로 읽고, 하나도 없으면 {@code GEMINI_API_KEY}를
 * 사용합니다. 빈 값과 {@code your_...} 자리표시자는 풀 로딩 단계에서 제외됩니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class EnvironmentCredentialSource {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentCredentialSource.class);

    public static final int DEFAULT_MAX_KEYS_PER_SERVICE = 3;

    private final Map<String, String> environment;
    private final int maxKeysPerService;

    public EnvironmentCredentialSource(Map<String, String> environment) {
        this(environment, DEFAULT_MAX_KEYS_PER_SERVICE);
    }

    /**
     * 생성자.
     *
     * @param environment 환경 변수 맵
     * @param maxKeysPerService 서비스당 읽을 번호 붙은 키의 최대 개수
     */
    public EnvironmentCredentialSource(Map<String, String> environment, int maxKeysPerService) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (maxKeysPerService <= 0) {
            throw new IllegalArgumentException(
                "maxKeysPerService must be positive (current: " + maxKeysPerService + ")");
        }
        this.environment = Map.copyOf(environment);
        this.maxKeysPerService = maxKeysPerService;
    }

    /**
     * 프로세스 환경 변수 기반 소스.
     *
     * @return EnvironmentCredentialSource
     */
    public static EnvironmentCredentialSource fromSystem() {
        return new EnvironmentCredentialSource(System.getenv());
    }

    /**
     * 서비스 목록의 자격 증명 설정 생성.
     *
     * @param services 서비스 목록
     * @return CredentialConfig (설정이 없는 서비스는 빈 목록)
     */
    public CredentialConfig load(Collection<ServiceName> services) {
        if (services == null) {
            throw new IllegalArgumentException("services cannot be null");
        }
        CredentialConfig.Builder builder = CredentialConfig.builder();
        for (ServiceName service : services) {
            List<String> secrets = secretsFor(service);
            log.info("Found {} configured key(s) for service {}", secrets.size(), service);
            builder.service(service, secrets);
        }
        return builder.build();
    }

    List<String> secretsFor(ServiceName service) {
        String prefix = service.envPrefix() + "_API_KEY";
        List<String> secrets = new ArrayList<>();
        for (int i = 1; i <= maxKeysPerService; i++) {
            String value = environment.get(prefix + "_" + i);
            if (value != null && !value.isBlank()) {
                secrets.add(value.trim());
            }
        }
        if (secrets.isEmpty()) {
            String single = environment.get(prefix);
            if (single != null && !single.isBlank()) {
                secrets.add(single.trim());
            }
        }
        return secrets;
    }
}
