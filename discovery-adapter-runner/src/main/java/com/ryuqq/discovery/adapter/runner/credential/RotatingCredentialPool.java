package com.ryuqq.discovery.adapter.runner.credential;

import com.ryuqq.discovery.core.credential.Credential;
import com.ryuqq.discovery.core.credential.CredentialPool;
import com.ryuqq.discovery.core.credential.CredentialPoolConfig;
import com.ryuqq.discovery.core.credential.CredentialStatus;
import com.ryuqq.discovery.core.exception.ConfigurationException;
import com.ryuqq.discovery.core.exception.PoolExhaustedException;
import com.ryuqq.discovery.core.guard.FailureKind;
import com.ryuqq.discovery.core.model.ServiceName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 서비스별 자격 증명 로테이션 풀.
 *
 * <p>서비스마다 락 하나를 두고, 선택(LRU 탐색 + lastUsedAt 갱신)과 모든 카운터 변경을
 * 그 락 안에서 수행합니다. 서로 다른 서비스는 서로를 막지 않습니다.</p>
 *
 * <p><strong>선택 알고리즘:</strong></p>
 * <ol>
 *   <li>각 자격 증명의 만료된 레이트 리밋 해제, 쿨다운이 지난 비활성화 해제</li>
 *   <li>선택 가능한 것 중 가장 오래 전에 선택된 것 (미사용은 가장 오래된 것으로 간주)</li>
 *   <li>동률이면 설정 순서가 앞선 것</li>
 *   <li>lastUsedAt = now, 선택 순번 기록 후 반환</li>
 * </ol>
 *
 * <p>선택 순서는 시계가 아니라 풀 내부 순번으로 비교하므로 같은 시각에 연속 선택해도
 * 로테이션이 유지됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CredentialPool pool = new RotatingCredentialPool();
 * pool.loadAll(EnvironmentCredentialSource.fromSystem().load(services));
 *
 * Credential key = pool.select(ServiceName.of("gemini"));
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class RotatingCredentialPool implements CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(RotatingCredentialPool.class);

    static final String PLACEHOLDER_PREFIX = "your_";

    private final ConcurrentHashMap<ServiceName, ServicePool> pools = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CredentialPoolConfig config;

    /**
     * 기본 설정 (쿨다운 60분, 연속 오류 3회 비활성화)과 시스템 시계로 생성.
     */
    public RotatingCredentialPool() {
        this(Clock.systemUTC(), new CredentialPoolConfig());
    }

    /**
     * 생성자.
     *
     * @param clock 시계
     * @param config 풀 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RotatingCredentialPool(Clock clock, CredentialPoolConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.clock = clock;
        this.config = config;
    }

    @Override
    public List<Credential> load(ServiceName service, List<String> secrets) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (secrets == null) {
            throw new ConfigurationException("No credentials configured for service '" + service + "'");
        }

        List<Credential> credentials = new ArrayList<>();
        for (String secret : secrets) {
            if (isUsable(secret)) {
                credentials.add(new Credential(service, credentials.size(), secret.trim()));
            }
        }
        if (credentials.isEmpty()) {
            throw new ConfigurationException("No usable credentials configured for service '" + service + "'");
        }

        ServicePool previous = pools.putIfAbsent(service, new ServicePool(credentials));
        if (previous != null) {
            throw new ConfigurationException("Credentials for service '" + service + "' are already loaded");
        }

        log.info("Loaded {} credential(s) for service {}", credentials.size(), service);
        return Collections.unmodifiableList(credentials);
    }

    @Override
    public Credential select(ServiceName service) {
        ServicePool pool = poolOf(service);
        Instant now = clock.instant();

        pool.lock.lock();
        try {
            Credential chosen = null;
            for (Credential candidate : pool.credentials) {
                if (!candidate.refreshAndCheckSelectable(now, config.cooldown())) {
                    continue;
                }
                if (chosen == null || pool.selectedBefore(candidate, chosen)) {
                    chosen = candidate;
                }
            }
            if (chosen == null) {
                throw new PoolExhaustedException(service);
            }
            chosen.markUsed(now);
            pool.markSelected(chosen);
            log.debug("Selected credential {} for service {}", chosen.getId(), service);
            return chosen;
        } finally {
            pool.lock.unlock();
        }
    }

    @Override
    public int availableCount(ServiceName service) {
        ServicePool pool = poolOf(service);
        Instant now = clock.instant();

        pool.lock.lock();
        try {
            int count = 0;
            for (Credential credential : pool.credentials) {
                if (credential.refreshAndCheckSelectable(now, config.cooldown())) {
                    count++;
                }
            }
            return count;
        } finally {
            pool.lock.unlock();
        }
    }

    @Override
    public void recordSuccess(Credential credential) {
        ServicePool pool = poolOf(credential);
        pool.lock.lock();
        try {
            credential.recordSuccess();
        } finally {
            pool.lock.unlock();
        }
    }

    @Override
    public void recordFailure(Credential credential, FailureKind kind) {
        if (kind == null || !kind.isRecordable()) {
            throw new IllegalArgumentException("Only RATE_LIMITED or TRANSIENT failures can be recorded (kind: " + kind + ")");
        }
        ServicePool pool = poolOf(credential);
        Instant now = clock.instant();

        pool.lock.lock();
        try {
            if (kind == FailureKind.RATE_LIMITED) {
                credential.recordRateLimited(now, config.cooldown());
                log.warn("Credential {} rate-limited until {}", credential.getId(), now.plus(config.cooldown()));
            } else {
                boolean disabled = credential.recordTransientFailure(now, config.maxConsecutiveErrors());
                if (disabled) {
                    log.error("Credential {} disabled after {} consecutive errors",
                        credential.getId(), credential.getConsecutiveErrorCount());
                } else {
                    log.debug("Credential {} error count {}", credential.getId(), credential.getConsecutiveErrorCount());
                }
            }
        } finally {
            pool.lock.unlock();
        }
    }

    @Override
    public void reset(ServiceName service) {
        ServicePool pool = poolOf(service);
        pool.lock.lock();
        try {
            for (Credential credential : pool.credentials) {
                credential.reset();
            }
        } finally {
            pool.lock.unlock();
        }
        log.info("Reset all credentials for service {}", service);
    }

    @Override
    public List<CredentialStatus> status(ServiceName service) {
        ServicePool pool = poolOf(service);
        Instant now = clock.instant();

        pool.lock.lock();
        try {
            List<CredentialStatus> statuses = new ArrayList<>(pool.credentials.size());
            for (Credential credential : pool.credentials) {
                statuses.add(credential.snapshot(now));
            }
            return Collections.unmodifiableList(statuses);
        } finally {
            pool.lock.unlock();
        }
    }

    @Override
    public Set<ServiceName> services() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pools.keySet()));
    }

    private ServicePool poolOf(Credential credential) {
        if (credential == null) {
            throw new IllegalArgumentException("credential cannot be null");
        }
        return poolOf(credential.getService());
    }

    private ServicePool poolOf(ServiceName service) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        ServicePool pool = pools.get(service);
        if (pool == null) {
            throw new ConfigurationException("No credentials loaded for service '" + service + "'");
        }
        return pool;
    }

    private static boolean isUsable(String secret) {
        return secret != null && !secret.isBlank() && !secret.trim().startsWith(PLACEHOLDER_PREFIX);
    }

    private static final class ServicePool {
        private final List<Credential> credentials;
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, Long> selectionOrder = new HashMap<>();
        private long selections;

        private ServicePool(List<Credential> credentials) {
            this.credentials = List.copyOf(credentials);
        }

        // lock 보유 상태에서만 호출
        private void markSelected(Credential credential) {
            selectionOrder.put(credential.getId(), ++selections);
        }

        // 한 번도 선택되지 않은 것이 가장 오래된 것. 동률은 먼저 본 후보(설정 순서)를 유지.
        private boolean selectedBefore(Credential candidate, Credential chosen) {
            long candidateOrder = selectionOrder.getOrDefault(candidate.getId(), 0L);
            long chosenOrder = selectionOrder.getOrDefault(chosen.getId(), 0L);
            return candidateOrder < chosenOrder;
        }
    }
}
