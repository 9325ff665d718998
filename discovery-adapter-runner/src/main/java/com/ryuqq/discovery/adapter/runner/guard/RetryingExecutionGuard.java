package com.ryuqq.discovery.adapter.runner.guard;

import com.ryuqq.discovery.adapter.runner.protection.FixedTimeoutPolicy;
import com.ryuqq.discovery.core.credential.Credential;
import com.ryuqq.discovery.core.credential.CredentialPool;
import com.ryuqq.discovery.core.exception.ExhaustedException;
import com.ryuqq.discovery.core.exception.NonRetryableCallException;
import com.ryuqq.discovery.core.exception.PoolExhaustedException;
import com.ryuqq.discovery.core.exception.TransientCallException;
import com.ryuqq.discovery.core.guard.CredentialCall;
import com.ryuqq.discovery.core.guard.DefaultFailureClassifier;
import com.ryuqq.discovery.core.guard.ExecutionGuard;
import com.ryuqq.discovery.core.guard.FailureClassifier;
import com.ryuqq.discovery.core.guard.FailureKind;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.protection.RateLimiter;
import com.ryuqq.discovery.core.protection.TimeoutPolicy;
import com.ryuqq.discovery.core.protection.noop.NoOpRateLimiter;
import com.ryuqq.discovery.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 자격 증명 로테이션 + 재시도 ExecutionGuard 구현체.
 *
 * <p>한 번의 {@link #execute} 호출은 최대 {@code maxAttempts}번 시도하며, 매 시도마다
 * 풀에서 자격 증명을 고르고 결과를 풀에 기록합니다. 기록은 즉시 다른 호출자에게도 보입니다.</p>
 *
 * <p><strong>시도 한 번의 흐름:</strong></p>
 * <ol>
 *   <li>{@link CredentialPool#select}: PoolExhausted면 백오프 후 다음 시도</li>
 *   <li>클라이언트 측 {@link RateLimiter} permit: 거절되면 자격 증명과 무관한 일시적 실패</li>
 *   <li>시도당 타임아웃({@link TimeoutPolicy}) 안에서 작업 실행, 초과 시 작업 취소 후 일시적 실패</li>
 *   <li>분류({@link FailureClassifier}):
 *     <ul>
 *       <li>성공: recordSuccess 후 반환</li>
 *       <li>RATE_LIMITED: 기록 후, 선택 가능한 자격 증명이 남아 있으면 대기 없이 다음 시도, 없으면 백오프.
 *           마지막 시도에서 로테이션하면 추가 시도 한 번이 허용됩니다.</li>
 *       <li>TRANSIENT: 기록 후 백오프</li>
 *       <li>NON_RETRYABLE: 기록 없이 즉시 {@link NonRetryableCallException}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>시도 k의 백오프는 {@code base * 2^(k-1)} (기본 2s, 4s, 8s)이며 마지막 시도 뒤에도 적용됩니다.
 * 예산을 다 쓰면 마지막 원인을 담은 {@link ExhaustedException}, 마지막 원인이 풀 고갈이면
 * {@link PoolExhaustedException}을 던집니다. 백오프 중 인터럽트되면 인터럽트 플래그를 복원하고
 * {@link ExhaustedException}으로 끝냅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionGuard guard = new RetryingExecutionGuard(pool);
 * String answer = guard.execute(ServiceName.of("gemini"), key -&gt; llmClient.generate(key.getSecret(), prompt));
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class RetryingExecutionGuard implements ExecutionGuard, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryingExecutionGuard.class);

    private final CredentialPool pool;
    private final GuardConfig config;
    private final BackoffCalculator backoff;
    private final TimeoutPolicy timeoutPolicy;
    private final RateLimiter rateLimiter;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;

    /**
     * 기본 설정으로 생성 (3회, 2s 백오프, 30s 타임아웃, 클라이언트 측 제한 없음).
     *
     * @param pool 자격 증명 풀
     */
    public RetryingExecutionGuard(CredentialPool pool) {
        this(pool, new GuardConfig(), Sleeper.SYSTEM);
    }

    /**
     * 설정과 Sleeper를 지정해 생성.
     *
     * @param pool 자격 증명 풀
     * @param config 가드 설정
     * @param sleeper 백오프 대기 수단
     */
    public RetryingExecutionGuard(CredentialPool pool, GuardConfig config, Sleeper sleeper) {
        this(pool, config, new FixedTimeoutPolicy(), new NoOpRateLimiter(), new DefaultFailureClassifier(), sleeper);
    }

    /**
     * 전체 생성자.
     *
     * @param pool 자격 증명 풀
     * @param config 가드 설정
     * @param timeoutPolicy 시도당 타임아웃 정책
     * @param rateLimiter 클라이언트 측 레이트 리미터
     * @param classifier 실패 분류기
     * @param sleeper 백오프 대기 수단
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public RetryingExecutionGuard(CredentialPool pool, GuardConfig config, TimeoutPolicy timeoutPolicy,
                                  RateLimiter rateLimiter, FailureClassifier classifier, Sleeper sleeper) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.pool = pool;
        this.config = config;
        this.backoff = new BackoffCalculator(config);
        this.timeoutPolicy = timeoutPolicy;
        this.rateLimiter = rateLimiter;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.callExecutor = Executors.newCachedThreadPool(new GuardThreadFactory());
    }

    @Override
    public <T> T execute(ServiceName service, CredentialCall<T> work) {
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }

        Throwable lastCause = null;
        int attempt = 0;
        int budget = config.maxAttempts();
        while (attempt < budget) {
            attempt++;

            Credential credential;
            try {
                credential = pool.select(service);
            } catch (PoolExhaustedException e) {
                log.warn("[{}] attempt {}/{}: no credential available", service, attempt, budget);
                lastCause = e;
                sleepBackoff(service, attempt, e);
                continue;
            }

            if (!acquirePermit(service, attempt)) {
                log.warn("[{}] attempt {}/{}: client-side rate limit permit refused",
                    service, attempt, budget);
                lastCause = new TransientCallException("Client-side rate limit permit refused for service '" + service + "'");
                sleepBackoff(service, attempt, lastCause);
                continue;
            }

            try {
                T result = invoke(service, credential, work);
                pool.recordSuccess(credential);
                log.debug("[{}] attempt {}/{} with {}: success", service, attempt, budget, credential.getId());
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExhaustedException(service, attempt, e);
            } catch (Exception failure) {
                lastCause = failure;
                FailureKind kind = classifier.classify(failure);
                log.warn("[{}] attempt {}/{} with {}: {} ({})", service, attempt, budget,
                    credential.getId(), kind, failure.getMessage());

                if (kind == FailureKind.NON_RETRYABLE) {
                    throw asNonRetryable(service, failure);
                }

                pool.recordFailure(credential, kind);
                if (kind == FailureKind.RATE_LIMITED && pool.availableCount(service) > 0) {
                    // 마지막 시도의 로테이션은 한 번만 추가 시도로 이어짐
                    if (attempt == budget && budget == config.maxAttempts()) {
                        budget++;
                    }
                    log.info("[{}] rotating away from rate-limited credential {}", service, credential.getId());
                    continue;
                }
                sleepBackoff(service, attempt, failure);
            }
        }

        if (lastCause instanceof PoolExhaustedException) {
            throw (PoolExhaustedException) lastCause;
        }
        log.error("[{}] call failed after {} attempts", service, attempt);
        throw new ExhaustedException(service, attempt, lastCause);
    }

    /**
     * 작업 실행 스레드 정리.
     */
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    @Override
    public void close() {
        shutdown();
    }

    private boolean acquirePermit(ServiceName service, int attempt) {
        try {
            return rateLimiter.tryAcquire(service, config.rateLimitAcquireTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExhaustedException(service, attempt, e);
        }
    }

    private <T> T invoke(ServiceName service, Credential credential, CredentialCall<T> work) throws Exception {
        long timeoutMs = timeoutPolicy.getPerAttemptTimeoutMs(service);
        if (timeoutMs <= 0) {
            return work.call(credential);
        }

        Future<T> future = callExecutor.submit(() -> work.call(credential));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            timeoutPolicy.recordTimeout(service, timeoutMs);
            throw new TransientCallException(
                "Call to service '" + service + "' timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private void sleepBackoff(ServiceName service, int attempt, Throwable cause) {
        long delayMs = backoff.calculate(attempt);
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            e.addSuppressed(cause);
            throw new ExhaustedException(service, attempt, e);
        }
    }

    private static RuntimeException asNonRetryable(ServiceName service, Exception failure) {
        if (failure instanceof NonRetryableCallException) {
            return (NonRetryableCallException) failure;
        }
        return new NonRetryableCallException(
            "Call to service '" + service + "' failed permanently: " + failure.getMessage(), failure);
    }

    private static final class GuardThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "discovery-guard-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
