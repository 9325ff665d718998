package com.ryuqq.discovery.adapter.runner.batch;

import com.ryuqq.discovery.core.exception.DiscoveryException;
import com.ryuqq.discovery.core.guard.ExecutionGuard;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.outcome.ItemFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 아이템 단위 배치 실행기.
 *
 * <p>논문 목록처럼 아이템 여러 개를 같은 서비스로 처리할 때, 고정 크기 스레드 풀에서
 * 아이템마다 {@link ExecutionGuard}를 거쳐 호출합니다. 모든 워커가 하나의 자격 증명 풀을
 * 공유하므로 한 워커가 기록한 레이트 리밋은 다른 워커의 다음 선택에 바로 반영됩니다.</p>
 *
 * <p>가드가 포기한 아이템(재시도 소진, 재시도 불가, 풀 고갈, 기타 런타임 예외)은
 * {@link ItemFailure}가 되고 배치는 계속됩니다. 결과는 입력 순서를 유지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchResult&lt;String&gt; analyzed = batch.run(papers, Paper::id, GEMINI,
 *     (paper, key) -&gt; llm.analyze(key.getSecret(), paper));
 * return analyzed.toOutcome(results -&gt; Payload.of(json(results)));
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class BatchExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private final ExecutionGuard guard;
    private final BatchConfig config;
    private final ExecutorService workers;

    public BatchExecutor(ExecutionGuard guard) {
        this(guard, new BatchConfig());
    }

    /**
     * 생성자.
     *
     * @param guard 실행 가드
     * @param config 배치 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public BatchExecutor(ExecutionGuard guard, BatchConfig config) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.guard = guard;
        this.config = config;
        this.workers = Executors.newFixedThreadPool(config.concurrency(), new BatchThreadFactory());
    }

    /**
     * 아이템 문자열 표현을 키로 사용해 실행.
     *
     * @param items 아이템 목록
     * @param service 호출할 서비스
     * @param call 아이템별 작업
     * @param <I> 아이템 타입
     * @param <R> 결과 타입
     * @return 배치 결과
     */
    public <I, R> BatchResult<R> run(List<I> items, ServiceName service, ItemCall<I, R> call) {
        return run(items, String::valueOf, service, call);
    }

    /**
     * 배치 실행.
     *
     * @param items 아이템 목록
     * @param keyOf 실패 기록용 아이템 키
     * @param service 호출할 서비스
     * @param call 아이템별 작업
     * @param <I> 아이템 타입
     * @param <R> 결과 타입
     * @return 배치 결과 (입력 순서 유지)
     * @throws DiscoveryException 대기 중 인터럽트된 경우
     */
    public <I, R> BatchResult<R> run(List<I> items, Function<I, String> keyOf, ServiceName service,
                                     ItemCall<I, R> call) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (keyOf == null || service == null || call == null) {
            throw new IllegalArgumentException("keyOf, service and call cannot be null");
        }

        List<Future<R>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            futures.add(workers.submit(() -> guard.execute(service, credential -> call.call(item, credential))));
        }

        List<R> results = new ArrayList<>();
        List<ItemFailure> failures = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            String key = keyOf.apply(items.get(i));
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelFrom(futures, i);
                throw new DiscoveryException("Batch on service '" + service + "' interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof Error) {
                    cancelFrom(futures, i + 1);
                    throw (Error) cause;
                }
                String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                log.warn("Item {} failed on service {}: {}", key, service, reason);
                failures.add(new ItemFailure(key, reason));
            }
        }

        log.info("Batch on service {} finished: {} succeeded, {} failed (concurrency {})",
            service, results.size(), failures.size(), config.concurrency());
        return new BatchResult<>(items.size(), results, failures);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static void cancelFrom(List<? extends Future<?>> futures, int from) {
        for (int j = from; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }

    private static final class BatchThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "discovery-batch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
