package com.ryuqq.discovery.adapter.runner.batch;

import com.ryuqq.discovery.core.model.Payload;
import com.ryuqq.discovery.core.outcome.CollaboratorOutcome;
import com.ryuqq.discovery.core.outcome.Fatal;
import com.ryuqq.discovery.core.outcome.ItemFailure;
import com.ryuqq.discovery.core.outcome.Partial;
import com.ryuqq.discovery.core.outcome.Success;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 배치 처리 결과.
 *
 * <p>{@code results}와 {@code failures}는 각각 입력 아이템 순서를 유지합니다.
 * 작업이 null을 반환한 아이템은 성공으로 보고 {@code results}에 null로 남습니다.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 * @param itemCount 입력 아이템 수
 * @param results 성공한 아이템의 결과
 * @param failures 실패한 아이템
 * @param <R> 결과 타입
 */
public record BatchResult<R>(int itemCount, List<R> results, List<ItemFailure> failures) {

    public static final String EMPTY_BATCH = "EMPTY_BATCH";

    public BatchResult {
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount must be non-negative (current: " + itemCount + ")");
        }
        if (results == null || failures == null) {
            throw new IllegalArgumentException("results and failures cannot be null");
        }
        if (results.size() + failures.size() != itemCount) {
            throw new IllegalArgumentException(
                "results + failures must equal itemCount (" + results.size() + " + " + failures.size()
                    + " != " + itemCount + ")");
        }
        // 아이템 결과로 null 허용
        results = Collections.unmodifiableList(new ArrayList<>(results));
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * 협력자 결과로 변환.
     *
     * <ul>
     *   <li>아이템이 있는데 성공이 하나도 없으면 Fatal(EMPTY_BATCH)</li>
     *   <li>일부 실패면 Partial</li>
     *   <li>그 외 Success (빈 배치 포함)</li>
     * </ul>
     *
     * @param encoder 성공 결과 목록을 페이로드로 직렬화
     * @return CollaboratorOutcome
     */
    public CollaboratorOutcome toOutcome(Function<List<R>, Payload> encoder) {
        if (itemCount > 0 && results.isEmpty()) {
            String firstReason = failures.get(0).reason();
            return Fatal.of(EMPTY_BATCH, "All " + itemCount + " items failed", firstReason);
        }
        Payload payload = encoder.apply(results);
        if (hasFailures()) {
            return new Partial(payload, failures);
        }
        return Success.of(payload);
    }
}
