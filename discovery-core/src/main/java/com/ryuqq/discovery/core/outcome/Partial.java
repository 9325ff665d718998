package com.ryuqq.discovery.core.outcome;

import com.ryuqq.discovery.core.model.Payload;

import java.util.List;

/**
 * 부분 성공 결과.
 *
 * <p>배치 작업(예: 논문 여러 편 분석)에서 일부 항목만 실패한 경우입니다.
 * 실패 항목은 세션 로그에 기록되고 단계는 계속 진행합니다.</p>
 *
 * @param result 사용 가능한 결과
 * @param failures 항목 단위 실패 (1개 이상)
 * @author Discovery Team
 * @since 1.0.0
 */
public record Partial(Payload result, List<ItemFailure> failures) implements CollaboratorOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null이거나 failures가 비어있는 경우
     */
    public Partial {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures cannot be null or empty");
        }
        failures = List.copyOf(failures);
    }
}
