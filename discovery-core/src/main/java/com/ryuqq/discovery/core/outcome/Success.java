package com.ryuqq.discovery.core.outcome;

import com.ryuqq.discovery.core.model.Payload;

/**
 * 성공 결과.
 *
 * @param result 다음 단계 입력으로 전달될 결과
 * @author Discovery Team
 * @since 1.0.0
 */
public record Success(Payload result) implements CollaboratorOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null인 경우
     */
    public Success {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }

    public static Success of(Payload result) {
        return new Success(result);
    }
}
