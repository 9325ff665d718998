package com.ryuqq.discovery.core.outcome;

import com.ryuqq.discovery.core.model.Payload;

import java.util.List;
import java.util.Optional;

/**
 * 협력자(Collaborator) 호출 결과.
 *
 * <p>세 가지 결과만 존재합니다:</p>
 * <ul>
 *   <li>{@link Success}: 결과 전체 사용 가능</li>
 *   <li>{@link Partial}: 결과는 있지만 일부 항목 실패 ({@link ItemFailure}), 단계는 계속 진행</li>
 *   <li>{@link Fatal}: 단계 전체를 진행할 수 없음, 세션 실패</li>
 * </ul>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public sealed interface CollaboratorOutcome permits Success, Partial, Fatal {

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isPartial() {
        return this instanceof Partial;
    }

    default boolean isFatal() {
        return this instanceof Fatal;
    }

    /**
     * 다음 단계로 넘길 출력.
     *
     * @return Fatal이면 empty
     */
    default Optional<Payload> output() {
        if (this instanceof Success) {
            return Optional.of(((Success) this).result());
        }
        if (this instanceof Partial) {
            return Optional.of(((Partial) this).result());
        }
        return Optional.empty();
    }

    /**
     * 항목 단위 실패 목록.
     *
     * @return Partial이 아니면 빈 목록
     */
    default List<ItemFailure> itemFailures() {
        if (this instanceof Partial) {
            return ((Partial) this).failures();
        }
        return List.of();
    }
}
