package com.ryuqq.discovery.core.guard;

/**
 * 호출 실패를 {@link FailureKind}로 분류.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * 실패 분류.
     *
     * @param failure 호출이 던진 예외 (타임아웃은 {@link java.util.concurrent.TimeoutException})
     * @return 분류 결과
     */
    FailureKind classify(Throwable failure);
}
