package com.ryuqq.discovery.core.guard;

import com.ryuqq.discovery.core.exception.ServiceCallException;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 기본 실패 분류기.
 *
 * <p><strong>분류 순서:</strong></p>
 * <ol>
 *   <li>{@link ServiceCallException}: 예외가 알려주는 분류 그대로</li>
 *   <li>{@link TimeoutException}, {@link IOException}: TRANSIENT</li>
 *   <li>메시지에 "429", "rate limit", "quota" 포함: RATE_LIMITED</li>
 *   <li>{@link IllegalArgumentException}: NON_RETRYABLE (잘못된 요청)</li>
 *   <li>그 외: TRANSIENT</li>
 * </ol>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public FailureKind classify(Throwable failure) {
        if (failure instanceof ServiceCallException) {
            return ((ServiceCallException) failure).kind();
        }
        if (failure instanceof TimeoutException || failure instanceof IOException) {
            return FailureKind.TRANSIENT;
        }
        if (looksRateLimited(failure.getMessage())) {
            return FailureKind.RATE_LIMITED;
        }
        if (failure instanceof IllegalArgumentException) {
            return FailureKind.NON_RETRYABLE;
        }
        return FailureKind.TRANSIENT;
    }

    private static boolean looksRateLimited(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("429") || lower.contains("rate limit") || lower.contains("quota");
    }
}
