package com.ryuqq.discovery.core.guard;

import com.ryuqq.discovery.core.credential.Credential;

/**
 * 자격 증명 하나로 수행하는 외부 호출 한 번.
 *
 * @param <T> 호출 결과 타입
 * @author Discovery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CredentialCall<T> {

    /**
     * 호출 수행.
     *
     * @param credential ExecutionGuard가 선택한 자격 증명
     * @return 결과
     * @throws Exception 실패 시 (분류는 {@link FailureClassifier}가 담당)
     */
    T call(Credential credential) throws Exception;
}
