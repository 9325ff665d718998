package com.ryuqq.discovery.adapter.runner.batch;

import com.ryuqq.discovery.core.credential.Credential;

/**
 * Per-item work executed through the guard with the credential it selected.
 *
 * @param <I> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface ItemCall<I, R> {

    R call(I item, Credential credential) throws Exception;
}
