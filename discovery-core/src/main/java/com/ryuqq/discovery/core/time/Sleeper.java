package com.ryuqq.discovery.core.time;

/**
 * 호출 스레드만 멈추는 대기 추상화 (테스트에서는 기록용 구현으로 대체).
 *
 * @author Discovery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long)}을 쓰는 기본 구현.
     */
    Sleeper SYSTEM = Thread::sleep;

    /**
     * 지정 시간 대기.
     *
     * @param millis 대기 시간 (밀리초)
     * @throws InterruptedException 대기 중 인터럽트
     */
    void sleep(long millis) throws InterruptedException;
}
