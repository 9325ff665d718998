package com.ryuqq.discovery.core.model;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 시간 순으로 정렬되는 {@link SessionId} 생성기.
 *
 * <p>UTC 기준 밀리초 타임스탬프 뒤에 프로세스 내 단조 증가 시퀀스를 붙여
 * 같은 밀리초에 생성된 세션끼리도 충돌하지 않도록 합니다. 시퀀스는 모든 생성기가
 * 공유하므로 같은 파일을 여는 저장소 인스턴스가 여러 개여도 ID가 겹치지 않습니다.</p>
 *
 * <pre>
 * session_20261019_142233_517_0001
 * session_20261019_142233_517_0002
 * </pre>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class SessionIdGenerator {

    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    // 생성기 인스턴스가 여러 개여도 프로세스 안에서는 하나의 시퀀스를 공유
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Clock clock;

    /**
     * 생성자.
     *
     * @param clock 타임스탬프 기준 시계
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public SessionIdGenerator(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 새 SessionId 발급.
     *
     * @return 이전에 발급된 값보다 사전순으로 뒤에 오는 SessionId
     */
    public SessionId next() {
        long seq = SEQUENCE.incrementAndGet() % 10_000;
        return SessionId.of("session_" + FORMAT.format(clock.instant()) + String.format("_%04d", seq));
    }
}
