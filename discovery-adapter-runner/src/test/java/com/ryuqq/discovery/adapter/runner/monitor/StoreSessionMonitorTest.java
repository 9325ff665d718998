package com.ryuqq.discovery.adapter.runner.monitor;

import com.ryuqq.discovery.adapter.inmemory.store.InMemorySessionStore;
import com.ryuqq.discovery.adapter.runner.credential.RotatingCredentialPool;
import com.ryuqq.discovery.core.credential.CredentialPoolConfig;
import com.ryuqq.discovery.core.model.ServiceName;
import com.ryuqq.discovery.core.model.SessionId;
import com.ryuqq.discovery.core.model.SessionParams;
import com.ryuqq.discovery.core.statemachine.Phase;
import com.ryuqq.discovery.core.statemachine.SessionStatus;
import com.ryuqq.discovery.testkit.time.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StoreSessionMonitorTest {

    private ManualClock clock;
    private InMemorySessionStore store;
    private RotatingCredentialPool pool;
    private StoreSessionMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-05-01T09:00:00Z"));
        store = new InMemorySessionStore(clock);
        pool = new RotatingCredentialPool(clock, new CredentialPoolConfig());
        pool.load(ServiceName.of("gemini"), List.of("a", "b"));
        monitor = new StoreSessionMonitor(store, pool);
    }

    @Test
    void 세션_상태와_로그를_조회한다() {
        // given
        SessionId first = store.create("topic one", new SessionParams());
        clock.advanceMillis(1_000);
        SessionId second = store.create("topic two", new SessionParams());
        store.setStatus(second, SessionStatus.RUNNING);
        store.updateProgress(second, 10, Phase.COLLECTING_PAPERS, "CollectingPapers");

        // when & then
        assertThat(monitor.get(second).orElseThrow().progress()).isEqualTo(10);
        assertThat(monitor.list()).extracting(s -> s.id()).containsExactly(second, first);
        assertThat(monitor.list(SessionStatus.PENDING)).extracting(s -> s.id()).containsExactly(first);
        assertThat(monitor.logs(second)).extracting(e -> e.message()).containsExactly("CollectingPapers");
    }

    @Test
    void 자격_증명_상태를_조회하고_모르는_서비스는_빈_목록() {
        assertThat(monitor.credentials(ServiceName.of("gemini")))
            .extracting(s -> s.id())
            .containsExactly("gemini-1", "gemini-2");
        assertThat(monitor.credentials(ServiceName.of("openai"))).isEmpty();
    }
}
