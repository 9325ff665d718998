package com.ryuqq.discovery.testkit.time;

import com.ryuqq.discovery.core.time.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested durations instead of blocking.
 *
 * <p>When built with a {@link ManualClock}, each sleep also advances that clock, so
 * time-based policies (rate-limit windows, cool-downs) observe the elapsed time.</p>
 *
 * @author Discovery Team
 * @since 1.0.0
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();
    private final ManualClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(ManualClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
        if (clock != null) {
            clock.advanceMillis(millis);
        }
    }

    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    public synchronized long totalMillis() {
        long total = 0;
        for (Long sleep : sleeps) {
            total += sleep;
        }
        return total;
    }
}
