package com.david.spring.log.dispatch.event.listener;

import com.david.spring.log.dispatch.chain.DispatchResult;
import com.david.spring.log.dispatch.event.DispatchListener;
import com.david.spring.log.dispatch.model.Severity;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dispatch statistics listener.
 * Counts handled messages per severity, dropped messages and hard failures.
 */
@Slf4j
public class DispatchStatisticsListener implements DispatchListener {

    private final Map<Severity, AtomicLong> handledCounts = new EnumMap<>(Severity.class);
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public DispatchStatisticsListener() {
        for (Severity severity : Severity.values()) {
            handledCounts.put(severity, new AtomicLong());
        }
    }

    @Override
    public void onDispatch(DispatchResult result) {
        switch (result.outcome()) {
            case HANDLED -> handledCounts.get(result.severity()).incrementAndGet();
            case DROPPED -> droppedCount.incrementAndGet();
            case FAILED -> failedCount.incrementAndGet();
        }
    }

    public DispatchStats getStats() {
        Map<Severity, Long> handled = new EnumMap<>(Severity.class);
        handledCounts.forEach((severity, count) -> handled.put(severity, count.get()));
        return new DispatchStats(Collections.unmodifiableMap(handled), droppedCount.get(), failedCount.get());
    }

    public void reset() {
        handledCounts.values().forEach(count -> count.set(0));
        droppedCount.set(0);
        failedCount.set(0);
    }

    public void logStats() {
        DispatchStats stats = getStats();
        log.info("Dispatch statistics: handled={}, dropped={}, failed={}, total={}",
                stats.handled(), stats.dropped(), stats.failed(), stats.total());
    }

    /**
     * Snapshot of the counters.
     *
     * @param handled handled message count per severity
     * @param dropped messages that reached the end of the chain unclaimed
     * @param failed  dispatches ended by a hard failure
     */
    public record DispatchStats(Map<Severity, Long> handled, long dropped, long failed) {

        public long handled(Severity severity) {
            return handled.getOrDefault(severity, 0L);
        }

        public long total() {
            return handled.values().stream().mapToLong(Long::longValue).sum() + dropped + failed;
        }
    }
}
