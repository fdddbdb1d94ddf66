package org.example.insights.service;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class RecapMetricsService {

    private final LongAdder firings = new LongAdder();
    private final LongAdder firingsSkipped = new LongAdder();
    private final LongAdder runsCompleted = new LongAdder();
    private final LongAdder runsSkipped = new LongAdder();
    private final LongAdder runsFailed = new LongAdder();
    private final LongAdder pagesPublished = new LongAdder();
    private final LongAdder publishFailures = new LongAdder();
    private final LongAdder messagesSent = new LongAdder();
    private final LongAdder sendFailures = new LongAdder();
    private final LongAdder subscribersRevoked = new LongAdder();
    private final AtomicLong runLatencyTotalMs = new AtomicLong(0);

    public void recordFiring() {
        firings.increment();
    }

    public void recordFiringSkipped() {
        firingsSkipped.increment();
    }

    public void recordRunCompleted(long durationMs) {
        runsCompleted.increment();
        addLatency(durationMs);
    }

    public void recordRunSkipped() {
        runsSkipped.increment();
    }

    public void recordRunFailed(long durationMs) {
        runsFailed.increment();
        addLatency(durationMs);
    }

    public void recordPagesPublished(int pages) {
        pagesPublished.add(pages);
    }

    public void recordPublishFailure() {
        publishFailures.increment();
    }

    public void recordMessageSent() {
        messagesSent.increment();
    }

    public void recordSendFailure() {
        sendFailures.increment();
    }

    public void recordSubscriberRevoked() {
        subscribersRevoked.increment();
    }

    public Map<String, Object> snapshot() {
        long completed = runsCompleted.sum();
        long failed = runsFailed.sum();
        long measured = completed + failed;
        long avgLatencyMs = measured == 0 ? 0 : runLatencyTotalMs.get() / measured;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("firings", firings.sum());
        metrics.put("firingsSkipped", firingsSkipped.sum());
        metrics.put("runsCompleted", completed);
        metrics.put("runsSkipped", runsSkipped.sum());
        metrics.put("runsFailed", failed);
        metrics.put("pagesPublished", pagesPublished.sum());
        metrics.put("publishFailures", publishFailures.sum());
        metrics.put("messagesSent", messagesSent.sum());
        metrics.put("sendFailures", sendFailures.sum());
        metrics.put("subscribersRevoked", subscribersRevoked.sum());
        metrics.put("avgRunLatencyMs", avgLatencyMs);
        return metrics;
    }

    private void addLatency(long durationMs) {
        if (durationMs > 0) {
            runLatencyTotalMs.addAndGet(durationMs);
        }
    }
}
