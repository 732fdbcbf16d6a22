package com.contact.identity.metrics;

import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.core.model.LinkPrecedence;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code contact.identify.duration}: Timer (tag: outcome)</li>
 *   <li>{@code contact.created}: Counter (tag: linkPrecedence)</li>
 *   <li>{@code contact.primary.demoted}: Counter</li>
 *   <li>{@code contact.cluster.size}: DistributionSummary</li>
 *   <li>{@code contact.identify.failed}: Counter (tag: error)</li>
 *   <li>{@code contact.identify.retried}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<IdentifyOutcome, Timer> durationTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter demotedCounter;
    private final Counter retriedCounter;
    private final DistributionSummary clusterSizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.demotedCounter = Counter.builder("contact.primary.demoted")
                .description("Number of primaries demoted by cluster merges")
                .register(registry);
        this.retriedCounter = Counter.builder("contact.identify.retried")
                .description("Number of reconciliations re-run after a transient failure")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("contact.cluster.size")
                .description("Number of contacts in the cluster returned by identify")
                .register(registry);
    }

    @Override
    public void recordIdentifyDuration(IdentifyOutcome outcome, Duration duration) {
        Timer timer = durationTimers.computeIfAbsent(outcome, o ->
                Timer.builder("contact.identify.duration")
                        .description("Duration of identify reconciliations")
                        .tag("outcome", o.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementContactCreated(LinkPrecedence precedence) {
        counterCache.computeIfAbsent("created:" + precedence.name(), k ->
                Counter.builder("contact.created")
                        .description("Number of contacts created")
                        .tag("linkPrecedence", precedence.dbValue())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementPrimaryDemoted(int count) {
        demotedCounter.increment(count);
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void incrementIdentifyFailed(String errorType) {
        counterCache.computeIfAbsent("failed:" + errorType, k ->
                Counter.builder("contact.identify.failed")
                        .description("Number of identify calls that failed")
                        .tag("error", errorType)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementIdentifyRetried() {
        retriedCounter.increment();
    }
}
