package com.contact.identity.metrics;

import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.core.model.LinkPrecedence;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIdentifyDuration(IdentifyOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementContactCreated(LinkPrecedence precedence) {
    }

    @Override
    public void incrementPrimaryDemoted(int count) {
    }

    @Override
    public void recordClusterSize(int size) {
    }

    @Override
    public void incrementIdentifyFailed(String errorType) {
    }

    @Override
    public void incrementIdentifyRetried() {
    }
}
