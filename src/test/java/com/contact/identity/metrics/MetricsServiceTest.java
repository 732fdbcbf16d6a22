package com.contact.identity.metrics;

import com.contact.identity.core.model.IdentifyOutcome;
import com.contact.identity.core.model.LinkPrecedence;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("Micrometer")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Durations are tagged by outcome")
        void duration() {
            metrics.recordIdentifyDuration(IdentifyOutcome.MERGED, Duration.ofMillis(40));
            metrics.recordIdentifyDuration(IdentifyOutcome.MERGED, Duration.ofMillis(60));
            metrics.recordIdentifyDuration(IdentifyOutcome.MATCHED, Duration.ofMillis(5));

            assertEquals(2, registry.get("contact.identify.duration").tag("outcome", "MERGED").timer().count());
            assertEquals(100.0, registry.get("contact.identify.duration").tag("outcome", "MERGED")
                    .timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
            assertEquals(1, registry.get("contact.identify.duration").tag("outcome", "MATCHED").timer().count());
        }

        @Test
        @DisplayName("Created contacts are counted per precedence")
        void created() {
            metrics.incrementContactCreated(LinkPrecedence.PRIMARY);
            metrics.incrementContactCreated(LinkPrecedence.SECONDARY);
            metrics.incrementContactCreated(LinkPrecedence.SECONDARY);

            assertEquals(1.0, registry.get("contact.created").tag("linkPrecedence", "primary").counter().count());
            assertEquals(2.0, registry.get("contact.created").tag("linkPrecedence", "secondary").counter().count());
        }

        @Test
        @DisplayName("Demotions, cluster sizes, failures and retries are recorded")
        void others() {
            metrics.incrementPrimaryDemoted(2);
            metrics.recordClusterSize(3);
            metrics.recordClusterSize(5);
            metrics.incrementIdentifyFailed("StoreTimeoutException");
            metrics.incrementIdentifyRetried();

            assertEquals(2.0, registry.get("contact.primary.demoted").counter().count());
            assertEquals(8.0, registry.get("contact.cluster.size").summary().totalAmount());
            assertEquals(5.0, registry.get("contact.cluster.size").summary().max());
            assertEquals(1.0, registry.get("contact.identify.failed")
                    .tag("error", "StoreTimeoutException").counter().count());
            assertEquals(1.0, registry.get("contact.identify.retried").counter().count());
        }
    }

    @Test
    @DisplayName("NoOp metrics accept every call")
    void noOp() {
        MetricsService metrics = new NoOpMetricsService();

        assertDoesNotThrow(() -> {
            metrics.recordIdentifyDuration(IdentifyOutcome.NEW_PRIMARY, Duration.ZERO);
            metrics.incrementContactCreated(LinkPrecedence.PRIMARY);
            metrics.incrementPrimaryDemoted(1);
            metrics.recordClusterSize(1);
            metrics.incrementIdentifyFailed("X");
            metrics.incrementIdentifyRetried();
        });
    }
}
