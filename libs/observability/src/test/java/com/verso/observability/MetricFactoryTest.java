package com.verso.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link MetricFactory}: meter creation with the structure tag. */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "orders-db");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "orders-db"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank structure name")
        void shouldRejectBlankStructure() {
            assertThatThrownBy(() -> new MetricFactory(registry, " "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("structure");
        }

        @Test
        @DisplayName("should expose registry and structure")
        void shouldExposeRegistryAndStructure() {
            assertThat(factory.registry()).isSameAs(registry);
            assertThat(factory.structure()).isEqualTo("orders-db");
        }
    }

    @Test
    @DisplayName("counter carries the structure tag and extra tags")
    void counterTags() {
        Counter counter =
                factory.counter("versioner.changes.applied", "applied", "direction", "upgrade");
        counter.increment(2);

        Counter found =
                registry.find("versioner.changes.applied")
                        .tag(MetricFactory.TAG_STRUCTURE, "orders-db")
                        .tag("direction", "upgrade")
                        .counter();
        assertThat(found).isNotNull();
        assertThat(found.count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        Timer timer = factory.timer("versioner.change.duration", "duration");
        timer.record(Duration.ofMillis(40));

        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.getId().getTag(MetricFactory.TAG_STRUCTURE)).isEqualTo("orders-db");
    }

    @Test
    @DisplayName("gauge starts at its initial value and follows updates")
    void gaugeFollowsValue() {
        AtomicLong value = factory.gauge("versioner.version.last.applied", "last", -1);

        assertThat(registry.get("versioner.version.last.applied").gauge().value()).isEqualTo(-1.0);

        value.set(12);
        assertThat(registry.get("versioner.version.last.applied").gauge().value()).isEqualTo(12.0);
    }
}
