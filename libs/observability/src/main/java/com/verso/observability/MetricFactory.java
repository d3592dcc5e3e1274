package com.verso.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters tagged with the versioned structure they describe.
 *
 * <p>Every meter created here carries a {@code structure} tag (e.g. {@code orders-db}) so that
 * several versioners sharing one registry stay distinguishable. Additional tags can be supplied per
 * meter.
 */
public final class MetricFactory {

    /** Tag key naming the versioned structure. */
    public static final String TAG_STRUCTURE = "structure";

    private final MeterRegistry registry;
    private final String structure;

    /**
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param structure logical name of the versioned structure, included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String structure) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (structure == null || structure.isBlank()) {
            throw new IllegalArgumentException("structure must not be null or blank");
        }
        this.registry = registry;
        this.structure = structure;
    }

    /**
     * Creates a counter with the structure tag.
     *
     * @param name metric name (e.g., "versioner.changes.applied")
     * @param description human-readable description
     * @param tags additional tags (key-value pairs)
     * @return the counter
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates a timer with the structure tag.
     *
     * @param name metric name (e.g., "versioner.change.duration")
     * @param description human-readable description
     * @param tags additional tags (key-value pairs)
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by an {@link AtomicLong}, with the structure tag.
     *
     * @param name metric name (e.g., "versioner.version.last.applied")
     * @param description human-readable description
     * @param initialValue value reported until the first update
     * @param tags additional tags (key-value pairs)
     * @return an AtomicLong that can be used to update the gauge value
     */
    public AtomicLong gauge(String name, String description, long initialValue, String... tags) {
        AtomicLong value = new AtomicLong(initialValue);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String structure() {
        return structure;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_STRUCTURE, structure);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
