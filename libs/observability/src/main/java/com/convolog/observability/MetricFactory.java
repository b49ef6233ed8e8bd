package com.convolog.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters with a common {@code component} tag.
 * <p>
 * Meter names are prefixed with {@code convolog.} so the event log, command pipeline and
 * projector metrics group together in whatever backend the registry exports to.
 */
public final class MetricFactory {

    /** Prefix applied to every meter name. */
    public static final String PREFIX = "convolog.";

    /** Tag key identifying the emitting component. */
    public static final String TAG_COMPONENT = "component";

    private final MeterRegistry registry;
    private final String component;

    /**
     * Creates a MetricFactory bound to the given registry and component name.
     *
     * @param registry  the Micrometer meter registry
     * @param component logical component name included as a default tag (e.g. "projector")
     */
    public MetricFactory(MeterRegistry registry, String component) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.registry = registry;
        this.component = component;
    }

    /**
     * Factory backed by an in-memory registry, for code paths constructed without Spring.
     */
    public static MetricFactory noop(String component) {
        return new MetricFactory(new SimpleMeterRegistry(), component);
    }

    /**
     * Returns the counter with the given name and extra tags (key-value pairs).
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the timer with the given name and extra tags (key-value pairs).
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(PREFIX + name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge and returns the value holder that drives it.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(PREFIX + name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String component() {
        return component;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_COMPONENT, component);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
