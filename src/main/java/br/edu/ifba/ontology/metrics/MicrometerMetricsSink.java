package br.edu.ifba.ontology.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsSink} backed by a Micrometer {@link MeterRegistry}.
 *
 * <p>Meters are cached per name and tag set. Tag values are kept low-cardinality:
 * trimmed, lower-cased, capped at 64 characters, {@code none} when blank.
 * Registry failures are logged at DEBUG and dropped.</p>
 */
public final class MicrometerMetricsSink implements MetricsSink {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsSink.class);

    private static final int MAX_TAG_LENGTH = 64;

    private final MeterRegistry registry;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();
    // gauge values are stored as raw double bits
    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsSink(@NotNull MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public void increment(@NotNull String name, @NotNull Map<String, String> tags) {
        try {
            Tags meterTags = toTags(tags);
            counters.computeIfAbsent(meterKey(name, meterTags),
                    k -> Counter.builder(name).tags(meterTags).register(registry))
                .increment();
        } catch (RuntimeException e) {
            logger.debug("Dropping counter {}: {}", name, e.getMessage());
        }
    }

    @Override
    public void observe(@NotNull String name, double value, @NotNull Map<String, String> tags) {
        try {
            Tags meterTags = toTags(tags);
            summaries.computeIfAbsent(meterKey(name, meterTags),
                    k -> DistributionSummary.builder(name).tags(meterTags).register(registry))
                .record(value);
        } catch (RuntimeException e) {
            logger.debug("Dropping observation {}: {}", name, e.getMessage());
        }
    }

    @Override
    public void gauge(@NotNull String name, double value, @NotNull Map<String, String> tags) {
        try {
            Tags meterTags = toTags(tags);
            gauges.computeIfAbsent(meterKey(name, meterTags), k -> {
                    AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0.0));
                    Gauge.builder(name, holder, h -> Double.longBitsToDouble(h.get()))
                        .tags(meterTags)
                        .register(registry);
                    return holder;
                })
                .set(Double.doubleToLongBits(value));
        } catch (RuntimeException e) {
            logger.debug("Dropping gauge {}: {}", name, e.getMessage());
        }
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags.isEmpty()) {
            return Tags.empty();
        }
        List<Tag> result = new ArrayList<>(tags.size());
        for (Map.Entry<String, String> entry : new TreeMap<>(tags).entrySet()) {
            result.add(Tag.of(entry.getKey(), safeTag(entry.getValue())));
        }
        return Tags.of(result);
    }

    private static String meterKey(String name, Tags tags) {
        StringBuilder key = new StringBuilder(name);
        for (Tag tag : tags) {
            key.append('|').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return key.toString();
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > MAX_TAG_LENGTH) {
            s = s.substring(0, MAX_TAG_LENGTH);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
