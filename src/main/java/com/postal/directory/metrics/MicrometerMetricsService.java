package com.postal.directory.metrics;

import com.postal.directory.lookup.CepType;
import com.postal.directory.parser.ParseErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code edne.load.duration} - Timer (tag: kind)</li>
 *   <li>{@code edne.records.loaded} - Counter (tag: kind)</li>
 *   <li>{@code edne.load.failures} - Counter (tags: kind, error)</li>
 *   <li>{@code edne.lookup.build.duration} - Timer</li>
 *   <li>{@code edne.lookup.entries} - DistributionSummary (tag: type)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<CepType, DistributionSummary> entrySummaries = new ConcurrentHashMap<>();
    private final Timer buildTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.buildTimer = Timer.builder("edne.lookup.build.duration")
                .description("Time spent merging collections into the postal-code lookup")
                .register(registry);
    }

    @Override
    public void recordLoadDuration(String kind, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(kind, k ->
                Timer.builder("edne.load.duration")
                        .description("Time spent parsing one eDNE source")
                        .tag("kind", k)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementRecordsLoaded(String kind, long count) {
        Counter counter = counterCache.computeIfAbsent("loaded:" + kind, k ->
                Counter.builder("edne.records.loaded")
                        .description("Number of records parsed from eDNE sources")
                        .tag("kind", kind)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementLoadFailure(String kind, ParseErrorKind errorKind) {
        Counter counter = counterCache.computeIfAbsent("failed:" + kind + ":" + errorKind.name(), k ->
                Counter.builder("edne.load.failures")
                        .description("Number of eDNE sources rejected by the parser")
                        .tag("kind", kind)
                        .tag("error", errorKind.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void recordLookupEntries(CepType type, long count) {
        DistributionSummary summary = entrySummaries.computeIfAbsent(type, t ->
                DistributionSummary.builder("edne.lookup.entries")
                        .description("Postal-code entries per type in a built lookup")
                        .tag("type", t.name())
                        .register(registry));
        summary.record(count);
    }
}
