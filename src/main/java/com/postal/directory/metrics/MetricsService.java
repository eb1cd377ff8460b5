package com.postal.directory.metrics;

import com.postal.directory.lookup.CepType;
import com.postal.directory.parser.ParseErrorKind;

import java.time.Duration;

/**
 * Interface for recording directory loading and index build metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordLoadDuration(String kind, Duration duration);

    void incrementRecordsLoaded(String kind, long count);

    void incrementLoadFailure(String kind, ParseErrorKind errorKind);

    void recordBuildDuration(Duration duration);

    void recordLookupEntries(CepType type, long count);
}
