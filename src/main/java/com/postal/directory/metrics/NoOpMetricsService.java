package com.postal.directory.metrics;

import com.postal.directory.lookup.CepType;
import com.postal.directory.parser.ParseErrorKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLoadDuration(String kind, Duration duration) {
    }

    @Override
    public void incrementRecordsLoaded(String kind, long count) {
    }

    @Override
    public void incrementLoadFailure(String kind, ParseErrorKind errorKind) {
    }

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void recordLookupEntries(CepType type, long count) {
    }
}
