package com.postal.directory.bulk;

import com.postal.directory.logging.LogContext;
import com.postal.directory.metrics.MetricsService;
import com.postal.directory.metrics.NoOpMetricsService;
import com.postal.directory.parser.ParseException;
import com.postal.directory.parser.RecordKind;
import com.postal.directory.parser.RecordSource;
import com.postal.directory.parser.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;

/**
 * Parses eDNE sources into {@link RecordCollection}s.
 *
 * <p>Loading is fail-fast: the first malformed line aborts the whole source
 * with a {@link ParseException} and no partial collection is returned.</p>
 *
 * <pre>
 * RecordLoader loader = new RecordLoader();
 * RecordCollection&lt;LocalityId, Locality&gt; localities =
 *         loader.load(RecordKinds.LOCALITY, Files.readAllBytes(path));
 * </pre>
 */
public class RecordLoader {
    private static final Logger log = LoggerFactory.getLogger(RecordLoader.class);

    private final LoaderOptions options;
    private final MetricsService metricsService;

    public RecordLoader() {
        this(LoaderOptions.defaults(), null);
    }

    public RecordLoader(LoaderOptions options, MetricsService metricsService) {
        this.options = options != null ? options : LoaderOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Loads a source from raw ISO-8859-1 bytes.
     */
    public <I, R> RecordCollection<I, R> load(RecordKind<I, R> kind, byte[] latin1Bytes) {
        return load(kind, RecordSource.fromLatin1(latin1Bytes), ProgressCallback.NOOP);
    }

    /**
     * Loads a source from already decoded text.
     */
    public <I, R> RecordCollection<I, R> load(RecordKind<I, R> kind, String text) {
        return load(kind, RecordSource.fromText(text), ProgressCallback.NOOP);
    }

    /**
     * Reads the stream fully as ISO-8859-1 and loads it. The stream is not closed.
     *
     * @throws UncheckedIOException if the stream cannot be read
     */
    public <I, R> RecordCollection<I, R> load(RecordKind<I, R> kind, InputStream input, ProgressCallback callback) {
        byte[] bytes;
        try {
            bytes = input.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + kind.name() + " source", e);
        }
        return load(kind, RecordSource.fromLatin1(bytes), callback);
    }

    public <I, R> RecordCollection<I, R> load(RecordKind<I, R> kind, RecordSource source, ProgressCallback callback) {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(source, "source is required");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;

        try (LogContext ctx = LogContext.forLoad(LogContext.generateCorrelationId(), kind.name())) {
            log.debug("load.started kind={} chars={}", kind.name(), source.content().length());
            long start = System.nanoTime();

            RecordCollection<I, R> collection = new RecordCollection<>(kind);
            long parsed = 0;
            Iterator<SourceLine> lines = source.lines().iterator();
            while (lines.hasNext()) {
                SourceLine line = lines.next();
                R record;
                try {
                    record = kind.parseLine(line.text(), line.lineNumber(), options.getSeparator());
                } catch (ParseException e) {
                    metricsService.incrementLoadFailure(kind.name(), e.getKind());
                    log.warn("load.failed kind={} line={} error={}", kind.name(), line.lineNumber(), e.getMessage());
                    throw e;
                }
                collection.insert(record);
                parsed++;

                if (parsed % options.getProgressInterval() == 0) {
                    cb.onProgress(parsed, -1, "Parsed " + parsed + " " + kind.name() + " records");
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordLoadDuration(kind.name(), duration);
            metricsService.incrementRecordsLoaded(kind.name(), collection.size());
            cb.onProgress(parsed, parsed, "Load completed");
            log.info("load.completed kind={} lines={} records={} durationMs={}",
                    kind.name(), parsed, collection.size(), duration.toMillis());
            return collection;
        }
    }
}
