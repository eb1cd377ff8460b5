package com.postal.directory.bulk;

import com.postal.directory.parser.FieldSplitter;

/**
 * Options for loading eDNE sources.
 */
public class LoaderOptions {

    private static final int DEFAULT_PROGRESS_INTERVAL = 10_000;

    private final char separator;
    private final int progressInterval;

    private LoaderOptions(Builder builder) {
        this.separator = builder.separator;
        this.progressInterval = builder.progressInterval;
    }

    /**
     * Field separator; {@code '@'} in every published eDNE release.
     */
    public char getSeparator() {
        return separator;
    }

    /**
     * Number of records between two progress reports.
     */
    public int getProgressInterval() {
        return progressInterval;
    }

    public static LoaderOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private char separator = FieldSplitter.DEFAULT_SEPARATOR;
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        public Builder separator(char separator) {
            if (separator == '\n' || separator == '\r') {
                throw new IllegalArgumentException("separator cannot be a line terminator");
            }
            this.separator = separator;
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval <= 0) {
                throw new IllegalArgumentException("progressInterval must be > 0");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public LoaderOptions build() {
            return new LoaderOptions(this);
        }
    }

    @Override
    public String toString() {
        return "LoaderOptions{separator='" + separator + "', progressInterval=" + progressInterval + '}';
    }
}
