package com.postal.directory.parser;

import com.postal.directory.core.model.SourceText;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Decoded content of one eDNE file.
 *
 * <p>Lines end with {@code \n} or {@code \r\n}. Blank lines are skipped but
 * still counted, so {@link SourceLine#lineNumber()} always points at the
 * physical line.</p>
 */
public final class RecordSource {

    private final String content;

    private RecordSource(String content) {
        this.content = Objects.requireNonNull(content, "content is required");
    }

    /**
     * Creates a source from raw ISO-8859-1 file bytes.
     */
    public static RecordSource fromLatin1(byte[] bytes) {
        return new RecordSource(Latin1Decoder.decode(bytes));
    }

    /**
     * Creates a source from text that is already decoded.
     */
    public static RecordSource fromText(String content) {
        return new RecordSource(content);
    }

    /**
     * Returns a lazy stream over the non-blank lines. Each call starts a new
     * pass over the content.
     */
    public Stream<SourceLine> lines() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(new LineIterator(content),
                        Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public String content() {
        return content;
    }

    private static final class LineIterator implements Iterator<SourceLine> {
        private final String content;
        private int position;
        private long lineNumber;
        private SourceLine next;

        LineIterator(String content) {
            this.content = content;
        }

        @Override
        public boolean hasNext() {
            while (next == null && position < content.length()) {
                int end = content.indexOf('\n', position);
                int lineEnd = end < 0 ? content.length() : end;
                String text = content.substring(position, lineEnd);
                if (end >= 0 && text.endsWith("\r")) {
                    text = text.substring(0, text.length() - 1);
                }
                position = end < 0 ? content.length() : end + 1;
                lineNumber++;
                if (!SourceText.isBlank(text)) {
                    next = new SourceLine(lineNumber, text);
                }
            }
            return next != null;
        }

        @Override
        public SourceLine next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            SourceLine line = next;
            next = null;
            return line;
        }
    }
}
