package com.postal.directory.bulk;

import com.postal.directory.parser.RecordKind;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Records of one eDNE kind keyed by their own identifier.
 *
 * <p>Inserting a record whose identifier is already present replaces the
 * earlier one. Iteration order is not part of the contract.</p>
 *
 * @param <I> identifier type
 * @param <R> record type
 */
public class RecordCollection<I, R> implements Iterable<R> {

    private final RecordKind<I, R> kind;
    private final Map<I, R> records;

    public RecordCollection(RecordKind<I, R> kind) {
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.records = new LinkedHashMap<>();
    }

    public RecordKind<I, R> kind() {
        return kind;
    }

    /**
     * Inserts a record, returning the one it replaced.
     */
    public Optional<R> insert(R record) {
        Objects.requireNonNull(record, "record is required");
        return Optional.ofNullable(records.put(kind.idOf(record), record));
    }

    public Optional<R> get(I id) {
        return Optional.ofNullable(records.get(id));
    }

    public boolean contains(I id) {
        return records.containsKey(id);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Collection<R> values() {
        return Collections.unmodifiableCollection(records.values());
    }

    public Set<I> ids() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public Stream<R> stream() {
        return records.values().stream();
    }

    @Override
    public Iterator<R> iterator() {
        return values().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordCollection<?, ?> that = (RecordCollection<?, ?>) o;
        return kind.getClass() == that.kind.getClass() && records.equals(that.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind.getClass(), records);
    }

    @Override
    public String toString() {
        return "RecordCollection{kind=" + kind.name() + ", size=" + records.size() + '}';
    }
}
