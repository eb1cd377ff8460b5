package com.postal.directory.lookup;

import com.postal.directory.core.model.StateCode;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only postal code index produced by {@link CepLookupBuilder}.
 *
 * <p>Keys are matched exactly; no normalization or fuzzy matching is applied.</p>
 */
public class CepLookup {

    private final Map<String, CepInfo> entries;

    CepLookup(Map<String, CepInfo> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public Optional<CepInfo> lookup(String postalCode) {
        return Optional.ofNullable(entries.get(postalCode));
    }

    public List<CepInfo> byState(StateCode state) {
        return entries.values().stream()
                .filter(info -> info.state() == state)
                .collect(Collectors.toList());
    }

    public List<CepInfo> byLocalityName(String locality) {
        return entries.values().stream()
                .filter(info -> Objects.equals(info.locality(), locality))
                .collect(Collectors.toList());
    }

    /**
     * Returns the number of entries per type; types without entries are absent.
     */
    public Map<CepType, Long> countByType() {
        return entries.values().stream()
                .collect(Collectors.groupingBy(CepInfo::type, () -> new EnumMap<>(CepType.class),
                        Collectors.counting()));
    }

    /**
     * Returns the number of entries per state, in state declaration order.
     */
    public Map<StateCode, Long> countByState() {
        return entries.values().stream()
                .collect(Collectors.groupingBy(CepInfo::state, () -> new EnumMap<>(StateCode.class),
                        Collectors.counting()));
    }

    public Collection<CepInfo> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "CepLookup{size=" + entries.size() + '}';
    }
}
