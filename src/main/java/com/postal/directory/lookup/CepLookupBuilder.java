package com.postal.directory.lookup;

import com.postal.directory.bulk.RecordCollection;
import com.postal.directory.core.model.Address;
import com.postal.directory.core.model.AddressId;
import com.postal.directory.core.model.BigUser;
import com.postal.directory.core.model.BigUserId;
import com.postal.directory.core.model.Cpc;
import com.postal.directory.core.model.CpcId;
import com.postal.directory.core.model.Locality;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.Neighborhood;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.OperationalUnit;
import com.postal.directory.core.model.OperationalUnitId;
import com.postal.directory.logging.LogContext;
import com.postal.directory.metrics.MetricsService;
import com.postal.directory.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates the six eDNE collections and merges them into a {@link CepLookup}.
 *
 * <p>Collections can be added in any order and several times (for instance one
 * street file per state); records with the same identifier replace each other.
 * {@link #build()} then runs five stages, each overwriting earlier entries
 * with the same postal code:</p>
 * <ol>
 *   <li>uncoded localities (their general postal code)</li>
 *   <li>streets</li>
 *   <li>big users</li>
 *   <li>operational units</li>
 *   <li>community postal boxes</li>
 * </ol>
 *
 * <p>Foreign keys are looked up by id; an unknown locality yields an empty
 * locality name and an unknown neighborhood yields no neighborhood. When two
 * records of the same kind share a postal code, which one survives is not
 * specified.</p>
 *
 * <p>A builder is single use and not thread-safe.</p>
 */
public class CepLookupBuilder {
    private static final Logger log = LoggerFactory.getLogger(CepLookupBuilder.class);

    private final MetricsService metricsService;

    private final Map<LocalityId, Locality> localities = new LinkedHashMap<>();
    private final Map<NeighborhoodId, Neighborhood> neighborhoods = new LinkedHashMap<>();
    private final Map<AddressId, Address> addresses = new LinkedHashMap<>();
    private final Map<BigUserId, BigUser> bigUsers = new LinkedHashMap<>();
    private final Map<OperationalUnitId, OperationalUnit> operationalUnits = new LinkedHashMap<>();
    private final Map<CpcId, Cpc> cpcs = new LinkedHashMap<>();

    private boolean built;

    public CepLookupBuilder() {
        this(null);
    }

    public CepLookupBuilder(MetricsService metricsService) {
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public CepLookupBuilder addLocalities(RecordCollection<LocalityId, Locality> collection) {
        accumulate(collection, localities);
        return this;
    }

    public CepLookupBuilder addNeighborhoods(RecordCollection<NeighborhoodId, Neighborhood> collection) {
        accumulate(collection, neighborhoods);
        return this;
    }

    public CepLookupBuilder addAddresses(RecordCollection<AddressId, Address> collection) {
        accumulate(collection, addresses);
        return this;
    }

    public CepLookupBuilder addBigUsers(RecordCollection<BigUserId, BigUser> collection) {
        accumulate(collection, bigUsers);
        return this;
    }

    public CepLookupBuilder addOperationalUnits(RecordCollection<OperationalUnitId, OperationalUnit> collection) {
        accumulate(collection, operationalUnits);
        return this;
    }

    public CepLookupBuilder addCpcs(RecordCollection<CpcId, Cpc> collection) {
        accumulate(collection, cpcs);
        return this;
    }

    /**
     * Runs the merge and releases the accumulated records.
     *
     * @throws IllegalStateException if the builder was already built
     */
    public CepLookup build() {
        checkNotBuilt();
        built = true;

        try (LogContext ctx = LogContext.forBuild(LogContext.generateCorrelationId())) {
            long start = System.nanoTime();
            Map<String, CepInfo> entries = new LinkedHashMap<>(
                    localities.size() + addresses.size() + bigUsers.size()
                            + operationalUnits.size() + cpcs.size());
            Map<CepType, Long> emitted = new EnumMap<>(CepType.class);

            emitted.put(CepType.UNCODED_LOCALITY, mergeUncodedLocalities(entries));
            emitted.put(CepType.STREET, mergeStreets(entries));
            emitted.put(CepType.BIG_USER, mergeBigUsers(entries));
            emitted.put(CepType.OPERATIONAL_UNIT, mergeOperationalUnits(entries));
            emitted.put(CepType.CPC, mergeCpcs(entries));
            emitted.forEach((type, count) ->
                    log.info("build.stage type={} emitted={}", type, count));

            CepLookup lookup = new CepLookup(entries);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordBuildDuration(duration);
            lookup.countByType().forEach(metricsService::recordLookupEntries);
            log.info("build.completed entries={} durationMs={}", lookup.size(), duration.toMillis());

            release();
            return lookup;
        }
    }

    private long mergeUncodedLocalities(Map<String, CepInfo> entries) {
        long emitted = 0;
        for (Locality locality : localities.values()) {
            if (locality.postalCode().isEmpty()) {
                continue;
            }
            // one level only: the parent's own parent is never consulted
            Optional<String> parentName = locality.parentId()
                    .map(localities::get)
                    .map(Locality::name);
            put(entries, new CepInfo(
                    locality.postalCode().get(),
                    locality.state(),
                    locality.name(),
                    parentName,
                    "",
                    Optional.empty(),
                    CepType.UNCODED_LOCALITY));
            emitted++;
        }
        return emitted;
    }

    private long mergeStreets(Map<String, CepInfo> entries) {
        for (Address address : addresses.values()) {
            put(entries, new CepInfo(
                    address.postalCode(),
                    address.state(),
                    localityName(address.localityId()),
                    neighborhoodName(address.startNeighborhoodId()),
                    address.displayName(),
                    address.complement(),
                    CepType.STREET));
        }
        return addresses.size();
    }

    private long mergeBigUsers(Map<String, CepInfo> entries) {
        for (BigUser user : bigUsers.values()) {
            put(entries, new CepInfo(
                    user.postalCode(),
                    user.state(),
                    localityName(user.localityId()),
                    neighborhoodName(user.neighborhoodId()),
                    user.address(),
                    Optional.of(user.name()),
                    CepType.BIG_USER));
        }
        return bigUsers.size();
    }

    private long mergeOperationalUnits(Map<String, CepInfo> entries) {
        for (OperationalUnit unit : operationalUnits.values()) {
            put(entries, new CepInfo(
                    unit.postalCode(),
                    unit.state(),
                    localityName(unit.localityId()),
                    neighborhoodName(unit.neighborhoodId()),
                    unit.address(),
                    Optional.of(unit.name()),
                    CepType.OPERATIONAL_UNIT));
        }
        return operationalUnits.size();
    }

    private long mergeCpcs(Map<String, CepInfo> entries) {
        for (Cpc cpc : cpcs.values()) {
            put(entries, new CepInfo(
                    cpc.postalCode(),
                    cpc.state(),
                    localityName(cpc.localityId()),
                    Optional.empty(),
                    cpc.address(),
                    Optional.of(cpc.name()),
                    CepType.CPC));
        }
        return cpcs.size();
    }

    private void put(Map<String, CepInfo> entries, CepInfo info) {
        CepInfo replaced = entries.put(info.postalCode(), info);
        if (replaced != null && log.isTraceEnabled()) {
            log.trace("build.overwrite cep={} previous={} current={}",
                    info.postalCode(), replaced.type(), info.type());
        }
    }

    private String localityName(LocalityId id) {
        Locality locality = localities.get(id);
        return locality != null ? locality.name() : "";
    }

    private Optional<String> neighborhoodName(NeighborhoodId id) {
        return Optional.ofNullable(neighborhoods.get(id)).map(Neighborhood::name);
    }

    private <I, R> void accumulate(RecordCollection<I, R> collection, Map<I, R> target) {
        checkNotBuilt();
        if (collection == null) {
            return;
        }
        for (R record : collection) {
            target.put(collection.kind().idOf(record), record);
        }
        log.debug("build.accumulated kind={} added={} total={}",
                collection.kind().name(), collection.size(), target.size());
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("CepLookupBuilder has already been built");
        }
    }

    private void release() {
        localities.clear();
        neighborhoods.clear();
        addresses.clear();
        bigUsers.clear();
        operationalUnits.clear();
        cpcs.clear();
    }
}
