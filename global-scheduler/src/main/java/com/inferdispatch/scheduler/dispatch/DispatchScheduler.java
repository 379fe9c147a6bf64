package com.inferdispatch.scheduler.dispatch;

import com.inferdispatch.core.metrics.MetricsNames;
import com.inferdispatch.core.metrics.MetricsTags;
import com.inferdispatch.core.model.DispatchStatistics;
import com.inferdispatch.core.model.InstanceLoadRecord;
import com.inferdispatch.scheduler.dispatch.policy.DispatchPolicy;
import com.inferdispatch.scheduler.dispatch.policy.DispatchPolicyRegistry;
import com.inferdispatch.scheduler.dispatch.policy.RankingMetric;
import com.inferdispatch.scheduler.stats.DispatchStatsSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides which serving instance receives each new request.
 * <p>
 * Tracks every known instance and a bounded subset of them that is eligible for new requests.
 * Decode-only instances are tracked but never eligible. When an eligible instance leaves and the
 * fleet is large enough to fill the capacity, an ineligible instance is promoted in its place.
 * Load snapshots come from the external load calculator and are pushed in through
 * {@link #updateInstanceInfos}; the scheduler never pulls them.
 * </p>
 * <p>
 * Not thread-safe: all operations must run on a single thread, one at a time.
 * Wrap in {@link ReactiveDispatchScheduler} to share between callers.
 * </p>
 */
public class DispatchScheduler implements IDispatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    /**
     * Statistics are emitted on every n-th dispatched request.
     */
    static final int STATS_INTERVAL = 100;

    private final DispatchPolicy dispatchPolicy;
    private final int numDispatchInstances;
    private final DispatchStatsSink statsSink;
    private final Random random;
    private final Predicate<String> decodeOnly;
    private final Counter dispatchCounter;

    private final Set<String> instanceIds = new LinkedHashSet<>();
    private final Set<String> dispatchInstanceIds = new LinkedHashSet<>();
    private final Map<String, Long> instanceNumRequests = new LinkedHashMap<>();

    private Map<String, InstanceLoadRecord> instanceInfos = Collections.emptyMap();
    private List<InstanceLoadRecord> sortedInstanceInfos = Collections.emptyList();
    private long numRequests;

    /**
     * @param dispatchPolicy       Registry name of the dispatch policy
     * @param numDispatchInstances Capacity of the eligible set; zero or less means unbounded
     * @param statsSink            Receiver of periodic dispatch statistics
     * @param random               Random source for queue tie-breaks and backfill choice
     * @param decodeOnly           Tells whether an instance id denotes a decode-only instance
     * @param meterRegistry        Registry for membership gauges and the dispatch counter
     * @throws UnknownPolicyException if the policy name is not registered
     */
    public DispatchScheduler(String dispatchPolicy,
                             int numDispatchInstances,
                             DispatchStatsSink statsSink,
                             Random random,
                             Predicate<String> decodeOnly,
                             MeterRegistry meterRegistry) {
        this.dispatchPolicy = DispatchPolicyRegistry.create(dispatchPolicy, random);
        this.numDispatchInstances = numDispatchInstances;
        this.statsSink = statsSink;
        this.random = random;
        this.decodeOnly = decodeOnly;

        // Metrics
        Gauge.builder(MetricsNames.DISPATCH_INSTANCES, this, s -> s.instanceIds.size())
            .register(meterRegistry);
        Gauge.builder(MetricsNames.DISPATCH_ELIGIBLE_INSTANCES, this, s -> s.dispatchInstanceIds.size())
            .register(meterRegistry);
        this.dispatchCounter = Counter.builder(MetricsNames.DISPATCH_DECISIONS_TOTAL)
            .tag(MetricsTags.POLICY, this.dispatchPolicy.name())
            .register(meterRegistry);

        log.info("Dispatch scheduler created: policy={}, numDispatchInstances={}",
            this.dispatchPolicy.name(), isCapacityEnforced() ? numDispatchInstances : "unbounded");
    }

    @Override
    public void updateInstanceInfos(Map<String, InstanceLoadRecord> instanceInfos) {
        this.instanceInfos = new LinkedHashMap<>(instanceInfos);
    }

    @Override
    public void addInstance(String instanceId) {
        instanceIds.add(instanceId);

        if (decodeOnly.test(instanceId)) {
            log.info("Instance {} added as decode-only, not dispatchable", instanceId);
            return;
        }
        if (dispatchInstanceIds.contains(instanceId)) {
            log.debug("Instance {} is already dispatchable", instanceId);
            return;
        }
        if (!isCapacityEnforced() || dispatchInstanceIds.size() < numDispatchInstances) {
            makeDispatchable(instanceId);
            log.info("Instance {} added, dispatchable ({}/{})", instanceId, dispatchInstanceIds.size(), instanceIds.size());
        } else {
            log.info("Instance {} added, dispatch capacity {} reached", instanceId, numDispatchInstances);
        }
    }

    @Override
    public void removeInstance(String instanceId) {
        if (!instanceIds.remove(instanceId)) {
            throw new InstanceNotFoundException(instanceId);
        }

        if (instanceNumRequests.remove(instanceId) == null) {
            log.warn("Instance {} has no dispatch counter", instanceId);
        }

        if (dispatchInstanceIds.remove(instanceId)) {
            if (isCapacityEnforced() && instanceIds.size() >= numDispatchInstances) {
                backfill(instanceId);
            }
        }
        log.info("Instance {} removed ({} dispatchable of {})", instanceId, dispatchInstanceIds.size(), instanceIds.size());
    }

    @Override
    public String dispatch() {
        numRequests++;
        if (dispatchInstanceIds.isEmpty()) {
            throw new NoAvailableInstanceException(
                "No dispatchable instance among " + instanceIds.size() + " registered");
        }

        RankingMetric rankingMetric = dispatchPolicy.rankingMetric();
        if (rankingMetric.ranks()) {
            sortInstanceInfos(rankingMetric);
        }
        String instanceId = dispatchPolicy.select(
            Collections.unmodifiableMap(instanceNumRequests), sortedInstanceInfos);

        instanceNumRequests.merge(instanceId, 1L, Long::sum);
        dispatchCounter.increment();

        if (numRequests % STATS_INTERVAL == 0) {
            emitStatistics();
        }
        return instanceId;
    }

    @Override
    public RegistryView getRegistryView() {
        return new RegistryView(
            dispatchPolicy.name(),
            Collections.unmodifiableSet(new LinkedHashSet<>(instanceIds)),
            Collections.unmodifiableSet(new LinkedHashSet<>(dispatchInstanceIds)),
            Collections.unmodifiableMap(new LinkedHashMap<>(instanceNumRequests)),
            numRequests
        );
    }

    @Override
    public DispatchStatistics getStatistics() {
        return DispatchStatistics.builder()
            .totalRequests(numRequests)
            .instanceRequests(Collections.unmodifiableMap(new LinkedHashMap<>(instanceNumRequests)))
            .capturedAt(Instant.now())
            .build();
    }

    private boolean isCapacityEnforced() {
        return numDispatchInstances > 0;
    }

    private void makeDispatchable(String instanceId) {
        dispatchInstanceIds.add(instanceId);
        instanceNumRequests.put(instanceId, 0L);
    }

    /**
     * Promotes one random non-decode, non-dispatchable instance into the slot freed by {@code removedId}.
     * The promoted instance starts with a zero counter so counting policies can select it.
     */
    private void backfill(String removedId) {
        List<String> candidates = new ArrayList<>();
        for (String id : instanceIds) {
            if (!dispatchInstanceIds.contains(id) && !decodeOnly.test(id)) {
                candidates.add(id);
            }
        }
        if (candidates.isEmpty()) {
            log.info("No instance available to replace {}, dispatch slot left open", removedId);
            return;
        }
        String replacement = candidates.get(random.nextInt(candidates.size()));
        makeDispatchable(replacement);
        log.info("Instance {} made dispatchable in place of {}", replacement, removedId);
    }

    private void sortInstanceInfos(RankingMetric rankingMetric) {
        sortedInstanceInfos = instanceInfos.values().stream()
            .filter(info -> dispatchInstanceIds.contains(info.getInstanceId()))
            .sorted(rankingMetric.order())
            .collect(Collectors.toList());
    }

    private void emitStatistics() {
        try {
            statsSink.record(getStatistics());
        } catch (RuntimeException e) {
            log.warn("Failed to record dispatch statistics at {} requests", numRequests, e);
        }
    }
}
