package com.inferdispatch.scheduler.dispatch;

import com.inferdispatch.core.metrics.MetricsNames;
import com.inferdispatch.core.model.DispatchStatistics;
import com.inferdispatch.core.model.InstanceIds;
import com.inferdispatch.core.model.InstanceLoadRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the instance-eligibility state machine and dispatch bookkeeping.
 */
class DispatchSchedulerTest {

    private SimpleMeterRegistry meterRegistry;
    private RecordingStatsSink statsSink;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        statsSink = new RecordingStatsSink();
    }

    private DispatchScheduler newScheduler(String policy, int numDispatchInstances) {
        return new DispatchScheduler(policy, numDispatchInstances, statsSink, new Random(7),
            InstanceIds::isDecodeOnly, meterRegistry);
    }

    // ========== Membership ==========

    @Test
    @DisplayName("Eligible set never exceeds capacity and fills up to min(capacity, non-decode instances)")
    void testCapacityInvariant() {
        DispatchScheduler scheduler = newScheduler("balanced", 3);

        for (int i = 0; i < 5; i++) {
            scheduler.addInstance("instance-" + i);
            assertTrue(scheduler.getRegistryView().dispatchInstanceIds().size() <= 3);
        }
        scheduler.addInstance("instance-decode-0");

        RegistryView view = scheduler.getRegistryView();
        assertEquals(6, view.instanceIds().size());
        assertEquals(Set.of("instance-0", "instance-1", "instance-2"), view.dispatchInstanceIds());
    }

    @Test
    @DisplayName("Random add/remove churn keeps the eligible set bounded and saturated")
    void testCapacityInvariantUnderChurn() {
        int capacity = 3;
        DispatchScheduler scheduler = newScheduler("balanced", capacity);
        Random churn = new Random(2024);
        List<String> live = new ArrayList<>();
        int nextId = 0;

        for (int step = 0; step < 500; step++) {
            if (live.isEmpty() || churn.nextDouble() < 0.55) {
                String id = churn.nextInt(5) == 0 ? "instance-decode-" + nextId : "instance-" + nextId;
                nextId++;
                scheduler.addInstance(id);
                live.add(id);
            } else {
                String id = live.remove(churn.nextInt(live.size()));
                scheduler.removeInstance(id);
            }

            RegistryView view = scheduler.getRegistryView();
            long nonDecode = live.stream().filter(id -> !InstanceIds.isDecodeOnly(id)).count();
            assertEquals(Math.min(capacity, nonDecode), view.dispatchInstanceIds().size(), "step " + step);
            assertTrue(view.instanceIds().containsAll(view.dispatchInstanceIds()));
            assertEquals(view.dispatchInstanceIds(), view.dispatchCounts().keySet());
        }
    }

    @Test
    @DisplayName("Unbounded capacity makes every non-decode instance eligible")
    void testUnboundedCapacity() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);

        for (int i = 0; i < 10; i++) {
            scheduler.addInstance("instance-" + i);
        }

        assertEquals(10, scheduler.getRegistryView().dispatchInstanceIds().size());
    }

    @Test
    @DisplayName("Decode-only instances are registered but never eligible nor counted")
    void testDecodeOnlyExclusion() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);
        scheduler.addInstance("instance-decode-0");
        scheduler.addInstance("instance-0");

        RegistryView view = scheduler.getRegistryView();
        assertTrue(view.instanceIds().contains("instance-decode-0"));
        assertFalse(view.dispatchInstanceIds().contains("instance-decode-0"));
        assertFalse(view.dispatchCounts().containsKey("instance-decode-0"));

        for (int i = 0; i < 10; i++) {
            assertEquals("instance-0", scheduler.dispatch());
        }
    }

    @Test
    @DisplayName("Custom decode-only predicate is honoured")
    void testInjectedDecodePredicate() {
        DispatchScheduler scheduler = new DispatchScheduler("balanced", 0, statsSink, new Random(1),
            id -> id.startsWith("d-"), meterRegistry);
        scheduler.addInstance("d-1");
        scheduler.addInstance("p-1");

        assertEquals(Set.of("p-1"), scheduler.getRegistryView().dispatchInstanceIds());
    }

    @Test
    @DisplayName("Re-adding an eligible instance keeps its dispatch counter")
    void testDuplicateAdd_KeepsCounter() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);
        scheduler.addInstance("a");
        scheduler.dispatch();
        scheduler.dispatch();

        scheduler.addInstance("a");

        assertEquals(2L, scheduler.getRegistryView().dispatchCounts().get("a"));
    }

    @Test
    @DisplayName("Removing an eligible instance backfills the freed slot with an ineligible one")
    void testRemovalBackfill() {
        DispatchScheduler scheduler = newScheduler("balanced", 2);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.addInstance("c");
        assertEquals(Set.of("a", "b"), scheduler.getRegistryView().dispatchInstanceIds());

        scheduler.removeInstance("a");

        RegistryView view = scheduler.getRegistryView();
        assertEquals(Set.of("b", "c"), view.dispatchInstanceIds());
        assertEquals(Set.of("b", "c"), view.instanceIds());
    }

    @Test
    @DisplayName("Backfilled instance gets a zero counter (deliberate fix of the missing-counter gap)")
    void testBackfilledInstance_CountedAndSelectable() {
        DispatchScheduler scheduler = newScheduler("balanced", 2);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.addInstance("c");
        for (int i = 0; i < 4; i++) {
            scheduler.dispatch();
        }

        scheduler.removeInstance("a");

        Map<String, Long> counts = scheduler.getRegistryView().dispatchCounts();
        assertEquals(0L, counts.get("c"));
        assertEquals(2L, counts.get("b"));
        assertEquals("c", scheduler.dispatch());
    }

    @Test
    @DisplayName("Decode-only instances are never backfilled")
    void testBackfill_SkipsDecodeOnly() {
        DispatchScheduler scheduler = newScheduler("balanced", 1);
        scheduler.addInstance("a");
        scheduler.addInstance("instance-decode-0");
        scheduler.addInstance("instance-decode-1");

        scheduler.removeInstance("a");

        assertTrue(scheduler.getRegistryView().dispatchInstanceIds().isEmpty());
        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);

        scheduler.addInstance("b");
        assertEquals("b", scheduler.dispatch());
    }

    @Test
    @DisplayName("Removing an ineligible instance does not change the eligible set")
    void testRemoveIneligible_NoBackfill() {
        DispatchScheduler scheduler = newScheduler("balanced", 2);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.addInstance("c");
        scheduler.addInstance("instance-decode-0");

        scheduler.removeInstance("c");
        scheduler.removeInstance("instance-decode-0");

        RegistryView view = scheduler.getRegistryView();
        assertEquals(Set.of("a", "b"), view.dispatchInstanceIds());
        assertEquals(Set.of("a", "b"), view.instanceIds());
    }

    @Test
    @DisplayName("Removing an unknown instance fails and leaves state untouched")
    void testRemoveUnknown() {
        DispatchScheduler scheduler = newScheduler("balanced", 2);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.addInstance("c");
        scheduler.dispatch();
        RegistryView before = scheduler.getRegistryView();

        InstanceNotFoundException err = assertThrows(InstanceNotFoundException.class,
            () -> scheduler.removeInstance("ghost"));

        assertEquals("ghost", err.getInstanceId());
        assertEquals(before, scheduler.getRegistryView());
    }

    @Test
    @DisplayName("Removing the same instance twice fails the second time")
    void testRemoveTwice() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);
        scheduler.addInstance("a");
        scheduler.removeInstance("a");

        assertThrows(InstanceNotFoundException.class, () -> scheduler.removeInstance("a"));
    }

    // ========== Dispatch ==========

    @Test
    @DisplayName("Dispatch without eligible instances fails")
    void testEmptyDispatch() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);

        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);

        scheduler.addInstance("instance-decode-0");
        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);
        assertTrue(scheduler.getRegistryView().dispatchCounts().isEmpty());
    }

    @Test
    @DisplayName("Every dispatch call counts toward the request total, failed ones included")
    void testFailedDispatch_CountsTowardTotal() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);

        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);
        assertEquals(1, scheduler.getRegistryView().totalRequests());

        scheduler.addInstance("a");
        assertEquals("a", scheduler.dispatch());

        RegistryView view = scheduler.getRegistryView();
        assertEquals(2, view.totalRequests());
        assertEquals(Map.of("a", 1L), view.dispatchCounts());
        assertEquals(1.0, meterRegistry.get(MetricsNames.DISPATCH_DECISIONS_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Ranked policy without load records for eligible instances fails")
    void testRankedDispatch_WithoutSnapshot() {
        DispatchScheduler scheduler = newScheduler("load", 0);
        scheduler.addInstance("a");

        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);

        scheduler.updateInstanceInfos(snapshot(record("stale", 0.0, 0)));
        assertThrows(NoAvailableInstanceException.class, scheduler::dispatch);
    }

    @Test
    @DisplayName("Balanced keeps counts within one of each other")
    void testBalancedFairness() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);
        for (String id : List.of("a", "b", "c", "d", "e")) {
            scheduler.addInstance(id);
        }

        for (int k = 1; k <= 103; k++) {
            scheduler.dispatch();
            Map<String, Long> counts = scheduler.getRegistryView().dispatchCounts();
            long max = counts.values().stream().mapToLong(Long::longValue).max().orElseThrow();
            long min = counts.values().stream().mapToLong(Long::longValue).min().orElseThrow();
            assertTrue(max - min <= 1, "after " + k + " dispatches: " + counts);
        }
    }

    @Test
    @DisplayName("Round robin cycles in lexicographic order regardless of registration order")
    void testRoundRobinDeterminism() {
        DispatchScheduler scheduler = newScheduler("rr", 0);
        scheduler.addInstance("b");
        scheduler.addInstance("a");
        scheduler.addInstance("c");

        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            picks.add(scheduler.dispatch());
        }

        assertEquals(List.of("a", "b", "c", "a"), picks);
    }

    @Test
    @DisplayName("Flood concentrates every request on one instance")
    void testFlood() {
        DispatchScheduler scheduler = newScheduler("flood", 0);
        scheduler.addInstance("a");
        scheduler.addInstance("b");

        for (int i = 0; i < 20; i++) {
            assertEquals("a", scheduler.dispatch());
        }
        assertEquals(0L, scheduler.getRegistryView().dispatchCounts().get("b"));
    }

    @Test
    @DisplayName("Load policy picks the strictly least loaded eligible instance")
    void testLoadSelection() {
        DispatchScheduler scheduler = newScheduler("load", 2);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.addInstance("c");  // not eligible

        scheduler.updateInstanceInfos(snapshot(
            record("a", 4.0, 0),
            record("b", -1.5, 9),
            record("c", -10.0, 0)
        ));
        assertEquals("b", scheduler.dispatch());

        scheduler.updateInstanceInfos(snapshot(
            record("a", -3.0, 0),
            record("b", -1.5, 0)
        ));
        assertEquals("a", scheduler.dispatch());
    }

    @Test
    @DisplayName("Load policy ties keep snapshot order")
    void testLoadTie_SnapshotOrder() {
        DispatchScheduler scheduler = newScheduler("load", 0);
        scheduler.addInstance("a");
        scheduler.addInstance("b");

        scheduler.updateInstanceInfos(snapshot(record("b", 1.0, 0), record("a", 1.0, 0)));

        assertEquals("b", scheduler.dispatch());
    }

    @Test
    @DisplayName("Queue policy only picks among instances with the shortest queue")
    void testQueueSelection() {
        DispatchScheduler scheduler = newScheduler("queue", 0);
        for (String id : List.of("a", "b", "c")) {
            scheduler.addInstance(id);
        }
        scheduler.updateInstanceInfos(snapshot(
            record("a", 0.0, 5),
            record("b", 0.0, 1),
            record("c", 0.0, 1)
        ));

        for (int i = 0; i < 50; i++) {
            assertNotEquals("a", scheduler.dispatch());
        }
    }

    @Test
    @DisplayName("Snapshot replacement is wholesale")
    void testSnapshotReplacedWholesale() {
        DispatchScheduler scheduler = newScheduler("load", 0);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.updateInstanceInfos(snapshot(record("a", 0.0, 0), record("b", 5.0, 0)));
        assertEquals("a", scheduler.dispatch());

        scheduler.updateInstanceInfos(snapshot(record("b", 5.0, 0)));

        assertEquals("b", scheduler.dispatch());
    }

    // ========== Statistics and metrics ==========

    @Test
    @DisplayName("Statistics are emitted on every 100th dispatch")
    void testStatisticsEmission() {
        DispatchScheduler scheduler = newScheduler("balanced", 0);
        scheduler.addInstance("a");
        scheduler.addInstance("b");

        for (int i = 0; i < 99; i++) {
            scheduler.dispatch();
        }
        assertTrue(statsSink.recorded.isEmpty());

        scheduler.dispatch();
        assertEquals(1, statsSink.recorded.size());
        DispatchStatistics stats = statsSink.recorded.get(0);
        assertEquals(100, stats.getTotalRequests());
        assertEquals(Map.of("a", 50L, "b", 50L), stats.getInstanceRequests());

        for (int i = 0; i < 100; i++) {
            scheduler.dispatch();
        }
        assertEquals(2, statsSink.recorded.size());
        assertEquals(200, statsSink.recorded.get(1).getTotalRequests());
    }

    @Test
    @DisplayName("A failing statistics sink never fails dispatch")
    void testFailingStatsSink() {
        DispatchScheduler scheduler = new DispatchScheduler("balanced", 0,
            stats -> {
                throw new IllegalStateException("sink down");
            },
            new Random(1), InstanceIds::isDecodeOnly, meterRegistry);
        scheduler.addInstance("a");

        for (int i = 0; i < 100; i++) {
            assertEquals("a", scheduler.dispatch());
        }
        assertEquals(100, scheduler.getStatistics().getTotalRequests());
    }

    @Test
    @DisplayName("Membership gauges and dispatch counter are registered")
    void testMeters() {
        DispatchScheduler scheduler = newScheduler("rr", 1);
        scheduler.addInstance("a");
        scheduler.addInstance("b");
        scheduler.dispatch();
        scheduler.dispatch();

        assertEquals(2.0, meterRegistry.get(MetricsNames.DISPATCH_INSTANCES).gauge().value());
        assertEquals(1.0, meterRegistry.get(MetricsNames.DISPATCH_ELIGIBLE_INSTANCES).gauge().value());
        assertEquals(2.0, meterRegistry.get(MetricsNames.DISPATCH_DECISIONS_TOTAL).tag("policy", "rr")
            .counter().count());
    }

    @Test
    @DisplayName("Unknown policy fails at construction")
    void testUnknownPolicy() {
        UnknownPolicyException err = assertThrows(UnknownPolicyException.class,
            () -> newScheduler("random", 0));
        assertEquals("random", err.getPolicyName());
    }

    private static InstanceLoadRecord record(String id, double loadScore, int queueDepth) {
        return InstanceLoadRecord.builder()
            .instanceId(id)
            .loadScore(loadScore)
            .queueDepth(queueDepth)
            .build();
    }

    private static Map<String, InstanceLoadRecord> snapshot(InstanceLoadRecord... records) {
        Map<String, InstanceLoadRecord> snapshot = new LinkedHashMap<>();
        for (InstanceLoadRecord record : records) {
            snapshot.put(record.getInstanceId(), record);
        }
        return snapshot;
    }

    /**
     * Test stub collecting every emitted statistics snapshot.
     */
    private static class RecordingStatsSink implements com.inferdispatch.scheduler.stats.DispatchStatsSink {
        final List<DispatchStatistics> recorded = new ArrayList<>();

        @Override
        public void record(DispatchStatistics statistics) {
            recorded.add(statistics);
        }
    }
}
