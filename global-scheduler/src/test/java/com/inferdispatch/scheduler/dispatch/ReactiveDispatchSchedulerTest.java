package com.inferdispatch.scheduler.dispatch;

import com.inferdispatch.core.model.InstanceIds;
import com.inferdispatch.core.model.InstanceLoadRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReactiveDispatchSchedulerTest {

    private ReactiveDispatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        DispatchScheduler delegate = new DispatchScheduler("balanced", 2, stats -> {
        }, new Random(5), InstanceIds::isDecodeOnly, new SimpleMeterRegistry());
        scheduler = new ReactiveDispatchScheduler(delegate);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void testOperationsApplyInOrder() {
        StepVerifier.create(scheduler.addInstance("a")
                .then(scheduler.addInstance("b"))
                .then(scheduler.addInstance("c"))
                .then(scheduler.removeInstance("a"))
                .then(scheduler.registryView()))
            .assertNext(view -> {
                assertEquals(Set.of("b", "c"), view.dispatchInstanceIds());
                assertEquals("balanced", view.policy());
            })
            .verifyComplete();
    }

    @Test
    void testTypedErrorsPropagate() {
        StepVerifier.create(scheduler.removeInstance("ghost"))
            .expectError(InstanceNotFoundException.class)
            .verify(Duration.ofSeconds(5));

        StepVerifier.create(scheduler.dispatch())
            .expectError(NoAvailableInstanceException.class)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void testDispatchAndStatistics() {
        InstanceLoadRecord record = InstanceLoadRecord.builder().instanceId("a").loadScore(1.0).queueDepth(0).build();

        StepVerifier.create(scheduler.addInstance("a")
                .then(scheduler.updateInstanceInfos(Map.of("a", record)))
                .then(scheduler.dispatch()))
            .expectNext("a")
            .verifyComplete();

        StepVerifier.create(scheduler.statistics())
            .assertNext(stats -> {
                assertEquals(1, stats.getTotalRequests());
                assertEquals(Map.of("a", 1L), stats.getInstanceRequests());
            })
            .verifyComplete();
    }

    @Test
    void testConcurrentCallersAreSerialized() {
        StepVerifier.create(scheduler.addInstance("a").then(scheduler.addInstance("b")))
            .verifyComplete();

        int requests = 1_000;
        Flux<String> concurrent = Flux.range(0, requests)
            .parallel(8)
            .runOn(Schedulers.parallel())
            .flatMap(i -> scheduler.dispatch())
            .sequential();

        StepVerifier.create(concurrent.count())
            .expectNext((long) requests)
            .verifyComplete();

        StepVerifier.create(scheduler.registryView())
            .assertNext(view -> {
                assertEquals(requests, view.totalRequests());
                assertEquals(500L, view.dispatchCounts().get("a"));
                assertEquals(500L, view.dispatchCounts().get("b"));
            })
            .verifyComplete();
    }
}
