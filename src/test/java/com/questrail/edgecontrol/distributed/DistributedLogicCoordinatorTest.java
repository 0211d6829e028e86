package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.CapacityExceededException;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.RuleUnavailableException;
import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.arbitration.ActuatorArbitrator;
import com.questrail.edgecontrol.arbitration.ActuatorCatalog;
import com.questrail.edgecontrol.arbitration.PriorityResolver;
import com.questrail.edgecontrol.config.BackupPolicy;
import com.questrail.edgecontrol.config.DataQualityPolicy;
import com.questrail.edgecontrol.evaluation.ConditionEvaluator;
import com.questrail.edgecontrol.failsafe.FailsafeCoordinator;
import com.questrail.edgecontrol.failsafe.InMemoryKeyValueStore;
import com.questrail.edgecontrol.failsafe.StatePublisher;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.observability.RecordingObservabilitySink;
import com.questrail.edgecontrol.rule.ComparisonOperator;
import com.questrail.edgecontrol.rule.Condition;
import com.questrail.edgecontrol.rule.FallbackStrategy;
import com.questrail.edgecontrol.rule.SensorType;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.DeterministicScheduler;
import com.questrail.edgecontrol.time.ManualMonotonicClock;
import com.questrail.edgecontrol.time.ManualWallClock;
import com.questrail.edgecontrol.transport.CommandDispatcher;
import com.questrail.edgecontrol.transport.RecordingTransport;
import com.questrail.edgecontrol.transport.StaticTopology;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DistributedLogicCoordinatorTest
 * -----------------------------------------------------------------------------
 * Greenhouse topology: the hall sensor lives on esp2 behind aggregator agg-b,
 * the humidity sensor on esp3 behind agg-c. Actions drive esp1 (local) and esp4.
 */
class DistributedLogicCoordinatorTest {

    private static final SensorRef HALL_TEMP = SensorRef.of("esp2", 4);
    private static final SensorRef HALL_HUMIDITY = SensorRef.of("esp3", 2);
    private static final ActuatorRef VENT = ActuatorRef.of("esp1", 5);
    private static final ActuatorRef MISTER = ActuatorRef.of("esp4", 7);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ManualWallClock wallClock;
    private RecordingTransport transport;
    private RecordingObservabilitySink sink;
    private ActuatorArbitrator arbitrator;
    private FailsafeCoordinator failsafe;
    private DistributedLogicCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        wallClock = new ManualWallClock(Instant.parse("2026-03-02T10:00:00Z"));
        transport = new RecordingTransport();
        sink = new RecordingObservabilitySink();

        StaticTopology topology = StaticTopology.local("agg-a")
                .withController("esp2", "agg-b")
                .withController("esp3", "agg-c")
                .withController("esp4", "agg-c");
        CommandDispatcher dispatcher = new CommandDispatcher(transport, topology, wallClock, sink);
        failsafe = new FailsafeCoordinator(dispatcher, new InMemoryKeyValueStore(), BackupPolicy.defaults(),
                wallClock, sink);
        arbitrator = new ActuatorArbitrator(new PriorityResolver(), new ActuatorCatalog(), 100, wallClock, sink);
        RemoteSampleFetcher fetcher = new RemoteSampleFetcher(transport, topology,
                new Deadlines(scheduler, clock), Duration.ofSeconds(5));

        coordinator = new DistributedLogicCoordinator(3, fetcher,
                new ConditionEvaluator(DataQualityPolicy.defaults()), arbitrator,
                new StatePublisher(dispatcher, failsafe), failsafe, wallClock, sink);
    }

    private static CrossControllerMetadata metadata(String zone, String subzone) {
        return new CrossControllerMetadata(Set.of("agg-a", "agg-b"), Set.of(zone), Set.of(subzone),
                Set.of("esp1", "esp2", "esp3", "esp4"));
    }

    private static CrossControllerRule ventilation(String id, boolean failsafeEnabled) {
        return new CrossControllerRule(id, "hall ventilation",
                List.of(Condition.of(HALL_TEMP, ComparisonOperator.GREATER_THAN, 28.0, SensorType.TEMPERATURE)),
                List.of(Condition.of(HALL_HUMIDITY, ComparisonOperator.LESS_THAN, 60.0, SensorType.HUMIDITY)),
                List.of(new RemoteAction(VENT, ActuatorState.ON), new RemoteAction(MISTER, ActuatorState.level(0.5))),
                true, failsafeEnabled, ActuatorState.OFF,
                metadata("greenhouse", "hall"));
    }

    private void reading(SensorRef sensor, double value) {
        transport.respond(sensor, SensorSample.of(sensor, value, wallClock.now()));
    }

    @Test
    void allSignalsActiveFansOutActions() {
        coordinator.create(ventilation("vent", true));
        reading(HALL_TEMP, 31.0);
        reading(HALL_HUMIDITY, 45.0);

        DistributedEvaluation result = coordinator.evaluateDistributed("vent").join();

        assertTrue(result.fired());
        assertEquals(2, result.signals().size());
        assertTrue(result.signals().stream().allMatch(s -> s.reason() == SignalResult.Reason.CONDITION_MET));
        assertTrue(result.actions().stream().allMatch(ActionResult::delivered));

        assertEquals(ActuatorState.ON, transport.lastCommandFor(VENT).orElseThrow().state());
        assertEquals(ActuatorState.level(0.5), transport.lastCommandFor(MISTER).orElseThrow().state());
        assertEquals("vent", arbitrator.resolved(MISTER).orElseThrow().origin());
        assertTrue(transport.sampleRequests().stream().anyMatch(t -> t.aggregatorId().equals("agg-b")));
    }

    @Test
    void oneFailedDeliveryDoesNotUndoTheOthers() {
        coordinator.create(ventilation("vent", true));
        reading(HALL_TEMP, 31.0);
        reading(HALL_HUMIDITY, 45.0);
        transport.failPublishTo(MISTER);

        DistributedEvaluation result = coordinator.evaluateDistributed("vent").join();

        assertTrue(result.fired());
        ActionResult vent = result.actions().get(0);
        ActionResult mister = result.actions().get(1);
        assertTrue(vent.delivered());
        assertFalse(mister.delivered());
        assertTrue(mister.error().isPresent());
        assertTrue(transport.lastCommandFor(VENT).isPresent());
        assertFalse(result.failsafeApplied());
    }

    @Test
    void timeoutIsInactiveAndDoesNotBlockOtherSignals() {
        coordinator.create(ventilation("vent", true));
        reading(HALL_HUMIDITY, 45.0);
        // HALL_TEMP never answers

        CompletableFuture<DistributedEvaluation> pending = coordinator.evaluateDistributed("vent");
        assertFalse(pending.isDone());

        clock.advanceMillis(5_000);
        scheduler.runDueTasks();

        DistributedEvaluation result = pending.join();
        assertFalse(result.fired());
        assertFalse(result.failsafeApplied());
        assertEquals(SignalResult.Reason.TIMEOUT, result.signals().get(0).reason());
        assertEquals(SignalResult.Reason.CONDITION_MET, result.signals().get(1).reason());
        assertTrue(transport.published().isEmpty());
    }

    @Test
    void failedFetchAppliesFailsafeToEveryTarget() {
        coordinator.create(ventilation("vent", true));
        reading(HALL_HUMIDITY, 45.0);
        transport.failFetch(HALL_TEMP, new IllegalStateException("agg-b unreachable"));

        DistributedEvaluation result = coordinator.evaluateDistributed("vent").join();

        assertFalse(result.fired());
        assertTrue(result.failsafeApplied());
        assertTrue(result.error().isPresent());
        assertEquals(SignalResult.Reason.EVALUATION_ERROR, result.signals().get(0).reason());
        assertEquals(ActuatorState.OFF, transport.lastCommandFor(VENT).orElseThrow().state());
        assertEquals(ActuatorState.OFF, transport.lastCommandFor(MISTER).orElseThrow().state());
        assertEquals(2, failsafe.activations());
        assertEquals(2, sink.getProcessEvents(ProcessEventType.FAILSAFE_ACTIVATED).size());
    }

    @Test
    void failedFetchWithoutFailsafeOnlyReports() {
        coordinator.create(ventilation("vent", false));
        reading(HALL_HUMIDITY, 45.0);
        transport.failFetch(HALL_TEMP, new IllegalStateException("agg-b unreachable"));

        DistributedEvaluation result = coordinator.evaluateDistributed("vent").join();

        assertFalse(result.failsafeApplied());
        assertTrue(result.error().isPresent());
        assertTrue(transport.published().isEmpty());
    }

    @Test
    void emptyAnswerIsSensorUnavailable() {
        coordinator.create(ventilation("vent", true));
        transport.respondEmpty(HALL_TEMP);
        reading(HALL_HUMIDITY, 45.0);

        DistributedEvaluation result = coordinator.evaluateDistributed("vent").join();

        assertFalse(result.fired());
        assertEquals(SignalResult.Reason.SENSOR_UNAVAILABLE, result.signals().get(0).reason());
    }

    @Test
    void unknownRuleFailsWithRuleUnavailable() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> coordinator.evaluateDistributed("missing").join());
        assertInstanceOf(RuleUnavailableException.class, error.getCause());
    }

    @Test
    void createValidatesMetadataAndCapacity() {
        CrossControllerRule noZones = new CrossControllerRule("bad", null, List.of(), List.of(), List.of(),
                true, true, ActuatorState.OFF,
                new CrossControllerMetadata(Set.of("agg-a"), Set.of(), Set.of(), Set.of("esp1")));
        assertThrows(IllegalArgumentException.class, () -> coordinator.create(noZones));

        coordinator.create(ventilation("r1", true));
        coordinator.create(ventilation("r2", true));
        coordinator.create(ventilation("r3", true));
        assertThrows(CapacityExceededException.class, () -> coordinator.create(ventilation("r4", true)));

        coordinator.create(ventilation("r1", false));
        assertFalse(coordinator.get("r1").orElseThrow().failsafeEnabled(), "replacing an existing id is allowed");
    }

    @Test
    void removeWithdrawsProposalsAndPublishesFallback() {
        coordinator.create(ventilation("vent", true));
        reading(HALL_TEMP, 31.0);
        reading(HALL_HUMIDITY, 45.0);
        coordinator.evaluateDistributed("vent").join();

        coordinator.remove("vent").join();

        assertTrue(coordinator.get("vent").isEmpty());
        assertEquals(ProposalSource.DEFAULT, transport.lastCommandFor(VENT).orElseThrow().source());
        assertEquals(ActuatorState.OFF, transport.lastCommandFor(VENT).orElseThrow().state());
    }

    @Test
    void queriesByZoneSubzoneAndDevice() {
        coordinator.create(ventilation("vent", true));
        coordinator.create(new CrossControllerRule("lights", null,
                List.of(Condition.of(SensorRef.of("esp2", 9), ComparisonOperator.LESS_THAN, 100.0, SensorType.LIGHT)),
                List.of(),
                List.of(new RemoteAction(ActuatorRef.of("esp4", 1), ActuatorState.ON)),
                true, true, ActuatorState.OFF,
                metadata("nursery", "bench")));

        assertEquals(List.of("vent"), ids(coordinator.rulesTouchingZone("greenhouse")));
        assertEquals(List.of("lights"), ids(coordinator.rulesTouchingSubzone("bench")));
        assertEquals(List.of("vent"), ids(coordinator.rulesTouchingDevice("esp3", 2)));
        assertEquals(List.of("lights"), ids(coordinator.rulesTouchingDevice("esp4", 1)));
        assertTrue(coordinator.rulesTouchingDevice("esp9", 0).isEmpty());

        Map<String, List<String>> index = coordinator.zoneIndex();
        assertEquals(List.of("greenhouse", "nursery"), List.copyOf(index.keySet()));
    }

    private static List<String> ids(List<CrossControllerRule> rules) {
        return rules.stream().map(CrossControllerRule::id).collect(Collectors.toList());
    }

    @Test
    void emptyAnswerFollowsConditionFallback() {
        coordinator.create(new CrossControllerRule("vent-safe-on", "hall ventilation",
                List.of(Condition.of(HALL_TEMP, ComparisonOperator.GREATER_THAN, 28.0, SensorType.TEMPERATURE)
                        .withFallback(FallbackStrategy.SAFE_ON)),
                List.of(Condition.of(HALL_HUMIDITY, ComparisonOperator.LESS_THAN, 60.0, SensorType.HUMIDITY)),
                List.of(new RemoteAction(VENT, ActuatorState.ON)),
                true, true, ActuatorState.OFF,
                metadata("greenhouse", "hall")));
        transport.respondEmpty(HALL_TEMP);
        reading(HALL_HUMIDITY, 45.0);

        DistributedEvaluation result = coordinator.evaluateDistributed("vent-safe-on").join();

        SignalResult trigger = result.signals().get(0);
        assertTrue(trigger.active());
        assertEquals(SignalResult.Reason.SENSOR_UNAVAILABLE, trigger.reason());
        assertTrue(result.fired());
        assertEquals(ActuatorState.ON, transport.lastCommandFor(VENT).orElseThrow().state());
    }
}
