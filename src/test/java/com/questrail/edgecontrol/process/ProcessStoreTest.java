package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.CapacityExceededException;
import com.questrail.edgecontrol.api.RuleUnavailableException;
import com.questrail.edgecontrol.config.StoreLimits;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.observability.RecordingObservabilitySink;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProcessStoreTest
 * -----------------------------------------------------------------------------
 * Start/stop lifecycle, capacity ceiling and bounded bookkeeping.
 */
class ProcessStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private RecordingObservabilitySink sink;
    private ProcessStore store;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        StoreLimits limits = new StoreLimits(2, 100, 100, 3, 4, 10);
        store = new ProcessStore(limits, new ManualWallClock(T0), sink);
    }

    private static LogicRule rule(String id, int pin) {
        return LogicRule.builder(id, ActuatorRef.of("esp1", pin)).build();
    }

    @Test
    void startCreatesRunningProcess() {
        LogicProcess p = store.start(rule("r1", 1));

        assertEquals(ProcessStatus.RUNNING, p.status());
        assertEquals(T0, p.startedAt());
        assertEquals(0, p.evaluationCount());
        assertTrue(p.currentState().isEmpty());
        assertTrue(store.isCurrent(p));
        assertEquals(1, sink.getProcessEvents(ProcessEventType.PROCESS_STARTED).size());
    }

    @Test
    void missingRuleIsUnavailable() {
        assertThrows(RuleUnavailableException.class, () -> store.start(null));
    }

    @Test
    void disabledRuleIsUnavailable() {
        LogicRule disabled = rule("r1", 1).withEnabled(false);

        assertThrows(RuleUnavailableException.class, () -> store.start(disabled));
        assertEquals(0, store.size());
    }

    @Test
    void ceilingRejectsNewActuators() {
        store.start(rule("r1", 1));
        store.start(rule("r2", 2));

        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> store.start(rule("r3", 3)));
        assertEquals(2, e.limit());
        assertEquals(2, store.size());
    }

    @Test
    void restartingSameActuatorReplacesWithoutCountingTwice() {
        store.start(rule("r1", 1));
        LogicProcess old = store.start(rule("r2", 2));
        LogicProcess replacement = store.start(LogicRule.builder("r2b", ActuatorRef.of("esp1", 2)).build());

        assertEquals(2, store.size());
        assertEquals(ProcessStatus.STOPPED, old.status());
        assertFalse(store.isCurrent(old));
        assertTrue(store.isCurrent(replacement));
    }

    @Test
    void stopIsIdempotent() {
        LogicProcess p = store.start(rule("r1", 1));

        assertTrue(store.stop(p.actuator()).isPresent());
        assertTrue(store.stop(p.actuator()).isEmpty());
        assertEquals(ProcessStatus.STOPPED, p.status());
        assertFalse(store.isCurrent(p));
        assertEquals(1, sink.getProcessEvents(ProcessEventType.PROCESS_STOPPED).size());
    }

    @Test
    void historiesAreBounded() {
        LogicProcess p = store.start(rule("r1", 1));

        for (int i = 0; i < 10; i++) {
            p.applyState(i % 2 == 0 ? ActuatorState.ON : ActuatorState.OFF, "flip " + i, T0.plusSeconds(i));
            p.diagnostic(ProcessEventType.EVALUATION_ERROR, "e" + i, T0.plusSeconds(i));
        }

        assertEquals(3, p.triggerHistory().size());
        assertEquals("flip 9", p.triggerHistory().get(2).reason());
        assertEquals(4, p.diagnostics().size());
        assertEquals("e9", p.diagnostics().get(3).detail());
    }

    @Test
    void failsafeForgetsComputedState() {
        LogicProcess p = store.start(rule("r1", 1));
        p.applyState(ActuatorState.ON, "on", T0);
        assertFalse(p.wouldFlip(ActuatorState.ON));

        p.markFailsafe("timeout", T0);

        assertTrue(p.failsafeActive());
        assertTrue(p.wouldFlip(ActuatorState.ON));
        p.applyState(ActuatorState.ON, "recovered", T0);
        assertFalse(p.failsafeActive());
    }

    @Test
    void byRuleFindsRunningProcesses() {
        store.start(rule("r1", 1));
        store.start(rule("r2", 2));

        assertEquals(1, store.byRule("r2").size());
        assertTrue(store.byRule("nope").isEmpty());
    }

    @Test
    void stopListenerSeesStoppedAndReplacedProcesses() {
        List<String> left = new ArrayList<>();
        ProcessStore listening = new ProcessStore(new StoreLimits(2, 100, 100, 3, 4, 10),
                new ManualWallClock(T0), sink, p -> left.add(p.ruleId()));

        listening.start(rule("r1", 1));
        listening.start(LogicRule.builder("r1b", ActuatorRef.of("esp1", 1)).build());
        listening.stop(ActuatorRef.of("esp1", 1));
        listening.stop(ActuatorRef.of("esp1", 1));

        assertEquals(List.of("r1", "r1b"), left);
    }

    @Test
    void ifCurrentSkipsActionForStoppedProcess() {
        LogicProcess p = store.start(rule("r1", 1));

        assertEquals("ran", store.ifCurrent(p, () -> "ran").orElseThrow());
        store.stop(p.actuator());
        assertTrue(store.ifCurrent(p, () -> "ran").isEmpty());
    }
}
