package com.questrail.edgecontrol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EngineObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEngineObservabilitySink implements EngineObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEngineObservabilitySink.class);

    @Override
    public void onArbitration(ArbitrationEvent event) {
        if (event.changed()) {
            log.info("Actuator {}: {} wins with {} ({} active)",
                event.actuator(),
                event.winner().source(),
                event.winner().state(),
                event.activeProposals());
        } else {
            log.debug("Actuator {}: unchanged, {} active", event.actuator(), event.activeProposals());
        }
    }

    @Override
    public void onProcessEvent(ProcessEvent event) {
        switch (event.type()) {
            case PROCESS_STARTED, PROCESS_STOPPED ->
                log.info("Process {} [{}]: {} {}", event.actuator(), event.ruleId(), event.type(), event.detail());
            case EVALUATION_TIMEOUT, EVALUATION_ERROR, FAILSAFE_ACTIVATED ->
                log.warn("Process {} [{}]: {} {}", event.actuator(), event.ruleId(), event.type(), event.detail());
            default ->
                log.debug("Process {} [{}]: {} {}", event.actuator(), event.ruleId(), event.type(), event.detail());
        }
    }

    @Override
    public void onSchedulerEvent(SchedulerEvent event) {
        if (event.type() == SchedulerEvent.Type.PASS_SKIPPED) {
            log.warn("Evaluation pass skipped: {}", event.detail());
        } else {
            log.debug("Scheduler Event: {}", event);
        }
    }

    @Override
    public void onError(EngineErrorEvent event) {
        log.error("Engine Error: {}", event.message(), event.cause());
    }
}
