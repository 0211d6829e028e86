package com.questrail.edgecontrol.api;

import com.questrail.edgecontrol.distributed.CrossControllerRule;
import com.questrail.edgecontrol.distributed.DistributedEvaluation;
import com.questrail.edgecontrol.failsafe.StateBackup;
import com.questrail.edgecontrol.process.LogicProcess;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.scheduling.TickReport;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * EdgeControlEngine
 * -----------------------------------------------------------------------------
 * Semantic façade of the arbitration and rule-evaluation engine for one edge
 * aggregator.
 *
 * <h2>Arbitration</h2>
 * Producers (operators, alerts, automation, schedules) submit
 * {@link StateProposal}s per actuator. The engine keeps exactly one
 * authoritative state per actuator: the highest-priority active proposal,
 * with ties broken by the actuator's {@link ActuatorKind}. Whenever the
 * authoritative state changes it is forwarded to the transport.
 *
 * <h2>Automation</h2>
 * Started {@link LogicRule}s run as logic processes, evaluated on a fixed
 * cadence. Their results enter arbitration as LOGIC proposals like any other
 * producer's.
 *
 * <h2>Safety</h2>
 * Evaluations that cannot be trusted (errors, timeouts) force the rule's
 * failsafe state. Stale, missing or implausible readings are handled per
 * condition by its fallback strategy and never raise.
 *
 * <h2>Errors</h2>
 * Only {@link CapacityExceededException} and {@link RuleUnavailableException}
 * are thrown synchronously, by the start and create operations. Everything
 * else is reported through the observability sink or on returned futures.
 *
 * <h2>Threading</h2>
 * Implementations are thread-safe.
 */
public interface EdgeControlEngine
{
    // ---------------------------------------------------------------------
    // Arbitration
    // ---------------------------------------------------------------------

    void registerActuator(ActuatorRef actuator, ActuatorKind kind);

    /**
     * Adds or replaces the proposal of {@code (source, origin)} for the actuator.
     *
     * @return the resolved state after arbitration
     */
    ResolvedState submitProposal(ActuatorRef actuator, StateProposal proposal);

    ResolvedState clearProposals(ActuatorRef actuator, ProposalSource source);

    ResolvedState clearProposal(ActuatorRef actuator, ProposalSource source, String origin);

    /**
     * @return the current winner, empty if no proposal was ever submitted for the actuator
     */
    Optional<StateProposal> getResolvedState(ActuatorRef actuator);

    // ---------------------------------------------------------------------
    // Logic processes
    // ---------------------------------------------------------------------

    void registerRule(LogicRule rule);

    /**
     * Registers the rule and starts a process for it.
     *
     * @throws RuleUnavailableException if the rule is missing or disabled
     * @throws CapacityExceededException if the process ceiling is reached
     */
    LogicProcess startProcess(LogicRule rule);

    /**
     * Starts a process for a previously registered rule.
     *
     * @throws RuleUnavailableException if no such rule is registered, or it is disabled
     * @throws CapacityExceededException if the process ceiling is reached
     */
    LogicProcess startProcess(String ruleId);

    /**
     * Stops the actuator's process, if any, and withdraws its proposal. Idempotent.
     *
     * @return true if a process was running
     */
    boolean stopProcess(ActuatorRef actuator);

    /**
     * Unregisters the rule and stops every process running it.
     */
    boolean deleteRule(String ruleId);

    Optional<LogicProcess> getProcess(ActuatorRef actuator);

    ProcessStats getProcessStats();

    /**
     * Runs one evaluation pass now. Skipped if a pass is already running.
     */
    CompletableFuture<TickReport> runEvaluationPass();

    // ---------------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------------

    void acceptSample(SensorSample sample);

    void signalEvent(String name);

    // ---------------------------------------------------------------------
    // Failsafe
    // ---------------------------------------------------------------------

    CompletableFuture<Void> activateFailsafe(ActuatorRef actuator, ActuatorState safeState);

    CompletableFuture<Optional<StateBackup>> restore(ActuatorRef actuator);

    // ---------------------------------------------------------------------
    // Cross-controller rules
    // ---------------------------------------------------------------------

    void createCrossControllerRule(CrossControllerRule rule);

    CompletableFuture<Void> deleteCrossControllerRule(String ruleId);

    CompletableFuture<DistributedEvaluation> evaluateDistributed(String ruleId);

    List<CrossControllerRule> rulesTouchingZone(String zone);

    List<CrossControllerRule> rulesTouchingSubzone(String subzone);

    List<CrossControllerRule> rulesTouchingDevice(String controllerId, int pin);
}
