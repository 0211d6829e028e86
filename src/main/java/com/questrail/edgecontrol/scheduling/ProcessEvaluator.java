package com.questrail.edgecontrol.scheduling;

import com.questrail.edgecontrol.api.EvaluationTimeoutException;
import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.distributed.RemoteSampleFetcher;
import com.questrail.edgecontrol.evaluation.RuleEvaluator;
import com.questrail.edgecontrol.evaluation.RuleVerdict;
import com.questrail.edgecontrol.evaluation.SampleCache;
import com.questrail.edgecontrol.process.LogicProcess;
import com.questrail.edgecontrol.rule.Condition;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.time.FetchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Computes the verdict of one logic process.
 *
 * <p>Sensors on the actuator's own controller are read from the sample cache.
 * Every other sensor is fetched remotely; a remote fetch that times out or
 * fails fails the whole evaluation, which the scheduler turns into failsafe.</p>
 */
public final class ProcessEvaluator {

    private final RuleEvaluator rules;
    private final SampleCache samples;
    private final RemoteSampleFetcher remote;

    public ProcessEvaluator(RuleEvaluator rules, SampleCache samples, RemoteSampleFetcher remote) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.samples = Objects.requireNonNull(samples, "samples");
        this.remote = Objects.requireNonNull(remote, "remote");
    }

    public CompletableFuture<RuleVerdict> evaluate(LogicProcess process) {
        LogicRule rule = process.rule();

        List<CompletableFuture<Optional<SensorSample>>> reads = new ArrayList<>(rule.conditions().size());
        for (Condition condition : rule.conditions()) {
            reads.add(read(rule, condition.sensor()));
        }

        return CompletableFuture.allOf(reads.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<Optional<SensorSample>> resolved = new ArrayList<>(reads.size());
                    for (CompletableFuture<Optional<SensorSample>> read : reads) {
                        resolved.add(read.join());
                    }
                    return rules.evaluate(rule, resolved, process.lastValidResults());
                });
    }

    private CompletableFuture<Optional<SensorSample>> read(LogicRule rule, SensorRef sensor) {
        if (sensor.isOn(rule.actuator().controllerId())) {
            return CompletableFuture.completedFuture(samples.latest(sensor));
        }
        return remote.fetch(sensor).thenApply(result -> {
            if (result instanceof FetchResult.Completed<Optional<SensorSample>> completed) {
                return completed.value();
            }
            if (result instanceof FetchResult.TimedOut<Optional<SensorSample>> timedOut) {
                throw new CompletionException(new EvaluationTimeoutException(rule.actuator(), timedOut.bound()));
            }
            FetchResult.Failed<Optional<SensorSample>> failed = (FetchResult.Failed<Optional<SensorSample>>) result;
            throw new CompletionException(failed.cause());
        });
    }
}
