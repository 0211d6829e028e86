package com.questrail.edgecontrol.runtime;

import com.questrail.edgecontrol.api.EdgeControlEngine;
import com.questrail.edgecontrol.config.EngineConfig;
import com.questrail.edgecontrol.core.DefaultEdgeControlEngine;
import com.questrail.edgecontrol.failsafe.InMemoryKeyValueStore;
import com.questrail.edgecontrol.failsafe.KeyValueStore;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.observability.NullObservabilitySink;
import com.questrail.edgecontrol.time.HashedWheelTimerScheduler;
import com.questrail.edgecontrol.time.MonotonicClock;
import com.questrail.edgecontrol.time.ScheduledExecutorScheduler;
import com.questrail.edgecontrol.time.SystemMonotonicClock;
import com.questrail.edgecontrol.time.SystemWallClock;
import com.questrail.edgecontrol.time.WallClock;
import com.questrail.edgecontrol.transport.ActuatorTransport;
import com.questrail.edgecontrol.transport.StaticTopology;
import com.questrail.edgecontrol.transport.Topology;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * EdgeControlRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production engine.
 *
 * <ul>
 *   <li>the evaluation cadence runs on a single-threaded scheduled executor</li>
 *   <li>evaluation and fetch deadlines run on a Netty hashed-wheel timer and
 *       dispatch onto the same executor</li>
 *   <li>samples pushed by the transport feed the engine's sample cache</li>
 * </ul>
 */
public final class EdgeControlRuntime {
    private final DefaultEdgeControlEngine engine;
    private final EvaluationTicker ticker;
    private final HashedWheelTimerScheduler deadlineScheduler;
    private final ScheduledExecutorService executor;

    private EdgeControlRuntime(DefaultEdgeControlEngine engine,
                               EvaluationTicker ticker,
                               HashedWheelTimerScheduler deadlineScheduler,
                               ScheduledExecutorService executor) {
        this.engine = engine;
        this.ticker = ticker;
        this.deadlineScheduler = deadlineScheduler;
        this.executor = executor;
    }

    public void start() {
        ticker.start();
    }

    public void stop() {
        ticker.stop();
        deadlineScheduler.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public EdgeControlEngine engine() {
        return engine;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private ActuatorTransport transport;
        private Topology topology;
        private KeyValueStore backupStore = new InMemoryKeyValueStore();
        private EngineObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private long wheelTickMillis = 10;

        public Builder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(ActuatorTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withTopology(Topology topology) {
            this.topology = topology;
            return this;
        }

        public Builder withBackupStore(KeyValueStore store) {
            this.backupStore = store;
            return this;
        }

        public Builder withObservabilitySink(EngineObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWheelTickMillis(long millis) {
            this.wheelTickMillis = millis;
            return this;
        }

        public EdgeControlRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread t = new Thread(runnable, "edgecontrol-evaluation");
                t.setDaemon(true);
                return t;
            });
            HashedWheelTimerScheduler deadlines = new HashedWheelTimerScheduler(clock, exec, wheelTickMillis);

            // 2. Engine
            Topology effectiveTopology = topology != null
                    ? topology
                    : StaticTopology.local(config.localAggregatorId());
            DefaultEdgeControlEngine engine = DefaultEdgeControlEngine.create(
                    config,
                    transport,
                    effectiveTopology,
                    backupStore,
                    clock,
                    deadlines,
                    wallClock,
                    observabilitySink);

            // 3. Inbound samples
            transport.onSample(engine::acceptSample);

            // 4. Cadence
            EvaluationTicker ticker = new EvaluationTicker(
                    new ScheduledExecutorScheduler(exec, clock),
                    clock,
                    config.evaluation().tickInterval(),
                    () -> {
                        engine.runEvaluationPass();
                        engine.evaluateCrossControllerRules();
                    },
                    wallClock,
                    observabilitySink);

            return new EdgeControlRuntime(engine, ticker, deadlines, exec);
        }
    }
}
