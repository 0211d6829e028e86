package com.questrail.edgecontrol.config;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Aggregated configuration of one engine instance.
 *
 * <p>{@code zone} is the local time zone used for timer windows.
 * {@code localAggregatorId} names the edge aggregator this engine runs on;
 * sensors and actuators behind any other aggregator are reached through the
 * topology.</p>
 */
public record EngineConfig(
        EvaluationPolicy evaluation,
        DataQualityPolicy dataQuality,
        StoreLimits limits,
        BackupPolicy backups,
        ZoneId zone,
        String localAggregatorId
) {
    public EngineConfig {
        Objects.requireNonNull(evaluation, "evaluation");
        Objects.requireNonNull(dataQuality, "dataQuality");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(backups, "backups");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(localAggregatorId, "localAggregatorId");
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EvaluationPolicy evaluation = EvaluationPolicy.defaults();
        private DataQualityPolicy dataQuality = DataQualityPolicy.defaults();
        private StoreLimits limits = StoreLimits.defaults();
        private BackupPolicy backups = BackupPolicy.defaults();
        private ZoneId zone = ZoneId.systemDefault();
        private String localAggregatorId = "local";

        public Builder withEvaluationPolicy(EvaluationPolicy evaluation) {
            this.evaluation = evaluation;
            return this;
        }

        public Builder withDataQualityPolicy(DataQualityPolicy dataQuality) {
            this.dataQuality = dataQuality;
            return this;
        }

        public Builder withStoreLimits(StoreLimits limits) {
            this.limits = limits;
            return this;
        }

        public Builder withBackupPolicy(BackupPolicy backups) {
            this.backups = backups;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder withLocalAggregatorId(String localAggregatorId) {
            this.localAggregatorId = localAggregatorId;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(evaluation, dataQuality, limits, backups, zone, localAggregatorId);
        }
    }
}
