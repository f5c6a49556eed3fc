package com.stockpulse.workflow;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Time budgets of one run.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WorkflowSettings {
    /** Budget shared by the news fetch and the extraction fan-out. */
    public final long runTimeoutMs;
    /** Separate budget for the price fetch, started when that stage begins. */
    public final long priceTimeoutMs;

    public static WorkflowSettings defaults() {
        return new WorkflowSettings(300_000L, 60_000L);
    }

    public static WorkflowSettings fromConfig(Config config) {
        WorkflowSettings d = defaults();
        int runSeconds = config.requireInt("workflow.run_timeout_sec", (int) (d.runTimeoutMs / 1000L));
        int priceSeconds = config.requireInt("workflow.price_timeout_sec", (int) (d.priceTimeoutMs / 1000L));
        return new WorkflowSettings(runSeconds * 1000L, priceSeconds * 1000L).validated();
    }

    public WorkflowSettings validated() {
        if (runTimeoutMs <= 0L) {
            throw new ConfigurationException("workflow.run_timeout_sec", "must be > 0");
        }
        if (priceTimeoutMs <= 0L) {
            throw new ConfigurationException("workflow.price_timeout_sec", "must be > 0");
        }
        return this;
    }
}
