package com.mk.fx.qa.latency.agent;

import com.mk.fx.qa.latency.agent.dto.DispatchedConfiguration;
import com.mk.fx.qa.latency.agent.dto.Measurement;

/** Runs one voice pipeline turn on the client and measures it. */
@FunctionalInterface
public interface ConfigurationExecutor {

    /**
     * @return the measured latencies; thrown exceptions are reported to the harness as a failed
     *     configuration
     */
    Measurement execute(DispatchedConfiguration configuration) throws Exception;
}
