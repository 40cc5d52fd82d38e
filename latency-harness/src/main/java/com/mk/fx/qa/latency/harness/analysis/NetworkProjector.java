package com.mk.fx.qa.latency.harness.analysis;

import com.mk.fx.qa.latency.harness.model.NetworkProfile;
import com.mk.fx.qa.latency.harness.model.TestConfiguration;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extrapolates a measured latency to every {@link NetworkProfile}. The profile's added latency is
 * counted once per network-bound stage, so an all on-device pipeline projects to the measured
 * value under every profile.
 */
public final class NetworkProjector {

  private NetworkProjector() {
    // Utility class, no instantiation
  }

  public static double project(double measuredMs, int networkStageCount, NetworkProfile profile) {
    return measuredMs + profile.getAddedLatencyMs() * networkStageCount;
  }

  /** Projection under every profile, keyed by the profile's wire name, in declaration order. */
  public static Map<String, Double> projectAll(double measuredMs, int networkStageCount) {
    Map<String, Double> projections = new LinkedHashMap<>();
    for (NetworkProfile profile : NetworkProfile.values()) {
      projections.put(profile.getValue(), project(measuredMs, networkStageCount, profile));
    }
    return projections;
  }

  /**
   * Network-bound stages of the pipeline that produced {@code result}. A stage whose settings were
   * not reported is counted as network-bound.
   */
  public static int networkStageCount(TestResult result) {
    int count = 0;
    if (result.sttConfig() == null || result.sttConfig().requiresNetwork()) {
      count++;
    }
    if (result.llmConfig() == null || result.llmConfig().requiresNetwork()) {
      count++;
    }
    if (result.ttsConfig() == null || result.ttsConfig().requiresNetwork()) {
      count++;
    }
    return count;
  }

  /** Copy of {@code result} carrying projections of its end-to-end latency. */
  public static TestResult withProjections(TestResult result, TestConfiguration configuration) {
    return result.toBuilder()
        .networkProjections(
            projectAll(result.e2eLatencyMs(), configuration.networkStageCount()))
        .build();
  }
}
