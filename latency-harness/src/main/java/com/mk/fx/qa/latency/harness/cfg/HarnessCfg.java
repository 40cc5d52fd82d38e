package com.mk.fx.qa.latency.harness.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "latency.harness")
public class HarnessCfg {

  /** Runs driven in parallel. Each run still dispatches one configuration at a time. */
  @Min(1)
  @Max(64)
  private int runConcurrency = 4;

  @NotNull private Duration configurationTimeout = Duration.ofSeconds(120);

  @NotNull private Duration heartbeatTimeout = Duration.ofSeconds(30);

  @NotNull private Duration heartbeatCheckInterval = Duration.ofSeconds(5);

  @NotNull private Duration pollWait = Duration.ofSeconds(20);

  @Positive private int eventQueueCapacity = 1000;

  @Positive private int runHistoryLimit = 50;

  @Valid private Storage storage = new Storage();

  @Valid private Analysis analysis = new Analysis();

  @Data
  public static class Storage {

    /** {@code file} or {@code jdbc}. */
    @NotBlank private String type = "file";

    @NotBlank private String dataDir = "data/latency_harness";
  }

  @Data
  public static class Analysis {

    /** Median end-to-end target used for network projections and recommendations. */
    @Positive private double latencyTargetMs = 500;

    /** Provider name to estimated USD per hour of conversation. */
    private Map<String, Double> providerCostPerHour = new HashMap<>();
  }
}
