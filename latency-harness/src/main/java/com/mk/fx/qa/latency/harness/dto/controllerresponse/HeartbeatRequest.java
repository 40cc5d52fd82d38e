package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.Data;

/**
 * Periodic liveness signal from a test client. The first heartbeat registers the client; later
 * ones refresh it and replace its capabilities when present.
 */
@Data
public class HeartbeatRequest {

  @NotBlank private String clientId;

  @NotBlank private String clientType;

  @Valid private Capabilities capabilities;

  @Data
  public static class Capabilities {
    private List<String> supportedSttProviders;
    private List<String> supportedLlmProviders;
    private List<String> supportedTtsProviders;
    private Boolean hasHighPrecisionTiming;
    private Boolean hasDeviceMetrics;
    private Boolean hasOnDeviceMl;
    private Integer maxConcurrentTests;
  }
}
