package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request to start a run of a suite. {@code clientId} pins the run to one client; otherwise the
 * first idle capable client is chosen, optionally restricted to {@code clientType}.
 */
@Data
public class StartRunRequest {

  @NotBlank private String suiteId;

  private String clientId;

  private String clientType;
}
