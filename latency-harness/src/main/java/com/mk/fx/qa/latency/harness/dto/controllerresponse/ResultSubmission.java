package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.TestResult;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Measurement posted by a client for a configuration it received from the work endpoint. */
@Data
public class ResultSubmission {

  @NotBlank private String clientId;

  @NotBlank private String dispatchId;

  @NotNull private TestResult result;
}
