package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/** Snapshot a completed run as a baseline. A missing name defaults to one derived from the run. */
@Data
public class CreateBaselineRequest {

  @NotBlank private String runId;

  private String name;

  private String description;

  private boolean setActive;
}
