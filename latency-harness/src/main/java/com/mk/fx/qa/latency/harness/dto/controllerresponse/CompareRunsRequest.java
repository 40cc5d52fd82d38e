package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CompareRunsRequest {

  @NotBlank private String run1Id;

  @NotBlank private String run2Id;
}
