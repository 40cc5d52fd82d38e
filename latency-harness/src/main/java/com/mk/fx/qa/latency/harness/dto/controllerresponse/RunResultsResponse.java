package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestResult;
import java.util.List;

public record RunResultsResponse(
    String runId,
    RunStatus status,
    int completedConfigurations,
    int totalConfigurations,
    List<TestResult> results) {}
