package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.NetworkProfile;
import com.mk.fx.qa.latency.harness.model.ParameterSpace;
import com.mk.fx.qa.latency.harness.model.TestScenario;
import java.util.List;

/** Full suite definition plus the number of configurations it expands to. */
public record SuiteDetailResponse(
    String id,
    String name,
    String description,
    List<TestScenario> scenarios,
    List<NetworkProfile> networkProfiles,
    ParameterSpace parameterSpace,
    int totalTestCount) {}
