package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import com.mk.fx.qa.latency.harness.model.NetworkProfile;
import java.util.List;

public record SuiteSummaryResponse(
    String id,
    String name,
    String description,
    int scenarioCount,
    int totalTestCount,
    List<NetworkProfile> networkProfiles) {}
