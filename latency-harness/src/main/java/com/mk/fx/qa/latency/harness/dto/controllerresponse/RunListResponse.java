package com.mk.fx.qa.latency.harness.dto.controllerresponse;

import java.util.List;

/** One page of the run history, newest first, with the number of runs matching the filters. */
public record RunListResponse(List<RunSummaryResponse> runs, int total, int offset) {}
