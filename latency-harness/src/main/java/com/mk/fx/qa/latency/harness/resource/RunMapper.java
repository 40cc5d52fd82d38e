package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.dto.controllerresponse.RunSummaryResponse;
import com.mk.fx.qa.latency.harness.model.TestRun;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface RunMapper {

  RunSummaryResponse toSummary(TestRun run);

  List<RunSummaryResponse> toSummaries(List<TestRun> runs);
}
