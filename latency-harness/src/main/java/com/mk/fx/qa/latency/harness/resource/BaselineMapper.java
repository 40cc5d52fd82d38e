package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.dto.controllerresponse.BaselineSummaryResponse;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface BaselineMapper {

  @Mapping(target = "isActive", expression = "java(baseline.isActive())")
  @Mapping(target = "configCount", expression = "java(baseline.configMetrics().size())")
  @Mapping(
      target = "overallMedianE2eMs",
      expression =
          "java(baseline.overallMetrics() == null ? null"
              + " : baseline.overallMetrics().medianE2eMs())")
  BaselineSummaryResponse toSummary(PerformanceBaseline baseline);

  List<BaselineSummaryResponse> toSummaries(List<PerformanceBaseline> baselines);
}
