package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.dto.controllerresponse.SuiteDetailResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.SuiteSummaryResponse;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface SuiteMapper {

  @Mapping(target = "scenarioCount", expression = "java(suite.scenarios().size())")
  @Mapping(target = "totalTestCount", expression = "java(suite.totalTestCount())")
  SuiteSummaryResponse toSummary(TestSuiteDefinition suite);

  List<SuiteSummaryResponse> toSummaries(List<TestSuiteDefinition> suites);

  @Mapping(target = "totalTestCount", expression = "java(suite.totalTestCount())")
  SuiteDetailResponse toDetail(TestSuiteDefinition suite);
}
