package com.mk.fx.qa.latency.harness.resource;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.CreateBaselineRequest;
import com.mk.fx.qa.latency.harness.dto.report.BaselineCheckReport;
import com.mk.fx.qa.latency.harness.exception.ResourceNotFoundException;
import com.mk.fx.qa.latency.harness.model.BaselineMetrics;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.service.BaselineService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = BaselineController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class, BaselineMapperImpl.class})
class BaselineControllerTest {

  private static final BaselineMetrics METRICS =
      new BaselineMetrics(400, 520, 380, 530, 90.0, 120.0, 250.0, 60.0, 150.0, 3);

  @Autowired private MockMvc mvc;

  @Autowired private ObjectMapper mapper;

  @MockBean private BaselineService baselineService;

  @Test
  void listBaselines_returnsSummaries() throws Exception {
    when(baselineService.listBaselines()).thenReturn(List.of(baseline("b-1", true)));

    mvc.perform(get("/api/latency-tests/baselines"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id").value("b-1"))
        .andExpect(jsonPath("$[0].isActive").value(true))
        .andExpect(jsonPath("$[0].configCount").value(1))
        .andExpect(jsonPath("$[0].overallMedianE2eMs").value(400.0));
  }

  @Test
  void createBaseline_returns201() throws Exception {
    var request = new CreateBaselineRequest();
    request.setRunId("run-1");
    request.setSetActive(true);
    when(baselineService.createBaseline("run-1", null, null, true))
        .thenReturn(baseline("b-2", true));

    mvc.perform(
            post("/api/latency-tests/baselines")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value("b-2"))
        .andExpect(jsonPath("$.name").value("Baseline from run-1"))
        .andExpect(jsonPath("$.configMetrics.cfg-a.sampleCount").value(3));
  }

  @Test
  void createBaseline_runNotCompleted_returns400() throws Exception {
    var request = new CreateBaselineRequest();
    request.setRunId("run-1");
    when(baselineService.createBaseline("run-1", null, null, false))
        .thenThrow(
            new IllegalArgumentException("Run run-1 is running, only completed runs qualify"));

    mvc.perform(
            post("/api/latency-tests/baselines")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid Argument"));
  }

  @Test
  void createBaseline_missingRunId_returns400() throws Exception {
    mvc.perform(
            post("/api/latency-tests/baselines")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"nightly\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Validation Failed"));
  }

  @Test
  void getActiveBaseline_noneActive_returns404() throws Exception {
    when(baselineService.getActiveBaseline())
        .thenThrow(new ResourceNotFoundException("Baseline", "active"));

    mvc.perform(get("/api/latency-tests/baselines/active"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.details").value("Baseline not found: active"));
  }

  @Test
  void activateBaseline_returnsActivatedBaseline() throws Exception {
    when(baselineService.activateBaseline("b-1")).thenReturn(baseline("b-1", true));

    mvc.perform(post("/api/latency-tests/baselines/b-1/activate"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.isActive").value(true));
  }

  @Test
  void deleteBaseline_unknown_returns404() throws Exception {
    doThrow(new ResourceNotFoundException("Baseline", "b-9"))
        .when(baselineService)
        .deleteBaseline("b-9");

    mvc.perform(delete("/api/latency-tests/baselines/b-9")).andExpect(status().isNotFound());
  }

  @Test
  void deleteBaseline_returns204() throws Exception {
    mvc.perform(delete("/api/latency-tests/baselines/b-1")).andExpect(status().isNoContent());

    verify(baselineService).deleteBaseline("b-1");
  }

  @Test
  void checkBaseline_returnsReport() throws Exception {
    var report = new BaselineCheckReport();
    report.baselineId = "b-1";
    report.runId = "run-2";
    report.summary = new BaselineCheckReport.Summary();
    report.summary.totalConfigs = 2;
    report.summary.regressedConfigs = 1;
    when(baselineService.checkBaseline("b-1", "run-2")).thenReturn(report);

    mvc.perform(get("/api/latency-tests/baselines/b-1/check").param("runId", "run-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.baselineId").value("b-1"))
        .andExpect(jsonPath("$.summary.totalConfigs").value(2))
        .andExpect(jsonPath("$.summary.regressedConfigs").value(1));
  }

  @Test
  void checkBaseline_missingRunId_returns400() throws Exception {
    mvc.perform(get("/api/latency-tests/baselines/b-1/check"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing Parameter"))
        .andExpect(jsonPath("$.details").value("runId is required"));
  }

  private static PerformanceBaseline baseline(String id, boolean active) {
    return new PerformanceBaseline(
        id,
        "Baseline from run-1",
        null,
        "run-1",
        Instant.parse("2026-02-01T09:00:00Z"),
        active,
        Map.of("cfg-a", METRICS),
        METRICS);
  }
}
