package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.dto.controllerresponse.BaselineSummaryResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.CreateBaselineRequest;
import com.mk.fx.qa.latency.harness.dto.report.BaselineCheckReport;
import com.mk.fx.qa.latency.harness.model.PerformanceBaseline;
import com.mk.fx.qa.latency.harness.service.BaselineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Baselines", description = "Performance baselines and regression checks")
@RestController
@RequestMapping("/api/latency-tests/baselines")
@Validated
@RequiredArgsConstructor
public class BaselineController {

  private final BaselineService baselineService;
  private final BaselineMapper baselineMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "List baselines", description = "Lists baselines, newest first.")
  @GetMapping
  public ResponseEntity<List<BaselineSummaryResponse>> listBaselines() {
    return ResponseEntity.ok(baselineMapper.toSummaries(baselineService.listBaselines()));
  }

  @Operation(summary = "Create baseline", description = "Snapshots a completed run.")
  @PostMapping
  public ResponseEntity<PerformanceBaseline> createBaseline(
      @Valid @RequestBody CreateBaselineRequest request) {
    log.info(
        "Received baseline request run={} active={}", request.getRunId(), request.isSetActive());
    return responseFactory.created(
        baselineService.createBaseline(
            request.getRunId(),
            request.getName(),
            request.getDescription(),
            request.isSetActive()));
  }

  @Operation(summary = "Active baseline", description = "Returns the active baseline.")
  @GetMapping("/active")
  public ResponseEntity<PerformanceBaseline> getActiveBaseline() {
    return ResponseEntity.ok(baselineService.getActiveBaseline());
  }

  @Operation(summary = "Get baseline", description = "Returns a baseline with all its metrics.")
  @GetMapping("/{baselineId}")
  public ResponseEntity<PerformanceBaseline> getBaseline(@PathVariable String baselineId) {
    return ResponseEntity.ok(baselineService.getBaseline(baselineId));
  }

  @Operation(summary = "Delete baseline", description = "Deletes a baseline.")
  @DeleteMapping("/{baselineId}")
  public ResponseEntity<Void> deleteBaseline(@PathVariable String baselineId) {
    baselineService.deleteBaseline(baselineId);
    return responseFactory.noContent();
  }

  @Operation(
      summary = "Activate baseline",
      description = "Makes a baseline the regression reference, deactivating any other.")
  @PostMapping("/{baselineId}/activate")
  public ResponseEntity<PerformanceBaseline> activateBaseline(@PathVariable String baselineId) {
    return ResponseEntity.ok(baselineService.activateBaseline(baselineId));
  }

  @Operation(
      summary = "Check run against baseline",
      description = "Compares a run's medians with the baseline and classifies the changes.")
  @GetMapping("/{baselineId}/check")
  public ResponseEntity<BaselineCheckReport> checkBaseline(
      @PathVariable String baselineId, @RequestParam String runId) {
    return ResponseEntity.ok(baselineService.checkBaseline(baselineId, runId));
  }
}
