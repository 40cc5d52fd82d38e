package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.analysis.ResultsExporter;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.CompareRunsRequest;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.RunCancellationResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.RunListResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.RunResultsResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.RunStartResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.StartRunRequest;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.SuiteDetailResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.SuiteSummaryResponse;
import com.mk.fx.qa.latency.harness.dto.report.AnalysisReport;
import com.mk.fx.qa.latency.harness.dto.report.RunComparisonReport;
import com.mk.fx.qa.latency.harness.model.ClientType;
import com.mk.fx.qa.latency.harness.model.RunStatus;
import com.mk.fx.qa.latency.harness.model.TestRun;
import com.mk.fx.qa.latency.harness.model.TestSuiteDefinition;
import com.mk.fx.qa.latency.harness.service.LatencyTestOrchestrator;
import com.mk.fx.qa.latency.harness.service.RunAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
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
@Tag(
    name = "Latency Tests",
    description = "Endpoints for managing suites, running them and analysing their results")
@RestController
@RequestMapping("/api/latency-tests")
@Validated
@RequiredArgsConstructor
public class LatencyTestController {

  static final MediaType TEXT_CSV = new MediaType("text", "csv");

  private final LatencyTestOrchestrator orchestrator;
  private final RunAnalysisService analysisService;
  private final SuiteMapper suiteMapper;
  private final RunMapper runMapper;
  private final ClientMapper clientMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Suites
  // -----------------------------------------------------
  @Operation(summary = "List suites", description = "Lists built-in and saved test suites.")
  @GetMapping("/suites")
  public ResponseEntity<List<SuiteSummaryResponse>> listSuites() {
    return ResponseEntity.ok(suiteMapper.toSummaries(orchestrator.listSuites()));
  }

  @Operation(
      summary = "Get suite",
      description = "Returns a suite definition and the number of configurations it expands to.")
  @GetMapping("/suites/{suiteId}")
  public ResponseEntity<SuiteDetailResponse> getSuite(@PathVariable String suiteId) {
    return ResponseEntity.ok(suiteMapper.toDetail(orchestrator.getSuite(suiteId)));
  }

  @Operation(summary = "Save suite", description = "Validates and stores a suite definition.")
  @PostMapping("/suites")
  public ResponseEntity<SuiteDetailResponse> saveSuite(@RequestBody TestSuiteDefinition suite) {
    log.info("Received suite definition id={}", suite.id());
    return responseFactory.created(suiteMapper.toDetail(orchestrator.saveSuite(suite)));
  }

  @Operation(summary = "Delete suite", description = "Deletes a saved suite. Built-ins stay.")
  @DeleteMapping("/suites/{suiteId}")
  public ResponseEntity<Void> deleteSuite(@PathVariable String suiteId) {
    orchestrator.deleteSuite(suiteId);
    return responseFactory.noContent();
  }

  // -----------------------------------------------------
  // Run submission and control
  // -----------------------------------------------------
  @Operation(
      summary = "Start run",
      description = "Claims a capable client and starts executing every configuration of a suite.")
  @PostMapping("/runs")
  public ResponseEntity<RunStartResponse> startRun(@Valid @RequestBody StartRunRequest request) {
    log.info(
        "Received run request suite={} client={} type={}",
        request.getSuiteId(),
        request.getClientId(),
        request.getClientType());
    ClientType clientType =
        request.getClientType() == null || request.getClientType().isBlank()
            ? null
            : clientMapper.mapClientType(request.getClientType());
    var run = orchestrator.startRun(request.getSuiteId(), request.getClientId(), clientType);
    return responseFactory.accepted(
        new RunStartResponse(
            run.getId(),
            run.getStatus(),
            run.getTotalConfigurations(),
            run.getClientId(),
            "Test run started on client " + run.getClientId()));
  }

  @Operation(summary = "Get run", description = "Returns a run with its progress and results.")
  @GetMapping("/runs/{runId}")
  public ResponseEntity<TestRun> getRun(@PathVariable String runId) {
    return ResponseEntity.ok(orchestrator.getRun(runId));
  }

  @Operation(summary = "Cancel run", description = "Requests cancellation of an active run.")
  @DeleteMapping("/runs/{runId}")
  public ResponseEntity<?> cancelRun(@PathVariable String runId) {
    var result = orchestrator.cancelRun(runId);
    log.info("Cancellation requested for run {} -> {}", runId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.error(
          HttpStatus.NOT_FOUND, "Not Found", "Run not found: " + runId);
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT,
          "Conflict",
          "Run " + runId + " is " + result.getRunStatus().getValue() + " and cannot be cancelled");
      case CANCELLATION_REQUESTED -> ResponseEntity.ok(
          new RunCancellationResponse(runId, result.getRunStatus(), "Cancellation requested"));
    };
  }

  // -----------------------------------------------------
  // Run listings and results
  // -----------------------------------------------------
  @Operation(
      summary = "List runs",
      description = "Lists runs newest first, optionally filtered by status and suite.")
  @GetMapping("/runs")
  public ResponseEntity<?> listRuns(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String suiteId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset) {
    RunStatus runStatus = null;
    if (status != null) {
      try {
        runStatus = RunStatus.fromValue(status);
      } catch (IllegalArgumentException ex) {
        log.warn("Invalid status filter: {}", status);
        String allowed =
            Arrays.toString(Arrays.stream(RunStatus.values()).map(RunStatus::getValue).toArray());
        return responseFactory.error(
            HttpStatus.BAD_REQUEST,
            "Invalid Status",
            "Unrecognized status: " + status + ". Allowed: " + allowed);
      }
    }
    var page = orchestrator.listRuns(runStatus, suiteId, limit, offset);
    return ResponseEntity.ok(
        new RunListResponse(
            runMapper.toSummaries(page.runs()),
            page.total(),
            offset == null ? 0 : offset));
  }

  @Operation(
      summary = "Run results",
      description = "Returns stored results of a run, optionally for one provider combination.")
  @GetMapping("/runs/{runId}/results")
  public ResponseEntity<RunResultsResponse> getResults(
      @PathVariable String runId,
      @RequestParam(required = false) String configId,
      @RequestParam(required = false) Integer limit) {
    var results = orchestrator.getResults(runId, configId, limit);
    var run = orchestrator.getRun(runId);
    return ResponseEntity.ok(
        new RunResultsResponse(
            runId,
            run.getStatus(),
            run.getCompletedConfigurations(),
            run.getTotalConfigurations(),
            results));
  }

  // -----------------------------------------------------
  // Analysis and export
  // -----------------------------------------------------
  @Operation(
      summary = "Analyse run",
      description =
          "Ranks configurations, projects them onto network profiles and checks the active"
              + " baseline.")
  @GetMapping("/runs/{runId}/analysis")
  public ResponseEntity<AnalysisReport> analyze(@PathVariable String runId) {
    return ResponseEntity.ok(analysisService.analyze(runId));
  }

  @Operation(summary = "Compare runs", description = "Per-configuration median deltas.")
  @PostMapping("/compare")
  public ResponseEntity<RunComparisonReport> compareRuns(
      @Valid @RequestBody CompareRunsRequest request) {
    return ResponseEntity.ok(
        analysisService.compareRuns(request.getRun1Id(), request.getRun2Id()));
  }

  @Operation(summary = "Export results", description = "Downloads a run's results as CSV or JSON.")
  @GetMapping("/runs/{runId}/export")
  public ResponseEntity<?> export(
      @PathVariable String runId, @RequestParam(defaultValue = "json") String format) {
    if ("csv".equalsIgnoreCase(format)) {
      return ResponseEntity.ok()
          .header(
              HttpHeaders.CONTENT_DISPOSITION,
              "attachment; filename=" + ResultsExporter.csvFileName(runId))
          .contentType(TEXT_CSV)
          .body(analysisService.exportCsv(runId));
    }
    if ("json".equalsIgnoreCase(format)) {
      return ResponseEntity.ok(analysisService.exportJson(runId));
    }
    log.warn("Invalid export format: {}", format);
    return responseFactory.error(
        HttpStatus.BAD_REQUEST,
        "Invalid Format",
        "Unrecognized format: " + format + ". Allowed: [csv, json]");
  }

  // -----------------------------------------------------
  // Misc endpoints
  // -----------------------------------------------------
  @Operation(summary = "Health check", description = "Verifies service health.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = orchestrator.isHealthy();
    log.debug("Health check: {}", healthy ? "UP" : "DOWN");
    return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN"));
  }
}
