package com.mk.fx.qa.latency.harness.analysis;

import com.mk.fx.qa.latency.harness.model.TestResult;
import com.mk.fx.qa.latency.harness.model.TestRun;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Flattens a run's results for download. */
@Component
public class ResultsExporter {

  static final List<String> CSV_HEADER =
      List.of(
          "config_id",
          "scenario_name",
          "repetition",
          "timestamp",
          "stt_latency_ms",
          "llm_ttfb_ms",
          "llm_completion_ms",
          "tts_ttfb_ms",
          "tts_completion_ms",
          "e2e_latency_ms",
          "network_profile",
          "is_success",
          "errors");

  /** One header row and one row per result, in storage order, RFC 4180 quoting. */
  public String toCsv(TestRun run) {
    var out = new StringBuilder();
    appendRow(out, CSV_HEADER);
    for (TestResult r : run.getResults()) {
      appendRow(
          out,
          List.of(
              nullToEmpty(r.configId()),
              nullToEmpty(r.scenarioName()),
              String.valueOf(r.repetition()),
              r.timestamp().toString(),
              r.sttLatencyMs() == null ? "" : String.valueOf(r.sttLatencyMs()),
              String.valueOf(r.llmTtfbMs()),
              String.valueOf(r.llmCompletionMs()),
              String.valueOf(r.ttsTtfbMs()),
              String.valueOf(r.ttsCompletionMs()),
              String.valueOf(r.e2eLatencyMs()),
              r.networkProfile().getValue(),
              String.valueOf(r.isSuccess()),
              String.join(";", r.errors())));
    }
    return out.toString();
  }

  /** Run identity, timing and every result, ready for JSON serialisation. */
  public Map<String, Object> toJsonDocument(TestRun run) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("runId", run.getId());
    doc.put("suiteName", run.getSuiteName());
    doc.put("startedAt", run.getStartedAt());
    Instant completedAt = run.getCompletedAt();
    doc.put("completedAt", completedAt);
    doc.put("results", run.getResults());
    return doc;
  }

  public static String csvFileName(String runId) {
    return "latency_results_" + runId + ".csv";
  }

  private static void appendRow(StringBuilder out, List<String> cells) {
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        out.append(',');
      }
      out.append(escape(cells.get(i)));
    }
    out.append("\r\n");
  }

  private static String escape(String cell) {
    if (cell.indexOf(',') < 0
        && cell.indexOf('"') < 0
        && cell.indexOf('\n') < 0
        && cell.indexOf('\r') < 0) {
      return cell;
    }
    return '"' + cell.replace("\"", "\"\"") + '"';
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
