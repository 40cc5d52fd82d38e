package com.mk.fx.qa.latency.harness;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.latency.agent.HarnessAgentClient;
import com.mk.fx.qa.latency.agent.HarnessHttpClient;
import com.mk.fx.qa.latency.agent.dto.AgentCapabilities;
import com.mk.fx.qa.latency.agent.dto.Measurement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Drives a whole run over HTTP: an agent registers and serves work while the harness executes a
 * saved suite, then the run is analysed, exported and snapshotted as a baseline.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LatencyHarnessEndToEndTest {

  private static final String API = "/api/latency-tests";
  private static final String CLIENT_ID = "e2e-web";

  @DynamicPropertySource
  static void harnessProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", () -> "jdbc:h2:mem:e2e;DB_CLOSE_DELAY=-1");
    registry.add("latency.harness.storage.type", () -> "jdbc");
    registry.add("latency.harness.poll-wait", () -> "1s");
    registry.add("latency.harness.configuration-timeout", () -> "10s");
  }

  @LocalServerPort private int port;

  @Autowired private TestRestTemplate rest;

  private HarnessAgentClient agent;
  private Thread agentThread;

  @BeforeEach
  void startAgent() {
    var http = new HarnessHttpClient("http://localhost:" + port, 5, Map.of());
    agent =
        new HarnessAgentClient(
            http,
            CLIENT_ID,
            "web",
            new AgentCapabilities(
                List.of("deepgram"),
                List.of("anthropic"),
                List.of("chatterbox"),
                true,
                false,
                false,
                1));
    agent.heartbeat();
    agentThread =
        new Thread(
            () ->
                agent.serve(
                    configuration ->
                        Measurement.of(
                            120.0, 150, 320, 90, 210, 600 + configuration.repetition()),
                    Duration.ofSeconds(1)),
            "e2e-agent");
    agentThread.setDaemon(true);
    agentThread.start();
  }

  @AfterEach
  void stopAgent() throws InterruptedException {
    agent.close();
    agentThread.join(5_000);
  }

  @Test
  @SuppressWarnings("unchecked")
  void savedSuite_runsOnAgent_andFeedsAnalysisExportAndBaseline() throws Exception {
    var saved =
        rest.postForEntity(API + "/suites", LatencyFixtures.suite("e2e-suite", 3), Map.class);
    assertEquals(HttpStatus.CREATED, saved.getStatusCode());
    assertEquals(3, saved.getBody().get("totalTestCount"));

    var started =
        rest.postForEntity(
            API + "/runs", Map.of("suiteId", "e2e-suite", "clientId", CLIENT_ID), Map.class);
    assertEquals(HttpStatus.ACCEPTED, started.getStatusCode());
    String runId = (String) started.getBody().get("runId");
    assertNotNull(runId);

    Map<String, Object> run = awaitTerminal(runId, Duration.ofSeconds(30));
    assertEquals("completed", run.get("status"));
    assertEquals(3, run.get("completedConfigurations"));

    var results = rest.getForObject(API + "/runs/" + runId + "/results", Map.class);
    var resultList = (List<Map<String, Object>>) results.get("results");
    assertEquals(3, resultList.size());
    assertEquals("web", resultList.get(0).get("clientType"));

    var analysis = rest.getForObject(API + "/runs/" + runId + "/analysis", Map.class);
    var summary = (Map<String, Object>) analysis.get("summary");
    assertEquals(3, summary.get("successfulTests"));
    assertEquals(602.0, ((Number) summary.get("overallMedianE2eMs")).doubleValue());
    var ranked = (List<Map<String, Object>>) analysis.get("rankedConfigurations");
    assertEquals("deepgram_anthropic_claude-3-5-haiku_chatterbox", ranked.get(0).get("configId"));

    var csv = rest.getForEntity(API + "/runs/" + runId + "/export?format=csv", String.class);
    assertEquals(HttpStatus.OK, csv.getStatusCode());
    assertEquals(4, csv.getBody().split("\r\n").length);

    var baseline =
        rest.postForEntity(
            API + "/baselines", Map.of("runId", runId, "setActive", true), Map.class);
    assertEquals(HttpStatus.CREATED, baseline.getStatusCode());
    assertEquals("Baseline from " + runId, baseline.getBody().get("name"));

    var active = rest.getForObject(API + "/baselines/active", Map.class);
    assertEquals(baseline.getBody().get("id"), active.get("id"));

    var check =
        rest.getForObject(
            API + "/baselines/" + active.get("id") + "/check?runId=" + runId, Map.class);
    var checkSummary = (Map<String, Object>) check.get("summary");
    assertEquals(1, checkSummary.get("totalConfigs"));
    assertEquals(0, checkSummary.get("regressedConfigs"));
  }

  @Test
  void startRun_withoutCapableClient_isRejected() {
    var response =
        rest.postForEntity(
            API + "/runs",
            Map.of("suiteId", "e2e-missing-suite", "clientId", CLIENT_ID),
            Map.class);
    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());

    var unknownType =
        rest.postForEntity(
            API + "/runs",
            Map.of("suiteId", "quick_validation", "clientType", "ios_device"),
            Map.class);
    assertEquals(HttpStatus.CONFLICT, unknownType.getStatusCode());
    assertEquals("No Capable Client", unknownType.getBody().get("error"));
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> awaitTerminal(String runId, Duration timeout)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (System.nanoTime() < deadline) {
      Map<String, Object> run = rest.getForObject(API + "/runs/" + runId, Map.class);
      String status = (String) run.get("status");
      if (!"pending".equals(status) && !"running".equals(status)) {
        return run;
      }
      Thread.sleep(100);
    }
    fail("Run " + runId + " did not finish within " + timeout);
    return Map.of();
  }
}
