package com.mk.fx.qa.latency.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.latency.agent.dto.AgentCapabilities;
import com.mk.fx.qa.latency.agent.dto.Measurement;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HarnessAgentClientTest {

  private static final String WORK_JSON =
      """
      {"dispatchId":"d-1","runId":"r-1",
       "configId":"deepgram_anthropic_claude-3-5-haiku-20241022_chatterbox",
       "configuration":{"id":"config_1","scenarioName":"Short Response","repetition":1,
         "stt":{"provider":"deepgram","language":"en-US"},
         "llm":{"provider":"anthropic","model":"claude-3-5-haiku-20241022","maxTokens":512},
         "tts":{"provider":"chatterbox","chatterboxConfig":{"exaggeration":0.5}},
         "audioEngine":{"sampleRate":24000.0,"bufferSize":1024},
         "networkProfile":"localhost","someFutureField":true}}
      """;

  private HttpServer server;
  private HarnessAgentClient client;
  private final BlockingQueue<JsonNode> heartbeats = new LinkedBlockingQueue<>();
  private final BlockingQueue<JsonNode> results = new LinkedBlockingQueue<>();
  private final AtomicInteger workToHandOut = new AtomicInteger();
  private volatile int resultStatus = 200;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/api/latency-tests/heartbeat",
        exchange -> {
          heartbeats.add(readJson(exchange));
          respond(exchange, 200, "{\"status\":\"ok\"}");
        });
    server.createContext(
        "/api/latency-tests/clients/agent-1/work",
        exchange -> {
          if (workToHandOut.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            respond(exchange, 200, WORK_JSON);
          } else {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
          }
        });
    server.createContext(
        "/api/latency-tests/clients/stranger/work",
        exchange -> respond(exchange, 404, "{\"error\":\"Not Found\"}"));
    server.createContext(
        "/api/latency-tests/results",
        exchange -> {
          results.add(readJson(exchange));
          respond(exchange, resultStatus, "{\"status\":\"received\"}");
        });
    server.start();
    client = newClient("agent-1");
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.stop(0);
  }

  private HarnessAgentClient newClient(String clientId) {
    var baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    var http = new HarnessHttpClient(baseUrl, 2, Map.of());
    var capabilities =
        new AgentCapabilities(
            List.of("deepgram"),
            List.of("anthropic"),
            List.of("chatterbox"),
            true,
            false,
            false,
            1);
    return new HarnessAgentClient(http, clientId, "web", capabilities);
  }

  @Test
  void heartbeat_postsIdentityAndCapabilities() throws Exception {
    client.heartbeat();

    JsonNode body = heartbeats.poll(2, TimeUnit.SECONDS);
    assertNotNull(body);
    assertEquals("agent-1", body.get("clientId").asText());
    assertEquals("web", body.get("clientType").asText());
    assertEquals("deepgram", body.get("capabilities").get("supportedSttProviders").get(0).asText());
    assertTrue(body.get("capabilities").get("hasHighPrecisionTiming").asBoolean());
  }

  @Test
  void pollWork_noContent_returnsEmpty() {
    assertTrue(client.pollWork(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void pollWork_parsesAssignmentAndIgnoresUnknownFields() {
    workToHandOut.set(1);

    var assignment = client.pollWork(Duration.ofMillis(10)).orElseThrow();

    assertEquals("d-1", assignment.dispatchId());
    assertEquals("config_1", assignment.configuration().id());
    assertEquals("claude-3-5-haiku-20241022", assignment.configuration().llm().model());
    assertEquals(0.5, assignment.configuration().tts().chatterboxConfig().get("exaggeration"));
    assertEquals("localhost", assignment.configuration().networkProfile());
  }

  @Test
  void pollWork_unknownClient_throwsNotFound() {
    var stranger = newClient("stranger");

    var ex = assertThrows(HarnessClientException.class, () -> stranger.pollWork(Duration.ZERO));
    assertTrue(ex.isNotFound());
  }

  @Test
  void submitResult_rejectedDispatch_throwsWithStatus() {
    resultStatus = 404;

    var ex =
        assertThrows(
            HarnessClientException.class,
            () -> client.submitResult("gone", Measurement.of(null, 1, 2, 3, 4, 5)));
    assertEquals(404, ex.getStatusCode());
  }

  @Test
  void serve_executesAssignmentAndSubmitsMeasurement() throws Exception {
    workToHandOut.set(1);
    var served =
        new Thread(
            () ->
                client.serve(
                    configuration -> Measurement.of(120.0, 200, 450, 90, 600, 980),
                    Duration.ofMillis(20)));
    served.start();

    JsonNode submitted = results.poll(5, TimeUnit.SECONDS);
    client.close();
    served.join(5_000);

    assertNotNull(submitted);
    assertEquals("agent-1", submitted.get("clientId").asText());
    assertEquals("d-1", submitted.get("dispatchId").asText());
    assertEquals(980.0, submitted.get("result").get("e2eLatencyMs").asDouble());
    assertEquals(0, submitted.get("result").get("errors").size());
    assertFalse(served.isAlive());
    assertFalse(client.isRunning());
  }

  @Test
  void serve_executorFailure_submitsFailedMeasurement() throws Exception {
    workToHandOut.set(1);
    var served =
        new Thread(
            () ->
                client.serve(
                    configuration -> {
                      throw new IllegalStateException("microphone unavailable");
                    },
                    Duration.ofMillis(20)));
    served.start();

    JsonNode submitted = results.poll(5, TimeUnit.SECONDS);
    client.close();
    served.join(5_000);

    assertNotNull(submitted);
    var errors = submitted.get("result").get("errors");
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).asText().contains("microphone unavailable"));
  }

  @Test
  void serve_twice_isRejected() throws Exception {
    var served = new Thread(() -> client.serve(c -> null, Duration.ofMillis(20)));
    served.start();
    long deadline = System.currentTimeMillis() + 5_000;
    while (!client.isRunning() && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }

    assertThrows(IllegalStateException.class, () -> client.serve(c -> null, Duration.ZERO));

    client.close();
    served.join(5_000);
  }

  private static JsonNode readJson(HttpExchange exchange) throws IOException {
    var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    return JsonUtil.mapper().readTree(body);
  }

  private static void respond(HttpExchange exchange, int status, String json) throws IOException {
    byte[] body = json.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }
}
