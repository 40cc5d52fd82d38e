package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.cfg.HarnessCfg;
import com.mk.fx.qa.latency.harness.client.ClientRegistry;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.HeartbeatRequest;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.HeartbeatResponse;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.ResultAcknowledgement;
import com.mk.fx.qa.latency.harness.dto.controllerresponse.ResultSubmission;
import com.mk.fx.qa.latency.harness.model.ClientStatus;
import com.mk.fx.qa.latency.harness.transport.PollingClientTransport;
import com.mk.fx.qa.latency.harness.transport.WorkItem;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Endpoints called by test clients: heartbeat, work polling and result submission. */
@Slf4j
@Tag(name = "Test Clients", description = "Registration and work exchange with test clients")
@RestController
@RequestMapping("/api/latency-tests")
@Validated
@RequiredArgsConstructor
public class ClientController {

  private final ClientRegistry registry;
  private final PollingClientTransport transport;
  private final ClientMapper clientMapper;
  private final HarnessCfg properties;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "List clients", description = "Lists registered test clients.")
  @GetMapping("/clients")
  public ResponseEntity<List<ClientStatus>> listClients() {
    return ResponseEntity.ok(registry.listClients());
  }

  @Operation(
      summary = "Client heartbeat",
      description = "Registers an unknown client or refreshes a known one.")
  @PostMapping("/heartbeat")
  public ResponseEntity<HeartbeatResponse> heartbeat(
      @Valid @RequestBody HeartbeatRequest request) {
    var clientType = clientMapper.mapClientType(request.getClientType());
    var capabilities =
        request.getCapabilities() == null
            ? null
            : clientMapper.toCapabilities(request.getCapabilities());
    var status = registry.register(request.getClientId(), clientType, capabilities);
    log.debug("Heartbeat from client {}", request.getClientId());
    return ResponseEntity.ok(new HeartbeatResponse("ok", status));
  }

  @Operation(
      summary = "Poll for work",
      description =
          "Waits for the next configuration dispatched to the client. 204 when nothing arrives"
              + " within the wait window.")
  @GetMapping("/clients/{clientId}/work")
  public ResponseEntity<WorkItem> pollWork(
      @PathVariable String clientId, @RequestParam(required = false) Long waitMs) {
    registry.heartbeat(clientId);
    var wait = effectiveWait(waitMs);
    return transport
        .pollWork(clientId, wait)
        .map(
            item -> {
              log.debug("Client {} picked up {}", clientId, item.configuration().id());
              return ResponseEntity.ok(item);
            })
        .orElseGet(responseFactory::noContent);
  }

  @Operation(
      summary = "Submit result",
      description = "Completes a dispatched configuration with the client's measurement.")
  @PostMapping("/results")
  public ResponseEntity<ResultAcknowledgement> submitResult(
      @Valid @RequestBody ResultSubmission submission) {
    transport.submitResult(
        submission.getClientId(), submission.getDispatchId(), submission.getResult());
    log.debug(
        "Client {} submitted result for dispatch {}",
        submission.getClientId(),
        submission.getDispatchId());
    return ResponseEntity.ok(new ResultAcknowledgement("received", submission.getDispatchId()));
  }

  private Duration effectiveWait(Long waitMs) {
    var max = properties.getPollWait();
    if (waitMs == null || waitMs < 0) {
      return max;
    }
    var requested = Duration.ofMillis(waitMs);
    return requested.compareTo(max) < 0 ? requested : max;
  }
}
