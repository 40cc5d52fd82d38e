package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.events.SseEventBroadcaster;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Events", description = "Live run progress")
@RestController
@RequestMapping("/api/latency-tests")
@RequiredArgsConstructor
public class EventStreamController {

  private final SseEventBroadcaster broadcaster;

  @Operation(
      summary = "Event stream",
      description =
          "Server-sent events named test_progress, test_result and run_complete, for one run or"
              + " all runs.")
  @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter events(@RequestParam(required = false) String runId) {
    return broadcaster.open(runId);
  }
}
