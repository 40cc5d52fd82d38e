package com.mk.fx.qa.latency.harness.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum ScenarioType {
  AUDIO_INPUT("audio_input"),
  TEXT_INPUT("text_input"),
  TTS_ONLY("tts_only"),
  CONVERSATION("conversation");

  private final String value;

  ScenarioType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ScenarioType fromValue(String value) {
    return Arrays.stream(values())
        .filter(type -> type.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported scenario type: " + value));
  }
}
