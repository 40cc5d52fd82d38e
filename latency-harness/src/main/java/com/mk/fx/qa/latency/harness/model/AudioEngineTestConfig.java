package com.mk.fx.qa.latency.harness.model;

/** Client-side audio engine settings. The audio engine always runs on device. */
public record AudioEngineTestConfig(
    Double sampleRate, Integer bufferSize, Double vadThreshold, Integer vadSmoothingWindow) {

  public AudioEngineTestConfig {
    sampleRate = sampleRate == null ? 24000.0 : sampleRate;
    bufferSize = bufferSize == null ? 1024 : bufferSize;
    vadThreshold = vadThreshold == null ? 0.5 : vadThreshold;
    vadSmoothingWindow = vadSmoothingWindow == null ? 5 : vadSmoothingWindow;
  }

  public static AudioEngineTestConfig defaults() {
    return new AudioEngineTestConfig(null, null, null, null);
  }
}
