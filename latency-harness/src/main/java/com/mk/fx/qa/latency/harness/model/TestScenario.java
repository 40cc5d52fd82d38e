package com.mk.fx.qa.latency.harness.model;

/**
 * A conversational exchange to measure. Either an audio file or literal text drives the turn;
 * {@code repetitions} controls how often each configuration replays it.
 */
public record TestScenario(
    String id,
    String name,
    String description,
    ScenarioType scenarioType,
    Integer repetitions,
    String userUtteranceAudioPath,
    String userUtteranceText,
    ResponseType expectedResponseType) {

  public TestScenario {
    scenarioType = scenarioType == null ? ScenarioType.TEXT_INPUT : scenarioType;
    repetitions = repetitions == null ? 10 : repetitions;
    expectedResponseType =
        expectedResponseType == null ? ResponseType.MEDIUM : expectedResponseType;
  }

  public static TestScenario text(String id, String name, int repetitions, String utterance) {
    return new TestScenario(
        id, name, name, ScenarioType.TEXT_INPUT, repetitions, null, utterance, null);
  }
}
