package com.mk.fx.qa.latency.harness.model;

import java.util.List;
import java.util.Set;

/** Suites shipped with the harness. They are seeded at start-up and cannot be deleted. */
public final class PredefinedSuites {

  public static final String QUICK_VALIDATION = "quick_validation";
  public static final String PROVIDER_COMPARISON = "provider_comparison";

  private static final Set<String> BUILT_IN_IDS = Set.of(QUICK_VALIDATION, PROVIDER_COMPARISON);

  private PredefinedSuites() {}

  public static List<TestSuiteDefinition> all() {
    return List.of(quickValidation(), providerComparison());
  }

  public static boolean isBuiltIn(String suiteId) {
    return BUILT_IN_IDS.contains(suiteId);
  }

  /** Fast sanity check for CI pipelines. */
  public static TestSuiteDefinition quickValidation() {
    return new TestSuiteDefinition(
        QUICK_VALIDATION,
        "Quick Validation",
        "Fast sanity check for CI/CD pipelines",
        List.of(
            new TestScenario(
                "short_response",
                "Short Response",
                "Brief Q&A exchange",
                ScenarioType.TEXT_INPUT,
                3,
                null,
                "What is the capital of France?",
                ResponseType.SHORT)),
        List.of(NetworkProfile.LOCALHOST),
        ParameterSpace.of(
            List.of(SttTestConfig.of("deepgram")),
            List.of(LlmTestConfig.of("anthropic", "claude-3-5-haiku-20241022")),
            List.of(TtsTestConfig.of("chatterbox"))));
  }

  public static TestSuiteDefinition providerComparison() {
    return new TestSuiteDefinition(
        PROVIDER_COMPARISON,
        "Provider Comparison",
        "Compare all available providers",
        List.of(
            new TestScenario(
                "short_response",
                "Short Response",
                "Brief Q&A exchange",
                ScenarioType.TEXT_INPUT,
                10,
                null,
                "What is photosynthesis?",
                ResponseType.SHORT),
            new TestScenario(
                "medium_response",
                "Medium Response",
                "Moderate explanation",
                ScenarioType.TEXT_INPUT,
                5,
                null,
                "Explain how the human heart works.",
                ResponseType.MEDIUM)),
        List.of(NetworkProfile.LOCALHOST, NetworkProfile.WIFI, NetworkProfile.CELLULAR_US),
        ParameterSpace.of(
            List.of(
                SttTestConfig.of("deepgram"),
                SttTestConfig.of("assemblyai"),
                SttTestConfig.of("apple")),
            List.of(
                LlmTestConfig.of("anthropic", "claude-3-5-haiku-20241022"),
                LlmTestConfig.of("openai", "gpt-4o-mini"),
                LlmTestConfig.of("selfhosted", "qwen2.5:7b")),
            List.of(
                TtsTestConfig.of("chatterbox"),
                TtsTestConfig.of("vibevoice"),
                TtsTestConfig.of("apple"))));
  }
}
