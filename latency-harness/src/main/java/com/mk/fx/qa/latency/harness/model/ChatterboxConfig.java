package com.mk.fx.qa.latency.harness.model;

/** Voice-synthesis knobs specific to the Chatterbox TTS provider. */
public record ChatterboxConfig(
    Double exaggeration,
    Double cfgWeight,
    Double speed,
    Boolean enableParalinguisticTags,
    Boolean useMultilingual,
    String language,
    Boolean useStreaming,
    Integer seed) {

  public ChatterboxConfig {
    exaggeration = exaggeration == null ? 0.5 : exaggeration;
    cfgWeight = cfgWeight == null ? 0.5 : cfgWeight;
    speed = speed == null ? 1.0 : speed;
    enableParalinguisticTags =
        enableParalinguisticTags == null ? Boolean.FALSE : enableParalinguisticTags;
    useMultilingual = useMultilingual == null ? Boolean.FALSE : useMultilingual;
    language = language == null ? "en" : language;
    useStreaming = useStreaming == null ? Boolean.TRUE : useStreaming;
  }

  public static ChatterboxConfig defaults() {
    return new ChatterboxConfig(null, null, null, null, null, null, null, null);
  }
}
