package com.mk.fx.qa.latency.harness.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Latency Harness API")
                .description(
                    "Define STT/LLM/TTS test suites, run them on remote clients and analyse the"
                        + " measured latencies."));
  }
}
