package com.mk.fx.qa.latency.harness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class LatencyHarnessApplication {

  public static void main(String[] args) {
    SpringApplication.run(LatencyHarnessApplication.class, args);
  }
}
