package com.opstest.opstest.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMax;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "ops-test")
public class OpsTestProperties {

  @NotBlank
  private String greeting = "Hello from SRE Test!";

  /** Wait applied before answering {@code GET /}, in whole milliseconds. Zero means no wait. */
  @NotNull
  @DurationMin
  @DurationMax(hours = 1)
  private Duration greetingDelay = Duration.ZERO;
}
