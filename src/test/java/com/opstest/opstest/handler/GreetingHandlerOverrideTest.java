package com.opstest.opstest.handler;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "ops-test.greeting=Hello from staging")
class GreetingHandlerOverrideTest {

  @Autowired TestRestTemplate rest;

  @Test @DisplayName("configured greeting replaces the default body")
  void greetingOverride() {
    ResponseEntity<String> res = rest.getForEntity("/", String.class);

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(res.getBody()).isEqualTo("Hello from staging");
  }
}
