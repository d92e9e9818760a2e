package com.opstest.opstest.handler;

import com.opstest.opstest.config.OpsTestProperties;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

@Slf4j
@Component
@RequiredArgsConstructor
public class GreetingHandler {

  private final OpsTestProperties properties;

  public ServerResponse home(ServerRequest request) {
    Duration delay = properties.getGreetingDelay();
    if (!delay.isZero()) {
      log.debug("Delaying greeting by {}", delay);
      pause(delay);
    }
    return ServerResponse.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body(properties.getGreeting());
  }

  private void pause(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while delaying greeting", e);
    }
  }
}
