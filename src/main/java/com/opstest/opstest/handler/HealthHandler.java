package com.opstest.opstest.handler;

import com.opstest.opstest.model.HealthStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

@Component
public class HealthHandler {

  public ServerResponse healthz(ServerRequest request) {
    return ServerResponse.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(HealthStatus.OK);
  }
}
