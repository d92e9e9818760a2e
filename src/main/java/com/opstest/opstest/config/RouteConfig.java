package com.opstest.opstest.config;

import static org.springframework.web.servlet.function.RouterFunctions.route;

import com.opstest.opstest.handler.GreetingHandler;
import com.opstest.opstest.handler.HealthHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

@Slf4j
@Configuration
public class RouteConfig {

  // Anything not listed here falls through to the default not-found handling.
  @Bean
  RouterFunction<ServerResponse> routes(GreetingHandler greeting, HealthHandler health) {
    RouterFunction<ServerResponse> routes = route()
        .GET("/", greeting::home)
        .GET("/healthz", health::healthz)
        .build();
    log.info("Registered routes: {}", routes);
    return routes;
  }
}
