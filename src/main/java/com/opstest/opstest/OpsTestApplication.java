package com.opstest.opstest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpsTestApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpsTestApplication.class, args);
  }
}
