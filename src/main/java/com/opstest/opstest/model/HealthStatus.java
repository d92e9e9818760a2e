package com.opstest.opstest.model;

import lombok.Value;

@Value
public class HealthStatus {

  public static final HealthStatus OK = new HealthStatus("ok");

  String status;
}
