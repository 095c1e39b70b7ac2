/*
 * Copyright 2017 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.spinnaker.tagger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties("tagger")
public class TaggerProperties {
  private Duration throttleDelay = Duration.ofSeconds(1);
  private Integer poolSize = 12;
  private Duration shutdownTimeout = Duration.ofSeconds(30);
  private Map<String, ServiceConfig> services = new HashMap<>();

  public Duration getThrottleDelay() {
    return throttleDelay;
  }

  public void setThrottleDelay(Duration throttleDelay) {
    this.throttleDelay = throttleDelay;
  }

  public Integer getPoolSize() {
    return poolSize;
  }

  public void setPoolSize(Integer poolSize) {
    this.poolSize = poolSize;
  }

  /**
   * How long the context waits for running service passes once shutdown starts
   */

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }

  public Map<String, ServiceConfig> getServices() {
    return services;
  }

  public void setServices(Map<String, ServiceConfig> services) {
    this.services = services;
  }

  /**
   * Services without an entry are enabled
   */

  public boolean isEnabled(String service) {
    return services.entrySet()
      .stream()
      .filter(e -> e.getKey().equalsIgnoreCase(service))
      .findFirst()
      .map(e -> !Boolean.FALSE.equals(e.getValue().getEnabled()))
      .orElse(true);
  }

  public static class ServiceConfig {
    private Boolean enabled = true;

    public Boolean getEnabled() {
      return enabled;
    }

    public void setEnabled(Boolean enabled) {
      this.enabled = enabled;
    }
  }
}
