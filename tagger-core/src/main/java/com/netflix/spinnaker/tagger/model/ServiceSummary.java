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

package com.netflix.spinnaker.tagger.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The outcome of one service pass, broken down by resource type in declaration order
 */

public class ServiceSummary {
  private static final Logger LOGGER = LoggerFactory.getLogger(ServiceSummary.class);

  private final String service;
  private final Map<String, TaggingMetrics> metrics = new LinkedHashMap<>();
  private volatile String skipReason;

  public ServiceSummary(String service) {
    this.service = service;
  }

  /**
   * Gets or creates the counters of a resource type
   */

  public synchronized TaggingMetrics metricsFor(String resourceType) {
    return metrics.computeIfAbsent(resourceType, TaggingMetrics::new);
  }

  public synchronized Optional<TaggingMetrics> getMetrics(String resourceType) {
    return Optional.ofNullable(metrics.get(resourceType));
  }

  public synchronized List<TaggingMetrics> getAllMetrics() {
    return new ArrayList<>(metrics.values());
  }

  public void markSkipped(String reason) {
    this.skipReason = reason;
  }

  public boolean isSkipped() {
    return skipReason != null;
  }

  public String getSkipReason() {
    return skipReason;
  }

  public String getService() {
    return service;
  }

  public int getFound() {
    return getAllMetrics().stream().mapToInt(TaggingMetrics::getFound).sum();
  }

  public int getTagged() {
    return getAllMetrics().stream().mapToInt(TaggingMetrics::getTagged).sum();
  }

  public int getFailed() {
    return getAllMetrics().stream().mapToInt(TaggingMetrics::getFailed).sum();
  }

  public void log() {
    if (isSkipped()) {
      LOGGER.info("{} tagging skipped: {}", service, skipReason);
      return;
    }

    LOGGER.info("{} Tagging Summary:", service);
    getAllMetrics().forEach(m -> LOGGER.info("  {}", m));
    LOGGER.info("{} Total: Found={}, Tagged={}, Failed={}", service, getFound(), getTagged(), getFailed());
  }

  @Override
  public String toString() {
    return String.format("%s[found=%d, tagged=%d, failed=%d]", service, getFound(), getTagged(), getFailed());
  }
}
