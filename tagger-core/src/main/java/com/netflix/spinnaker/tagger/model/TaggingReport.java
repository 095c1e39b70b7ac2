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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate result of a run: one summary per registered service and the task errors seen at fan-in
 */

public class TaggingReport {
  private final Map<String, ServiceSummary> summaries;
  private final List<Throwable> errors;

  public TaggingReport(Map<String, ServiceSummary> summaries, List<Throwable> errors) {
    this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
    this.errors = Collections.unmodifiableList(errors);
  }

  public Map<String, ServiceSummary> getSummaries() {
    return summaries;
  }

  public Optional<ServiceSummary> getSummary(String service) {
    return Optional.ofNullable(summaries.get(service));
  }

  public List<Throwable> getErrors() {
    return errors;
  }

  public int getTotalTagged() {
    return summaries.values().stream().mapToInt(ServiceSummary::getTagged).sum();
  }

  public int getTotalFailed() {
    return summaries.values().stream().mapToInt(ServiceSummary::getFailed).sum();
  }
}
