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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Found/tagged/failed counters for one resource type within one service pass
 */

public class TaggingMetrics {
  private final String resourceType;
  private final AtomicInteger found = new AtomicInteger();
  private final AtomicInteger tagged = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();

  public TaggingMetrics(String resourceType) {
    this.resourceType = resourceType;
  }

  public void incrementFound() {
    found.incrementAndGet();
  }

  public void incrementTagged() {
    tagged.incrementAndGet();
  }

  public void incrementFailed() {
    failed.incrementAndGet();
  }

  public String getResourceType() {
    return resourceType;
  }

  public int getFound() {
    return found.get();
  }

  public int getTagged() {
    return tagged.get();
  }

  public int getFailed() {
    return failed.get();
  }

  @Override
  public String toString() {
    return String.format("%s: Found=%d, Tagged=%d, Failed=%d", resourceType, getFound(), getTagged(), getFailed());
  }
}
