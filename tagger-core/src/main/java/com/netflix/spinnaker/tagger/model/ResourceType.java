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

/**
 * Describes how the identifier of one kind of resource is formed.
 * The ARN pattern consumes region, account id and the cleaned resource name, in that order.
 */

public final class ResourceType {
  private final String service;
  private final String type;
  private final String arnPattern;

  public ResourceType(String service, String type, String arnPattern) {
    this.service = service;
    this.type = type;
    this.arnPattern = arnPattern;
  }

  public String getService() {
    return service;
  }

  public String getType() {
    return type;
  }

  public String getArnPattern() {
    return arnPattern;
  }

  @Override
  public String toString() {
    return service + ":" + type;
  }
}
