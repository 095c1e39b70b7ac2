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

package com.netflix.spinnaker.tagger.arn;

import com.netflix.spinnaker.tagger.model.ResourceType;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds resource ARNs for services whose list calls return names rather than ARNs.
 * Malformed names never fail, they only produce a shorter ARN.
 */

public class ArnBuilder {
  private static final String SEPARATOR = "/";
  private static final String DOUBLE_SEPARATOR = SEPARATOR + SEPARATOR;

  private final String region;
  private final String accountId;

  public ArnBuilder(String region, String accountId) {
    this.region = region;
    this.accountId = accountId;
  }

  /**
   * Removes leading and trailing slashes and collapses repeated slashes into one
   * @param name a raw resource name, possibly null
   * @return the cleaned name, never null
   */

  public static String cleanResourceName(String name) {
    if (name == null) {
      return "";
    }

    String cleaned = name;
    while (cleaned.contains(DOUBLE_SEPARATOR)) {
      cleaned = cleaned.replace(DOUBLE_SEPARATOR, SEPARATOR);
    }

    int start = 0;
    int end = cleaned.length();
    while (start < end && cleaned.charAt(start) == '/') {
      start++;
    }

    while (end > start && cleaned.charAt(end - 1) == '/') {
      end--;
    }

    return cleaned.substring(start, end);
  }

  public String build(ResourceType resourceType, String resourceName) {
    return String.format(resourceType.getArnPattern(), region, accountId, cleanResourceName(resourceName));
  }

  /**
   * Builds an ARN for resources addressed by several name segments, e.g. database/table.
   * Each segment is cleaned on its own and empty segments are dropped.
   */

  public String buildCompound(ResourceType resourceType, String... parts) {
    List<String> cleanParts = new ArrayList<>(parts.length);
    for (String part : parts) {
      String cleaned = cleanResourceName(part);
      if (!cleaned.isEmpty()) {
        cleanParts.add(cleaned);
      }
    }

    return build(resourceType, String.join(SEPARATOR, cleanParts));
  }

  public String getRegion() {
    return region;
  }

  public String getAccountId() {
    return accountId;
  }
}
