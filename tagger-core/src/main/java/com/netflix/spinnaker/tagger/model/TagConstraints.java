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

import java.util.Map;
import java.util.Optional;

/**
 * Tag limits documented by a service. Checked once before a service pass starts.
 */

public final class TagConstraints {
  public static final TagConstraints AWS_DEFAULT = new TagConstraints(50, 128, 256, "aws:");

  private final int maxTags;
  private final int maxKeyLength;
  private final int maxValueLength;
  private final String reservedPrefix;

  public TagConstraints(int maxTags, int maxKeyLength, int maxValueLength, String reservedPrefix) {
    this.maxTags = maxTags;
    this.maxKeyLength = maxKeyLength;
    this.maxValueLength = maxValueLength;
    this.reservedPrefix = reservedPrefix;
  }

  /**
   * Checks a tag set against these limits
   * @param tags tags about to be applied
   * @return the first violation found, empty if the tags are acceptable
   */

  public Optional<String> check(TagSet tags) {
    if (tags.size() > maxTags) {
      return Optional.of(String.format("number of tags exceeds maximum limit of %d", maxTags));
    }

    for (Map.Entry<String, String> entry : tags.asMap().entrySet()) {
      String key = entry.getKey();
      if (reservedPrefix != null && key.startsWith(reservedPrefix)) {
        return Optional.of(String.format("tag key cannot start with '%s': %s", reservedPrefix, key));
      }

      if (key.length() < 1 || key.length() > maxKeyLength) {
        return Optional.of(String.format("tag key length must be between 1 and %d characters: %s", maxKeyLength, key));
      }

      if (entry.getValue().length() > maxValueLength) {
        return Optional.of(String.format("tag value length must not exceed %d characters for key: %s", maxValueLength, key));
      }
    }

    return Optional.empty();
  }

  public int getMaxTags() {
    return maxTags;
  }

  public int getMaxKeyLength() {
    return maxKeyLength;
  }

  public int getMaxValueLength() {
    return maxValueLength;
  }

  public String getReservedPrefix() {
    return reservedPrefix;
  }
}
