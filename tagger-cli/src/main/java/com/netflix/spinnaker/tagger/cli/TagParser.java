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

package com.netflix.spinnaker.tagger.cli;

import com.netflix.spinnaker.tagger.model.TagSet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the {@code key:value[,key:value...]} tag argument. Values may contain colons.
 */

public final class TagParser {
  private static final String PAIR_SEPARATOR = ",";
  private static final String KEY_VALUE_SEPARATOR = ":";

  private TagParser() {}

  public static TagSet parse(String argument) throws IllegalArgumentException {
    if (argument == null || argument.trim().isEmpty()) {
      throw new IllegalArgumentException("At least one tag must be specified");
    }

    Map<String, String> tags = new LinkedHashMap<>();
    for (String pair : argument.split(PAIR_SEPARATOR, -1)) {
      String[] parts = pair.split(KEY_VALUE_SEPARATOR, 2);
      if (parts.length != 2) {
        throw new IllegalArgumentException(String.format("Invalid tag format: '%s', expected key:value", pair.trim()));
      }

      String key = parts[0].trim();
      String value = parts[1].trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException(String.format("Tag key cannot be empty: '%s'", pair.trim()));
      }

      if (value.isEmpty()) {
        throw new IllegalArgumentException(String.format("Tag value cannot be empty for key: %s", key));
      }

      tags.put(key, value);
    }

    return TagSet.of(tags);
  }
}
