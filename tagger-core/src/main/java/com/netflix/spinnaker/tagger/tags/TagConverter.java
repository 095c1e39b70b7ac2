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

package com.netflix.spinnaker.tagger.tags;

import com.netflix.spinnaker.tagger.model.TagSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Converts the canonical tag set into the shapes service APIs accept
 */

public final class TagConverter {
  private TagConverter() {}

  /**
   * Converts to a list of key/value pairs
   * @param tags canonical tags
   * @param pairFactory creates one service-specific tag from a key and a value
   * @return one pair per tag, empty (never null) for an empty tag set
   */

  public static <T> List<T> toPairs(TagSet tags, BiFunction<String, String, T> pairFactory) {
    List<T> pairs = new ArrayList<>(tags.size());
    tags.forEach((key, value) -> pairs.add(pairFactory.apply(key, value)));
    return pairs;
  }

  public static Map<String, String> toMap(TagSet tags) {
    return new LinkedHashMap<>(tags.asMap());
  }
}
