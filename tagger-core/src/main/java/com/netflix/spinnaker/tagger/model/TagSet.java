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
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * The canonical key/value tags applied to every discovered resource.
 * Built once per run and never mutated afterwards.
 */

public final class TagSet {
  private static final TagSet EMPTY = new TagSet(Collections.emptyMap());

  private final Map<String, String> tags;

  private TagSet(Map<String, String> tags) {
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  public static TagSet empty() {
    return EMPTY;
  }

  /**
   * Creates a tag set preserving the iteration order of the given map
   * @param tags tag key to tag value
   * @return an immutable tag set
   * @throws IllegalArgumentException if a key is blank or a value is null
   */

  public static TagSet of(Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) {
      return EMPTY;
    }

    tags.forEach((key, value) -> {
      if (key == null || key.trim().isEmpty()) {
        throw new IllegalArgumentException("Tag keys must not be empty");
      }

      if (value == null) {
        throw new IllegalArgumentException(String.format("Tag %s has no value", key));
      }
    });

    return new TagSet(tags);
  }

  /**
   * Merges two tag sets; entries of {@code overrides} win on key collisions
   */

  public static TagSet merge(TagSet base, TagSet overrides) {
    Map<String, String> merged = new LinkedHashMap<>(base.asMap());
    merged.putAll(overrides.asMap());
    return of(merged);
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  public int size() {
    return tags.size();
  }

  public String get(String key) {
    return tags.get(key);
  }

  public Map<String, String> asMap() {
    return tags;
  }

  public void forEach(BiConsumer<String, String> action) {
    tags.forEach(action);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof TagSet) {
      TagSet that = (TagSet) obj;
      return tags.equals(that.tags);
    }

    return false;
  }

  @Override
  public int hashCode() {
    return tags.hashCode();
  }

  @Override
  public String toString() {
    return tags.toString();
  }
}
