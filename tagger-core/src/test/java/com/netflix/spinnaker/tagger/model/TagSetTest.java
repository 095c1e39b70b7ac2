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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagSetTest {

  @Test
  @DisplayName("Should keep insertion order and be unmodifiable")
  void shouldBeOrderedAndImmutable() {
    Map<String, String> source = new LinkedHashMap<>();
    source.put("b", "2");
    source.put("a", "1");
    TagSet tags = TagSet.of(source);
    source.put("c", "3");

    assertThat(tags.asMap().keySet()).containsExactly("b", "a");
    assertThatThrownBy(() -> tags.asMap().put("d", "4")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Should reject blank keys")
  void shouldRejectBlankKeys() {
    assertThatThrownBy(() -> TagSet.of(Collections.singletonMap(" ", "value")))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Override entries should win on merge")
  void shouldMergeWithOverrides() {
    TagSet base = TagSet.of(Collections.singletonMap("map-migrated", "mig12345"));
    Map<String, String> custom = new LinkedHashMap<>();
    custom.put("team", "data");
    custom.put("map-migrated", "mig999");

    TagSet merged = TagSet.merge(base, TagSet.of(custom));

    assertThat(merged.size()).isEqualTo(2);
    assertThat(merged.get("map-migrated")).isEqualTo("mig999");
    assertThat(merged.get("team")).isEqualTo("data");
  }

  @Test
  @DisplayName("An empty map yields the empty tag set")
  void shouldBeEmpty() {
    assertThat(TagSet.of(Collections.emptyMap()).isEmpty()).isTrue();
    assertThat(TagSet.empty()).isEqualTo(TagSet.of(null));
  }
}
