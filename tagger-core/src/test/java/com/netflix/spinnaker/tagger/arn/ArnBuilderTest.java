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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ArnBuilderTest {
  private static final ResourceType GLUE_DATABASE =
    new ResourceType("glue", "database", "arn:aws:glue:%s:%s:database/%s");
  private static final ResourceType GLUE_TABLE =
    new ResourceType("glue", "table", "arn:aws:glue:%s:%s:table/%s");

  private final ArnBuilder arnBuilder = new ArnBuilder("us-east-1", "123456789012");

  @Nested
  @DisplayName("Resource name cleaning")
  class CleanResourceName {

    @Test
    @DisplayName("Should strip leading and trailing slashes")
    void shouldStripOuterSlashes() {
      assertThat(ArnBuilder.cleanResourceName("/my-db/")).isEqualTo("my-db");
      assertThat(ArnBuilder.cleanResourceName("///my-db")).isEqualTo("my-db");
    }

    @Test
    @DisplayName("Should collapse repeated slashes")
    void shouldCollapseRepeatedSlashes() {
      assertThat(ArnBuilder.cleanResourceName("a//b///c")).isEqualTo("a/b/c");
    }

    @Test
    @DisplayName("Should return an empty name for null, empty or slash-only input")
    void shouldReturnEmptyForDegenerateInput() {
      assertThat(ArnBuilder.cleanResourceName(null)).isEmpty();
      assertThat(ArnBuilder.cleanResourceName("")).isEmpty();
      assertThat(ArnBuilder.cleanResourceName("////")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"plain", "/a/", "a//b", "//x//y//", "/", "a/b/c", " spaced name "})
    @DisplayName("Cleaning an already cleaned name should change nothing")
    void shouldBeIdempotent(String name) {
      String once = ArnBuilder.cleanResourceName(name);
      assertThat(ArnBuilder.cleanResourceName(once)).isEqualTo(once);
      assertThat(once).doesNotStartWith("/").doesNotEndWith("/").doesNotContain("//");
    }
  }

  @Nested
  @DisplayName("ARN building")
  class Build {

    @Test
    @DisplayName("Should fill region, account and cleaned name into the pattern")
    void shouldBuildArn() {
      assertThat(arnBuilder.build(GLUE_DATABASE, "/sales//db/"))
        .isEqualTo("arn:aws:glue:us-east-1:123456789012:database/sales/db");
    }

    @Test
    @DisplayName("Should join compound parts with a single slash")
    void shouldBuildCompoundArn() {
      assertThat(arnBuilder.buildCompound(GLUE_TABLE, "sales", "orders"))
        .isEqualTo("arn:aws:glue:us-east-1:123456789012:table/sales/orders");
    }

    @Test
    @DisplayName("Should drop parts that are empty after cleaning")
    void shouldDropEmptyParts() {
      assertThat(arnBuilder.buildCompound(GLUE_TABLE, "/sales/", "", "//", null, "orders/"))
        .isEqualTo("arn:aws:glue:us-east-1:123456789012:table/sales/orders");
    }
  }
}
