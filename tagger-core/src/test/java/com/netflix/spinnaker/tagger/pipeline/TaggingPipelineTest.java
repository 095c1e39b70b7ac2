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

package com.netflix.spinnaker.tagger.pipeline;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.Cancellation;
import com.netflix.spinnaker.tagger.model.MapClientFactory;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.ServiceSummary;
import com.netflix.spinnaker.tagger.model.TagSet;
import com.netflix.spinnaker.tagger.model.TaggingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TaggingPipelineTest {
  private static final String SERVICE = "Test";

  @Mock
  private ErrorClassifier errorClassifier;

  private TaggingPipeline pipeline;
  private Cancellation cancellation;
  private RunContext context;
  private ServiceSummary summary;
  private List<String> tagged;

  @BeforeEach
  void setUp() {
    pipeline = new TaggingPipeline(errorClassifier);
    cancellation = new Cancellation();
    context = new RunContext(
      "us-east-1", "123456789012", TagSet.of(Collections.singletonMap("team", "data")), new MapClientFactory(), cancellation
    );
    summary = new ServiceSummary(SERVICE);
    tagged = new ArrayList<>();
  }

  private TaggableResourceType.Builder<String> namesIn(List<String> names) {
    return TaggableResourceType.<String>builder("Thing")
      .pages(token -> ResourcePage.last(names))
      .displayName(name -> name)
      .identifier(name -> "id-" + name)
      .tagWith(tagged::add);
  }

  private TaggingMetrics metrics(String type) {
    return summary.getMetrics(type).orElseThrow(IllegalStateException::new);
  }

  @Nested
  @DisplayName("Pagination")
  class Pagination {

    @Test
    @DisplayName("Should follow continuation tokens until a page has none")
    void shouldVisitEveryPage() {
      List<String> tokensSeen = new ArrayList<>();
      TaggableResourceType<String> type = TaggableResourceType.<String>builder("Thing")
        .pages(token -> {
          tokensSeen.add(token);
          if (token == null) {
            return ResourcePage.of(Arrays.asList("a", "b"), "t1");
          }
          if (token.equals("t1")) {
            return ResourcePage.of(Collections.singletonList("c"), "t2");
          }
          return ResourcePage.of(Collections.singletonList("d"), "");
        })
        .identifier(name -> name)
        .tagWith(tagged::add)
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(tokensSeen).containsExactly(null, "t1", "t2");
      assertThat(tagged).containsExactly("a", "b", "c", "d");
      assertThat(metrics("Thing").getFound()).isEqualTo(4);
      assertThat(metrics("Thing").getTagged()).isEqualTo(4);
    }
  }

  @Nested
  @DisplayName("Failure isolation")
  class FailureIsolation {

    @Test
    @DisplayName("A failing resource should not stop the others")
    void shouldContinueAfterResourceFailure() {
      RuntimeException boom = new RuntimeException("boom");
      TaggableResourceType<String> type = namesIn(Arrays.asList("a", "b", "c"))
        .tagWith(id -> {
          if (id.equals("id-b")) {
            throw boom;
          }
          tagged.add(id);
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(tagged).containsExactly("id-a", "id-c");
      assertThat(metrics("Thing").getFound()).isEqualTo(3);
      assertThat(metrics("Thing").getTagged()).isEqualTo(2);
      assertThat(metrics("Thing").getFailed()).isEqualTo(1);
      verify(errorClassifier).classify(boom, "id-b", "Test Thing");
    }

    @Test
    @DisplayName("A failing identifier lookup counts as a resource failure")
    void shouldCountIdentifierFailure() {
      TaggableResourceType<String> type = namesIn(Arrays.asList("a", "b"))
        .identifier(name -> {
          if (name.equals("a")) {
            throw new IllegalStateException("describe failed");
          }
          return "id-" + name;
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(tagged).containsExactly("id-b");
      assertThat(metrics("Thing").getFailed()).isEqualTo(1);
      verify(errorClassifier).classify(any(IllegalStateException.class), eq("a"), eq("Test Thing"));
    }

    @Test
    @DisplayName("A failing first page should abort the type with nothing counted")
    void shouldAbortOnFirstListingFailure() {
      RuntimeException denied = new RuntimeException("denied");
      TaggableResourceType<String> type = namesIn(Collections.emptyList())
        .pages(token -> {
          throw denied;
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(metrics("Thing").getFound()).isZero();
      assertThat(tagged).isEmpty();
      verify(errorClassifier).classify(denied, TaggingPipeline.ALL_RESOURCES, "Test Thing");
    }

    @Test
    @DisplayName("A failing later page should keep what earlier pages tagged")
    void shouldKeepCountsOnLaterListingFailure() {
      TaggableResourceType<String> type = namesIn(Collections.emptyList())
        .pages(token -> {
          if (token == null) {
            return ResourcePage.of(Arrays.asList("a", "b"), "next");
          }
          throw new RuntimeException("throttled");
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(tagged).containsExactly("id-a", "id-b");
      assertThat(metrics("Thing").getFound()).isEqualTo(2);
      assertThat(metrics("Thing").getTagged()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Exclusion")
  class Exclusion {

    @Test
    @DisplayName("Excluded resources are neither counted nor identified nor tagged")
    void shouldSkipExcludedResources() {
      List<String> identified = new ArrayList<>();
      TaggableResourceType<String> type = namesIn(Arrays.asList("primary", "analytics"))
        .excluding("primary"::equals)
        .identifier(name -> {
          identified.add(name);
          return "id-" + name;
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(identified).containsExactly("analytics");
      assertThat(tagged).containsExactly("id-analytics");
      assertThat(metrics("Thing").getFound()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Child resource types")
  class Children {

    @Test
    @DisplayName("Children run only for successfully tagged parents and their failures stay with that parent")
    void shouldRunChildrenPerTaggedParent() {
      TaggableResourceType<String> parents = namesIn(Arrays.asList("lb-1", "lb-2", "lb-3"))
        .tagWith(id -> {
          if (id.equals("id-lb-2")) {
            throw new RuntimeException("parent failed");
          }
          tagged.add(id);
        })
        .children(parent -> Collections.singletonList(
          TaggableResourceType.<String>builder("Child")
            .pages(token -> {
              if (parent.equals("lb-3")) {
                throw new RuntimeException("child listing failed");
              }
              return ResourcePage.last(Arrays.asList(parent + "/tg-1", parent + "/tg-2"));
            })
            .identifier(name -> name)
            .tagWith(tagged::add)
            .build()
        ))
        .build();

      pipeline.run(context, SERVICE, parents, summary);

      assertThat(tagged).containsExactly("id-lb-1", "lb-1/tg-1", "lb-1/tg-2", "id-lb-3");
      assertThat(metrics("Thing").getTagged()).isEqualTo(2);
      assertThat(metrics("Thing").getFailed()).isEqualTo(1);
      assertThat(metrics("Child").getFound()).isEqualTo(2);
      assertThat(metrics("Child").getTagged()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Cancellation")
  class CancellationTests {

    @Test
    @DisplayName("Should not list anything once the run is cancelled")
    void shouldStopBeforeListing() {
      List<String> tokensSeen = new ArrayList<>();
      cancellation.cancel();

      pipeline.run(context, SERVICE, namesIn(Collections.singletonList("a"))
        .pages(token -> {
          tokensSeen.add(token);
          return ResourcePage.last(Collections.singletonList("a"));
        })
        .build(), summary);

      assertThat(tokensSeen).isEmpty();
      assertThat(tagged).isEmpty();
    }

    @Test
    @DisplayName("Should stop between resources when cancelled mid-page")
    void shouldStopBetweenResources() {
      TaggableResourceType<String> type = namesIn(Arrays.asList("a", "b", "c"))
        .tagWith(id -> {
          tagged.add(id);
          cancellation.cancel();
        })
        .build();

      pipeline.run(context, SERVICE, type, summary);

      assertThat(tagged).containsExactly("id-a");
      verify(errorClassifier, never()).classify(any(), any(), any());
    }
  }
}
