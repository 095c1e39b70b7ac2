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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Everything the pipeline needs to tag one kind of resource of a service:
 * how to list it, which instances to skip, how to identify an instance and how to apply tags.
 * Children are resource types scoped to a successfully tagged parent.
 *
 * @param <R> the resource as returned by the listing API
 */

public final class TaggableResourceType<R> {
  private final String name;
  private final PageFetcher<R> pageFetcher;
  private final Predicate<R> exclusion;
  private final Function<R, String> displayName;
  private final Function<R, String> identifier;
  private final Consumer<String> tagApplier;
  private final Function<R, List<TaggableResourceType<?>>> children;

  private TaggableResourceType(Builder<R> builder) {
    this.name = builder.name;
    this.pageFetcher = Objects.requireNonNull(builder.pageFetcher, "pageFetcher");
    this.identifier = Objects.requireNonNull(builder.identifier, "identifier");
    this.tagApplier = Objects.requireNonNull(builder.tagApplier, "tagApplier");
    this.exclusion = builder.exclusion;
    this.displayName = builder.displayName == null ? builder.identifier : builder.displayName;
    this.children = builder.children;
  }

  public static <R> Builder<R> builder(String name) {
    return new Builder<>(name);
  }

  public String getName() {
    return name;
  }

  ResourcePage<R> fetch(String nextToken) {
    return pageFetcher.fetch(nextToken);
  }

  boolean isExcluded(R resource) {
    return exclusion.test(resource);
  }

  String displayName(R resource) {
    return displayName.apply(resource);
  }

  String identify(R resource) {
    return identifier.apply(resource);
  }

  void applyTags(String resourceId) {
    tagApplier.accept(resourceId);
  }

  List<TaggableResourceType<?>> childrenOf(R resource) {
    return children.apply(resource);
  }

  public static class Builder<R> {
    private final String name;
    private PageFetcher<R> pageFetcher;
    private Predicate<R> exclusion = r -> false;
    private Function<R, String> displayName;
    private Function<R, String> identifier;
    private Consumer<String> tagApplier;
    private Function<R, List<TaggableResourceType<?>>> children = r -> Collections.emptyList();

    private Builder(String name) {
      this.name = name;
    }

    public Builder<R> pages(PageFetcher<R> pageFetcher) {
      this.pageFetcher = pageFetcher;
      return this;
    }

    public Builder<R> excluding(Predicate<R> exclusion) {
      this.exclusion = exclusion;
      return this;
    }

    public Builder<R> displayName(Function<R, String> displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder<R> identifier(Function<R, String> identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder<R> tagWith(Consumer<String> tagApplier) {
      this.tagApplier = tagApplier;
      return this;
    }

    public Builder<R> children(Function<R, List<TaggableResourceType<?>>> children) {
      this.children = children;
      return this;
    }

    public TaggableResourceType<R> build() {
      return new TaggableResourceType<>(this);
    }
  }
}
