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

/**
 * One page of a listing call and the token to fetch the next one
 */

public final class ResourcePage<R> {
  private final List<R> items;
  private final String nextToken;

  private ResourcePage(List<R> items, String nextToken) {
    this.items = items == null ? Collections.emptyList() : items;
    this.nextToken = nextToken;
  }

  public static <R> ResourcePage<R> of(List<R> items, String nextToken) {
    return new ResourcePage<>(items, nextToken);
  }

  /**
   * A page with no continuation, used for APIs that do not paginate
   */

  public static <R> ResourcePage<R> last(List<R> items) {
    return new ResourcePage<>(items, null);
  }

  public List<R> getItems() {
    return items;
  }

  public String getNextToken() {
    return nextToken;
  }

  public boolean hasNext() {
    return nextToken != null && !nextToken.isEmpty();
  }
}
