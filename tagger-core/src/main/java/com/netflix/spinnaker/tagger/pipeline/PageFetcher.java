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

/**
 * Calls a listing API once
 * @param <R> the listed resource
 */

@FunctionalInterface
public interface PageFetcher<R> {

  /**
   * @param nextToken continuation token of the previous page, null for the first page
   */

  ResourcePage<R> fetch(String nextToken);
}
