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

/**
 * Hands out authenticated service clients scoped to the run's region
 */

public interface ClientFactory {

  /**
   * Gets a client implementing the given capability
   * @param type the capability interface a tagger depends on
   * @return a client, created on first use and shared afterwards
   * @throws IllegalArgumentException if no client is known for the type
   */

  <T> T getClient(Class<T> type);
}
