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

package com.netflix.spinnaker.tagger.errors;

/**
 * Buckets a failed remote call and logs it. Implementations never throw.
 */

public interface ErrorClassifier {

  /**
   * Classifies and logs a failure
   * @param error the failure raised by the remote call
   * @param resourceId identifier of the resource being processed, "all" for listing calls
   * @param service human readable service and resource type
   * @return the category the error fell into
   */

  ErrorCategory classify(Throwable error, String resourceId, String service);
}
