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

package com.netflix.spinnaker.tagger.orchestrator;

import com.netflix.spinnaker.tagger.errors.SessionValidationException;

public interface SessionValidator {

  /**
   * Proves the configured credentials work before any service is touched
   * @return the identity behind the credentials
   * @throws SessionValidationException when the credentials are missing, expired or rejected
   */

  CallerIdentity validate() throws SessionValidationException;
}
