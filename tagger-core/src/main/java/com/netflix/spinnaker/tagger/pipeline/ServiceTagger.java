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

import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.ServiceSummary;

/**
 * Tags every supported resource of one cloud service
 */

public interface ServiceTagger {

  /**
   * Name of the service, also used as its registry key
   */

  String getName();

  /**
   * Runs one full tagging pass. Resource and listing failures are logged and counted, not thrown.
   * @param context read-only state of the run
   * @return counters of the pass
   */

  ServiceSummary tagResources(RunContext context);
}
