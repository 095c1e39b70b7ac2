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

package com.netflix.spinnaker.tagger.aws;

import com.netflix.spinnaker.tagger.model.ResourceType;

/**
 * ARN shapes of resources whose list calls only return names
 */

public final class AwsResourceTypes {
  private AwsResourceTypes() {}

  public static final ResourceType ATHENA_WORKGROUP =
    new ResourceType("athena", "workgroup", "arn:aws:athena:%s:%s:workgroup/%s");
  public static final ResourceType ATHENA_DATA_CATALOG =
    new ResourceType("athena", "datacatalog", "arn:aws:athena:%s:%s:datacatalog/%s");

  public static final ResourceType GLUE_DATABASE =
    new ResourceType("glue", "database", "arn:aws:glue:%s:%s:database/%s");
  public static final ResourceType GLUE_CONNECTION =
    new ResourceType("glue", "connection", "arn:aws:glue:%s:%s:connection/%s");
  public static final ResourceType GLUE_CRAWLER =
    new ResourceType("glue", "crawler", "arn:aws:glue:%s:%s:crawler/%s");
  public static final ResourceType GLUE_JOB =
    new ResourceType("glue", "job", "arn:aws:glue:%s:%s:job/%s");
  public static final ResourceType GLUE_TRIGGER =
    new ResourceType("glue", "trigger", "arn:aws:glue:%s:%s:trigger/%s");
  public static final ResourceType GLUE_WORKFLOW =
    new ResourceType("glue", "workflow", "arn:aws:glue:%s:%s:workflow/%s");
}
