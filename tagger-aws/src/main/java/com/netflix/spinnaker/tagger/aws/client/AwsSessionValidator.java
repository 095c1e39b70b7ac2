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

package com.netflix.spinnaker.tagger.aws.client;

import com.netflix.spinnaker.tagger.errors.SessionValidationException;
import com.netflix.spinnaker.tagger.model.ClientFactory;
import com.netflix.spinnaker.tagger.orchestrator.CallerIdentity;
import com.netflix.spinnaker.tagger.orchestrator.SessionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

/**
 * Validates credentials with STS GetCallerIdentity, which needs no IAM permission
 */

public class AwsSessionValidator implements SessionValidator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AwsSessionValidator.class);

  private final ClientFactory clientFactory;

  public AwsSessionValidator(ClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  @Override
  public CallerIdentity validate() throws SessionValidationException {
    GetCallerIdentityResponse response;
    try {
      response = clientFactory.getClient(StsClient.class)
        .getCallerIdentity(GetCallerIdentityRequest.builder().build());
    } catch (SdkException e) {
      throw new SessionValidationException("Failed to validate AWS session: " + e.getMessage(), e);
    }

    if (response.account() == null || response.account().isEmpty()) {
      throw new SessionValidationException("Failed to validate AWS session: no account returned", null);
    }

    LOGGER.info("Using AWS identity {}", response.arn());
    return new CallerIdentity(response.account(), response.arn());
  }
}
