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

package com.netflix.spinnaker.tagger.aws.errors;

import com.netflix.spinnaker.tagger.errors.ErrorCategory;
import com.netflix.spinnaker.tagger.errors.LoggingErrorClassifier;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies failures by the error code AWS returns, never by message text
 */

public class AwsErrorClassifier extends LoggingErrorClassifier {
  private static final Map<String, ErrorCategory> CATEGORIES = new HashMap<>();

  static {
    CATEGORIES.put("AccessDenied", ErrorCategory.ACCESS_DENIED);
    CATEGORIES.put("AccessDeniedException", ErrorCategory.ACCESS_DENIED);
    CATEGORIES.put("UnauthorizedOperation", ErrorCategory.ACCESS_DENIED);

    CATEGORIES.put("ResourceNotFoundException", ErrorCategory.NOT_FOUND);
    CATEGORIES.put("EntityNotFoundException", ErrorCategory.NOT_FOUND);
    CATEGORIES.put("NotFound", ErrorCategory.NOT_FOUND);

    CATEGORIES.put("Throttling", ErrorCategory.THROTTLED);
    CATEGORIES.put("ThrottlingException", ErrorCategory.THROTTLED);
    CATEGORIES.put("RequestLimitExceeded", ErrorCategory.THROTTLED);
    CATEGORIES.put("TooManyRequestsException", ErrorCategory.THROTTLED);
  }

  public AwsErrorClassifier() {
    super(CATEGORIES);
  }

  @Override
  protected Optional<String> errorCode(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof AwsServiceException) {
        AwsErrorDetails details = ((AwsServiceException) current).awsErrorDetails();
        return Optional.ofNullable(details).map(AwsErrorDetails::errorCode);
      }

      current = current.getCause();
    }

    return Optional.empty();
  }
}
