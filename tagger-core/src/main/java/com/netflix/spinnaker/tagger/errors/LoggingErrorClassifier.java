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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Maps structured error codes to categories and writes one targeted log line per category.
 * Subclasses only know how to read the error code out of a provider specific exception.
 */

public abstract class LoggingErrorClassifier implements ErrorClassifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingErrorClassifier.class);

  private final Map<String, ErrorCategory> categoriesByCode;

  protected LoggingErrorClassifier(Map<String, ErrorCategory> categoriesByCode) {
    this.categoriesByCode = Collections.unmodifiableMap(categoriesByCode);
  }

  /**
   * Extracts the remote error code, if the error carries one
   */

  protected abstract Optional<String> errorCode(Throwable error);

  @Override
  public ErrorCategory classify(Throwable error, String resourceId, String service) {
    ErrorCategory category = ErrorCategory.UNKNOWN;
    try {
      category = errorCode(error)
        .map(code -> categoriesByCode.getOrDefault(code, ErrorCategory.UNKNOWN))
        .orElse(ErrorCategory.UNKNOWN);
    } catch (RuntimeException e) {
      LOGGER.debug("Unable to read error code from {}", error, e);
    }

    switch (category) {
      case ACCESS_DENIED:
        LOGGER.warn("Access denied while tagging {} resource {}", service, resourceId);
        break;
      case NOT_FOUND:
        LOGGER.warn("Resource {} not found in {}", resourceId, service);
        break;
      case THROTTLED:
        LOGGER.warn("Request throttled while tagging {} resource {}", service, resourceId);
        break;
      default:
        LOGGER.error("Error tagging {} resource {}: {}", service, resourceId, error.getMessage(), error);
    }

    return category;
  }
}
