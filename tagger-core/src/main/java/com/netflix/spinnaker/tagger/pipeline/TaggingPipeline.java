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

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.ServiceSummary;
import com.netflix.spinnaker.tagger.model.TaggingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs list, filter, identify, apply and classify for one resource type, page by page.
 * A failure on one resource never stops the loop; a listing failure only stops the current type.
 */

public class TaggingPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaggingPipeline.class);
  static final String ALL_RESOURCES = "all";

  private final ErrorClassifier errorClassifier;

  public TaggingPipeline(ErrorClassifier errorClassifier) {
    this.errorClassifier = errorClassifier;
  }

  public <R> void run(RunContext context, String service, TaggableResourceType<R> type, ServiceSummary summary) {
    TaggingMetrics metrics = summary.metricsFor(type.getName());
    String label = service + " " + type.getName();
    String nextToken = null;

    do {
      if (context.isCancelled()) {
        LOGGER.warn("Run cancelled, stopped listing {} resources", label);
        return;
      }

      ResourcePage<R> page;
      try {
        page = type.fetch(nextToken);
      } catch (RuntimeException e) {
        errorClassifier.classify(e, ALL_RESOURCES, label);
        return;
      }

      LOGGER.info("Found {} {} resources in current page", page.getItems().size(), label);
      for (R resource : page.getItems()) {
        if (context.isCancelled()) {
          LOGGER.warn("Run cancelled, stopped tagging {} resources", label);
          return;
        }

        if (type.isExcluded(resource)) {
          LOGGER.debug("Skipping excluded {} {}", label, type.displayName(resource));
          continue;
        }

        if (tagResource(context, service, type, resource, label, metrics)) {
          for (TaggableResourceType<?> child : type.childrenOf(resource)) {
            run(context, service, child, summary);
          }
        }
      }

      nextToken = page.getNextToken();
    } while (nextToken != null && !nextToken.isEmpty());
  }

  private <R> boolean tagResource(RunContext context,
                                  String service,
                                  TaggableResourceType<R> type,
                                  R resource,
                                  String label,
                                  TaggingMetrics metrics) {
    metrics.incrementFound();
    String resourceId = null;
    try {
      String name = type.displayName(resource);
      resourceId = name;
      resourceId = type.identify(resource);
      LOGGER.debug("{} ARN: {}", label, resourceId);
      type.applyTags(resourceId);

      metrics.incrementTagged();
      LOGGER.info("Successfully tagged {} {}: {} with tags {}", service, type.getName(), name, context.getTags());
      return true;
    } catch (RuntimeException e) {
      metrics.incrementFailed();
      errorClassifier.classify(e, resourceId == null ? String.valueOf(resource) : resourceId, label);
      return false;
    }
  }
}
