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
import com.netflix.spinnaker.tagger.model.TagConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The shared shape of a service pass. Subclasses declare their resource types in the order they
 * must be processed and, optionally, the tag limits of their service.
 */

public abstract class AbstractServiceTagger implements ServiceTagger {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractServiceTagger.class);

  private final String name;
  private final TaggingPipeline pipeline;

  protected AbstractServiceTagger(String name, ErrorClassifier errorClassifier) {
    this.name = name;
    this.pipeline = new TaggingPipeline(errorClassifier);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public final ServiceSummary tagResources(RunContext context) {
    ServiceSummary summary = new ServiceSummary(name);
    LOGGER.info("Tagging {} resources...", name);

    if (context.getTags().isEmpty()) {
      summary.markSkipped("no tags provided");
      summary.log();
      return summary;
    }

    Optional<String> violation = getTagConstraints().flatMap(c -> c.check(context.getTags()));
    if (violation.isPresent()) {
      LOGGER.error("Invalid tags configuration for {}: {}", name, violation.get());
      summary.markSkipped(violation.get());
      summary.log();
      return summary;
    }

    for (TaggableResourceType<?> type : resourceTypes(context)) {
      pipeline.run(context, name, type, summary);
    }

    summary.log();
    LOGGER.info("Completed tagging {} resources", name);
    return summary;
  }

  /**
   * Tag limits this service enforces, checked before any API call
   */

  protected Optional<TagConstraints> getTagConstraints() {
    return Optional.empty();
  }

  /**
   * The resource types of this service. Called once per pass so tags can be converted once.
   */

  protected abstract List<TaggableResourceType<?>> resourceTypes(RunContext context);
}
