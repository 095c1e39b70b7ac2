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

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spinnaker.tagger.errors.ServiceTaggingException;
import com.netflix.spinnaker.tagger.errors.SessionValidationException;
import com.netflix.spinnaker.tagger.model.Cancellation;
import com.netflix.spinnaker.tagger.model.ClientFactory;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.ServiceSummary;
import com.netflix.spinnaker.tagger.model.TagSet;
import com.netflix.spinnaker.tagger.model.TaggingReport;
import com.netflix.spinnaker.tagger.pipeline.ServiceTagger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Validates the session, then runs every registered service tagger concurrently and waits for all of them.
 * Each task sleeps a fixed delay after its tagger returns to spread API load.
 */

public class TaggingOrchestrator {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaggingOrchestrator.class);

  private final SessionValidator sessionValidator;
  private final ClientFactory clientFactory;
  private final List<ServiceTagger> serviceTaggers;
  private final Executor executor;
  private final Registry registry;
  private final Duration throttleDelay;
  private final String region;

  private final Id resourcesId;
  private final Id serviceErrorsId;

  public TaggingOrchestrator(SessionValidator sessionValidator,
                             ClientFactory clientFactory,
                             List<ServiceTagger> serviceTaggers,
                             Executor executor,
                             Registry registry,
                             Duration throttleDelay,
                             String region) {
    this.sessionValidator = sessionValidator;
    this.clientFactory = clientFactory;
    this.serviceTaggers = new ArrayList<>(serviceTaggers);
    this.executor = executor;
    this.registry = registry;
    this.throttleDelay = throttleDelay;
    this.region = region;
    this.resourcesId = registry.createId("tagger.resources");
    this.serviceErrorsId = registry.createId("tagger.serviceErrors");
  }

  public List<ServiceTagger> getServiceTaggers() {
    return serviceTaggers;
  }

  /**
   * Tags all resources of every registered service
   * @param tags tags applied to every resource
   * @param cancellation shared stop signal, checked by every pipeline
   * @return per service summaries in registration order, partial if the wait was interrupted
   * @throws SessionValidationException if the credentials cannot be validated, nothing is tagged then
   */

  public TaggingReport tagAllResources(TagSet tags, Cancellation cancellation) throws SessionValidationException {
    CallerIdentity identity = sessionValidator.validate();
    LOGGER.info("Session validated for account {} ({})", identity.getAccountId(), identity.getArn());

    RunContext context = new RunContext(region, identity.getAccountId(), tags, clientFactory, cancellation);
    int services = serviceTaggers.size();
    CountDownLatch latch = new CountDownLatch(services);
    BlockingQueue<Throwable> errors = new ArrayBlockingQueue<>(Math.max(1, services));
    Map<String, ServiceSummary> completed = new ConcurrentHashMap<>();

    LOGGER.info("Tagging resources of {} services in {} with tags {}", services, region, tags);
    for (ServiceTagger tagger : serviceTaggers) {
      try {
        executor.execute(() -> {
          try {
            ServiceSummary summary = tagger.tagResources(context);
            completed.put(tagger.getName(), summary);
            record(summary);
          } catch (RuntimeException e) {
            recordFailure(tagger, e, completed, errors);
          } finally {
            throttle();
            latch.countDown();
          }
        });
      } catch (RejectedExecutionException e) {
        LOGGER.error("Could not schedule {} tagger: {}", tagger.getName(), e.getMessage());
        recordFailure(tagger, e, completed, errors);
        latch.countDown();
      }
    }

    try {
      latch.await();
    } catch (InterruptedException e) {
      LOGGER.warn("Interrupted while waiting for service taggers, cancelling run");
      cancellation.cancel();
      Thread.currentThread().interrupt();
    }

    List<Throwable> collected = new ArrayList<>();
    errors.drainTo(collected);
    collected.forEach(error -> LOGGER.error("Error: {}", error.getMessage(), error));

    Map<String, ServiceSummary> summaries = new LinkedHashMap<>();
    for (ServiceTagger tagger : serviceTaggers) {
      ServiceSummary summary = completed.get(tagger.getName());
      if (summary != null) {
        summaries.put(tagger.getName(), summary);
      }
    }

    TaggingReport report = new TaggingReport(summaries, collected);
    LOGGER.info("Tagging complete: tagged {}, failed {} resources across {} services",
      report.getTotalTagged(), report.getTotalFailed(), summaries.size());
    return report;
  }

  private void record(ServiceSummary summary) {
    Id id = resourcesId.withTag("service", summary.getService());
    registry.counter(id.withTag("result", "found")).increment(summary.getFound());
    registry.counter(id.withTag("result", "tagged")).increment(summary.getTagged());
    registry.counter(id.withTag("result", "failed")).increment(summary.getFailed());
  }

  private void recordFailure(ServiceTagger tagger,
                             RuntimeException e,
                             Map<String, ServiceSummary> completed,
                             BlockingQueue<Throwable> errors) {
    registry.counter(serviceErrorsId.withTag("service", tagger.getName())).increment();
    ServiceSummary failed = new ServiceSummary(tagger.getName());
    failed.markSkipped("failed: " + e.getMessage());
    completed.put(tagger.getName(), failed);
    if (!errors.offer(new ServiceTaggingException(tagger.getName(), e))) {
      LOGGER.warn("Error queue full, dropping failure of {}", tagger.getName(), e);
    }
  }

  private void throttle() {
    if (throttleDelay.isZero() || throttleDelay.isNegative()) {
      return;
    }

    try {
      Thread.sleep(throttleDelay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
