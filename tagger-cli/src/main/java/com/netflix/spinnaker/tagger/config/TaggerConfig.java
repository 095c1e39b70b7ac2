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

package com.netflix.spinnaker.tagger.config;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.patterns.PolledMeter;
import com.netflix.spinnaker.tagger.aws.client.AwsClientFactory;
import com.netflix.spinnaker.tagger.aws.config.AwsConfigurationProperties;
import com.netflix.spinnaker.tagger.orchestrator.SessionValidator;
import com.netflix.spinnaker.tagger.orchestrator.TaggingOrchestrator;
import com.netflix.spinnaker.tagger.pipeline.ServiceTagger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;

@Configuration
@EnableConfigurationProperties(TaggerProperties.class)
public class TaggerConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaggerConfig.class);

  @Bean
  Registry registry() {
    return new DefaultRegistry();
  }

  /**
   * Destroyed before the client factory, so passes cancelled by a shutdown finish with open clients
   */

  @Bean
  @DependsOn("awsClientFactory")
  ThreadPoolTaskExecutor taggerPool(Registry registry, TaggerProperties taggerProperties) {
    ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(taggerProperties.getPoolSize());
    pool.setMaxPoolSize(taggerProperties.getPoolSize());
    pool.setThreadNamePrefix("tagger-");
    pool.setWaitForTasksToCompleteOnShutdown(true);
    pool.setAwaitTerminationMillis(taggerProperties.getShutdownTimeout().toMillis());
    return applyThreadPoolMetrics(registry, pool);
  }

  @Bean
  TaggingOrchestrator taggingOrchestrator(SessionValidator sessionValidator,
                                          AwsClientFactory awsClientFactory,
                                          List<ServiceTagger> serviceTaggers,
                                          ThreadPoolTaskExecutor taggerPool,
                                          Registry registry,
                                          TaggerProperties taggerProperties,
                                          AwsConfigurationProperties awsConfigurationProperties) {
    List<ServiceTagger> enabled = serviceTaggers
      .stream()
      .filter(t -> taggerProperties.isEnabled(t.getName()))
      .collect(Collectors.toList());

    LOGGER.info("Enabled service taggers: {}",
      enabled.stream().map(ServiceTagger::getName).collect(Collectors.toList()));

    return new TaggingOrchestrator(
      sessionValidator,
      awsClientFactory,
      enabled,
      taggerPool,
      registry,
      taggerProperties.getThrottleDelay(),
      awsConfigurationProperties.getRegion()
    );
  }

  private static ThreadPoolTaskExecutor applyThreadPoolMetrics(Registry registry,
                                                               ThreadPoolTaskExecutor executor) {
    BiConsumer<String, Function<ThreadPoolExecutor, Integer>> createGauge =
      (name, valueCallback) -> {
        Id id = registry
          .createId(format("threadpool.%s", name))
          .withTag("id", "taggerPool");

        PolledMeter.using(registry)
          .withId(id)
          .monitorValue(executor, ref -> valueCallback.apply(ref.getThreadPoolExecutor()));
      };

    createGauge.accept("activeCount", ThreadPoolExecutor::getActiveCount);
    createGauge.accept("maximumPoolSize", ThreadPoolExecutor::getMaximumPoolSize);
    createGauge.accept("corePoolSize", ThreadPoolExecutor::getCorePoolSize);
    createGauge.accept("poolSize", ThreadPoolExecutor::getPoolSize);
    createGauge.accept("blockingQueueSize", e -> e.getQueue().size());

    return executor;
  }
}
