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

package com.netflix.spinnaker.tagger.aws.config;

import com.netflix.spinnaker.tagger.aws.client.AwsClientFactory;
import com.netflix.spinnaker.tagger.aws.client.AwsSessionValidator;
import com.netflix.spinnaker.tagger.aws.errors.AwsErrorClassifier;
import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.orchestrator.SessionValidator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan("com.netflix.spinnaker.tagger.aws")
@EnableConfigurationProperties(AwsConfigurationProperties.class)
public class AwsConfiguration {

  @Bean(destroyMethod = "close")
  AwsClientFactory awsClientFactory(AwsConfigurationProperties awsConfigurationProperties) {
    return new AwsClientFactory(awsConfigurationProperties.getProfile(), awsConfigurationProperties.getRegion());
  }

  @Bean
  SessionValidator sessionValidator(AwsClientFactory awsClientFactory) {
    return new AwsSessionValidator(awsClientFactory);
  }

  @Bean
  ErrorClassifier errorClassifier() {
    return new AwsErrorClassifier();
  }
}
