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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rds.RdsClient;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AwsClientFactoryTest {
  private final AwsClientFactory factory =
    new AwsClientFactory(AnonymousCredentialsProvider.create(), Region.US_EAST_1);

  @Test
  @DisplayName("Should create a client once and share it afterwards")
  void shouldCacheClients() {
    RdsClient rds = mock(RdsClient.class);
    AtomicInteger created = new AtomicInteger();
    factory.register(RdsClient.class, () -> {
      created.incrementAndGet();
      return rds;
    });

    assertThat(factory.getClient(RdsClient.class)).isSameAs(rds);
    assertThat(factory.getClient(RdsClient.class)).isSameAs(rds);
    assertThat(created.get()).isEqualTo(1);

    factory.close();
    verify(rds).close();
  }

  @Test
  @DisplayName("Should reject types nobody registered")
  void shouldRejectUnknownTypes() {
    assertThatThrownBy(() -> factory.getClient(Runnable.class))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("Runnable");
  }
}
