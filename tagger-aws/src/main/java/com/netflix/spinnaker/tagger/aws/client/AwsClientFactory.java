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

import com.netflix.spinnaker.tagger.model.ClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticache.ElastiCacheClient;
import software.amazon.awssdk.services.elasticloadbalancing.ElasticLoadBalancingClient;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.opensearch.OpenSearchClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.vpclattice.VpcLatticeClient;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Lazily creates one SDK client per service, all bound to the same profile and region.
 * Clients are thread safe and shared by every tagger of a run.
 */

public class AwsClientFactory implements ClientFactory, Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AwsClientFactory.class);

  private final Region region;
  private final AwsCredentialsProvider credentialsProvider;
  private final Map<Class<?>, Supplier<? extends SdkClient>> suppliers = new ConcurrentHashMap<>();
  private final Map<Class<?>, SdkClient> clients = new ConcurrentHashMap<>();

  public AwsClientFactory(String profile, String region) {
    this(ProfileCredentialsProvider.create(profile), Region.of(region));
  }

  AwsClientFactory(AwsCredentialsProvider credentialsProvider, Region region) {
    this.credentialsProvider = credentialsProvider;
    this.region = region;

    register(StsClient.class, () -> build(StsClient.builder()));
    register(Ec2Client.class, () -> build(Ec2Client.builder()));
    register(RdsClient.class, () -> build(RdsClient.builder()));
    register(S3Client.class, () -> build(S3Client.builder().crossRegionAccessEnabled(true)));
    register(GlueClient.class, () -> build(GlueClient.builder()));
    register(AthenaClient.class, () -> build(AthenaClient.builder()));
    register(CloudWatchClient.class, () -> build(CloudWatchClient.builder()));
    register(OpenSearchClient.class, () -> build(OpenSearchClient.builder()));
    register(ElastiCacheClient.class, () -> build(ElastiCacheClient.builder()));
    register(ElasticLoadBalancingClient.class, () -> build(ElasticLoadBalancingClient.builder()));
    register(ElasticLoadBalancingV2Client.class, () -> build(ElasticLoadBalancingV2Client.builder()));
    register(VpcLatticeClient.class, () -> build(VpcLatticeClient.builder()));
  }

  public <T extends SdkClient> void register(Class<T> type, Supplier<? extends T> supplier) {
    suppliers.put(type, supplier);
  }

  @Override
  public <T> T getClient(Class<T> type) {
    SdkClient client = clients.computeIfAbsent(type, t -> {
      Supplier<? extends SdkClient> supplier = suppliers.get(t);
      if (supplier == null) {
        throw new IllegalArgumentException(String.format("No AWS client registered for %s", t.getName()));
      }

      LOGGER.debug("Creating {} for region {}", t.getSimpleName(), region);
      return supplier.get();
    });
    return type.cast(client);
  }

  public Region getRegion() {
    return region;
  }

  @Override
  public void close() {
    clients.forEach((type, client) -> {
      try {
        client.close();
      } catch (RuntimeException e) {
        LOGGER.warn("Failed to close {}", type.getSimpleName(), e);
      }
    });
    clients.clear();
  }

  private <B extends AwsClientBuilder<B, C>, C> C build(B builder) {
    return builder
      .region(region)
      .credentialsProvider(credentialsProvider)
      .build();
  }
}
