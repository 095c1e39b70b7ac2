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

package com.netflix.spinnaker.tagger.aws.elasticache;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.elasticache.ElastiCacheClient;
import software.amazon.awssdk.services.elasticache.model.AddTagsToResourceRequest;
import software.amazon.awssdk.services.elasticache.model.CacheCluster;
import software.amazon.awssdk.services.elasticache.model.DescribeCacheClustersRequest;
import software.amazon.awssdk.services.elasticache.model.DescribeCacheClustersResponse;
import software.amazon.awssdk.services.elasticache.model.DescribeReplicationGroupsRequest;
import software.amazon.awssdk.services.elasticache.model.DescribeReplicationGroupsResponse;
import software.amazon.awssdk.services.elasticache.model.ReplicationGroup;
import software.amazon.awssdk.services.elasticache.model.Tag;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

@Component
@Order(8)
public class ElastiCacheServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "ElastiCache";

  public ElastiCacheServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    ElastiCacheClient elastiCache = context.getClient(ElastiCacheClient.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = arn -> elastiCache.addTagsToResource(
      AddTagsToResourceRequest.builder().resourceName(arn).tags(tags).build()
    );

    return Arrays.asList(
      TaggableResourceType.<CacheCluster>builder("Cache Cluster")
        .pages(token -> {
          DescribeCacheClustersResponse response = elastiCache.describeCacheClusters(
            DescribeCacheClustersRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.cacheClusters(), response.marker());
        })
        .displayName(CacheCluster::cacheClusterId)
        .identifier(CacheCluster::arn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<ReplicationGroup>builder("Replication Group")
        .pages(token -> {
          DescribeReplicationGroupsResponse response = elastiCache.describeReplicationGroups(
            DescribeReplicationGroupsRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.replicationGroups(), response.marker());
        })
        .displayName(ReplicationGroup::replicationGroupId)
        .identifier(ReplicationGroup::arn)
        .tagWith(tagger)
        .build()
    );
  }
}
