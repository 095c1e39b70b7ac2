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

package com.netflix.spinnaker.tagger.aws.rds;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.AddTagsToResourceRequest;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBClusterSnapshot;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DBSnapshot;
import software.amazon.awssdk.services.rds.model.DescribeDbClusterSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClusterSnapshotsResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsResponse;
import software.amazon.awssdk.services.rds.model.Tag;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tags RDS instances, clusters and their snapshots using the ARNs RDS returns
 */

@Component
@Order(2)
public class RdsServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "RDS";

  public RdsServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    RdsClient rds = context.getClient(RdsClient.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = arn -> rds.addTagsToResource(
      AddTagsToResourceRequest.builder().resourceName(arn).tags(tags).build()
    );

    return Arrays.asList(
      TaggableResourceType.<DBInstance>builder("DB Instance")
        .pages(token -> {
          DescribeDbInstancesResponse response = rds.describeDBInstances(
            DescribeDbInstancesRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.dbInstances(), response.marker());
        })
        .displayName(DBInstance::dbInstanceIdentifier)
        .identifier(DBInstance::dbInstanceArn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<DBCluster>builder("DB Cluster")
        .pages(token -> {
          DescribeDbClustersResponse response = rds.describeDBClusters(
            DescribeDbClustersRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.dbClusters(), response.marker());
        })
        .displayName(DBCluster::dbClusterIdentifier)
        .identifier(DBCluster::dbClusterArn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<DBSnapshot>builder("DB Snapshot")
        .pages(token -> {
          DescribeDbSnapshotsResponse response = rds.describeDBSnapshots(
            DescribeDbSnapshotsRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.dbSnapshots(), response.marker());
        })
        .displayName(DBSnapshot::dbSnapshotIdentifier)
        .identifier(DBSnapshot::dbSnapshotArn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<DBClusterSnapshot>builder("DB Cluster Snapshot")
        .pages(token -> {
          DescribeDbClusterSnapshotsResponse response = rds.describeDBClusterSnapshots(
            DescribeDbClusterSnapshotsRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.dbClusterSnapshots(), response.marker());
        })
        .displayName(DBClusterSnapshot::dbClusterSnapshotIdentifier)
        .identifier(DBClusterSnapshot::dbClusterSnapshotArn)
        .tagWith(tagger)
        .build()
    );
  }
}
