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

import com.netflix.spinnaker.tagger.aws.errors.AwsErrorClassifier;
import com.netflix.spinnaker.tagger.model.ServiceSummary;
import com.netflix.spinnaker.tagger.model.TagSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.AddTagsToResourceRequest;
import software.amazon.awssdk.services.rds.model.AddTagsToResourceResponse;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.rds.model.DescribeDbClusterSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClusterSnapshotsResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbInstancesResponse;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbSnapshotsResponse;

import static com.netflix.spinnaker.tagger.aws.AwsTestSupport.awsError;
import static com.netflix.spinnaker.tagger.aws.AwsTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RdsServiceTaggerTest {
  private static final String DB_1 = "arn:aws:rds:us-east-1:123456789012:db:db-1";
  private static final String DB_2 = "arn:aws:rds:us-east-1:123456789012:db:db-2";

  @Mock
  private RdsClient rds;

  @Spy
  private AwsErrorClassifier errorClassifier = new AwsErrorClassifier();

  private RdsServiceTagger tagger;

  @BeforeEach
  void setUp() {
    tagger = new RdsServiceTagger(errorClassifier);
    lenient().when(rds.describeDBInstances(any(DescribeDbInstancesRequest.class)))
      .thenReturn(DescribeDbInstancesResponse.builder().build());
    lenient().when(rds.describeDBClusters(any(DescribeDbClustersRequest.class)))
      .thenReturn(DescribeDbClustersResponse.builder().build());
    lenient().when(rds.describeDBSnapshots(any(DescribeDbSnapshotsRequest.class)))
      .thenReturn(DescribeDbSnapshotsResponse.builder().build());
    lenient().when(rds.describeDBClusterSnapshots(any(DescribeDbClusterSnapshotsRequest.class)))
      .thenReturn(DescribeDbClusterSnapshotsResponse.builder().build());
  }

  private static DBInstance instance(String id, String arn) {
    return DBInstance.builder().dbInstanceIdentifier(id).dbInstanceArn(arn).build();
  }

  @Nested
  @DisplayName("DB instances")
  class Instances {

    @Test
    @DisplayName("db-1 denied and db-2 tagged: found 2, tagged 1, failed 1")
    void shouldIsolateDeniedInstance() {
      when(rds.describeDBInstances(any(DescribeDbInstancesRequest.class))).thenReturn(
        DescribeDbInstancesResponse.builder().dbInstances(instance("db-1", DB_1), instance("db-2", DB_2)).build()
      );
      when(rds.addTagsToResource(any(AddTagsToResourceRequest.class))).thenAnswer(invocation -> {
        AddTagsToResourceRequest request = invocation.getArgument(0);
        if (DB_1.equals(request.resourceName())) {
          throw awsError("AccessDenied");
        }
        return AddTagsToResourceResponse.builder().build();
      });

      ServiceSummary summary = tagger.tagResources(context(RdsClient.class, rds));

      assertThat(summary.getMetrics("DB Instance")).hasValueSatisfying(m -> {
        assertThat(m.getFound()).isEqualTo(2);
        assertThat(m.getTagged()).isEqualTo(1);
        assertThat(m.getFailed()).isEqualTo(1);
      });
      verify(errorClassifier).classify(any(), eq(DB_1), eq("RDS DB Instance"));
      verify(rds).addTagsToResource(argThat((AddTagsToResourceRequest r) -> DB_2.equals(r.resourceName())));
    }

    @Test
    @DisplayName("Should follow markers across pages")
    void shouldFollowMarkers() {
      when(rds.describeDBInstances(any(DescribeDbInstancesRequest.class))).thenReturn(
        DescribeDbInstancesResponse.builder().dbInstances(instance("db-1", DB_1)).marker("m1").build(),
        DescribeDbInstancesResponse.builder().dbInstances(instance("db-2", DB_2)).build()
      );
      when(rds.addTagsToResource(any(AddTagsToResourceRequest.class))).thenReturn(AddTagsToResourceResponse.builder().build());

      ServiceSummary summary = tagger.tagResources(context(RdsClient.class, rds));

      assertThat(summary.getMetrics("DB Instance")).hasValueSatisfying(m -> assertThat(m.getTagged()).isEqualTo(2));
      verify(rds).describeDBInstances(argThat((DescribeDbInstancesRequest r) -> "m1".equals(r.marker())));
    }
  }

  @Nested
  @DisplayName("Type isolation")
  class TypeIsolation {

    @Test
    @DisplayName("A cluster listing failure should not prevent the other types")
    void shouldContinueAfterListingFailure() {
      when(rds.describeDBClusters(any(DescribeDbClustersRequest.class))).thenThrow(awsError("AccessDenied"));
      when(rds.describeDBInstances(any(DescribeDbInstancesRequest.class))).thenReturn(
        DescribeDbInstancesResponse.builder().dbInstances(instance("db-1", DB_1)).build()
      );
      when(rds.addTagsToResource(any(AddTagsToResourceRequest.class))).thenReturn(AddTagsToResourceResponse.builder().build());

      ServiceSummary summary = tagger.tagResources(context(RdsClient.class, rds));

      assertThat(summary.getMetrics("DB Cluster")).hasValueSatisfying(m -> assertThat(m.getFound()).isZero());
      assertThat(summary.getMetrics("DB Instance")).hasValueSatisfying(m -> assertThat(m.getTagged()).isEqualTo(1));
      verify(rds).describeDBClusterSnapshots(any(DescribeDbClusterSnapshotsRequest.class));
      verify(errorClassifier).classify(any(), eq("all"), eq("RDS DB Cluster"));
    }

    @Test
    @DisplayName("No tags means no RDS calls at all")
    void shouldShortCircuitWithoutTags() {
      ServiceSummary summary = tagger.tagResources(context(TagSet.empty(), RdsClient.class, rds));

      assertThat(summary.isSkipped()).isTrue();
      verify(rds, never()).describeDBInstances(any(DescribeDbInstancesRequest.class));
      verify(rds, never()).addTagsToResource(any(AddTagsToResourceRequest.class));
    }

    @Test
    @DisplayName("Clusters should be tagged by the ARN RDS returns")
    void shouldTagClustersByArn() {
      String clusterArn = "arn:aws:rds:us-east-1:123456789012:cluster:aurora-1";
      when(rds.describeDBClusters(any(DescribeDbClustersRequest.class))).thenReturn(
        DescribeDbClustersResponse.builder()
          .dbClusters(DBCluster.builder().dbClusterIdentifier("aurora-1").dbClusterArn(clusterArn).build())
          .build()
      );
      when(rds.addTagsToResource(any(AddTagsToResourceRequest.class))).thenReturn(AddTagsToResourceResponse.builder().build());

      tagger.tagResources(context(RdsClient.class, rds));

      verify(rds).addTagsToResource(argThat((AddTagsToResourceRequest r) ->
        clusterArn.equals(r.resourceName()) && r.tags().size() == 2));
    }
  }
}
