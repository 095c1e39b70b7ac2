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

package com.netflix.spinnaker.tagger.aws.glue;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.ServiceSummary;
import com.netflix.spinnaker.tagger.model.TagSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.glue.GlueClient;
import software.amazon.awssdk.services.glue.model.Connection;
import software.amazon.awssdk.services.glue.model.Crawler;
import software.amazon.awssdk.services.glue.model.Database;
import software.amazon.awssdk.services.glue.model.GetConnectionsRequest;
import software.amazon.awssdk.services.glue.model.GetConnectionsResponse;
import software.amazon.awssdk.services.glue.model.GetCrawlersRequest;
import software.amazon.awssdk.services.glue.model.GetCrawlersResponse;
import software.amazon.awssdk.services.glue.model.GetDatabasesRequest;
import software.amazon.awssdk.services.glue.model.GetDatabasesResponse;
import software.amazon.awssdk.services.glue.model.GetJobsRequest;
import software.amazon.awssdk.services.glue.model.GetJobsResponse;
import software.amazon.awssdk.services.glue.model.GetTriggersRequest;
import software.amazon.awssdk.services.glue.model.GetTriggersResponse;
import software.amazon.awssdk.services.glue.model.Job;
import software.amazon.awssdk.services.glue.model.ListWorkflowsRequest;
import software.amazon.awssdk.services.glue.model.ListWorkflowsResponse;
import software.amazon.awssdk.services.glue.model.TagResourceRequest;
import software.amazon.awssdk.services.glue.model.TagResourceResponse;
import software.amazon.awssdk.services.glue.model.Trigger;

import java.util.Collections;
import java.util.stream.Collectors;

import static com.netflix.spinnaker.tagger.aws.AwsTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GlueServiceTaggerTest {

  @Mock
  private GlueClient glue;

  @Mock
  private ErrorClassifier errorClassifier;

  private GlueServiceTagger tagger;

  @BeforeEach
  void setUp() {
    tagger = new GlueServiceTagger(errorClassifier);
  }

  @Test
  @DisplayName("Should build an ARN for every Glue resource type and tag it with the flat tag map")
  void shouldTagEveryResourceType() {
    when(glue.getDatabases(any(GetDatabasesRequest.class))).thenReturn(
      GetDatabasesResponse.builder().databaseList(Database.builder().name("sales").build()).nextToken("n").build(),
      GetDatabasesResponse.builder().databaseList(Database.builder().name("/raw/").build()).build()
    );
    when(glue.getConnections(any(GetConnectionsRequest.class))).thenReturn(
      GetConnectionsResponse.builder().connectionList(Connection.builder().name("jdbc").build()).build()
    );
    when(glue.getCrawlers(any(GetCrawlersRequest.class))).thenReturn(
      GetCrawlersResponse.builder().crawlers(Crawler.builder().name("nightly").build()).build()
    );
    when(glue.getJobs(any(GetJobsRequest.class))).thenReturn(
      GetJobsResponse.builder().jobs(Job.builder().name("etl").build()).build()
    );
    when(glue.getTriggers(any(GetTriggersRequest.class))).thenReturn(
      GetTriggersResponse.builder().triggers(Trigger.builder().name("hourly").build()).build()
    );
    when(glue.listWorkflows(any(ListWorkflowsRequest.class))).thenReturn(
      ListWorkflowsResponse.builder().workflows("ingest").build()
    );
    when(glue.tagResource(any(TagResourceRequest.class))).thenReturn(TagResourceResponse.builder().build());

    ServiceSummary summary = tagger.tagResources(context(GlueClient.class, glue));

    ArgumentCaptor<TagResourceRequest> requests = ArgumentCaptor.forClass(TagResourceRequest.class);
    verify(glue, atLeastOnce()).tagResource(requests.capture());
    assertThat(requests.getAllValues().stream().map(TagResourceRequest::resourceArn).collect(Collectors.toList()))
      .containsExactly(
        "arn:aws:glue:us-east-1:123456789012:database/sales",
        "arn:aws:glue:us-east-1:123456789012:database/raw",
        "arn:aws:glue:us-east-1:123456789012:connection/jdbc",
        "arn:aws:glue:us-east-1:123456789012:crawler/nightly",
        "arn:aws:glue:us-east-1:123456789012:job/etl",
        "arn:aws:glue:us-east-1:123456789012:trigger/hourly",
        "arn:aws:glue:us-east-1:123456789012:workflow/ingest"
      );
    assertThat(requests.getValue().tagsToAdd()).containsExactly(entry("map-migrated", "mig12345"), entry("team", "data"));
    assertThat(summary.getTagged()).isEqualTo(7);
  }

  @Test
  @DisplayName("Should skip Glue entirely when tags use the reserved aws: prefix")
  void shouldSkipInvalidTags() {
    ServiceSummary summary = tagger.tagResources(
      context(TagSet.of(Collections.singletonMap("aws:cost", "x")), GlueClient.class, glue)
    );

    assertThat(summary.isSkipped()).isTrue();
    verifyNoInteractions(glue);
  }
}
