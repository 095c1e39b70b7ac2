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

import com.netflix.spinnaker.tagger.arn.ArnBuilder;
import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.ResourceType;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.TagConstraints;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.PageFetcher;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
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
import software.amazon.awssdk.services.glue.model.Trigger;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_CONNECTION;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_CRAWLER;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_DATABASE;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_JOB;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_TRIGGER;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.GLUE_WORKFLOW;

/**
 * Tags Glue catalog and ETL resources. Glue list calls return names only, so ARNs are built locally.
 * Tables are not taggable and are left alone.
 */

@Component
@Order(4)
public class GlueServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "Glue";

  public GlueServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected Optional<TagConstraints> getTagConstraints() {
    return Optional.of(TagConstraints.AWS_DEFAULT);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    GlueClient glue = context.getClient(GlueClient.class);
    ArnBuilder arns = context.getArnBuilder();
    Map<String, String> tags = TagConverter.toMap(context.getTags());

    return Arrays.asList(
      GlueServiceTagger.<Database>type("Database", GLUE_DATABASE, Database::name, glue, arns, tags, token -> {
        GetDatabasesResponse response = glue.getDatabases(GetDatabasesRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.databaseList(), response.nextToken());
      }),
      GlueServiceTagger.<Connection>type("Connection", GLUE_CONNECTION, Connection::name, glue, arns, tags, token -> {
        GetConnectionsResponse response = glue.getConnections(GetConnectionsRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.connectionList(), response.nextToken());
      }),
      GlueServiceTagger.<Crawler>type("Crawler", GLUE_CRAWLER, Crawler::name, glue, arns, tags, token -> {
        GetCrawlersResponse response = glue.getCrawlers(GetCrawlersRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.crawlers(), response.nextToken());
      }),
      GlueServiceTagger.<Job>type("Job", GLUE_JOB, Job::name, glue, arns, tags, token -> {
        GetJobsResponse response = glue.getJobs(GetJobsRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.jobs(), response.nextToken());
      }),
      GlueServiceTagger.<Trigger>type("Trigger", GLUE_TRIGGER, Trigger::name, glue, arns, tags, token -> {
        GetTriggersResponse response = glue.getTriggers(GetTriggersRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.triggers(), response.nextToken());
      }),
      GlueServiceTagger.<String>type("Workflow", GLUE_WORKFLOW, Function.identity(), glue, arns, tags, token -> {
        ListWorkflowsResponse response = glue.listWorkflows(ListWorkflowsRequest.builder().nextToken(token).build());
        return ResourcePage.of(response.workflows(), response.nextToken());
      })
    );
  }

  private static <R> TaggableResourceType<R> type(String typeName,
                                                  ResourceType resourceType,
                                                  Function<R, String> name,
                                                  GlueClient glue,
                                                  ArnBuilder arns,
                                                  Map<String, String> tags,
                                                  PageFetcher<R> pages) {
    return TaggableResourceType.<R>builder(typeName)
      .pages(pages)
      .displayName(name)
      .identifier(r -> arns.build(resourceType, name.apply(r)))
      .tagWith(arn -> glue.tagResource(TagResourceRequest.builder().resourceArn(arn).tagsToAdd(tags).build()))
      .build();
  }
}
