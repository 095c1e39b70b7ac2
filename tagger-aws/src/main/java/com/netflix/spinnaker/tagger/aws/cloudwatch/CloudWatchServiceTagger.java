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

package com.netflix.spinnaker.tagger.aws.cloudwatch;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.DashboardEntry;
import software.amazon.awssdk.services.cloudwatch.model.DescribeAlarmsRequest;
import software.amazon.awssdk.services.cloudwatch.model.DescribeAlarmsResponse;
import software.amazon.awssdk.services.cloudwatch.model.ListDashboardsRequest;
import software.amazon.awssdk.services.cloudwatch.model.ListDashboardsResponse;
import software.amazon.awssdk.services.cloudwatch.model.MetricAlarm;
import software.amazon.awssdk.services.cloudwatch.model.Tag;
import software.amazon.awssdk.services.cloudwatch.model.TagResourceRequest;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

@Component
@Order(6)
public class CloudWatchServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "CloudWatch";

  public CloudWatchServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    CloudWatchClient cloudWatch = context.getClient(CloudWatchClient.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = arn -> cloudWatch.tagResource(
      TagResourceRequest.builder().resourceARN(arn).tags(tags).build()
    );

    return Arrays.asList(
      TaggableResourceType.<MetricAlarm>builder("Alarm")
        .pages(token -> {
          DescribeAlarmsResponse response = cloudWatch.describeAlarms(
            DescribeAlarmsRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.metricAlarms(), response.nextToken());
        })
        .displayName(MetricAlarm::alarmName)
        .identifier(MetricAlarm::alarmArn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<DashboardEntry>builder("Dashboard")
        .pages(token -> {
          ListDashboardsResponse response = cloudWatch.listDashboards(
            ListDashboardsRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.dashboardEntries(), response.nextToken());
        })
        .displayName(DashboardEntry::dashboardName)
        .identifier(DashboardEntry::dashboardArn)
        .tagWith(tagger)
        .build()
    );
  }
}
