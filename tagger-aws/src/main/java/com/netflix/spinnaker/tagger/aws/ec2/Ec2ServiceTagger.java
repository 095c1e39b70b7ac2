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

package com.netflix.spinnaker.tagger.aws.ec2;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateTagsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Volume;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tags EC2 instances and EBS volumes by id
 */

@Component
@Order(1)
public class Ec2ServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "EC2";

  public Ec2ServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    Ec2Client ec2 = context.getClient(Ec2Client.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    return Arrays.asList(instances(ec2, tags), volumes(ec2, tags));
  }

  private TaggableResourceType<Instance> instances(Ec2Client ec2, List<Tag> tags) {
    return TaggableResourceType.<Instance>builder("Instance")
      .pages(token -> {
        DescribeInstancesResponse response = ec2.describeInstances(
          DescribeInstancesRequest.builder().nextToken(token).build()
        );
        List<Instance> instances = response.reservations()
          .stream()
          .flatMap(r -> r.instances().stream())
          .collect(Collectors.toList());
        return ResourcePage.of(instances, response.nextToken());
      })
      .identifier(Instance::instanceId)
      .tagWith(id -> createTags(ec2, id, tags))
      .build();
  }

  private TaggableResourceType<Volume> volumes(Ec2Client ec2, List<Tag> tags) {
    return TaggableResourceType.<Volume>builder("EBS Volume")
      .pages(token -> {
        DescribeVolumesResponse response = ec2.describeVolumes(
          DescribeVolumesRequest.builder().nextToken(token).build()
        );
        return ResourcePage.of(response.volumes(), response.nextToken());
      })
      .identifier(Volume::volumeId)
      .tagWith(id -> createTags(ec2, id, tags))
      .build();
  }

  static void createTags(Ec2Client ec2, String resourceId, List<Tag> tags) {
    ec2.createTags(CreateTagsRequest.builder().resources(resourceId).tags(tags).build());
  }
}
