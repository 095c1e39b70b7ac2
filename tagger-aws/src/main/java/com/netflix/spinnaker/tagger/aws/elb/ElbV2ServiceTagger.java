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

package com.netflix.spinnaker.tagger.aws.elb;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.AddTagsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeLoadBalancersResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsRequest;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.DescribeTargetGroupsResponse;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.LoadBalancer;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.Tag;
import software.amazon.awssdk.services.elasticloadbalancingv2.model.TargetGroup;

import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tags application, network and gateway load balancers, then the target groups of each tagged load balancer
 */

@Component
@Order(10)
public class ElbV2ServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "ELBv2";

  public ElbV2ServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    ElasticLoadBalancingV2Client elb = context.getClient(ElasticLoadBalancingV2Client.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = arn -> elb.addTags(AddTagsRequest.builder().resourceArns(arn).tags(tags).build());

    return Collections.singletonList(
      TaggableResourceType.<LoadBalancer>builder("Load Balancer")
        .pages(token -> {
          DescribeLoadBalancersResponse response = elb.describeLoadBalancers(
            DescribeLoadBalancersRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.loadBalancers(), response.nextMarker());
        })
        .displayName(lb -> lb.typeAsString() + " " + lb.loadBalancerName())
        .identifier(LoadBalancer::loadBalancerArn)
        .tagWith(tagger)
        .children(lb -> Collections.singletonList(targetGroups(elb, lb.loadBalancerArn(), tagger)))
        .build()
    );
  }

  private TaggableResourceType<TargetGroup> targetGroups(ElasticLoadBalancingV2Client elb,
                                                         String loadBalancerArn,
                                                         Consumer<String> tagger) {
    return TaggableResourceType.<TargetGroup>builder("Target Group")
      .pages(token -> {
        DescribeTargetGroupsResponse response = elb.describeTargetGroups(
          DescribeTargetGroupsRequest.builder().loadBalancerArn(loadBalancerArn).marker(token).build()
        );
        return ResourcePage.of(response.targetGroups(), response.nextMarker());
      })
      .displayName(TargetGroup::targetGroupName)
      .identifier(TargetGroup::targetGroupArn)
      .tagWith(tagger)
      .build();
  }
}
