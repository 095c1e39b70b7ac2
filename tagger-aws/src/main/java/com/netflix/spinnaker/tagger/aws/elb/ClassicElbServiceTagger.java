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
import software.amazon.awssdk.services.elasticloadbalancing.ElasticLoadBalancingClient;
import software.amazon.awssdk.services.elasticloadbalancing.model.AddTagsRequest;
import software.amazon.awssdk.services.elasticloadbalancing.model.DescribeLoadBalancersRequest;
import software.amazon.awssdk.services.elasticloadbalancing.model.DescribeLoadBalancersResponse;
import software.amazon.awssdk.services.elasticloadbalancing.model.LoadBalancerDescription;
import software.amazon.awssdk.services.elasticloadbalancing.model.Tag;

import java.util.Collections;
import java.util.List;

/**
 * Tags classic load balancers, which are addressed by name rather than ARN
 */

@Component
@Order(9)
public class ClassicElbServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "ELB";

  public ClassicElbServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    ElasticLoadBalancingClient elb = context.getClient(ElasticLoadBalancingClient.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());

    return Collections.singletonList(
      TaggableResourceType.<LoadBalancerDescription>builder("Classic Load Balancer")
        .pages(token -> {
          DescribeLoadBalancersResponse response = elb.describeLoadBalancers(
            DescribeLoadBalancersRequest.builder().marker(token).build()
          );
          return ResourcePage.of(response.loadBalancerDescriptions(), response.nextMarker());
        })
        .identifier(LoadBalancerDescription::loadBalancerName)
        .tagWith(name -> elb.addTags(AddTagsRequest.builder().loadBalancerNames(name).tags(tags).build()))
        .build()
    );
  }
}
