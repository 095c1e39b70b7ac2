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

package com.netflix.spinnaker.tagger.aws.vpc;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.vpclattice.VpcLatticeClient;
import software.amazon.awssdk.services.vpclattice.model.ListServiceNetworksRequest;
import software.amazon.awssdk.services.vpclattice.model.ListServiceNetworksResponse;
import software.amazon.awssdk.services.vpclattice.model.ListServicesRequest;
import software.amazon.awssdk.services.vpclattice.model.ListServicesResponse;
import software.amazon.awssdk.services.vpclattice.model.ServiceNetworkSummary;
import software.amazon.awssdk.services.vpclattice.model.ServiceSummary;
import software.amazon.awssdk.services.vpclattice.model.TagResourceRequest;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Component
@Order(12)
public class VpcLatticeServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "VPCLattice";

  public VpcLatticeServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    VpcLatticeClient lattice = context.getClient(VpcLatticeClient.class);
    Map<String, String> tags = TagConverter.toMap(context.getTags());
    Consumer<String> tagger = arn -> lattice.tagResource(
      TagResourceRequest.builder().resourceArn(arn).tags(tags).build()
    );

    return Arrays.asList(
      TaggableResourceType.<ServiceNetworkSummary>builder("Service Network")
        .pages(token -> {
          ListServiceNetworksResponse response = lattice.listServiceNetworks(
            ListServiceNetworksRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.items(), response.nextToken());
        })
        .displayName(ServiceNetworkSummary::name)
        .identifier(ServiceNetworkSummary::arn)
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<ServiceSummary>builder("Service")
        .pages(token -> {
          ListServicesResponse response = lattice.listServices(
            ListServicesRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.items(), response.nextToken());
        })
        .displayName(ServiceSummary::name)
        .identifier(ServiceSummary::arn)
        .tagWith(tagger)
        .build()
    );
  }
}
