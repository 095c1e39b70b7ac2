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
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateTagsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayPeeringAttachmentsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayPeeringAttachmentsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewaysResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.TransitGateway;
import software.amazon.awssdk.services.ec2.model.TransitGatewayAttachment;
import software.amazon.awssdk.services.ec2.model.TransitGatewayPeeringAttachment;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tags transit gateways and, for each tagged gateway, its VPN, VPC, Direct Connect and peering attachments
 */

@Component
@Order(11)
public class TransitGatewayServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "VPC";

  static final String TRANSIT_GATEWAY_ID = "transit-gateway-id";
  static final String RESOURCE_TYPE = "resource-type";

  public TransitGatewayServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    Ec2Client ec2 = context.getClient(Ec2Client.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = id -> ec2.createTags(CreateTagsRequest.builder().resources(id).tags(tags).build());

    return Collections.singletonList(
      TaggableResourceType.<TransitGateway>builder("Transit Gateway")
        .pages(token -> {
          DescribeTransitGatewaysResponse response = ec2.describeTransitGateways(
            DescribeTransitGatewaysRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.transitGateways(), response.nextToken());
        })
        .identifier(TransitGateway::transitGatewayId)
        .tagWith(tagger)
        .children(tgw -> Arrays.asList(
          attachments(ec2, tgw.transitGatewayId(), "vpn", "Transit Gateway VPN Attachment", tagger),
          attachments(ec2, tgw.transitGatewayId(), "vpc", "Transit Gateway VPC Attachment", tagger),
          peeringAttachments(ec2, tgw.transitGatewayId(), tagger),
          attachments(ec2, tgw.transitGatewayId(), "direct-connect-gateway",
            "Transit Gateway Direct Connect Attachment", tagger)
        ))
        .build()
    );
  }

  private TaggableResourceType<TransitGatewayAttachment> attachments(Ec2Client ec2,
                                                                     String transitGatewayId,
                                                                     String resourceType,
                                                                     String typeName,
                                                                     Consumer<String> tagger) {
    return TaggableResourceType.<TransitGatewayAttachment>builder(typeName)
      .pages(token -> {
        DescribeTransitGatewayAttachmentsResponse response = ec2.describeTransitGatewayAttachments(
          DescribeTransitGatewayAttachmentsRequest.builder()
            .filters(
              Filter.builder().name(TRANSIT_GATEWAY_ID).values(transitGatewayId).build(),
              Filter.builder().name(RESOURCE_TYPE).values(resourceType).build()
            )
            .nextToken(token)
            .build()
        );
        return ResourcePage.of(response.transitGatewayAttachments(), response.nextToken());
      })
      .identifier(TransitGatewayAttachment::transitGatewayAttachmentId)
      .tagWith(tagger)
      .build();
  }

  private TaggableResourceType<TransitGatewayPeeringAttachment> peeringAttachments(Ec2Client ec2,
                                                                                   String transitGatewayId,
                                                                                   Consumer<String> tagger) {
    return TaggableResourceType.<TransitGatewayPeeringAttachment>builder("Transit Gateway Peering Attachment")
      .pages(token -> {
        DescribeTransitGatewayPeeringAttachmentsResponse response = ec2.describeTransitGatewayPeeringAttachments(
          DescribeTransitGatewayPeeringAttachmentsRequest.builder()
            .filters(Filter.builder().name(TRANSIT_GATEWAY_ID).values(transitGatewayId).build())
            .nextToken(token)
            .build()
        );
        return ResourcePage.of(response.transitGatewayPeeringAttachments(), response.nextToken());
      })
      .identifier(TransitGatewayPeeringAttachment::transitGatewayAttachmentId)
      .tagWith(tagger)
      .build();
  }
}
