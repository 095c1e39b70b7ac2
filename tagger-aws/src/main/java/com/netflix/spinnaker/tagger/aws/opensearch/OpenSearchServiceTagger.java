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

package com.netflix.spinnaker.tagger.aws.opensearch;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.opensearch.OpenSearchClient;
import software.amazon.awssdk.services.opensearch.model.AddTagsRequest;
import software.amazon.awssdk.services.opensearch.model.DescribeDomainRequest;
import software.amazon.awssdk.services.opensearch.model.DomainInfo;
import software.amazon.awssdk.services.opensearch.model.ListDomainNamesRequest;
import software.amazon.awssdk.services.opensearch.model.ListTagsRequest;
import software.amazon.awssdk.services.opensearch.model.Tag;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tags OpenSearch domains. Domain ARNs are only available through DescribeDomain.
 */

@Component
@Order(7)
public class OpenSearchServiceTagger extends AbstractServiceTagger {
  private static final Logger LOGGER = LoggerFactory.getLogger(OpenSearchServiceTagger.class);
  public static final String NAME = "OpenSearch";

  public OpenSearchServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    OpenSearchClient openSearch = context.getClient(OpenSearchClient.class);
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());

    return Collections.singletonList(
      TaggableResourceType.<DomainInfo>builder("Domain")
        .pages(token -> ResourcePage.last(
          openSearch.listDomainNames(ListDomainNamesRequest.builder().build()).domainNames()
        ))
        .displayName(DomainInfo::domainName)
        .identifier(domain -> openSearch.describeDomain(
          DescribeDomainRequest.builder().domainName(domain.domainName()).build()
        ).domainStatus().arn())
        .tagWith(arn -> {
          openSearch.addTags(AddTagsRequest.builder().arn(arn).tagList(tags).build());
          logCurrentTags(openSearch, arn);
        })
        .build()
    );
  }

  private void logCurrentTags(OpenSearchClient openSearch, String arn) {
    if (!LOGGER.isDebugEnabled()) {
      return;
    }

    try {
      List<Tag> current = openSearch.listTags(ListTagsRequest.builder().arn(arn).build()).tagList();
      LOGGER.debug("Current tags for {}: {}", arn, formatTags(current));
    } catch (SdkException e) {
      LOGGER.debug("Unable to list tags of {}", arn, e);
    }
  }

  static String formatTags(List<Tag> tags) {
    return tags.stream()
      .filter(t -> t.key() != null && t.value() != null)
      .map(t -> t.key() + ": " + t.value())
      .collect(Collectors.joining(", ", "{", "}"));
  }
}
