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

package com.netflix.spinnaker.tagger.aws.athena;

import com.netflix.spinnaker.tagger.arn.ArnBuilder;
import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.model.TagConstraints;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.model.DataCatalogSummary;
import software.amazon.awssdk.services.athena.model.ListDataCatalogsRequest;
import software.amazon.awssdk.services.athena.model.ListDataCatalogsResponse;
import software.amazon.awssdk.services.athena.model.ListWorkGroupsRequest;
import software.amazon.awssdk.services.athena.model.ListWorkGroupsResponse;
import software.amazon.awssdk.services.athena.model.Tag;
import software.amazon.awssdk.services.athena.model.TagResourceRequest;
import software.amazon.awssdk.services.athena.model.WorkGroupSummary;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.ATHENA_DATA_CATALOG;
import static com.netflix.spinnaker.tagger.aws.AwsResourceTypes.ATHENA_WORKGROUP;

/**
 * Tags Athena workgroups and data catalogs. The built-in primary workgroup is never touched.
 */

@Component
@Order(5)
public class AthenaServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "Athena";
  static final String PRIMARY_WORKGROUP = "primary";

  public AthenaServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected Optional<TagConstraints> getTagConstraints() {
    return Optional.of(TagConstraints.AWS_DEFAULT);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    AthenaClient athena = context.getClient(AthenaClient.class);
    ArnBuilder arns = context.getArnBuilder();
    List<Tag> tags = TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build());
    Consumer<String> tagger = arn -> athena.tagResource(
      TagResourceRequest.builder().resourceARN(arn).tags(tags).build()
    );

    return Arrays.asList(
      TaggableResourceType.<WorkGroupSummary>builder("Workgroup")
        .pages(token -> {
          ListWorkGroupsResponse response = athena.listWorkGroups(
            ListWorkGroupsRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.workGroups(), response.nextToken());
        })
        .excluding(wg -> PRIMARY_WORKGROUP.equals(wg.name()))
        .displayName(WorkGroupSummary::name)
        .identifier(wg -> arns.build(ATHENA_WORKGROUP, wg.name()))
        .tagWith(tagger)
        .build(),
      TaggableResourceType.<DataCatalogSummary>builder("Data Catalog")
        .pages(token -> {
          ListDataCatalogsResponse response = athena.listDataCatalogs(
            ListDataCatalogsRequest.builder().nextToken(token).build()
          );
          return ResourcePage.of(response.dataCatalogsSummary(), response.nextToken());
        })
        .displayName(DataCatalogSummary::catalogName)
        .identifier(catalog -> arns.build(ATHENA_DATA_CATALOG, catalog.catalogName()))
        .tagWith(tagger)
        .build()
    );
  }
}
