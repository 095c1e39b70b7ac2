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

package com.netflix.spinnaker.tagger.aws.s3;

import com.netflix.spinnaker.tagger.errors.ErrorClassifier;
import com.netflix.spinnaker.tagger.model.RunContext;
import com.netflix.spinnaker.tagger.pipeline.AbstractServiceTagger;
import com.netflix.spinnaker.tagger.pipeline.ResourcePage;
import com.netflix.spinnaker.tagger.pipeline.TaggableResourceType;
import com.netflix.spinnaker.tagger.tags.TagConverter;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.PutBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

import java.util.Collections;
import java.util.List;

/**
 * Tags S3 buckets by name. Note that PutBucketTagging replaces the bucket's whole tag set.
 */

@Component
@Order(3)
public class S3ServiceTagger extends AbstractServiceTagger {
  public static final String NAME = "S3";

  public S3ServiceTagger(ErrorClassifier errorClassifier) {
    super(NAME, errorClassifier);
  }

  @Override
  protected List<TaggableResourceType<?>> resourceTypes(RunContext context) {
    S3Client s3 = context.getClient(S3Client.class);
    Tagging tagging = Tagging.builder()
      .tagSet(TagConverter.toPairs(context.getTags(), (k, v) -> Tag.builder().key(k).value(v).build()))
      .build();

    return Collections.singletonList(
      TaggableResourceType.<Bucket>builder("Bucket")
        .pages(token -> ResourcePage.last(s3.listBuckets(ListBucketsRequest.builder().build()).buckets()))
        .identifier(Bucket::name)
        .tagWith(name -> s3.putBucketTagging(
          PutBucketTaggingRequest.builder().bucket(name).tagging(tagging).build()
        ))
        .build()
    );
  }
}
