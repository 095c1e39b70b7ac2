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

package com.netflix.spinnaker.tagger.model;

import com.netflix.spinnaker.tagger.arn.ArnBuilder;

/**
 * State shared read-only by every service tagger during one run
 */

public final class RunContext {
  private final String region;
  private final String accountId;
  private final TagSet tags;
  private final ClientFactory clientFactory;
  private final Cancellation cancellation;
  private final ArnBuilder arnBuilder;

  public RunContext(String region,
                    String accountId,
                    TagSet tags,
                    ClientFactory clientFactory,
                    Cancellation cancellation) {
    this.region = region;
    this.accountId = accountId;
    this.tags = tags;
    this.clientFactory = clientFactory;
    this.cancellation = cancellation;
    this.arnBuilder = new ArnBuilder(region, accountId);
  }

  public String getRegion() {
    return region;
  }

  public String getAccountId() {
    return accountId;
  }

  public TagSet getTags() {
    return tags;
  }

  public ClientFactory getClientFactory() {
    return clientFactory;
  }

  public <T> T getClient(Class<T> type) {
    return clientFactory.getClient(type);
  }

  public Cancellation getCancellation() {
    return cancellation;
  }

  public boolean isCancelled() {
    return cancellation.isCancelled();
  }

  public ArnBuilder getArnBuilder() {
    return arnBuilder;
  }
}
