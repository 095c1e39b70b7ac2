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

package com.netflix.spinnaker.tagger.orchestrator;

/**
 * Who the validated session belongs to
 */

public final class CallerIdentity {
  private final String accountId;
  private final String arn;

  public CallerIdentity(String accountId, String arn) {
    this.accountId = accountId;
    this.arn = arn;
  }

  public String getAccountId() {
    return accountId;
  }

  public String getArn() {
    return arn;
  }

  @Override
  public String toString() {
    return "CallerIdentity{accountId=" + accountId + ", arn=" + arn + "}";
  }
}
