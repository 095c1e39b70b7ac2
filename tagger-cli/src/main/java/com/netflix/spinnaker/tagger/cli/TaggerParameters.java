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

package com.netflix.spinnaker.tagger.cli;

import com.netflix.spinnaker.tagger.model.TagSet;

import java.util.Collections;

/**
 * Parsed command line of one run
 */

public class TaggerParameters {
  public static final String MAP_MIGRATED_KEY = "map-migrated";

  public final boolean help;
  public final String profile;
  public final String region;
  public final String mapMigrated;
  public final TagSet customTags;

  TaggerParameters(boolean help, String profile, String region, String mapMigrated, TagSet customTags) {
    this.help = help;
    this.profile = profile;
    this.region = region;
    this.mapMigrated = mapMigrated;
    this.customTags = customTags;
  }

  /**
   * The tags applied to every resource: the map-migrated baseline, overridden by custom tags with the same key
   */

  public TagSet getTags() {
    TagSet baseline = TagSet.of(Collections.singletonMap(MAP_MIGRATED_KEY, mapMigrated));
    return TagSet.merge(baseline, customTags);
  }
}
