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
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;

/**
 * Parses the command line arguments and prints the help page
 */

public class CommandLineOptions {
  public static final String HELP_OPTION = "help";
  public static final String PROFILE_OPTION = "profile";
  public static final String REGION_OPTION = "region";
  public static final String MAP_MIGRATED_OPTION = "map-migrated";
  public static final String TAG_OPTION = "tag";

  public static final String DEFAULT_PROFILE = "default";
  public static final String DEFAULT_REGION = "us-east-1";
  public static final String DEFAULT_MAP_MIGRATED = "mig12345";

  private static final String COMMAND = "resource-tagger <options>";
  private static final String HEADER = "Apply a fixed set of tags to AWS resources across services.";
  private static final String FOOTER = "Example: resource-tagger -p prod -r eu-west-1 -t team:data,env:prod";

  private final Options options = createOptions();

  private static Options createOptions() {
    Options options = new Options();

    options.addOption(Option.builder("h")
      .hasArg(false)
      .desc("Show this syntax page.")
      .longOpt(HELP_OPTION)
      .build());

    options.addOption(Option.builder("p")
      .hasArg(true)
      .desc("AWS profile to use (default '" + DEFAULT_PROFILE + "').")
      .longOpt(PROFILE_OPTION)
      .argName("profile")
      .build());

    options.addOption(Option.builder("r")
      .hasArg(true)
      .desc("AWS region to use (default '" + DEFAULT_REGION + "').")
      .longOpt(REGION_OPTION)
      .argName("region")
      .build());

    options.addOption(Option.builder()
      .hasArg(true)
      .desc("MAP 2.0 value to use (default '" + DEFAULT_MAP_MIGRATED + "').")
      .longOpt(MAP_MIGRATED_OPTION)
      .argName("value")
      .build());

    options.addOption(Option.builder("t")
      .hasArg(true)
      .desc("Custom tags in key:value format, comma separated for multiple tags. Required.")
      .longOpt(TAG_OPTION)
      .argName("tags")
      .build());

    return options;
  }

  public void printHelp(PrintWriter writer) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, COMMAND, HEADER, options,
      HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, FOOTER);
    writer.flush();
  }

  public TaggerParameters parseCommandLineArguments(String[] args) throws IllegalArgumentException {
    CommandLine cl;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(options, args);
    } catch (ParseException e) {
      throw new IllegalArgumentException(e.getMessage(), e);
    }

    boolean help = cl.hasOption(HELP_OPTION);
    String profile = cl.getOptionValue(PROFILE_OPTION, DEFAULT_PROFILE);
    String region = cl.getOptionValue(REGION_OPTION, DEFAULT_REGION);
    String mapMigrated = cl.getOptionValue(MAP_MIGRATED_OPTION, DEFAULT_MAP_MIGRATED);

    if (help) {
      return new TaggerParameters(true, profile, region, mapMigrated, TagSet.empty());
    }

    if (!cl.hasOption(TAG_OPTION)) {
      throw new IllegalArgumentException("Missing required option: --" + TAG_OPTION);
    }

    if (mapMigrated.trim().isEmpty()) {
      throw new IllegalArgumentException("The --" + MAP_MIGRATED_OPTION + " value cannot be empty");
    }

    TagSet customTags = TagParser.parse(cl.getOptionValue(TAG_OPTION));
    return new TaggerParameters(false, profile, region, mapMigrated.trim(), customTags);
  }
}
