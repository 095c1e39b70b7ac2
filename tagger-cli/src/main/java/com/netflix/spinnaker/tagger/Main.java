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

package com.netflix.spinnaker.tagger;

import com.netflix.spinnaker.tagger.aws.config.AwsConfiguration;
import com.netflix.spinnaker.tagger.cli.CommandLineOptions;
import com.netflix.spinnaker.tagger.cli.TaggerParameters;
import com.netflix.spinnaker.tagger.config.TaggerConfig;
import com.netflix.spinnaker.tagger.errors.SessionValidationException;
import com.netflix.spinnaker.tagger.model.Cancellation;
import com.netflix.spinnaker.tagger.model.TaggingReport;
import com.netflix.spinnaker.tagger.orchestrator.TaggingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;

@Configuration
@Import({ TaggerConfig.class, AwsConfiguration.class })
@EnableAutoConfiguration
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final Map<String, Object> DEFAULT_PROPS = new HashMap<String, Object>() {
    {
      put("spring.application.name", "resource-tagger");
      put("spring.main.web-application-type", "none");
      put("spring.main.banner-mode", "off");
    }
  };

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Runs the tagger and returns the process exit code
   */

  static int run(String[] args, PrintStream out, PrintStream err) {
    CommandLineOptions options = new CommandLineOptions();
    TaggerParameters parameters;
    try {
      parameters = options.parseCommandLineArguments(args);
    } catch (IllegalArgumentException e) {
      PrintWriter writer = new PrintWriter(err);
      writer.println("Error: " + e.getMessage());
      options.printHelp(writer);
      return 1;
    }

    if (parameters.help) {
      options.printHelp(new PrintWriter(out));
      return 0;
    }

    Map<String, Object> props = new HashMap<>(DEFAULT_PROPS);
    props.put("aws.profile", parameters.profile);
    props.put("aws.region", parameters.region);

    try (ConfigurableApplicationContext context =
           new SpringApplicationBuilder().properties(props).sources(Main.class).run()) {
      TaggingOrchestrator orchestrator = context.getBean(TaggingOrchestrator.class);
      Cancellation cancellation = new Cancellation();
      Runtime.getRuntime().addShutdownHook(new Thread(cancellation::cancel, "tagger-shutdown"));

      LOGGER.info("Using AWS profile {} in region {}", parameters.profile, parameters.region);
      TaggingReport report = orchestrator.tagAllResources(parameters.getTags(), cancellation);
      LOGGER.info("Tagged {} resources, {} failures", report.getTotalTagged(), report.getTotalFailed());
      return 0;
    } catch (SessionValidationException e) {
      LOGGER.error("Failed to validate AWS session: {}", e.getMessage(), e);
      return 1;
    }
  }
}
