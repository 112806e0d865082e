/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.econgraph.edgar.cli;

import org.econgraph.edgar.ConfigurationException;
import org.econgraph.edgar.crawler.BatchCrawlOrchestrator;
import org.econgraph.edgar.crawler.BatchCrawlSummary;
import org.econgraph.edgar.crawler.CrawlConfig;
import org.econgraph.edgar.crawler.CrawlListener;
import org.econgraph.edgar.crawler.EdgarFilingSource;
import org.econgraph.edgar.crawler.FilingSource;
import org.econgraph.edgar.crawler.RateLimiter;
import org.econgraph.edgar.crawler.SecEdgarCrawler;
import org.econgraph.edgar.crawler.Sleeper;
import org.econgraph.edgar.storage.XbrlStorage;
import org.econgraph.edgar.util.SecUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Crawls several companies concurrently and reports per-company results.
 *
 * <p>All crawls share one rate limiter, so the request ceiling holds for the
 * whole batch. Exit code 1 is reserved for invalid configuration; failed
 * companies are listed in the report instead.
 */
public class BatchCrawlerCli {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCrawlerCli.class);

  static final List<String> DEFAULT_FORM_TYPES = ImmutableList.of("10-K", "10-Q");

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(SerializationFeature.INDENT_OUTPUT);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private final Function<String, @Nullable String> env;
  private final Function<CrawlConfig, FilingSource> sourceFactory;

  public BatchCrawlerCli() {
    this(System::getenv, EdgarFilingSource::new);
  }

  BatchCrawlerCli(Function<String, @Nullable String> env,
      Function<CrawlConfig, FilingSource> sourceFactory) {
    this.env = env;
    this.sourceFactory = sourceFactory;
  }

  public static void main(String[] args) {
    System.exit(new BatchCrawlerCli().run(args, System.out, System.err));
  }

  public int run(String[] args, PrintStream out, PrintStream err) {
    CliArguments arguments;
    List<String> ciks;
    try {
      arguments = CliArguments.parse(args, ImmutableSet.of("help"));
      if (arguments.flag("help")) {
        return usage(err, null);
      }
      ciks = CrawlConfig.parseList(arguments.require("ciks"));
    } catch (CliArguments.UsageException e) {
      return usage(err, e.getMessage());
    }

    BatchCrawlOrchestrator orchestrator;
    try {
      List<String> padded = new ArrayList<String>();
      for (String cik : ciks) {
        if (!SecUtils.isValidCik(cik)) {
          throw new ConfigurationException("Invalid CIK: " + cik);
        }
        padded.add(SecUtils.padCik(cik));
      }
      ciks = padded;
      Map<String, Object> file = SecCrawlerCli.loadConfigFile(arguments);
      CrawlConfig.Builder builder = SecCrawlerCli.baseBuilder(file, env);
      if (!file.containsKey("formTypes")) {
        builder.formTypes(DEFAULT_FORM_TYPES);
      }
      CrawlConfig config = SecCrawlerCli.applyFlags(builder, arguments).build();
      Integer maxConcurrent = arguments.getInt("max-concurrent");
      int concurrency = maxConcurrent != null ? maxConcurrent
          : BatchCrawlOrchestrator.DEFAULT_MAX_CONCURRENT;
      if (concurrency < 1) {
        throw new ConfigurationException("--max-concurrent must be at least 1");
      }
      XbrlStorage storage =
          new XbrlStorage(SecCrawlerCli.buildStorageConfig(arguments, file, env));
      SecEdgarCrawler crawler =
          new SecEdgarCrawler(config, sourceFactory.apply(config), storage,
              new RateLimiter(config.getMaxRequestsPerSecond()), Sleeper.SYSTEM,
              CrawlListener.NONE);
      orchestrator = new BatchCrawlOrchestrator(crawler, concurrency);
      out.println("Batch crawl of " + ciks.size() + " companies, " + concurrency
          + " at a time");
      out.println("  " + config);
    } catch (ConfigurationException e) {
      err.println("Configuration error: " + e.getMessage());
      return SecCrawlerCli.EXIT_FAILURE;
    } catch (IOException e) {
      err.println("Configuration error: cannot open storage: " + e.getMessage());
      return SecCrawlerCli.EXIT_FAILURE;
    }

    BatchCrawlSummary summary = orchestrator.crawlCompanies(ciks);
    out.println(summary.formatReport());

    String output = arguments.get("output");
    if (output != null) {
      try {
        ObjectMapper mapper = output.endsWith(".yaml") || output.endsWith(".yml")
            ? YAML_MAPPER : JSON_MAPPER;
        mapper.writeValue(Paths.get(output).toFile(), summary);
        out.println("Results written to " + output);
      } catch (IOException e) {
        LOGGER.error("Failed to write results to {}", output, e);
        err.println("Error: cannot write " + output + ": " + e.getMessage());
      }
    }
    return SecCrawlerCli.EXIT_OK;
  }

  private static int usage(PrintStream err, @Nullable String problem) {
    if (problem != null) {
      err.println("Error: " + problem);
      err.println();
    }
    err.println("Usage: BatchCrawlerCli --ciks CIK1,CIK2,... [options]");
    err.println();
    err.println("Options:");
    err.println("  --max-concurrent N    companies crawled at once (default "
        + BatchCrawlOrchestrator.DEFAULT_MAX_CONCURRENT + ")");
    err.println("  --form-types LIST     form types to keep (default 10-K,10-Q)");
    err.println("  --rate-limit N        requests per second across the batch");
    err.println("  --max-file-size SIZE  largest document to download");
    err.println("  --storage-dir DIR     directory for stored filings");
    err.println("  --config FILE         YAML or JSON configuration");
    err.println("  --output FILE         write results as JSON (or YAML for .yaml)");
    return SecCrawlerCli.EXIT_USAGE;
  }
}
