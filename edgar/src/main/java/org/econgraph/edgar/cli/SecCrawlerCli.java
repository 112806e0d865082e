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
import org.econgraph.edgar.EdgarException;
import org.econgraph.edgar.YamlUtils;
import org.econgraph.edgar.crawler.CrawlConfig;
import org.econgraph.edgar.crawler.CrawlListener;
import org.econgraph.edgar.crawler.CrawlResult;
import org.econgraph.edgar.crawler.EdgarFilingSource;
import org.econgraph.edgar.crawler.FilingSource;
import org.econgraph.edgar.crawler.RateLimiter;
import org.econgraph.edgar.crawler.SecEdgarCrawler;
import org.econgraph.edgar.crawler.Sleeper;
import org.econgraph.edgar.ratio.CalculatedRatio;
import org.econgraph.edgar.ratio.FinancialRatioCalculator;
import org.econgraph.edgar.ratio.RatioConfig;
import org.econgraph.edgar.storage.StorageStats;
import org.econgraph.edgar.storage.XbrlStorage;
import org.econgraph.edgar.storage.XbrlStorageConfig;
import org.econgraph.edgar.util.SecUtils;
import org.econgraph.edgar.xbrl.ParsedStatement;
import org.econgraph.edgar.xbrl.StatementWriter;
import org.econgraph.edgar.xbrl.ValidationReport;
import org.econgraph.edgar.xbrl.XbrlParseException;
import org.econgraph.edgar.xbrl.XbrlParser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.io.Writer;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Command-line front end for single-company crawls, storage statistics and
 * document parsing.
 *
 * <p>Usage: {@code SecCrawlerCli <command> [options]}; run without
 * arguments for the option list. Exit codes: 0 success, 1 configuration
 * error or fatal failure, 2 usage error. Failures of individual filings do
 * not change the exit code.
 */
public class SecCrawlerCli {
  private static final Logger LOGGER = LoggerFactory.getLogger(SecCrawlerCli.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String ENV_USER_AGENT = "SEC_USER_AGENT";
  static final String ENV_STORAGE_DIR = "SEC_STORAGE_DIR";

  private static final Set<String> FLAGS = ImmutableSet.of("exclude-amended",
      "exclude-restated", "help");

  private final Function<String, @Nullable String> env;
  private final Function<CrawlConfig, FilingSource> sourceFactory;

  public SecCrawlerCli() {
    this(System::getenv, EdgarFilingSource::new);
  }

  SecCrawlerCli(Function<String, @Nullable String> env,
      Function<CrawlConfig, FilingSource> sourceFactory) {
    this.env = env;
    this.sourceFactory = sourceFactory;
  }

  public static void main(String[] args) {
    System.exit(new SecCrawlerCli().run(args, System.out, System.err));
  }

  public int run(String[] args, PrintStream out, PrintStream err) {
    CliArguments arguments;
    try {
      arguments = CliArguments.parse(args, FLAGS);
    } catch (CliArguments.UsageException e) {
      return usage(err, e.getMessage());
    }
    List<String> words = arguments.positional();
    if (words.isEmpty() || arguments.flag("help")) {
      return usage(err, null);
    }
    String command = words.get(0);
    try {
      switch (command) {
      case "crawl-company":
        return crawlCompany(arguments, out);
      case "stats":
        return stats(arguments, out);
      case "validate":
        return validate(arguments, out);
      case "parse":
        return parse(arguments, out);
      case "ratios":
        return ratios(arguments, out);
      default:
        return usage(err, "Unknown command: " + command);
      }
    } catch (CliArguments.UsageException e) {
      return usage(err, e.getMessage());
    } catch (ConfigurationException e) {
      err.println("Configuration error: " + e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException | EdgarException e) {
      LOGGER.error("Command {} failed", command, e);
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private int crawlCompany(CliArguments arguments, PrintStream out) throws IOException {
    String cik = arguments.require("cik");
    if (!SecUtils.isValidCik(cik)) {
      throw new ConfigurationException("Invalid CIK: " + cik);
    }
    Map<String, Object> file = loadConfigFile(arguments);
    CrawlConfig config = buildCrawlConfig(arguments, file, env);
    XbrlStorage storage = new XbrlStorage(buildStorageConfig(arguments, file, env));

    String paddedCik = SecUtils.padCik(cik);
    out.println("Crawling filings for CIK " + paddedCik);
    out.println("  " + config);
    SecEdgarCrawler crawler =
        new SecEdgarCrawler(config, sourceFactory.apply(config), storage,
            new RateLimiter(config.getMaxRequestsPerSecond()), Sleeper.SYSTEM,
            CrawlListener.NONE);
    CrawlResult result = crawler.crawlCompanyFilings(paddedCik);
    printResult(result, out);
    return result.isSuccess() ? EXIT_OK : EXIT_FAILURE;
  }

  private int stats(CliArguments arguments, PrintStream out) throws IOException {
    Map<String, Object> file = loadConfigFile(arguments);
    XbrlStorageConfig storageConfig = buildStorageConfig(arguments, file, env);
    StorageStats stats = new XbrlStorage(storageConfig).getStorageStats();
    out.println("Storage: " + storageConfig.getBaseDirectory().toAbsolutePath());
    out.println("  Total files:        " + stats.getTotalFiles());
    out.println("  Total size:         " + SecUtils.formatFileSize(stats.getTotalBytes()));
    out.println("  Stored size:        " + SecUtils.formatFileSize(stats.getTotalStoredBytes()));
    out.println("  Large objects:      " + stats.getLargeObjectFiles());
    out.println("  Inline:             " + stats.getByteaFiles());
    out.println("  Compressed:         " + stats.getCompressedFiles());
    out.println("  Uncompressed:       " + stats.getUncompressedFiles());
    out.println(String.format(Locale.ROOT, "  Compression ratio:  %.3f",
        stats.getCompressionRatio()));
    return EXIT_OK;
  }

  private int validate(CliArguments arguments, PrintStream out) throws IOException {
    Path path = Paths.get(arguments.require("file"));
    ValidationReport report = new XbrlParser().validate(Files.readAllBytes(path));
    out.println((report.isValid() ? "VALID" : "INVALID") + ": " + path
        + " (" + report.getDocumentType() + ", " + report.getContextCount() + " contexts, "
        + report.getFactCount() + " facts)");
    for (String error : report.getErrors()) {
      out.println("  ERROR   " + error);
    }
    for (String warning : report.getWarnings()) {
      out.println("  WARNING " + warning);
    }
    return report.isValid() ? EXIT_OK : EXIT_FAILURE;
  }

  private int parse(CliArguments arguments, PrintStream out) throws IOException {
    ParsedStatement statement = parseFile(arguments);
    String format = arguments.get("format") == null ? "json"
        : arguments.require("format").toLowerCase(Locale.ROOT);
    StringWriter buffer = new StringWriter();
    switch (format) {
    case "json":
      StatementWriter.writeJson(statement, buffer);
      buffer.write(System.lineSeparator());
      break;
    case "yaml":
      buffer.write(StatementWriter.toYaml(statement));
      break;
    case "csv":
      StatementWriter.writeStatementsCsv(Collections.singletonList(statement), buffer);
      break;
    case "concepts-csv":
      StatementWriter.writeConceptsCsv(statement, buffer);
      break;
    default:
      throw new CliArguments.UsageException("Unknown format: " + format);
    }
    String output = arguments.get("output");
    if (output != null) {
      try (Writer writer = Files.newBufferedWriter(Paths.get(output), StandardCharsets.UTF_8)) {
        writer.write(buffer.toString());
      }
      out.println("Wrote " + statement.getConcepts().size() + " concepts to " + output);
    } else {
      out.print(buffer);
    }
    return EXIT_OK;
  }

  private int ratios(CliArguments arguments, PrintStream out) throws IOException {
    ParsedStatement statement = parseFile(arguments);
    RatioConfig config;
    String definitions = arguments.get("ratio-config");
    if (definitions != null) {
      try (InputStream in = Files.newInputStream(Paths.get(definitions))) {
        config = RatioConfig.fromYaml(in);
      }
    } else {
      config = RatioConfig.defaults();
    }
    out.println("Ratios for " + statement.getCompanyCik() + " " + statement.getFilingType()
        + " period ending " + statement.getPeriodEndDate());
    for (CalculatedRatio ratio : new FinancialRatioCalculator(config).calculate(statement)) {
      String value = ratio.getValue() != null
          ? ratio.getValue().setScale(4, RoundingMode.HALF_UP).toPlainString()
          : "n/a";
      out.println(String.format(Locale.ROOT, "  %-28s %12s  %s", ratio.getName(), value,
          ratio.getInterpretation() != null ? ratio.getInterpretation()
              : ratio.getNote() != null ? ratio.getNote() : ""));
    }
    return EXIT_OK;
  }

  private static ParsedStatement parseFile(CliArguments arguments)
      throws IOException {
    Path path = Paths.get(arguments.require("file"));
    try {
      return new XbrlParser().parse(Files.readAllBytes(path));
    } catch (XbrlParseException e) {
      throw new EdgarException("Cannot parse " + path + ": " + e.getMessage(), e);
    }
  }

  static void printResult(CrawlResult result, PrintStream out) {
    out.println();
    out.println("Crawl " + (result.isSuccess() ? "completed" : "FAILED") + " for CIK "
        + result.getCompanyCik());
    out.println("  Filings found:     " + result.getTotalFilingsFound());
    out.println("  Downloaded:        " + result.getFilingsDownloaded());
    out.println("  Failed:            " + result.getFilingsFailed());
    out.println("  Bytes downloaded:  "
        + SecUtils.formatFileSize(result.getTotalBytesDownloaded()));
    out.println("  Duration:          " + result.getDuration().toMillis() + " ms");
    if (!result.getErrors().isEmpty()) {
      out.println("  Errors:");
      for (String error : result.getErrors()) {
        out.println("    - " + error);
      }
    }
  }

  // Configuration precedence: defaults, then environment, then file, then flags

  static Map<String, Object> loadConfigFile(CliArguments arguments) {
    String path = arguments.get("config");
    if (path == null) {
      return Collections.emptyMap();
    }
    try {
      return YamlUtils.readMap(Paths.get(path));
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read configuration file " + path, e);
    }
  }

  static CrawlConfig buildCrawlConfig(CliArguments arguments, Map<String, Object> file,
      Function<String, @Nullable String> env) {
    return applyFlags(baseBuilder(file, env), arguments).build();
  }

  static CrawlConfig.Builder baseBuilder(Map<String, Object> file,
      Function<String, @Nullable String> env) {
    CrawlConfig.Builder builder = CrawlConfig.builder();
    String userAgent = env.apply(ENV_USER_AGENT);
    if (userAgent != null && !userAgent.trim().isEmpty()) {
      builder.userAgent(userAgent.trim());
    }
    return CrawlConfig.populate(builder, file);
  }

  static CrawlConfig.Builder applyFlags(CrawlConfig.Builder builder, CliArguments arguments) {
    if (arguments.has("start-date")) {
      builder.startDate(arguments.getDate("start-date"));
    }
    if (arguments.has("end-date")) {
      builder.endDate(arguments.getDate("end-date"));
    }
    String forms = arguments.get("form-types");
    if (forms != null) {
      builder.formTypes(CrawlConfig.parseList(forms));
    }
    if (arguments.flag("exclude-amended")) {
      builder.excludeAmended(true);
    }
    if (arguments.flag("exclude-restated")) {
      builder.excludeRestated(true);
    }
    Double rate = arguments.getDouble("rate-limit");
    if (rate != null) {
      builder.maxRequestsPerSecond(rate);
    }
    Integer retries = arguments.getInt("max-retries");
    if (retries != null) {
      builder.maxRetries(retries);
    }
    Long delay = arguments.getLong("retry-delay");
    if (delay != null) {
      builder.retryDelaySeconds(delay);
    }
    Long maxSize = arguments.getSize("max-file-size");
    if (maxSize != null) {
      builder.maxFileSizeBytes(maxSize);
    }
    String userAgent = arguments.get("user-agent");
    if (userAgent != null) {
      builder.userAgent(userAgent);
    }
    return builder;
  }

  @SuppressWarnings("unchecked")
  static XbrlStorageConfig buildStorageConfig(CliArguments arguments, Map<String, Object> file,
      Function<String, @Nullable String> env) {
    String envDir = env.apply(ENV_STORAGE_DIR);
    Path defaultDir = Paths.get(envDir != null && !envDir.trim().isEmpty()
        ? envDir.trim() : XbrlStorageConfig.DEFAULT_BASE_DIRECTORY);
    Object section = file.get("storage");
    XbrlStorageConfig config = XbrlStorageConfig.fromMap(
        section instanceof Map ? (Map<String, Object>) section : null, defaultDir);
    String flagDir = arguments.get("storage-dir");
    if (flagDir != null) {
      config = XbrlStorageConfig.builder(Paths.get(flagDir))
          .largeObjectThresholdBytes(config.getLargeObjectThresholdBytes())
          .compressionEnabled(config.isCompressionEnabled())
          .compressionLevel(config.getCompressionLevel())
          .minCompressionSizeBytes(config.getMinCompressionSizeBytes())
          .build();
    }
    return config;
  }

  private static int usage(PrintStream err, @Nullable String problem) {
    if (problem != null) {
      err.println("Error: " + problem);
      err.println();
    }
    for (String line : USAGE) {
      err.println(line);
    }
    return EXIT_USAGE;
  }

  private static final List<String> USAGE = ImmutableList.of(
      "Usage: SecCrawlerCli <command> [options]",
      "",
      "Commands:",
      "  crawl-company --cik CIK [--start-date D] [--end-date D] [--form-types 10-K,10-Q]",
      "                [--exclude-amended] [--exclude-restated] [--rate-limit N]",
      "                [--max-retries N] [--retry-delay SECONDS] [--max-file-size SIZE]",
      "                [--storage-dir DIR] [--user-agent UA] [--config FILE]",
      "  stats         [--storage-dir DIR] [--config FILE]",
      "  validate      --file FILE",
      "  parse         --file FILE [--format json|yaml|csv|concepts-csv]",
      "                [--output FILE]",
      "  ratios        --file FILE [--ratio-config FILE]",
      "",
      "Environment variables (optional):",
      "  " + ENV_USER_AGENT + "   - User-Agent sent to SEC EDGAR",
      "  " + ENV_STORAGE_DIR + "  - Directory for stored filings");
}
