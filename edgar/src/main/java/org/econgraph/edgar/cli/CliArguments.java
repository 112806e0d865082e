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
import org.econgraph.edgar.util.SecUtils;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Command-line arguments: positional words, {@code --name value} (or
 * {@code --name=value}) options and bare {@code --flag}s.
 */
final class CliArguments {
  private final List<String> positional;
  private final Map<String, String> options;

  private CliArguments(List<String> positional, Map<String, String> options) {
    this.positional = positional;
    this.options = options;
  }

  /**
   * Parses arguments.
   *
   * @param flags option names that take no value
   * @throws UsageException on an option with a missing value
   */
  static CliArguments parse(String[] args, Set<String> flags) {
    List<String> positional = new ArrayList<String>();
    Map<String, String> options = new LinkedHashMap<String, String>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        positional.add(arg);
        continue;
      }
      String name = arg.substring(2);
      int eq = name.indexOf('=');
      if (eq >= 0) {
        options.put(name.substring(0, eq), name.substring(eq + 1));
      } else if (flags.contains(name)) {
        options.put(name, "true");
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        options.put(name, args[++i]);
      } else {
        throw new UsageException("Option --" + name + " requires a value");
      }
    }
    return new CliArguments(positional, options);
  }

  List<String> positional() {
    return positional;
  }

  boolean has(String name) {
    return options.containsKey(name);
  }

  @Nullable String get(String name) {
    return options.get(name);
  }

  String require(String name) {
    String value = options.get(name);
    if (value == null || value.trim().isEmpty()) {
      throw new UsageException("Missing required option --" + name);
    }
    return value;
  }

  boolean flag(String name) {
    String value = options.get(name);
    return value != null && !value.equalsIgnoreCase("false");
  }

  @Nullable Integer getInt(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("--" + name + " must be an integer: " + value, e);
    }
  }

  @Nullable Long getLong(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("--" + name + " must be an integer: " + value, e);
    }
  }

  @Nullable Double getDouble(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("--" + name + " must be a number: " + value, e);
    }
  }

  /** A byte count, either plain digits or a size such as {@code 50MB}. */
  @Nullable Long getSize(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return SecUtils.parseFileSize(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("--" + name + " must be a size: " + value, e);
    }
  }

  @Nullable LocalDate getDate(String name) {
    String value = options.get(name);
    if (value == null) {
      return null;
    }
    try {
      return SecUtils.parseSecDate(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("--" + name + " is not a valid date: " + value, e);
    }
  }

  /** Wrong command-line usage; reported with the usage text. */
  static class UsageException extends IllegalArgumentException {
    UsageException(String message) {
      super(message);
    }
  }
}
