package io.nosqlbench.streamconvert.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing for the human friendly size and duration values accepted in
 * configuration files and on the command line.
 *
 * <ul>
 *   <li>sizes: {@code 1048576}, {@code 512k}, {@code 200MB}, {@code 16MiB}, {@code 2g}.
 *   Single letter suffixes and the {@code KiB}/{@code MiB}/{@code GiB} forms are binary multiples,
 *   {@code KB}/{@code MB}/{@code GB} are decimal.</li>
 *   <li>durations: {@code 250ms}, {@code 10s}, {@code 30m}, {@code 2h}, {@code 1d}, a bare
 *   number of seconds, or an ISO-8601 value such as {@code PT30M}.</li>
 * </ul>
 */
public final class ConfigValues {

    private static final Pattern SIZE = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*([a-zA-Z]*)\\s*$");
    private static final Pattern DURATION = Pattern.compile("^\\s*(\\d+)\\s*(ms|s|m|h|d)?\\s*$", Pattern.CASE_INSENSITIVE);

    private ConfigValues() {
    }

    public static long parseSize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("size value must not be null");
        }
        Matcher m = SIZE.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid size value '" + text + "'");
        }
        double number = Double.parseDouble(m.group(1));
        long multiplier = switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "", "b" -> 1L;
            case "k", "kib" -> 1L << 10;
            case "kb" -> 1_000L;
            case "m", "mib" -> 1L << 20;
            case "mb" -> 1_000_000L;
            case "g", "gib" -> 1L << 30;
            case "gb" -> 1_000_000_000L;
            case "t", "tib" -> 1L << 40;
            case "tb" -> 1_000_000_000_000L;
            default -> throw new IllegalArgumentException("unknown size unit '" + m.group(2) + "' in '" + text + "'");
        };
        double bytes = number * multiplier;
        if (bytes > Long.MAX_VALUE) {
            throw new IllegalArgumentException("size value '" + text + "' is too large");
        }
        return (long) bytes;
    }

    public static Duration parseDuration(String text) {
        if (text == null) {
            throw new IllegalArgumentException("duration value must not be null");
        }
        String trimmed = text.trim();
        if (trimmed.regionMatches(true, 0, "P", 0, 1)) {
            try {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("invalid duration value '" + text + "'", e);
            }
        }
        Matcher m = DURATION.matcher(trimmed);
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid duration value '" + text + "'");
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "s" : m.group(2).toLowerCase(Locale.ROOT);
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            default -> throw new IllegalArgumentException("unknown duration unit in '" + text + "'");
        };
    }

    /// Renders a byte count with a binary unit, for log lines and summaries.
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"KiB", "MiB", "GiB", "TiB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }
}
