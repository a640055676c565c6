package io.nosqlbench.forecast.config;

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

import io.nosqlbench.forecast.errors.ConfigurationErrorKind;
import io.nosqlbench.forecast.errors.ForecastConfigurationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses sampling periods and widths written either as ISO-8601 durations
/// (`P1D`, `PT15M`) or as a number with a unit suffix
/// (`30s`, `15min`, `1h`, `1d`, `1w`).
public final class Durations {

    private static final Pattern SHORT_FORM = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(s|min|h|d|w)");

    private Durations() {
    }

    public static Duration parse(String text) {
        String trimmed = text.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return positive(Duration.parse(trimmed.toUpperCase(Locale.ROOT)), text);
            } catch (DateTimeParseException e) {
                throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                    "cannot parse duration '" + text + "'", e);
            }
        }
        Matcher matcher = SHORT_FORM.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "cannot parse duration '" + text + "', expected ISO-8601 or <n><s|min|h|d|w>");
        }
        double amount = Double.parseDouble(matcher.group(1));
        double unitSeconds;
        switch (matcher.group(2)) {
            case "s":
                unitSeconds = 1;
                break;
            case "min":
                unitSeconds = 60;
                break;
            case "h":
                unitSeconds = 3600;
                break;
            case "d":
                unitSeconds = 86400;
                break;
            default:
                unitSeconds = 7 * 86400;
                break;
        }
        return positive(ofSeconds(amount * unitSeconds), text);
    }

    /// Converts fractional seconds to a duration with nanosecond resolution.
    ///
    /// @param seconds the length in seconds
    /// @return the duration
    public static Duration ofSeconds(double seconds) {
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1e9);
        return Duration.ofSeconds(whole, nanos);
    }

    public static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1e9;
    }

    private static Duration positive(Duration duration, String text) {
        if (duration.isNegative() || duration.isZero()) {
            throw new ForecastConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER,
                "duration must be positive: '" + text + "'");
        }
        return duration;
    }
}
