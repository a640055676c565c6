package io.nosqlbench.forecast.design;

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

import io.nosqlbench.forecast.config.Durations;
import io.nosqlbench.forecast.series.PredictionFrame;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A recurring or one-off effect with a fixed profile, contributing one column that sums
/// the profile over all occurrences.
///
/// Occurrences are either listed explicitly ([#single], [#intermittent]) or
/// generated from an anchor and a period ([#periodic]), in which case they extend
/// indefinitely in both directions.
///
/// The column is not rescaled.
public final class Event implements DesignComponent {

    private final String name;
    private final EventProfile profile;
    private final Double priorScale;
    private final List<Instant> occurrences;
    private final Instant anchor;
    private final Duration period;

    private Event(String name, EventProfile profile, Double priorScale,
                  List<Instant> occurrences, Instant anchor, Duration period) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.profile = Objects.requireNonNull(profile, "profile cannot be null");
        if (priorScale != null && !(priorScale > 0)) {
            throw new IllegalArgumentException("prior scale must be positive, got " + priorScale);
        }
        this.priorScale = priorScale;
        this.occurrences = occurrences;
        this.anchor = anchor;
        this.period = period;
    }

    public static Event single(String name, EventProfile profile, Instant occurrence) {
        return intermittent(name, profile, List.of(occurrence), null);
    }

    public static Event intermittent(String name, EventProfile profile, List<Instant> occurrences) {
        return intermittent(name, profile, occurrences, null);
    }

    public static Event intermittent(String name, EventProfile profile, List<Instant> occurrences, Double priorScale) {
        if (occurrences.isEmpty()) {
            throw new IllegalArgumentException("event '" + name + "' needs at least one occurrence");
        }
        List<Instant> sorted = new ArrayList<>(occurrences);
        Collections.sort(sorted);
        return new Event(name, profile, priorScale, Collections.unmodifiableList(sorted), null, null);
    }

    public static Event periodic(String name, EventProfile profile, Instant anchor, Duration period) {
        return periodic(name, profile, anchor, period, null);
    }

    public static Event periodic(String name, EventProfile profile, Instant anchor, Duration period, Double priorScale) {
        Objects.requireNonNull(anchor, "anchor cannot be null");
        Objects.requireNonNull(period, "period cannot be null");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("event period must be positive, got " + period);
        }
        return new Event(name, profile, priorScale, null, anchor, period);
    }

    @Override
    public String getName() {
        return name;
    }

    public EventProfile getProfile() {
        return profile;
    }

    public boolean isPeriodic() {
        return anchor != null;
    }

    /// @return the explicit occurrences; empty for a periodic event
    public List<Instant> getOccurrences() {
        return occurrences == null ? List.of() : occurrences;
    }

    @Override
    public List<String> columnNames() {
        return List.of(name);
    }

    @Override
    public double priorScale(PriorScaleDefaults defaults) {
        return priorScale != null ? priorScale : defaults.getEvent();
    }

    @Override
    public double[][] evaluate(PredictionFrame frame, ScalingContext scaling) {
        double[] seconds = frame.epochSeconds();
        double[] column = new double[seconds.length];
        double reach = profile.reach();
        for (int i = 0; i < seconds.length; i++) {
            column[i] = isPeriodic() ? periodicValue(seconds[i], reach) : listedValue(seconds[i], reach);
        }
        return new double[][]{column};
    }

    private double listedValue(double s, double reach) {
        double sum = 0.0;
        for (Instant occurrence : occurrences) {
            double offset = s - PredictionFrame.toEpochSeconds(occurrence);
            if (Math.abs(offset) <= reach) {
                sum += profile.value(offset);
            }
        }
        return sum;
    }

    private double periodicValue(double s, double reach) {
        double origin = PredictionFrame.toEpochSeconds(anchor);
        double step = Durations.toSeconds(period);
        long first = (long) Math.ceil((s - reach - origin) / step);
        long last = (long) Math.floor((s + reach - origin) / step);
        double sum = 0.0;
        for (long k = first; k <= last; k++) {
            sum += profile.value(s - (origin + k * step));
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event that = (Event) o;
        return name.equals(that.name) && profile.equals(that.profile)
            && Objects.equals(priorScale, that.priorScale) && Objects.equals(occurrences, that.occurrences)
            && Objects.equals(anchor, that.anchor) && Objects.equals(period, that.period);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, profile, priorScale, occurrences, anchor, period);
    }

    @Override
    public String toString() {
        return "Event{" + name + ", " + profile + (isPeriodic()
            ? ", every " + period + " from " + anchor
            : ", " + occurrences.size() + " occurrence(s)") + '}';
    }
}
