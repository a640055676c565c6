package io.nosqlbench.forecast.predict;

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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/// The fixed output columns of a prediction, in output order: eight values on the
/// observation scale followed by their counterparts on the linked scale.
public enum PredictionColumn {
    YHAT,
    YHAT_UPPER,
    YHAT_LOWER,
    OBSERVED_UPPER,
    OBSERVED_LOWER,
    TREND,
    TREND_UPPER,
    TREND_LOWER,
    YHAT_LINKED,
    YHAT_UPPER_LINKED,
    YHAT_LOWER_LINKED,
    OBSERVED_UPPER_LINKED,
    OBSERVED_LOWER_LINKED,
    TREND_LINKED,
    TREND_UPPER_LINKED,
    TREND_LOWER_LINKED;

    private static final String LINKED_SUFFIX = "_LINKED";

    /// @return the output column name, e.g. `yhat_upper_linked`
    public String columnName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isLinked() {
        return name().endsWith(LINKED_SUFFIX);
    }

    /// @return the linked-scale column of an observation-scale column, or this column if already linked
    public PredictionColumn linked() {
        return isLinked() ? this : valueOf(name() + LINKED_SUFFIX);
    }

    public static List<String> columnNames() {
        return Arrays.stream(values()).map(PredictionColumn::columnName).collect(Collectors.toList());
    }

    public static PredictionColumn fromColumnName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
