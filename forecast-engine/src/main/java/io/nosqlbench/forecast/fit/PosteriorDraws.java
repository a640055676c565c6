package io.nosqlbench.forecast.fit;

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

import java.util.List;

/// Parameter draws from an approximate posterior, in the order they were drawn.
public final class PosteriorDraws {

    private final List<FittedParameters> draws;

    public PosteriorDraws(List<FittedParameters> draws) {
        this.draws = List.copyOf(draws);
    }

    public int size() {
        return draws.size();
    }

    public FittedParameters get(int index) {
        return draws.get(index);
    }

    public List<FittedParameters> asList() {
        return draws;
    }
}
