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

/**
 * Finds the maximum a-posteriori point of an objective.
 */
public interface PosteriorOptimizer {

    /**
     * Maximizes the log-posterior.
     *
     * @param objective the log-posterior and its gradient
     * @param initial the starting point
     * @return the mode found
     * @throws io.nosqlbench.forecast.errors.OptimizationException when the search does not converge
     */
    PosteriorMode maximize(PosteriorObjective objective, double[] initial);
}
