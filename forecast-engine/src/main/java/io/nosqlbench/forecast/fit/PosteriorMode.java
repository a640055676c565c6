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

/// The maximum of a log-posterior as reported by a [PosteriorOptimizer].
public final class PosteriorMode {

    private final double[] point;
    private final double logPosterior;
    private final int iterations;
    private final int evaluations;

    public PosteriorMode(double[] point, double logPosterior, int iterations, int evaluations) {
        this.point = point.clone();
        this.logPosterior = logPosterior;
        this.iterations = iterations;
        this.evaluations = evaluations;
    }

    public double[] getPoint() {
        return point.clone();
    }

    public double getLogPosterior() {
        return logPosterior;
    }

    public int getIterations() {
        return iterations;
    }

    public int getEvaluations() {
        return evaluations;
    }
}
