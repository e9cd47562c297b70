package io.gedpaths.stats;

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
import java.util.Objects;

/// Immutable summary of a named sequence of values.
///
/// Mean and standard deviation use population formulas. For an empty sequence the
/// count is zero and the other moments are `NaN`.
public final class ValueStatistics {

    private final String name;
    private final double[] values;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;

    private ValueStatistics(String name, double[] values, double mean, double stdDev, double min, double max) {
        this.name = name;
        this.values = values;
        this.mean = mean;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
    }

    /**
     * Computes statistics over the given values.
     *
     * @param name the metric name
     * @param values the observed values, copied
     * @return computed statistics
     */
    public static ValueStatistics compute(String name, double[] values) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        double[] copy = values.clone();
        if (copy.length == 0) {
            return new ValueStatistics(name, copy, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
        }

        double min = copy[0];
        double max = copy[0];
        double sum = 0;
        for (double v : copy) {
            if (v < min) min = v;
            if (v > max) max = v;
            sum += v;
        }
        double mean = sum / copy.length;

        double m2 = 0;
        for (double v : copy) {
            double diff = v - mean;
            m2 += diff * diff;
        }
        return new ValueStatistics(name, copy, mean, Math.sqrt(m2 / copy.length), min, max);
    }

    public static ValueStatistics compute(String name, List<? extends Number> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i).doubleValue();
        }
        return compute(name, array);
    }

    public String name() {
        return name;
    }

    /// Returns a copy of the values.
    public double[] values() {
        return values.clone();
    }

    public int count() {
        return values.length;
    }

    public double mean() {
        return mean;
    }

    /// Population standard deviation.
    public double stdDev() {
        return stdDev;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueStatistics)) return false;
        ValueStatistics that = (ValueStatistics) o;
        return name.equals(that.name) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("%s{count=%d, mean=%.4f, stdDev=%.4f, min=%.4f, max=%.4f}",
            name, count(), mean, stdDev, min, max);
    }
}
