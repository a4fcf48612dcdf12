/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.stepflow.workflow.aggregation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Distribution of execution durations, in seconds. The standard deviation is the
 * population form.
 */
public final class DurationStatistics {

    private final int count;
    private final double min;
    private final double max;
    private final double average;
    private final double median;
    private final double standardDeviation;

    private DurationStatistics(int count, double min, double max, double average, double median,
                               double standardDeviation) {
        this.count = count;
        this.min = min;
        this.max = max;
        this.average = average;
        this.median = median;
        this.standardDeviation = standardDeviation;
    }

    /**
     * @return statistics over the given samples, all zero when there are none
     */
    public static DurationStatistics of(Collection<Double> durationsInSeconds) {
        if (durationsInSeconds == null || durationsInSeconds.isEmpty()) {
            return new DurationStatistics(0, 0, 0, 0, 0, 0);
        }
        List<Double> sorted = new ArrayList<>(durationsInSeconds);
        Collections.sort(sorted);
        int n = sorted.size();

        double sum = 0;
        for (double value : sorted) {
            sum += value;
        }
        double average = sum / n;

        double median = n % 2 == 1
                ? sorted.get(n / 2)
                : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;

        double squares = 0;
        for (double value : sorted) {
            squares += (value - average) * (value - average);
        }

        return new DurationStatistics(n, sorted.get(0), sorted.get(n - 1), average, median,
                Math.sqrt(squares / n));
    }

    public int getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getAverage() {
        return average;
    }

    public double getMedian() {
        return median;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    @Override
    public String toString() {
        return String.format("DurationStatistics{count=%d, min=%.3f, max=%.3f, avg=%.3f, median=%.3f, stddev=%.3f}",
                count, min, max, average, median, standardDeviation);
    }
}
