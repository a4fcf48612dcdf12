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

package dev.mars.stepflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for a batch run. Missing values take the defaults below.
 *
 * <p>{@code retryDelay} is both the pause between batches and the wait between
 * start attempts of a single item.
 */
public final class BatchProcessingConfig {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_PARALLELISM = 3;
    public static final int DEFAULT_RETRY_COUNT = 2;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(30);

    public static final int MAX_BATCH_SIZE = 1000;
    public static final int MAX_PARALLELISM = 50;
    public static final int MAX_RETRY_COUNT = 10;

    private final int batchSize;
    private final int maxParallelism;
    private final int retryCount;
    private final Duration retryDelay;
    private final boolean continueOnError;

    @JsonCreator
    public BatchProcessingConfig(@JsonProperty("batchSize") Integer batchSize,
                                 @JsonProperty("maxParallelism") Integer maxParallelism,
                                 @JsonProperty("retryCount") Integer retryCount,
                                 @JsonProperty("retryDelay") Duration retryDelay,
                                 @JsonProperty("continueOnError") Boolean continueOnError) {
        this.batchSize = batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
        this.maxParallelism = maxParallelism != null ? maxParallelism : DEFAULT_MAX_PARALLELISM;
        this.retryCount = retryCount != null ? retryCount : DEFAULT_RETRY_COUNT;
        this.retryDelay = retryDelay != null ? retryDelay : DEFAULT_RETRY_DELAY;
        this.continueOnError = continueOnError != null ? continueOnError : true;
    }

    public static BatchProcessingConfig defaults() {
        return new BatchProcessingConfig(null, null, null, null, null);
    }

    public static BatchProcessingConfig of(int batchSize, int maxParallelism, int retryCount,
                                           Duration retryDelay, boolean continueOnError) {
        return new BatchProcessingConfig(batchSize, maxParallelism, retryCount, retryDelay, continueOnError);
    }

    /**
     * @return one message per out-of-range setting, empty when the config is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            errors.add("batchSize must be between 1 and " + MAX_BATCH_SIZE + " but was " + batchSize);
        }
        if (maxParallelism < 1 || maxParallelism > MAX_PARALLELISM) {
            errors.add("maxParallelism must be between 1 and " + MAX_PARALLELISM + " but was " + maxParallelism);
        }
        if (retryCount < 0 || retryCount > MAX_RETRY_COUNT) {
            errors.add("retryCount must be between 0 and " + MAX_RETRY_COUNT + " but was " + retryCount);
        }
        if (retryDelay.isNegative()) {
            errors.add("retryDelay must not be negative");
        }
        return errors;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxParallelism() {
        return maxParallelism;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    @Override
    public String toString() {
        return "BatchProcessingConfig{" +
                "batchSize=" + batchSize +
                ", maxParallelism=" + maxParallelism +
                ", retryCount=" + retryCount +
                ", retryDelay=" + retryDelay +
                ", continueOnError=" + continueOnError +
                '}';
    }
}
