/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.weblog;

import static org.apache.weblog.WeblogConfiguration.*;

import java.util.Properties;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Holds the settings of one analysis run. The raw {@link Properties} are kept
 * so that components can look up keys they own; the well known keys from
 * {@link WeblogConfiguration} are parsed and validated up front so that a bad
 * value fails before any input is read.
 */
public class AnalysisContext {
    private static final Log log = LogFactory.getLog(AnalysisContext.class);

    private final Properties properties;

    private final int topK;
    private final int failureThreshold;
    private final Set<Integer> failureStatuses;
    private final boolean partitionEnabled;
    private final int maxPartitions;
    private final long minErrorRecords;
    private final float errorThreshold;
    private final int parallelWorkers;

    public AnalysisContext() {
        this(new Properties());
    }

    public AnalysisContext(Properties properties) {
        Preconditions.checkNotNull(properties, "properties");
        this.properties = properties;
        this.topK = getInt(WEBLOG_REPORT_TOPK, WEBLOG_REPORT_TOPK_DEFAULT);
        Preconditions.checkArgument(topK >= 0, "%s must not be negative: %s", WEBLOG_REPORT_TOPK, topK);
        this.failureThreshold = getInt(WEBLOG_FAILURE_THRESHOLD, WEBLOG_FAILURE_THRESHOLD_DEFAULT);
        this.failureStatuses = parseStatuses(
                properties.getProperty(WEBLOG_FAILURE_STATUSES, WEBLOG_FAILURE_STATUSES_DEFAULT));
        this.partitionEnabled = getBoolean(WEBLOG_PARTITION_ENABLED, false);
        this.maxPartitions = getInt(WEBLOG_PARTITION_MAX, WEBLOG_PARTITION_MAX_DEFAULT);
        Preconditions.checkArgument(maxPartitions > 0, "%s must be positive: %s", WEBLOG_PARTITION_MAX, maxPartitions);
        this.minErrorRecords = getInt(WEBLOG_ERROR_HANDLING_MIN_ERROR_RECORDS, 0);
        this.errorThreshold = getFloat(WEBLOG_ERROR_HANDLING_THRESHOLD_PERCENT, 1.0f);
        Preconditions.checkArgument(errorThreshold >= 0.0f && errorThreshold <= 1.0f,
                "%s must be between 0 and 1: %s", WEBLOG_ERROR_HANDLING_THRESHOLD_PERCENT, errorThreshold);
        this.parallelWorkers = getInt(WEBLOG_PARALLEL_WORKERS, WEBLOG_PARALLEL_WORKERS_DEFAULT);
        Preconditions.checkArgument(parallelWorkers > 0, "%s must be positive: %s", WEBLOG_PARALLEL_WORKERS, parallelWorkers);
        if (log.isDebugEnabled()) {
            log.debug("topK=" + topK + " failureThreshold=" + failureThreshold
                    + " failureStatuses=" + failureStatuses + " partitionEnabled=" + partitionEnabled
                    + " maxPartitions=" + maxPartitions);
        }
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }

    private float getFloat(String key, float defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static Set<Integer> parseStatuses(String value) {
        ImmutableSortedSet.Builder<Integer> statuses = ImmutableSortedSet.naturalOrder();
        for (String status : Splitter.on(',').trimResults().omitEmptyStrings().split(value)) {
            try {
                statuses.add(Integer.valueOf(status));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid status code in "
                        + WEBLOG_FAILURE_STATUSES + ": " + status, e);
            }
        }
        return statuses.build();
    }

    public Properties getProperties() {
        return properties;
    }

    public int getTopK() {
        return topK;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    /**
     * @return the status codes that count as a failed request, in ascending order
     */
    public Set<Integer> getFailureStatuses() {
        return failureStatuses;
    }

    public boolean isPartitionEnabled() {
        return partitionEnabled;
    }

    public int getMaxPartitions() {
        return maxPartitions;
    }

    public long getMinErrorRecords() {
        return minErrorRecords;
    }

    public float getErrorThreshold() {
        return errorThreshold;
    }

    public int getParallelWorkers() {
        return parallelWorkers;
    }
}
