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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.data.PartitionRow;
import org.apache.weblog.partition.PartitionOverflowException;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * Outcome of an analysis run: the finalized engine, the number of skipped
 * lines and warnings, and the partitions if partitioning was enabled.
 */
public class AnalysisResult {
    private final AggregationEngine engine;
    private final long skippedLines;
    private final Map<WeblogWarning, Long> warnings;
    private final Map<Integer, List<PartitionRow>> partitions;
    private final PartitionOverflowException partitionFailure;

    public AnalysisResult(AggregationEngine engine, long skippedLines, Map<WeblogWarning, Long> warnings,
            Map<Integer, List<PartitionRow>> partitions, PartitionOverflowException partitionFailure) {
        Preconditions.checkNotNull(engine, "engine");
        Preconditions.checkArgument(engine.isFinished(), "engine must be finalized");
        this.engine = engine;
        this.skippedLines = skippedLines;
        EnumMap<WeblogWarning, Long> copy = new EnumMap<WeblogWarning, Long>(WeblogWarning.class);
        copy.putAll(warnings);
        this.warnings = Maps.immutableEnumMap(copy);
        this.partitions = partitions;
        this.partitionFailure = partitionFailure;
    }

    public AggregationEngine getEngine() {
        return engine;
    }

    /**
     * @return number of malformed input lines that were skipped
     */
    public long getSkippedLines() {
        return skippedLines;
    }

    public long getWarningCount(WeblogWarning warning) {
        Long count = warnings.get(warning);
        return count == null ? 0 : count;
    }

    public Map<WeblogWarning, Long> getWarnings() {
        return warnings;
    }

    /**
     * @return true if partitioning ran to completion
     */
    public boolean hasPartitions() {
        return partitions != null;
    }

    /**
     * @return rows per status, or null if partitioning was disabled or failed
     */
    public Map<Integer, List<PartitionRow>> getPartitions() {
        return partitions;
    }

    /**
     * @return the failure that stopped partitioning, or null
     */
    public PartitionOverflowException getPartitionFailure() {
        return partitionFailure;
    }
}
