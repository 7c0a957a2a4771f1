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
package org.apache.weblog.partition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.weblog.data.LogRecord;
import org.apache.weblog.data.PartitionRow;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Groups records by status code, the way a dynamic partition insert groups
 * rows by its partition column. Partitions are created on the first record
 * carrying their key and are handed to a {@link PartitionSink} when the
 * writer is finished. Stored rows do not repeat the status column.
 */
public class PartitionWriter {
    private static final Log log = LogFactory.getLog(PartitionWriter.class);

    public static final String PARTITION_COLUMN = "status";

    private final int maxPartitions;
    private final PartitionSink sink;
    private final Map<Integer, List<PartitionRow>> partitions = new TreeMap<Integer, List<PartitionRow>>();
    private boolean finished = false;

    /**
     * @param maxPartitions maximum number of distinct partition keys
     * @param sink receives the partitions on {@link #finish()}
     */
    public PartitionWriter(int maxPartitions, PartitionSink sink) {
        Preconditions.checkArgument(maxPartitions > 0, "maxPartitions must be positive: %s", maxPartitions);
        this.maxPartitions = maxPartitions;
        this.sink = Preconditions.checkNotNull(sink, "sink");
    }

    /**
     * Derives the partition key of a record.
     */
    public static int partitionKey(LogRecord record) {
        return record.getStatus();
    }

    /**
     * Appends a record to its partition, creating the partition if needed.
     *
     * @return the partition key the record was assigned to
     * @throws PartitionOverflowException if a new partition would exceed the limit;
     *         the record is not stored in that case
     */
    public int assign(LogRecord record) throws PartitionOverflowException {
        Preconditions.checkState(!finished, "PartitionWriter is already finished");
        int key = partitionKey(record);
        List<PartitionRow> rows = partitions.get(key);
        if (rows == null) {
            if (partitions.size() >= maxPartitions) {
                throw new PartitionOverflowException("Creating partition " + PARTITION_COLUMN + "=" + key
                        + " exceeds the maximum of " + maxPartitions + " partitions", maxPartitions);
            }
            rows = new ArrayList<PartitionRow>();
            partitions.put(key, rows);
            if (log.isDebugEnabled()) {
                log.debug("Created partition " + PARTITION_COLUMN + "=" + key);
            }
        }
        rows.add(record.toPartitionRow());
        return key;
    }

    public int getPartitionCount() {
        return partitions.size();
    }

    /**
     * Writes every partition to the sink, in ascending key order, and
     * returns them.
     *
     * @return rows per partition key, in ascending key order
     * @throws IOException if the sink fails
     */
    public Map<Integer, List<PartitionRow>> finish() throws IOException {
        Preconditions.checkState(!finished, "PartitionWriter is already finished");
        finished = true;
        ImmutableSortedMap.Builder<Integer, List<PartitionRow>> result = ImmutableSortedMap.naturalOrder();
        for (Entry<Integer, List<PartitionRow>> e : partitions.entrySet()) {
            List<PartitionRow> rows = ImmutableList.copyOf(e.getValue());
            sink.write(e.getKey(), rows);
            result.put(e.getKey(), rows);
        }
        log.info("Wrote " + partitions.size() + " partitions");
        return result.build();
    }
}
