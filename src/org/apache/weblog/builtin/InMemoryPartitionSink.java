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
package org.apache.weblog.builtin;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.weblog.data.PartitionRow;
import org.apache.weblog.partition.PartitionSink;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Keeps written partitions in memory, for tests and for embedding the
 * analyzer in another process.
 */
public class InMemoryPartitionSink implements PartitionSink {
    private final Map<Integer, List<PartitionRow>> partitions = new TreeMap<Integer, List<PartitionRow>>();

    @Override
    public synchronized void write(int partitionKey, List<PartitionRow> rows) throws IOException {
        if (partitions.containsKey(partitionKey)) {
            throw new IOException("the partition " + partitionKey + " already exists");
        }
        partitions.put(partitionKey, ImmutableList.copyOf(rows));
    }

    /**
     * @return the rows of a partition, or null if it was never written
     */
    public synchronized List<PartitionRow> get(int partitionKey) {
        return partitions.get(partitionKey);
    }

    public synchronized Map<Integer, List<PartitionRow>> getPartitions() {
        return ImmutableSortedMap.copyOf(partitions);
    }
}
