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
import java.util.List;

import org.apache.weblog.data.PartitionRow;

/**
 * Receives the finished partitions of a run, one call per distinct
 * partition key. Implementations decide where and how rows are stored.
 */
public interface PartitionSink {

    /**
     * Stores one partition.
     *
     * @param partitionKey the status code shared by every row
     * @param rows the rows of the partition in input order, never empty
     * @throws IOException if the partition cannot be stored
     */
    public void write(int partitionKey, List<PartitionRow> rows) throws IOException;
}
