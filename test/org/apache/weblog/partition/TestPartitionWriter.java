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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.apache.weblog.builtin.InMemoryPartitionSink;
import org.apache.weblog.data.LogRecord;
import org.apache.weblog.data.PartitionRow;
import org.apache.weblog.parser.RecordParser;
import org.apache.weblog.test.Util;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestPartitionWriter {
    private final RecordParser parser = new RecordParser();
    private InMemoryPartitionSink sink;

    @Before
    public void setUp() {
        sink = new InMemoryPartitionSink();
    }

    @Test
    public void testSamplePartitions() throws Exception {
        PartitionWriter writer = new PartitionWriter(1000, sink);
        for (String line : Util.SAMPLE) {
            LogRecord record = parser.parse(line);
            assertEquals(record.getStatus(), writer.assign(record));
        }
        assertEquals(3, writer.getPartitionCount());
        Map<Integer, List<PartitionRow>> partitions = writer.finish();

        assertEquals(ImmutableList.of(200, 404, 500), ImmutableList.copyOf(partitions.keySet()));
        assertEquals(2, partitions.get(200).size());
        assertEquals(2, partitions.get(404).size());
        assertEquals(1, partitions.get(500).size());
        assertEquals(partitions, sink.getPartitions());

        PartitionRow row = partitions.get(500).get(0);
        assertEquals(ImmutableList.of("192.168.1.3", "2024-01-01 10:02:00", "/home", "Safari/14.0"), row.getFields());
        assertEquals("192.168.1.2,2024-01-01 10:01:00,/products,Chrome/90.0",
                partitions.get(404).get(0).toDelimitedString(","));
        // input order is kept within a partition
        assertEquals("192.168.1.5", partitions.get(404).get(1).getIp());
    }

    @Test
    public void testOverflow() throws Exception {
        PartitionWriter writer = new PartitionWriter(2, sink);
        writer.assign(parser.parse(Util.SAMPLE.get(0)));
        writer.assign(parser.parse(Util.SAMPLE.get(1)));
        // existing partitions still accept records
        writer.assign(parser.parse(Util.SAMPLE.get(3)));
        try {
            writer.assign(parser.parse(Util.SAMPLE.get(2)));
            fail("Expected PartitionOverflowException");
        } catch (PartitionOverflowException e) {
            assertEquals(2, e.getMaxPartitions());
            assertEquals(PartitionOverflowException.ERROR_CODE, e.getErrorCode());
        }
        assertEquals(2, writer.getPartitionCount());
        Map<Integer, List<PartitionRow>> partitions = writer.finish();
        assertEquals(2, partitions.get(200).size());
        assertNull(partitions.get(500));
    }

    @Test(expected = IllegalStateException.class)
    public void testAssignAfterFinish() throws Exception {
        PartitionWriter writer = new PartitionWriter(10, sink);
        writer.finish();
        writer.assign(parser.parse(Util.SAMPLE.get(0)));
    }

    @Test
    public void testNoRecordsWritesNothing() throws Exception {
        PartitionWriter writer = new PartitionWriter(10, sink);
        assertEquals(0, writer.finish().size());
        assertEquals(0, sink.getPartitions().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaxPartitionsMustBePositive() {
        new PartitionWriter(0, sink);
    }
}
