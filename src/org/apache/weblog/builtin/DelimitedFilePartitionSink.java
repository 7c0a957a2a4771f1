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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.weblog.data.PartitionRow;
import org.apache.weblog.partition.PartitionSink;
import org.apache.weblog.partition.PartitionWriter;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;

/**
 * Stores each partition as a delimited text file under a directory named
 * after the partition column and value, e.g.
 * <code>root/status=404/part-00000</code>. Rows are written in the column
 * order <code>ip,timestamp,url,user_agent</code>.
 */
public class DelimitedFilePartitionSink implements PartitionSink {
    private static final Log log = LogFactory.getLog(DelimitedFilePartitionSink.class);

    public static final String PART_FILE = "part-00000";

    private final File root;
    private final String fieldDel;

    public DelimitedFilePartitionSink(File root) {
        this(root, ",");
    }

    public DelimitedFilePartitionSink(File root, String fieldDel) {
        this.root = Preconditions.checkNotNull(root, "root");
        this.fieldDel = Preconditions.checkNotNull(fieldDel, "fieldDel");
    }

    /**
     * @return the file a partition is stored in
     */
    public File getPartitionFile(int partitionKey) {
        return new File(new File(root, PartitionWriter.PARTITION_COLUMN + "=" + partitionKey), PART_FILE);
    }

    @Override
    public void write(int partitionKey, List<PartitionRow> rows) throws IOException {
        File file = getPartitionFile(partitionKey);
        if (file.exists()) {
            throw new IOException("Output file " + file + " already exists");
        }
        Files.createParentDirs(file);
        List<String> lines = new ArrayList<String>(rows.size());
        for (PartitionRow row : rows) {
            lines.add(row.toDelimitedString(fieldDel));
        }
        Files.asCharSink(file, Charsets.UTF_8).writeLines(lines, "\n");
        if (log.isDebugEnabled()) {
            log.debug("Wrote " + rows.size() + " rows to " + file);
        }
    }
}
