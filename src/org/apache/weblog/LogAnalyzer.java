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

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.builtin.InMemoryPartitionSink;
import org.apache.weblog.data.LogRecord;
import org.apache.weblog.data.PartitionRow;
import org.apache.weblog.parser.MalformedRecordException;
import org.apache.weblog.parser.RecordParser;
import org.apache.weblog.partition.PartitionOverflowException;
import org.apache.weblog.partition.PartitionSink;
import org.apache.weblog.partition.PartitionWriter;

import com.google.common.base.Preconditions;

/**
 * Runs the analysis pipeline over one input: lines are parsed, malformed
 * lines are handed to the {@link ErrorHandler} and skipped, and every valid
 * record is fed to an {@link AggregationEngine} and, when partitioning is
 * enabled, to a {@link PartitionWriter}.
 * <p>
 * A leading header line is skipped without being counted. A partition
 * overflow only stops partitioning; the aggregates of the run stay valid.
 * <p>
 * An analyzer runs once. {@link #abort()} may be called from any thread and
 * is honoured before the next line is processed.
 */
public class LogAnalyzer {
    private static final Log log = LogFactory.getLog(LogAnalyzer.class);

    private final AnalysisContext context;
    private final RecordParser parser = new RecordParser();
    private final PartitionSink sink;

    private volatile boolean aborted = false;
    private boolean used = false;

    public LogAnalyzer(AnalysisContext context) {
        this(context, null);
    }

    /**
     * @param context run settings
     * @param sink receives the partitions when partitioning is enabled; an
     *        {@link InMemoryPartitionSink} is used when null
     */
    public LogAnalyzer(AnalysisContext context, PartitionSink sink) {
        this.context = Preconditions.checkNotNull(context, "context");
        this.sink = sink == null ? new InMemoryPartitionSink() : sink;
    }

    public AnalysisContext getContext() {
        return context;
    }

    /**
     * Consumes the source until it is exhausted. The source is not closed.
     *
     * @return the finalized result of the run
     * @throws AnalysisAbortedException if {@link #abort()} was called
     * @throws WeblogException if the error handler gives up on the input
     * @throws IOException if reading the source or writing partitions fails
     */
    public AnalysisResult analyze(LineSource source) throws IOException {
        Preconditions.checkNotNull(source, "source");
        Preconditions.checkState(!used, "LogAnalyzer instances can only run once");
        used = true;

        ErrorHandler errorHandler = new CounterBasedErrorHandler(context);
        AggregationEngine engine = new AggregationEngine(context);
        PartitionWriter partitionWriter = context.isPartitionEnabled()
                ? new PartitionWriter(context.getMaxPartitions(), sink) : null;
        PartitionOverflowException partitionFailure = null;
        Map<WeblogWarning, Long> warnings = new EnumMap<WeblogWarning, Long>(WeblogWarning.class);

        long lineNumber = 0;
        String line;
        while ((line = source.nextLine()) != null) {
            if (aborted) {
                throw new AnalysisAbortedException("Analysis aborted after " + lineNumber + " lines");
            }
            lineNumber++;
            if (lineNumber == 1) {
                line = RecordParser.stripByteOrderMark(line);
            }
            if (lineNumber == 1 && parser.isHeader(line)) {
                log.debug("Skipping header line");
                continue;
            }

            LogRecord record;
            try {
                record = parser.parse(line);
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed line " + lineNumber + ": " + e.getMessage());
                increment(warnings, WeblogWarning.MALFORMED_RECORD);
                errorHandler.onError(lineNumber, e);
                continue;
            }
            errorHandler.onSuccess();
            engine.ingest(record);

            if (partitionWriter != null) {
                try {
                    partitionWriter.assign(record);
                } catch (PartitionOverflowException e) {
                    log.error("Partitioning disabled for the rest of the run at line " + lineNumber
                            + ": " + e.getMessage());
                    increment(warnings, WeblogWarning.PARTITION_OVERFLOW);
                    partitionFailure = e;
                    partitionWriter = null;
                }
            }
        }
        if (aborted) {
            throw new AnalysisAbortedException("Analysis aborted after " + lineNumber + " lines");
        }

        engine.finish();
        Map<Integer, List<PartitionRow>> partitions = partitionWriter == null ? null : partitionWriter.finish();
        log.info("Analyzed " + lineNumber + " lines: " + engine.totalRequests() + " requests, "
                + errorHandler.getErrorCount() + " skipped");
        return new AnalysisResult(engine, errorHandler.getErrorCount(), warnings, partitions, partitionFailure);
    }

    /**
     * Stops a running analysis before its next line. The run's partial
     * results are discarded.
     */
    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    static void increment(Map<WeblogWarning, Long> warnings, WeblogWarning warning) {
        Long count = warnings.get(warning);
        warnings.put(warning, count == null ? 1L : count + 1);
    }
}
