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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.weblog.aggregate.AggregateState;
import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.data.LogRecord;
import org.apache.weblog.parser.MalformedRecordException;
import org.apache.weblog.parser.RecordParser;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Analyzes an in-memory list of lines with several worker threads. The list
 * is cut into contiguous chunks, each chunk is aggregated by its own
 * {@link AggregationEngine}, and the partial states are merged in chunk
 * order. Each worker numbers its records starting at the index of its first
 * line, so ties are broken exactly as in a sequential run and the result
 * equals that of {@link LogAnalyzer}.
 * <p>
 * Partitioning is not supported here.
 */
public class ParallelLogAnalyzer {
    private static final Log log = LogFactory.getLog(ParallelLogAnalyzer.class);

    private final AnalysisContext context;
    private final RecordParser parser = new RecordParser();
    private volatile boolean aborted = false;

    public ParallelLogAnalyzer(AnalysisContext context) {
        this.context = Preconditions.checkNotNull(context, "context");
    }

    public AnalysisResult analyze(List<String> lines) throws IOException {
        Preconditions.checkNotNull(lines, "lines");
        int workers = context.getParallelWorkers();
        int chunkSize = Math.max(1, (lines.size() + workers - 1) / workers);
        ErrorHandler errorHandler = new CounterBasedErrorHandler(context);

        ExecutorService pool = Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder().setNameFormat("weblog-worker-%d").setDaemon(true).build());
        try {
            List<Future<AggregateState>> partials = new ArrayList<Future<AggregateState>>();
            for (int start = 0; start < lines.size(); start += chunkSize) {
                int end = Math.min(lines.size(), start + chunkSize);
                partials.add(pool.submit(new ChunkTask(lines.subList(start, end), start, errorHandler)));
            }
            if (log.isDebugEnabled()) {
                log.debug("Split " + lines.size() + " lines into " + partials.size() + " chunks");
            }

            AggregateState merged = new AggregateState();
            for (Future<AggregateState> partial : partials) {
                merged.merge(getPartial(partial));
            }
            AggregationEngine engine = AggregationEngine.fromState(context, merged);

            Map<WeblogWarning, Long> warnings = new EnumMap<WeblogWarning, Long>(WeblogWarning.class);
            if (errorHandler.getErrorCount() > 0) {
                warnings.put(WeblogWarning.MALFORMED_RECORD, errorHandler.getErrorCount());
            }
            log.info("Analyzed " + lines.size() + " lines with " + partials.size() + " workers: "
                    + engine.totalRequests() + " requests, " + errorHandler.getErrorCount() + " skipped");
            return new AnalysisResult(engine, errorHandler.getErrorCount(), warnings, null, null);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Stops the workers before their next line.
     */
    public void abort() {
        aborted = true;
    }

    private static AggregateState getPartial(Future<AggregateState> partial) throws IOException {
        try {
            return partial.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisAbortedException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            int errCode = 2301;
            throw new WeblogException("Worker failed", errCode, WeblogException.BUG, cause);
        }
    }

    private class ChunkTask implements Callable<AggregateState> {
        private final List<String> lines;
        private final int firstLine;
        private final ErrorHandler errorHandler;

        ChunkTask(List<String> lines, int firstLine, ErrorHandler errorHandler) {
            this.lines = lines;
            this.firstLine = firstLine;
            this.errorHandler = errorHandler;
        }

        @Override
        public AggregateState call() throws IOException {
            AggregationEngine engine = new AggregationEngine(context, firstLine);
            for (int i = 0; i < lines.size(); i++) {
                if (aborted) {
                    throw new AnalysisAbortedException("Analysis aborted at line " + (firstLine + i + 1));
                }
                long lineNumber = firstLine + i + 1;
                String line = lines.get(i);
                if (lineNumber == 1) {
                    line = RecordParser.stripByteOrderMark(line);
                }
                if (lineNumber == 1 && parser.isHeader(line)) {
                    continue;
                }
                LogRecord record;
                try {
                    record = parser.parse(line);
                } catch (MalformedRecordException e) {
                    log.warn("Skipping malformed line " + lineNumber + ": " + e.getMessage());
                    errorHandler.onError(lineNumber, e);
                    continue;
                }
                errorHandler.onSuccess();
                engine.ingest(record);
            }
            engine.finish();
            return engine.getState();
        }
    }
}
