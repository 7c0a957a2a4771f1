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
package org.apache.weblog.aggregate;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.weblog.AnalysisContext;
import org.apache.weblog.data.CountEntry;
import org.apache.weblog.data.LogRecord;

import com.google.common.base.Preconditions;

/**
 * Computes the access log aggregates over a stream of {@link LogRecord}s.
 * <p>
 * An engine is used for exactly one run. Records are fed with
 * {@link #ingest(LogRecord)} until {@link #finish()} is called; from then on
 * ingest fails and the read accessors become available. Ranked views are
 * derived from the final state on every call, they are not maintained while
 * ingesting.
 * <p>
 * Not thread safe. Parallel runs use one engine per worker and merge the
 * resulting {@link AggregateState}s, see {@link #fromState}.
 */
public class AggregationEngine {
    private static final Log log = LogFactory.getLog(AggregationEngine.class);

    private final AggregateState state;
    private final Set<Integer> failureStatuses;
    private final int defaultTopK;
    private final int defaultFailureThreshold;

    private long nextOrdinal;
    private boolean finished = false;

    public AggregationEngine(AnalysisContext context) {
        this(context, 0L);
    }

    /**
     * @param context run settings
     * @param ordinalBase ordinal given to the first ingested record. Workers
     *        of a parallel run pass the index of their first input line so
     *        that first-seen order survives merging.
     */
    public AggregationEngine(AnalysisContext context, long ordinalBase) {
        this(context, new AggregateState(), ordinalBase);
    }

    private AggregationEngine(AnalysisContext context, AggregateState state, long ordinalBase) {
        Preconditions.checkNotNull(context, "context");
        this.state = state;
        this.failureStatuses = context.getFailureStatuses();
        this.defaultTopK = context.getTopK();
        this.defaultFailureThreshold = context.getFailureThreshold();
        this.nextOrdinal = ordinalBase;
    }

    /**
     * Wraps a copy of an already complete state, typically the merge of
     * several partial states, in a finalized engine.
     */
    public static AggregationEngine fromState(AnalysisContext context, AggregateState state) {
        Preconditions.checkNotNull(state, "state");
        AggregationEngine engine = new AggregationEngine(context, new AggregateState(state), 0L);
        engine.finished = true;
        return engine;
    }

    /**
     * Counts one record in every aggregate.
     *
     * @throws EngineFinalizedException if {@link #finish()} was called already
     */
    public void ingest(LogRecord record) throws EngineFinalizedException {
        if (finished) {
            throw new EngineFinalizedException("Cannot ingest " + record + " into a finalized engine");
        }
        Preconditions.checkNotNull(record, "record");
        state.add(record, nextOrdinal++, failureStatuses.contains(record.getStatus()));
        if (log.isTraceEnabled()) {
            log.trace("ingested " + record);
        }
    }

    /**
     * Ends ingestion. Calling this more than once has no further effect.
     */
    public void finish() {
        if (!finished) {
            finished = true;
            if (log.isDebugEnabled()) {
                log.debug("Finalized engine after " + state.getTotalCount() + " records");
            }
        }
    }

    public boolean isFinished() {
        return finished;
    }

    public long totalRequests() {
        checkFinished();
        return state.getTotalCount();
    }

    /**
     * @return count per status code, in ascending status order
     */
    public Map<Integer, Long> statusCounts() {
        checkFinished();
        return state.getStatuses().asSortedMap();
    }

    public List<CountEntry<String>> topUrls() {
        return topUrls(defaultTopK);
    }

    /**
     * @param k maximum number of URLs returned
     * @return the most visited URLs, highest count first, ties by first-seen order
     */
    public List<CountEntry<String>> topUrls(int k) {
        checkFinished();
        return state.getUrls().top(k);
    }

    /**
     * @return every user agent, highest count first, ties by first-seen order
     */
    public List<CountEntry<String>> userAgentCounts() {
        checkFinished();
        return state.getUserAgents().sortedByCount();
    }

    public List<CountEntry<String>> suspiciousIps() {
        return suspiciousIps(defaultFailureThreshold);
    }

    /**
     * @param threshold an IP is returned when its failed request count is
     *        strictly greater than this
     * @return matching IPs, most failures first, ties by first-seen order
     */
    public List<CountEntry<String>> suspiciousIps(int threshold) {
        checkFinished();
        return state.getFailures().above(threshold);
    }

    /**
     * @return request count per minute key, in ascending minute order
     */
    public List<CountEntry<String>> trafficPerMinute() {
        checkFinished();
        return state.getMinutes().sortedByKey();
    }

    /**
     * @return a copy of the current state; changes to it do not affect this engine
     */
    public AggregateState getState() {
        return new AggregateState(state);
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public int getDefaultFailureThreshold() {
        return defaultFailureThreshold;
    }

    private void checkFinished() {
        Preconditions.checkState(finished, "Aggregates are only available after finish()");
    }
}
