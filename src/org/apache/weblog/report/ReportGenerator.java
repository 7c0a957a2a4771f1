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
package org.apache.weblog.report;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.weblog.AnalysisResult;
import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.data.CountEntry;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

/**
 * Renders the aggregates of a finalized engine as plain text, one block per
 * {@link Report}. Lines within a block are separated by <code>\n</code>; a
 * report without entries renders as the empty string.
 */
public class ReportGenerator {

    public static final String SKIPPED_LINES = "Skipped Lines: ";

    private static final Joiner LINES = Joiner.on('\n');

    private final boolean engineDefaults;
    private final int topK;
    private final int failureThreshold;

    /**
     * Uses the top-k and failure threshold the engine was configured with.
     */
    public ReportGenerator() {
        this.engineDefaults = true;
        this.topK = 0;
        this.failureThreshold = 0;
    }

    /**
     * @param topK number of URLs in the top URL report
     * @param failureThreshold threshold of the suspicious IP report
     * @throws IllegalArgumentException if either value is negative
     */
    public ReportGenerator(int topK, int failureThreshold) {
        Preconditions.checkArgument(topK >= 0, "topK must not be negative: %s", topK);
        Preconditions.checkArgument(failureThreshold >= 0,
                "failureThreshold must not be negative: %s", failureThreshold);
        this.engineDefaults = false;
        this.topK = topK;
        this.failureThreshold = failureThreshold;
    }

    public Map<Report, String> render(AggregationEngine engine) {
        Preconditions.checkNotNull(engine, "engine");
        Preconditions.checkState(engine.isFinished(), "Reports can only be rendered from a finalized engine");
        int k = engineDefaults ? engine.getDefaultTopK() : topK;
        int threshold = engineDefaults ? engine.getDefaultFailureThreshold() : failureThreshold;

        EnumMap<Report, String> reports = new EnumMap<Report, String>(Report.class);
        reports.put(Report.TOTAL_REQUESTS, "Total Requests: " + engine.totalRequests());
        reports.put(Report.STATUS_COUNTS, renderStatusCounts(engine.statusCounts()));
        reports.put(Report.TOP_URLS, renderEntries(engine.topUrls(k), ""));
        reports.put(Report.USER_AGENTS, renderEntries(engine.userAgentCounts(), ""));
        reports.put(Report.SUSPICIOUS_IPS, renderEntries(engine.suspiciousIps(threshold), " failed requests"));
        reports.put(Report.TRAFFIC_PER_MINUTE, renderEntries(engine.trafficPerMinute(), " requests"));
        return Maps.immutableEnumMap(reports);
    }

    public String render(AggregationEngine engine, Report report) {
        return render(engine).get(report);
    }

    /**
     * Renders all six reports separated by blank lines, followed by the
     * number of skipped input lines.
     */
    public String renderAll(AnalysisResult result) {
        Preconditions.checkNotNull(result, "result");
        Map<Report, String> reports = render(result.getEngine());
        List<String> blocks = new ArrayList<String>(reports.size() + 1);
        for (Report report : Report.values()) {
            blocks.add(reports.get(report));
        }
        blocks.add(SKIPPED_LINES + result.getSkippedLines());
        return Joiner.on("\n\n").join(blocks);
    }

    private static String renderStatusCounts(Map<Integer, Long> counts) {
        List<String> lines = new ArrayList<String>(counts.size());
        for (Entry<Integer, Long> e : counts.entrySet()) {
            lines.add(e.getKey() + ": " + e.getValue());
        }
        return LINES.join(lines);
    }

    private static String renderEntries(List<? extends CountEntry<?>> entries, String suffix) {
        List<String> lines = new ArrayList<String>(entries.size());
        for (CountEntry<?> entry : entries) {
            lines.add(entry.getKey() + ": " + entry.getCount() + suffix);
        }
        return LINES.join(lines);
    }
}
