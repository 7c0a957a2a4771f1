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

import static org.apache.weblog.WeblogConfiguration.WEBLOG_PARALLEL_WORKERS;
import static org.junit.Assert.assertEquals;

import java.util.List;
import java.util.Random;

import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.builtin.TextLineSource;
import org.apache.weblog.report.ReportGenerator;
import org.apache.weblog.test.Util;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public class TestParallelLogAnalyzer {

    private static List<String> input() {
        Random random = new Random(5);
        String[] urls = {"/home", "/products", "/cart", "/checkout"};
        List<String> lines = Lists.newArrayList(Util.HEADER);
        for (int i = 0; i < 1000; i++) {
            if (i % 97 == 0) {
                lines.add("garbage line " + i);
                continue;
            }
            lines.add(Util.line("10.1.0." + random.nextInt(20),
                    String.format("2024-05-01 12:%02d:%02d", random.nextInt(30), random.nextInt(60)),
                    urls[random.nextInt(urls.length)],
                    random.nextBoolean() ? 200 : (random.nextBoolean() ? 404 : 500),
                    "agent-" + random.nextInt(3)));
        }
        return lines;
    }

    @Test
    public void testSameResultAsSequential() throws Exception {
        List<String> lines = input();
        AnalysisResult sequential = new LogAnalyzer(new AnalysisContext())
                .analyze(TextLineSource.fromString(Util.toText(lines)));
        for (String workers : ImmutableList.of("1", "3", "8")) {
            AnalysisResult parallel = new ParallelLogAnalyzer(Util.context(WEBLOG_PARALLEL_WORKERS, workers))
                    .analyze(lines);
            AggregationEngine s = sequential.getEngine();
            AggregationEngine p = parallel.getEngine();
            assertEquals(s.totalRequests(), p.totalRequests());
            assertEquals(s.statusCounts(), p.statusCounts());
            assertEquals(s.topUrls(4), p.topUrls(4));
            assertEquals(s.userAgentCounts(), p.userAgentCounts());
            assertEquals(s.suspiciousIps(0), p.suspiciousIps(0));
            assertEquals(s.trafficPerMinute(), p.trafficPerMinute());
            assertEquals(sequential.getSkippedLines(), parallel.getSkippedLines());
            assertEquals(new ReportGenerator().renderAll(sequential), new ReportGenerator().renderAll(parallel));
        }
    }

    @Test
    public void testByteOrderMarkBeforeHeader() throws Exception {
        List<String> lines = Lists.newArrayList(Util.withHeader(Util.SAMPLE));
        lines.set(0, "\uFEFF" + lines.get(0));
        AnalysisResult result = new ParallelLogAnalyzer(Util.context(WEBLOG_PARALLEL_WORKERS, "2")).analyze(lines);
        assertEquals(5, result.getEngine().totalRequests());
        assertEquals(0, result.getSkippedLines());
    }

    @Test
    public void testSampleTies() throws Exception {
        AnalysisResult result = new ParallelLogAnalyzer(Util.context(WEBLOG_PARALLEL_WORKERS, "5"))
                .analyze(Util.withHeader(Util.SAMPLE));
        assertEquals(5, result.getEngine().totalRequests());
        assertEquals("/home", result.getEngine().topUrls(3).get(0).getKey());
        assertEquals("/products", result.getEngine().topUrls(3).get(1).getKey());
    }

    @Test
    public void testEmptyInput() throws Exception {
        AnalysisResult result = new ParallelLogAnalyzer(new AnalysisContext())
                .analyze(ImmutableList.<String>of());
        assertEquals(0, result.getEngine().totalRequests());
    }

    @Test(expected = AnalysisAbortedException.class)
    public void testAbort() throws Exception {
        ParallelLogAnalyzer analyzer = new ParallelLogAnalyzer(new AnalysisContext());
        analyzer.abort();
        analyzer.analyze(input());
    }
}
