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

import static org.apache.weblog.aggregate.TestAggregationEngine.randomLines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Random;

import org.apache.weblog.AnalysisContext;
import org.apache.weblog.test.Util;
import org.junit.Before;
import org.junit.Test;

public class TestAggregateState {
    private final AnalysisContext context = new AnalysisContext();

    private List<String> lines;
    private AggregateState a;
    private AggregateState b;
    private AggregateState c;

    @Before
    public void setUp() throws Exception {
        lines = randomLines(new Random(11), 300);
        a = partial(0, 100);
        b = partial(100, 220);
        c = partial(220, 300);
    }

    private AggregateState partial(int from, int to) throws Exception {
        return Util.engineFor(context, lines.subList(from, to), from).getState();
    }

    private static AggregateState merged(AggregateState... states) {
        AggregateState result = new AggregateState();
        for (AggregateState state : states) {
            result.merge(state);
        }
        return result;
    }

    private void assertSameReports(AggregateState expected, AggregateState actual) {
        AggregationEngine e = AggregationEngine.fromState(context, expected);
        AggregationEngine f = AggregationEngine.fromState(context, actual);
        assertEquals(e.totalRequests(), f.totalRequests());
        assertEquals(e.statusCounts(), f.statusCounts());
        assertEquals(e.topUrls(5), f.topUrls(5));
        assertEquals(e.userAgentCounts(), f.userAgentCounts());
        assertEquals(e.suspiciousIps(0), f.suspiciousIps(0));
        assertEquals(e.trafficPerMinute(), f.trafficPerMinute());
    }

    @Test
    public void testMergeIsCommutative() {
        assertEquals(merged(a, b), merged(b, a));
        assertSameReports(merged(a, b), merged(b, a));
    }

    @Test
    public void testMergeIsAssociative() {
        AggregateState left = merged(merged(a, b), c);
        AggregateState right = merged(a, merged(b, c));
        assertEquals(left, right);
        assertSameReports(left, right);
        assertSameReports(left, merged(c, b, a));
    }

    @Test
    public void testMergeEqualsSequentialRun() throws Exception {
        AggregationEngine sequential = Util.engineFor(lines);
        assertSameReports(sequential.getState(), merged(c, a, b));
        assertTrue(merged(a, b, c).isConsistent());
    }

    @Test
    public void testMergeLeavesArgumentUntouched() {
        long before = b.getTotalCount();
        merged(a, b);
        assertEquals(before, b.getTotalCount());
        assertEquals(100 + 120 + 80, merged(a, b, c).getTotalCount());
    }
}
