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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.weblog.data.CountEntry;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class TestHistogram {

    private static Histogram<String> histogram(String... keys) {
        Histogram<String> h = new Histogram<String>();
        for (int i = 0; i < keys.length; i++) {
            h.add(keys[i], i);
        }
        return h;
    }

    @Test
    public void testCounts() {
        Histogram<String> h = histogram("a", "b", "a", "c", "a");
        assertEquals(3, h.getCount("a"));
        assertEquals(1, h.getCount("b"));
        assertEquals(0, h.getCount("missing"));
        assertEquals(5, h.getTotal());
        assertEquals(3, h.size());
        assertTrue(h.contains("c"));
        assertFalse(h.contains("d"));
    }

    @Test
    public void testTopBreaksTiesByFirstSeen() {
        Histogram<String> h = histogram("z", "y", "x", "y", "z", "w");
        List<CountEntry<String>> top = h.top(3);
        assertEquals(ImmutableList.of(CountEntry.of("z", 2), CountEntry.of("y", 2), CountEntry.of("x", 1)), top);
    }

    @Test
    public void testTopTruncatesAndHandlesSmallInputs() {
        Histogram<String> h = histogram("a", "b", "b");
        assertEquals(0, h.top(0).size());
        assertEquals(ImmutableList.of(CountEntry.of("b", 2)), h.top(1));
        assertEquals(2, h.top(10).size());
        assertEquals(0, new Histogram<String>().top(3).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTop() {
        histogram("a").top(-1);
    }

    @Test
    public void testTopAgreesWithFullSort() {
        Histogram<Integer> h = new Histogram<Integer>();
        long ordinal = 0;
        for (int i = 0; i < 200; i++) {
            for (int j = 0; j < i % 7; j++) {
                h.add(i, ordinal++);
            }
            h.add(i, ordinal++);
        }
        List<CountEntry<Integer>> all = h.sortedByCount();
        for (int k = 0; k <= 20; k++) {
            assertEquals(all.subList(0, k), h.top(k));
        }
    }

    @Test
    public void testAboveIsStrict() {
        Histogram<String> h = histogram("a", "a", "a", "b", "b", "c");
        assertEquals(ImmutableList.of(CountEntry.of("a", 3), CountEntry.of("b", 2)), h.above(1));
        assertEquals(ImmutableList.of(CountEntry.of("a", 3)), h.above(2));
        assertTrue(h.above(3).isEmpty());
    }

    @Test
    public void testSortedByKey() {
        Histogram<String> h = histogram("b", "c", "a", "b");
        assertEquals(ImmutableList.of(CountEntry.of("a", 1), CountEntry.of("b", 2), CountEntry.of("c", 1)),
                h.sortedByKey());
    }

    @Test
    public void testMergeKeepsEarliestFirstSeen() {
        Histogram<String> left = new Histogram<String>();
        left.add("late", 10);
        Histogram<String> right = new Histogram<String>();
        right.add("early", 1);
        right.add("late", 11);
        right.add("early", 12);
        left.merge(right);
        assertEquals(4, left.getTotal());
        // both have two hits, "early" was seen first in the input
        assertEquals(ImmutableList.of(CountEntry.of("early", 2), CountEntry.of("late", 2)), left.sortedByCount());
        assertEquals(1, right.getCount("late"));
    }

    @Test
    public void testMergeOrderDoesNotMatter() {
        Histogram<String> a = histogram("x", "y", "x");
        Histogram<String> b = new Histogram<String>();
        b.add("y", 3);
        b.add("z", 4);

        Histogram<String> ab = new Histogram<String>();
        ab.merge(a);
        ab.merge(b);
        Histogram<String> ba = new Histogram<String>();
        ba.merge(b);
        ba.merge(a);
        assertEquals(ab, ba);
        assertEquals(ab.sortedByCount(), ba.sortedByCount());
    }
}
