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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.PriorityQueue;
import java.util.SortedMap;

import org.apache.weblog.data.CountEntry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Counts occurrences per key. Besides the count, every key remembers the
 * ordinal of the first record it was seen in, which is what breaks ties when
 * keys are ranked by count: of two keys with the same count the one seen
 * first ranks higher.
 * <p>
 * Merging keeps the smaller first-seen ordinal, so merging is commutative and
 * associative as long as the merged histograms were fed disjoint ordinals.
 */
public class Histogram<K extends Comparable<? super K>> implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final class Bin implements Serializable {
        private static final long serialVersionUID = 1L;
        long count;
        long firstSeen;

        Bin(long firstSeen) {
            this.firstSeen = firstSeen;
        }
    }

    private final Map<K, Bin> bins = new HashMap<K, Bin>();
    private long total = 0;

    /**
     * Counts one occurrence of key.
     *
     * @param key must not be null
     * @param ordinal position of the record the key came from
     */
    public void add(K key, long ordinal) {
        add(key, 1, ordinal);
    }

    private void add(K key, long count, long firstSeen) {
        Preconditions.checkNotNull(key, "key");
        Bin bin = bins.get(key);
        if (bin == null) {
            bin = new Bin(firstSeen);
            bins.put(key, bin);
        } else if (firstSeen < bin.firstSeen) {
            bin.firstSeen = firstSeen;
        }
        bin.count += count;
        total += count;
    }

    /**
     * Adds all counts of other into this histogram. other is left untouched.
     */
    public void merge(Histogram<K> other) {
        for (Entry<K, Bin> e : other.bins.entrySet()) {
            add(e.getKey(), e.getValue().count, e.getValue().firstSeen);
        }
    }

    public long getCount(K key) {
        Bin bin = bins.get(key);
        return bin == null ? 0 : bin.count;
    }

    public boolean contains(K key) {
        return bins.containsKey(key);
    }

    /**
     * @return sum of all counts
     */
    public long getTotal() {
        return total;
    }

    /**
     * @return number of distinct keys
     */
    public int size() {
        return bins.size();
    }

    public SortedMap<K, Long> asSortedMap() {
        ImmutableSortedMap.Builder<K, Long> builder = ImmutableSortedMap.naturalOrder();
        for (Entry<K, Bin> e : bins.entrySet()) {
            builder.put(e.getKey(), e.getValue().count);
        }
        return builder.build();
    }

    /**
     * @return all entries in ascending key order
     */
    public List<CountEntry<K>> sortedByKey() {
        ImmutableList.Builder<CountEntry<K>> builder = ImmutableList.builder();
        for (Entry<K, Long> e : asSortedMap().entrySet()) {
            builder.add(CountEntry.of(e.getKey(), e.getValue()));
        }
        return builder.build();
    }

    /**
     * @return all entries, highest count first, ties by first-seen order
     */
    public List<CountEntry<K>> sortedByCount() {
        return above(Long.MIN_VALUE);
    }

    /**
     * @return the entries whose count is strictly greater than threshold,
     *         highest count first, ties by first-seen order
     */
    public List<CountEntry<K>> above(long threshold) {
        List<Entry<K, Bin>> selected = new ArrayList<Entry<K, Bin>>();
        for (Entry<K, Bin> e : bins.entrySet()) {
            if (e.getValue().count > threshold) {
                selected.add(e);
            }
        }
        Collections.sort(selected, new RankComparator<K>());
        return toEntries(selected);
    }

    /**
     * Selects the k highest ranked entries with a bounded heap of size k+1.
     *
     * @param k how many entries to keep; may be 0
     * @return at most k entries, highest count first, ties by first-seen order
     */
    public List<CountEntry<K>> top(int k) {
        Preconditions.checkArgument(k >= 0, "k must not be negative: %s", k);
        if (k == 0) {
            return ImmutableList.of();
        }
        // the head of the queue is the weakest entry retained so far
        PriorityQueue<Entry<K, Bin>> store = new PriorityQueue<Entry<K, Bin>>(k + 1,
                Collections.reverseOrder(new RankComparator<K>()));
        for (Entry<K, Bin> e : bins.entrySet()) {
            store.add(e);
            if (store.size() > k) {
                store.poll();
            }
        }
        List<Entry<K, Bin>> selected = new ArrayList<Entry<K, Bin>>(store);
        Collections.sort(selected, new RankComparator<K>());
        return toEntries(selected);
    }

    private static <K> List<CountEntry<K>> toEntries(List<Entry<K, Bin>> selected) {
        ImmutableList.Builder<CountEntry<K>> builder = ImmutableList.builder();
        for (Entry<K, Bin> e : selected) {
            builder.add(CountEntry.of(e.getKey(), e.getValue().count));
        }
        return builder.build();
    }

    /**
     * Count descending, then first-seen ascending. Keys are compared last so
     * that histograms built from overlapping ordinals still rank the same way.
     */
    private static class RankComparator<K extends Comparable<? super K>>
            implements Comparator<Entry<K, Bin>>, Serializable {
        private static final long serialVersionUID = 1L;

        @Override
        public int compare(Entry<K, Bin> o1, Entry<K, Bin> o2) {
            int c = Long.compare(o2.getValue().count, o1.getValue().count);
            if (c != 0) {
                return c;
            }
            c = Long.compare(o1.getValue().firstSeen, o2.getValue().firstSeen);
            if (c != 0) {
                return c;
            }
            return o1.getKey().compareTo(o2.getKey());
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Histogram)) {
            return false;
        }
        Histogram<?> that = (Histogram<?>) other;
        if (total != that.total || bins.size() != that.bins.size()) {
            return false;
        }
        for (Entry<K, Bin> e : bins.entrySet()) {
            Bin theirs = that.bins.get(e.getKey());
            if (theirs == null || theirs.count != e.getValue().count
                    || theirs.firstSeen != e.getValue().firstSeen) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Entry<K, Bin> e : bins.entrySet()) {
            h += e.getKey().hashCode() ^ (int) (e.getValue().count ^ (e.getValue().count >>> 32));
        }
        return h;
    }

    @Override
    public String toString() {
        return sortedByCount().toString();
    }
}
