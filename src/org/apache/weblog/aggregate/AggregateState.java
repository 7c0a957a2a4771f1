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

import org.apache.weblog.data.LogRecord;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * The running aggregates of one analysis run: total count, status, URL and
 * user agent histograms, failed requests per IP and requests per minute.
 * <p>
 * Invariants: the status and minute histograms both sum to the total count,
 * and the failure histogram only holds IPs that had at least one failed
 * request.
 * <p>
 * A state is owned by a single {@link AggregationEngine}; partial states built
 * by independent engines are combined with {@link #merge(AggregateState)}.
 */
public class AggregateState implements Serializable {
    private static final long serialVersionUID = 1L;

    private long totalCount = 0;
    private final Histogram<Integer> statuses = new Histogram<Integer>();
    private final Histogram<String> urls = new Histogram<String>();
    private final Histogram<String> userAgents = new Histogram<String>();
    private final Histogram<String> failures = new Histogram<String>();
    private final Histogram<String> minutes = new Histogram<String>();

    public AggregateState() {
    }

    /**
     * Deep copy of other.
     */
    public AggregateState(AggregateState other) {
        merge(other);
    }

    /**
     * Counts one record.
     *
     * @param record the record, must not be null
     * @param ordinal position of the record in the input, used for tie-breaks
     * @param failure whether the record's status counts as a failed request
     */
    void add(LogRecord record, long ordinal, boolean failure) {
        Preconditions.checkNotNull(record, "record");
        totalCount++;
        statuses.add(record.getStatus(), ordinal);
        urls.add(record.getUrl(), ordinal);
        userAgents.add(record.getUserAgent(), ordinal);
        minutes.add(record.getMinuteKey(), ordinal);
        if (failure) {
            failures.add(record.getIp(), ordinal);
        }
    }

    /**
     * Adds other into this state by summing every histogram. other is left
     * untouched. Both states must have been built with the same set of
     * failure statuses.
     *
     * @return this state
     */
    public AggregateState merge(AggregateState other) {
        Preconditions.checkNotNull(other, "other");
        totalCount += other.totalCount;
        statuses.merge(other.statuses);
        urls.merge(other.urls);
        userAgents.merge(other.userAgents);
        failures.merge(other.failures);
        minutes.merge(other.minutes);
        return this;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public Histogram<Integer> getStatuses() {
        return statuses;
    }

    public Histogram<String> getUrls() {
        return urls;
    }

    public Histogram<String> getUserAgents() {
        return userAgents;
    }

    public Histogram<String> getFailures() {
        return failures;
    }

    public Histogram<String> getMinutes() {
        return minutes;
    }

    /**
     * @return true if the histogram totals agree with the total count
     */
    public boolean isConsistent() {
        return statuses.getTotal() == totalCount && minutes.getTotal() == totalCount
                && urls.getTotal() == totalCount && userAgents.getTotal() == totalCount
                && failures.getTotal() <= totalCount;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AggregateState)) {
            return false;
        }
        AggregateState that = (AggregateState) other;
        return totalCount == that.totalCount && statuses.equals(that.statuses)
                && urls.equals(that.urls) && userAgents.equals(that.userAgents)
                && failures.equals(that.failures) && minutes.equals(that.minutes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(totalCount, statuses, urls, userAgents, failures, minutes);
    }

    @Override
    public String toString() {
        return "AggregateState(total=" + totalCount + ", statuses=" + statuses.asSortedMap() + ")";
    }
}
