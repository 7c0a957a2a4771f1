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

/**
 * Container for static configuration strings and their defaults. Values are
 * passed explicitly through {@link AnalysisContext}; nothing is read from
 * the environment.
 */
public class WeblogConfiguration {
    private WeblogConfiguration() {}

    /////////////////////////////////////////////////////////////////////////////////////
    /////////////////////////         REPORT KEYS           /////////////////////////////
    /////////////////////////////////////////////////////////////////////////////////////

    /**
     * Number of URLs listed in the top URL report. Default is 3
     */
    public static final String WEBLOG_REPORT_TOPK = "weblog.report.topk";
    public static final int WEBLOG_REPORT_TOPK_DEFAULT = 3;

    /**
     * An IP is suspicious once its failure count strictly exceeds this value. Default is 3
     */
    public static final String WEBLOG_FAILURE_THRESHOLD = "weblog.failure.threshold";
    public static final int WEBLOG_FAILURE_THRESHOLD_DEFAULT = 3;

    /**
     * Comma separated status codes counted as failed requests. Default is 404,500
     */
    public static final String WEBLOG_FAILURE_STATUSES = "weblog.failure.statuses";
    public static final String WEBLOG_FAILURE_STATUSES_DEFAULT = "404,500";

    /////////////////////////////////////////////////////////////////////////////////////
    /////////////////////////        PARTITION KEYS         /////////////////////////////
    /////////////////////////////////////////////////////////////////////////////////////

    /**
     * Boolean value to enable grouping records by status. Disabled by default
     */
    public static final String WEBLOG_PARTITION_ENABLED = "weblog.partition.enabled";

    /**
     * Upper bound on the number of distinct partitions one run may create.
     * Guards against partitioning by a high cardinality column. Default is 1000
     */
    public static final String WEBLOG_PARTITION_MAX = "weblog.partition.max";
    public static final int WEBLOG_PARTITION_MAX_DEFAULT = 1000;

    /////////////////////////////////////////////////////////////////////////////////////
    /////////////////////////      ERROR HANDLING KEYS      /////////////////////////////
    /////////////////////////////////////////////////////////////////////////////////////

    /**
     * Minimum number of malformed lines seen before the error rate is checked
     */
    public static final String WEBLOG_ERROR_HANDLING_MIN_ERROR_RECORDS = "weblog.error.handling.min.error.records";

    /**
     * Fraction of malformed lines tolerated before the run is aborted. The
     * default of 1.0 never aborts; malformed lines are only skipped and counted
     */
    public static final String WEBLOG_ERROR_HANDLING_THRESHOLD_PERCENT = "weblog.error.handling.threshold.percent";

    /////////////////////////////////////////////////////////////////////////////////////
    /////////////////////////        EXECUTION KEYS         /////////////////////////////
    /////////////////////////////////////////////////////////////////////////////////////

    /**
     * Number of worker threads used by {@link ParallelLogAnalyzer}. Default is 4
     */
    public static final String WEBLOG_PARALLEL_WORKERS = "weblog.parallel.workers";
    public static final int WEBLOG_PARALLEL_WORKERS_DEFAULT = 4;
}
