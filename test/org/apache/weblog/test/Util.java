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
package org.apache.weblog.test;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import org.apache.weblog.AnalysisContext;
import org.apache.weblog.aggregate.AggregationEngine;
import org.apache.weblog.data.LogRecord;
import org.apache.weblog.parser.RecordParser;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Shared fixtures for the tests.
 */
public class Util {

    public static final String HEADER = "ip,timestamp,url,status,user_agent";

    /**
     * The five record worked example.
     */
    public static final List<String> SAMPLE = ImmutableList.of(
            "192.168.1.1,2024-01-01 10:00:00,/home,200,Mozilla/5.0",
            "192.168.1.2,2024-01-01 10:01:00,/products,404,Chrome/90.0",
            "192.168.1.3,2024-01-01 10:02:00,/home,500,Safari/14.0",
            "192.168.1.4,2024-01-01 10:03:00,/checkout,200,Mozilla/5.0",
            "192.168.1.5,2024-01-01 10:04:00,/products,404,Chrome/90.0");

    public static List<String> withHeader(List<String> lines) {
        List<String> all = Lists.newArrayList(HEADER);
        all.addAll(lines);
        return all;
    }

    public static String toText(List<String> lines) {
        return Joiner.on('\n').join(lines) + "\n";
    }

    public static AnalysisContext context(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return new AnalysisContext(props);
    }

    /**
     * Builds a finalized engine from lines that are all expected to parse.
     */
    public static AggregationEngine engineFor(AnalysisContext context, List<String> lines, long ordinalBase)
            throws IOException {
        RecordParser parser = new RecordParser();
        AggregationEngine engine = new AggregationEngine(context, ordinalBase);
        for (String line : lines) {
            engine.ingest(parser.parse(line));
        }
        engine.finish();
        return engine;
    }

    public static AggregationEngine engineFor(List<String> lines) throws IOException {
        return engineFor(new AnalysisContext(), lines, 0);
    }

    public static String line(String ip, String timestamp, String url, int status, String agent) {
        return new LogRecord(ip, timestamp, url, status, agent).toDelimitedString(",");
    }
}
