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
package org.apache.weblog.parser;

import java.util.List;
import java.util.regex.Pattern;

import org.apache.weblog.data.LogRecord;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Parses one comma delimited access log line of the form
 * <code>ip,timestamp,url,status,user_agent</code> into a {@link LogRecord}.
 * <p>
 * This is flat CSV: quoting is not understood, so a field containing a comma
 * yields the wrong number of fields and the line is rejected as malformed
 * rather than being split in the wrong place.
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public class RecordParser {

    public static final char FIELD_DELIMITER = ',';

    public static final List<String> HEADER_FIELDS =
            ImmutableList.of("ip", "timestamp", "url", "status", "user_agent");

    public static final String TIMESTAMP_FORMAT = "yyyy-MM-dd HH:mm:ss";

    public static final int MIN_STATUS = 100;
    public static final int MAX_STATUS = 599;

    private static final int IP = 0;
    private static final int TIMESTAMP = 1;
    private static final int URL = 2;
    private static final int STATUS = 3;
    private static final int USER_AGENT = 4;

    private static final Splitter FIELD_SPLITTER = Splitter.on(FIELD_DELIMITER);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private static final Pattern STATUS_SHAPE = Pattern.compile("[0-9]{3}");

    // Joda is lenient about field widths, so the shape is checked first
    private static final Pattern TIMESTAMP_SHAPE =
            Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");
    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormat.forPattern(TIMESTAMP_FORMAT);

    /**
     * Removes a leading UTF-8 byte order mark, which editors tend to leave on
     * the first line of a file.
     */
    public static String stripByteOrderMark(String line) {
        if (line != null && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
            return line.substring(1);
        }
        return line;
    }

    /**
     * @param line a raw input line
     * @return true if the line consists of exactly the expected column names
     */
    public boolean isHeader(String line) {
        if (line == null) {
            return false;
        }
        List<String> fields = split(line);
        if (fields.size() != HEADER_FIELDS.size()) {
            return false;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (!HEADER_FIELDS.get(i).equals(fields.get(i).trim())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses a single line.
     *
     * @param line the raw line, with or without a trailing carriage return
     * @return the parsed record, never null
     * @throws MalformedRecordException if the field count, the status or the
     *         timestamp is wrong, or a field is empty
     */
    public LogRecord parse(String line) throws MalformedRecordException {
        if (line == null) {
            throw new MalformedRecordException("Null input line", null);
        }
        List<String> fields = split(line);
        if (fields.size() != HEADER_FIELDS.size()) {
            throw new MalformedRecordException("Expected " + HEADER_FIELDS.size()
                    + " fields but found " + fields.size(), line);
        }

        String ip = requireField(fields, IP, line);
        String timestamp = requireField(fields, TIMESTAMP, line);
        String url = requireField(fields, URL, line);
        String statusStr = requireField(fields, STATUS, line);
        String userAgent = requireField(fields, USER_AGENT, line);

        if (!STATUS_SHAPE.matcher(statusStr).matches()) {
            throw new MalformedRecordException("Status is not a three digit code: " + statusStr, line);
        }
        int status = Integer.parseInt(statusStr);
        if (status < MIN_STATUS || status > MAX_STATUS) {
            throw new MalformedRecordException("Status out of range " + MIN_STATUS + "-"
                    + MAX_STATUS + ": " + status, line);
        }

        checkTimestamp(timestamp, line);
        return new LogRecord(ip, timestamp, url, status, userAgent);
    }

    private static void checkTimestamp(String timestamp, String line) throws MalformedRecordException {
        if (!TIMESTAMP_SHAPE.matcher(timestamp).matches()) {
            throw new MalformedRecordException("Timestamp does not match " + TIMESTAMP_FORMAT
                    + ": " + timestamp, line);
        }
        try {
            TIMESTAMP_FORMATTER.parseLocalDateTime(timestamp);
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException("Invalid timestamp: " + timestamp, line, e);
        }
    }

    private static String requireField(List<String> fields, int index, String line)
            throws MalformedRecordException {
        String value = fields.get(index).trim();
        if (value.isEmpty()) {
            throw new MalformedRecordException("Empty " + HEADER_FIELDS.get(index) + " field", line);
        }
        return value;
    }

    private static List<String> split(String line) {
        return FIELD_SPLITTER.splitToList(CharMatcher.is('\r').trimTrailingFrom(line));
    }
}
