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
package org.apache.weblog.data;

import java.io.Serializable;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * One parsed web access log entry. Instances are immutable and are created by
 * {@link org.apache.weblog.parser.RecordParser}; the parser is responsible for
 * validating the field contents.
 */
public final class LogRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Length of the <code>yyyy-MM-dd HH:mm</code> prefix of a timestamp.
     */
    public static final int MINUTE_KEY_LENGTH = 16;

    private final String ip;
    private final String timestamp;
    private final String url;
    private final int status;
    private final String userAgent;

    public LogRecord(String ip, String timestamp, String url, int status, String userAgent) {
        this.ip = Preconditions.checkNotNull(ip, "ip");
        this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp");
        this.url = Preconditions.checkNotNull(url, "url");
        this.status = status;
        this.userAgent = Preconditions.checkNotNull(userAgent, "userAgent");
    }

    public String getIp() {
        return ip;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getUrl() {
        return url;
    }

    public int getStatus() {
        return status;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * Truncates the timestamp to minute resolution by taking its first 16
     * characters, e.g. <code>2024-01-01 10:05</code>.
     */
    public String getMinuteKey() {
        return timestamp.length() <= MINUTE_KEY_LENGTH ? timestamp : timestamp.substring(0, MINUTE_KEY_LENGTH);
    }

    /**
     * Projects away the status column, which is carried by the partition
     * the row is stored under.
     */
    public PartitionRow toPartitionRow() {
        return new PartitionRow(ip, timestamp, url, userAgent);
    }

    public String toDelimitedString(String delim) {
        return Joiner.on(delim).join(ip, timestamp, url, status, userAgent);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LogRecord)) {
            return false;
        }
        LogRecord that = (LogRecord) other;
        return status == that.status && ip.equals(that.ip) && timestamp.equals(that.timestamp)
                && url.equals(that.url) && userAgent.equals(that.userAgent);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(ip, timestamp, url, status, userAgent);
    }

    @Override
    public String toString() {
        return "(" + toDelimitedString(",") + ")";
    }
}
