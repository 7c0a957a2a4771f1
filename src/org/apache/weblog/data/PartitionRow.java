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
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A stored row of a status partition: a {@link LogRecord} without its status
 * column, fields in the order <code>ip,timestamp,url,user_agent</code>.
 */
public final class PartitionRow implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String ip;
    private final String timestamp;
    private final String url;
    private final String userAgent;

    public PartitionRow(String ip, String timestamp, String url, String userAgent) {
        this.ip = ip;
        this.timestamp = timestamp;
        this.url = url;
        this.userAgent = userAgent;
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

    public String getUserAgent() {
        return userAgent;
    }

    public List<String> getFields() {
        return ImmutableList.of(ip, timestamp, url, userAgent);
    }

    public String toDelimitedString(String delim) {
        return Joiner.on(delim).join(getFields());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PartitionRow)) {
            return false;
        }
        return getFields().equals(((PartitionRow) other).getFields());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(ip, timestamp, url, userAgent);
    }

    @Override
    public String toString() {
        return "(" + toDelimitedString(",") + ")";
    }
}
