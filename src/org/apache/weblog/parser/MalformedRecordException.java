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

import org.apache.weblog.WeblogException;

/**
 * Raised when an input line cannot be turned into a
 * {@link org.apache.weblog.data.LogRecord}. The line is skipped and counted;
 * the run carries on.
 */
public class MalformedRecordException extends WeblogException {
    private static final long serialVersionUID = 1L;

    public static final int ERROR_CODE = 1100;

    private final String line;

    public MalformedRecordException(String message, String line) {
        super(message, ERROR_CODE, INPUT);
        this.line = line;
    }

    public MalformedRecordException(String message, String line, Throwable cause) {
        super(message, ERROR_CODE, INPUT, cause);
        this.line = line;
    }

    /**
     * @return the offending input line, as read
     */
    public String getLine() {
        return line;
    }
}
