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
 * Raised by an analyzer that was aborted before it consumed all input. The
 * partial aggregates of the run are discarded.
 */
public class AnalysisAbortedException extends WeblogException {
    private static final long serialVersionUID = 1L;

    public static final int ERROR_CODE = 3300;

    public AnalysisAbortedException(String message) {
        super(message, ERROR_CODE, USER_ENVIRONMENT);
    }

    public AnalysisAbortedException(String message, Throwable cause) {
        super(message, ERROR_CODE, USER_ENVIRONMENT, cause);
    }
}
