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

import org.apache.weblog.parser.MalformedRecordException;

/**
 * Decides what happens to input lines that could not be parsed.
 */
public interface ErrorHandler {

    /**
     * Called after a line was parsed successfully.
     */
    public void onSuccess();

    /**
     * Called for a line that could not be parsed.
     *
     * @param lineNumber 1-based line number within the input
     * @param e the parse failure
     * @throws WeblogException if the run must not continue
     */
    public void onError(long lineNumber, MalformedRecordException e) throws WeblogException;

    /**
     * @return number of lines reported through {@link #onError}
     */
    public long getErrorCount();

    /**
     * @return number of lines seen, good or bad
     */
    public long getRecordCount();
}
