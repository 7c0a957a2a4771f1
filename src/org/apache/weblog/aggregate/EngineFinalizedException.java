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

import org.apache.weblog.WeblogException;

/**
 * Raised when a record is handed to an engine that has already been
 * finalized. This is a programming error and is never skipped.
 */
public class EngineFinalizedException extends WeblogException {
    private static final long serialVersionUID = 1L;

    public static final int ERROR_CODE = 2200;

    public EngineFinalizedException(String message) {
        super(message, ERROR_CODE, BUG);
    }
}
