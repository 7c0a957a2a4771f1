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

import java.util.concurrent.atomic.AtomicLong;

import org.apache.weblog.parser.MalformedRecordException;

/**
 * Counts good and malformed lines and tolerates malformed lines up to a
 * configured error rate. With the default settings every malformed line is
 * tolerated and only counted.
 * <p>
 * Counters are atomic so one handler can be shared by the workers of a
 * parallel run.
 */
public class CounterBasedErrorHandler implements ErrorHandler {

    public static final int ERROR_CODE = 1101;

    private final long minErrors;
    private final float errorThreshold; // fraction of errors allowed

    private final AtomicLong recordCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    public CounterBasedErrorHandler(AnalysisContext context) {
        this(context.getMinErrorRecords(), context.getErrorThreshold());
    }

    public CounterBasedErrorHandler(long minErrors, float errorThreshold) {
        this.minErrors = minErrors;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public void onSuccess() {
        recordCount.incrementAndGet();
    }

    @Override
    public void onError(long lineNumber, MalformedRecordException e) throws WeblogException {
        long numErrors = errorCount.incrementAndGet();
        long numRecords = recordCount.incrementAndGet();
        if (hasErrorExceededThreshold(numErrors, numRecords)) {
            throw new WeblogException("Exceeded the error rate while processing records. "
                    + "The latest error was seen at line " + lineNumber, ERROR_CODE, WeblogException.INPUT, e);
        }
    }

    private boolean hasErrorExceededThreshold(long numErrors, long numRecords) {
        if (numErrors > 0 && errorThreshold <= 0) { // no errors are tolerated
            return true;
        }
        double errRate = numErrors / (double) numRecords;
        // If we have more than the min allowed errors and if it exceeds the
        // threshold
        return numErrors >= minErrors && errRate > errorThreshold;
    }

    @Override
    public long getErrorCount() {
        return errorCount.get();
    }

    @Override
    public long getRecordCount() {
        return recordCount.get();
    }
}
