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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.apache.weblog.parser.MalformedRecordException;
import org.junit.Test;

public class TestCounterBasedErrorHandler {

    private static MalformedRecordException error() {
        return new MalformedRecordException("bad", "x");
    }

    @Test
    public void testDefaultToleratesEverything() throws Exception {
        CounterBasedErrorHandler handler = new CounterBasedErrorHandler(new AnalysisContext());
        for (int i = 0; i < 10; i++) {
            handler.onError(i + 1, error());
        }
        handler.onSuccess();
        assertEquals(10, handler.getErrorCount());
        assertEquals(11, handler.getRecordCount());
    }

    @Test
    public void testZeroThresholdToleratesNothing() throws Exception {
        CounterBasedErrorHandler handler = new CounterBasedErrorHandler(0, 0.0f);
        handler.onSuccess();
        try {
            handler.onError(2, error());
            fail("Expected WeblogException");
        } catch (WeblogException e) {
            assertEquals(CounterBasedErrorHandler.ERROR_CODE, e.getErrorCode());
            assertEquals(MalformedRecordException.class, e.getCause().getClass());
        }
    }

    @Test
    public void testMinErrorsBeforeRateApplies() throws Exception {
        CounterBasedErrorHandler handler = new CounterBasedErrorHandler(3, 0.5f);
        handler.onError(1, error());
        handler.onError(2, error());
        try {
            handler.onError(3, error());
            fail("Expected WeblogException");
        } catch (WeblogException e) {
            assertEquals(3, handler.getErrorCount());
        }
    }

    @Test
    public void testRateBelowThreshold() throws Exception {
        CounterBasedErrorHandler handler = new CounterBasedErrorHandler(1, 0.5f);
        handler.onSuccess();
        handler.onSuccess();
        handler.onError(3, error());
        assertEquals(1, handler.getErrorCount());
    }
}
