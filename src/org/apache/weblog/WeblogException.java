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

import java.io.IOException;

/**
 * All exceptions raised while analyzing access logs are encapsulated in the
 * <code>WeblogException</code> class. Details such as the source of the
 * error and the error code are contained in this class. The default values
 * for the attributes are:
 * errorSource = BUG
 * errorCode = 0
 */
public class WeblogException extends IOException {

    // Change this if you modify the class.
    static final long serialVersionUID = 1L;

    /*
     * Instead of using an enum for the source of the error,
     * the classic style of using static final is adopted
     */
    public static final byte INPUT = 2;
    public static final byte BUG = 4;
    public static final byte USER_ENVIRONMENT = 8;
    public static final byte ERROR = -1;

    /**
     * A static method to query if an error source is due to
     * an input or not.
     *
     * @param errSource - byte that indicates the error source
     * @return true if the error source is an input; false otherwise
     */
    public static boolean isInput(byte errSource) {
        return (errSource & INPUT) != 0;
    }

    /**
     * A static method to query if an error source is due to
     * a bug or not.
     *
     * @param errSource - byte that indicates the error source
     * @return true if the error source is a bug; false otherwise
     */
    public static boolean isBug(byte errSource) {
        return (errSource & BUG) != 0;
    }

    public static boolean isUserEnvironment(byte errSource) {
        return (errSource & USER_ENVIRONMENT) != 0;
    }

    /**
     * A static method to determine the error source given the error code.
     * Codes 1000-1999 are input problems, 2000-2999 are bugs (API misuse
     * included) and 3000-3999 come from the user environment.
     *
     * @param errCode - integer error code
     * @return byte that indicates the error source
     */
    public static byte determineErrorSource(int errCode) {
        if (errCode >= 1000 && errCode <= 1999) {
            return INPUT;
        } else if (errCode >= 2000 && errCode <= 2999) {
            return BUG;
        } else if (errCode >= 3000 && errCode <= 3999) {
            return USER_ENVIRONMENT;
        }
        return ERROR;
    }

    protected int errorCode = 0;
    protected byte errorSource = BUG;

    public WeblogException(String message) {
        super(message);
    }

    public WeblogException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Create a new WeblogException with the specified message and error code.
     * The error source is derived from the code.
     *
     * @param message - The error message shown to the user
     * @param errCode - The error code shown to the user
     */
    public WeblogException(String message, int errCode) {
        this(message, errCode, determineErrorSource(errCode));
    }

    /**
     * Create a new WeblogException with the specified message, error code
     * and error source.
     *
     * @param message - The error message shown to the user
     * @param errCode - The error code shown to the user
     * @param errSrc - The error source
     */
    public WeblogException(String message, int errCode, byte errSrc) {
        super(message);
        errorCode = errCode;
        errorSource = errSrc;
    }

    /**
     * Create a new WeblogException with the specified message, error code,
     * error source and cause.
     *
     * @param message - The error message shown to the user
     * @param errCode - The error code shown to the user
     * @param errSrc - The error source
     * @param cause - The cause indicating the source of this exception. A
     *        null value is permitted, and indicates that the cause is
     *        nonexistent or unknown.
     */
    public WeblogException(String message, int errCode, byte errSrc, Throwable cause) {
        super(message, cause);
        errorCode = errCode;
        errorSource = errSrc;
    }

    /**
     * Returns the error code of the exception
     *
     * @return error code of the exception
     */
    public int getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the error source of the exception. Can be more than one source.
     *
     * @return error sources represented as a byte
     */
    public byte getErrorSource() {
        return errorSource;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": <" + errorSourceName() + "> ERROR "
                + errorCode + ": " + getMessage();
    }

    private String errorSourceName() {
        if (isInput(errorSource)) {
            return "input";
        } else if (isUserEnvironment(errorSource)) {
            return "user environment";
        } else if (isBug(errorSource)) {
            return "bug";
        }
        return "unknown";
    }
}
