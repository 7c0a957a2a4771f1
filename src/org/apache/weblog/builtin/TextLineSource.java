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
package org.apache.weblog.builtin;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

import org.apache.weblog.LineSource;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;

/**
 * Reads lines from a character stream. Files are read as UTF-8.
 */
public class TextLineSource implements LineSource {
    private final BufferedReader in;

    public TextLineSource(Reader reader) {
        Preconditions.checkNotNull(reader, "reader");
        this.in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    public static TextLineSource open(File file) throws IOException {
        return new TextLineSource(Files.newReader(file, Charsets.UTF_8));
    }

    public static TextLineSource fromString(String text) {
        return new TextLineSource(new StringReader(text));
    }

    @Override
    public String nextLine() throws IOException {
        return in.readLine();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
