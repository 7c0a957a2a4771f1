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

import com.google.common.base.Objects;

/**
 * A key of some histogram together with its count.
 */
public final class CountEntry<K> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final K key;
    private final long count;

    public CountEntry(K key, long count) {
        this.key = key;
        this.count = count;
    }

    public static <K> CountEntry<K> of(K key, long count) {
        return new CountEntry<K>(key, count);
    }

    public K getKey() {
        return key;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CountEntry)) {
            return false;
        }
        CountEntry<?> that = (CountEntry<?>) other;
        return count == that.count && Objects.equal(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(key, count);
    }

    @Override
    public String toString() {
        return "(" + key + "," + count + ")";
    }
}
