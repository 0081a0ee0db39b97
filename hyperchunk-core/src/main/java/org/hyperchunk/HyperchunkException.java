/*
 * HyperchunkException.java
 *
 * This source file is part of the Hyperchunk open source project
 *
 * Copyright 2026 the Hyperchunk project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.hyperchunk;

import org.hyperchunk.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The base of all exceptions thrown by Hyperchunk.
 *
 * <p>
 * Besides its message, an exception carries a set of keys and values describing the chunk, partition or
 * statement involved, so that a failure can be logged as a {@link org.hyperchunk.logging.KeyValueLogMessage}
 * and searched for later. Keys should come from {@link org.hyperchunk.logging.LogMessageKeys}.
 * </p>
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class HyperchunkException extends RuntimeException {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with the given message and a sequence of key-value pairs.
     *
     * @param msg error message
     * @param keyValues flattened keys and values
     * @throws IllegalArgumentException if <code>keyValues</code> has an odd number of elements
     * @see #addLogInfo(Object...)
     */
    public HyperchunkException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public HyperchunkException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public HyperchunkException(Throwable cause) {
        super(cause);
    }

    /**
     * Get the log information associated with this exception.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    /**
     * Add a key/value pair to the log information.
     *
     * @param description the key
     * @param object the value
     * @return this exception
     */
    @Nonnull
    public HyperchunkException addLogInfo(@Nonnull String description, @Nullable Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    /**
     * Add a list of key/value pairs to the log information. Every even element is a key and the odd element that
     * follows it is its value, so <code>["k0", "v0", "k1", "v1"]</code> adds two pairs. This is the same format
     * that {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened keys and values
     * @return this exception
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    public HyperchunkException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    /**
     * Flatten the log information into alternating keys and values, in the order they were added.
     *
     * @return a flattened array of keys and values
     */
    @Nonnull
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        Object[] exportedInfo = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exportedInfo[i] = entry.getKey();
            exportedInfo[i + 1] = entry.getValue();
            i += 2;
        }
        return exportedInfo;
    }
}
