/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSDF.
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
 *
 */

package com.xilinx.rapidsdf.util;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Deduplicates identifier strings (instance names, pin names, cell types) read
 * from SDF files. Large SDF files repeat the same names on almost every line.
 * Each parse owns its pool, so pools are never shared across threads.
 */
public class StringPool {

    private final Map<String,String> stringPool;

    private StringPool(Map<String, String> stringPool) {
        this.stringPool = stringPool;
    }

    /**
     * Create a new StringPool that should be only used by a single thread.
     * @return a non thread safe StringPool
     */
    public static StringPool singleThreadedPool() {
        return new StringPool(new HashMap<>());
    }

    /**
     * Create a StringPool that hands back every name unchanged.
     * @return a pool that does not deduplicate
     */
    public static StringPool passThroughPool() {
        return new StringPool(null);
    }

    /**
     * Create the pool the SDF parser uses by default, honoring
     * {@link Params#RSDF_DISABLE_STRING_POOL}.
     * @return a single threaded pool, or a pass-through pool if pooling is disabled
     */
    public static StringPool defaultParserPool() {
        return Params.RSDF_DISABLE_STRING_POOL ? passThroughPool() : singleThreadedPool();
    }

    public String uniquifyName(String tmpName) {
        if (stringPool == null) {
            return tmpName;
        }
        return stringPool.computeIfAbsent(tmpName, Function.identity());
    }

    /**
     * @return Number of distinct names held, 0 for a pass-through pool
     */
    public int size() {
        return stringPool == null ? 0 : stringPool.size();
    }
}
