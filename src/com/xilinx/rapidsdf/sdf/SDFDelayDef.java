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

package com.xilinx.rapidsdf.sdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One delay definition inside an ABSOLUTE block of a DELAY timing spec.
 */
public abstract class SDFDelayDef {

    /**
     * Smallest number of values in a delay value list.
     */
    public static final int MIN_VALUES = 1;

    /**
     * Largest number of values in a delay value list (one per transition,
     * 01 10 0z z1 1z z0 0x x1 1x x0 xz zx).
     */
    public static final int MAX_VALUES = 12;

    public enum Type {
        INTERCONNECT,
        IOPATH,
        COND_IOPATH,
        CONDELSE_IOPATH
    }

    public abstract Type getType();

    /**
     * @return The IOPATH this definition describes, or null for an INTERCONNECT
     */
    public abstract SDFIOPath getIOPath();

    static List<SDFValue> checkValueList(List<SDFValue> values) {
        if (values.size() < MIN_VALUES || values.size() > MAX_VALUES) {
            throw new IllegalArgumentException("A delay value list holds " + MIN_VALUES + " to "
                    + MAX_VALUES + " values, got " + values.size());
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    static String valuesToString(List<SDFValue> values) {
        StringBuilder sb = new StringBuilder();
        for (SDFValue v : values) {
            sb.append(' ').append(v);
        }
        return sb.toString();
    }
}
