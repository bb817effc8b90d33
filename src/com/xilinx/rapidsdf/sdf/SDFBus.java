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
import java.util.List;
import java.util.Objects;

/**
 * A bus suffix on a path or port: a single bit {@code [3]} or an inclusive
 * range {@code [3:0]}.
 */
public final class SDFBus {

    private final int high;

    private final Integer low;

    public SDFBus(int high, Integer low) {
        this.high = high;
        this.low = low;
    }

    public SDFBus(int index) {
        this(index, null);
    }

    /**
     * @return The first index as written ({@code 3} for {@code [3:0]} and {@code [3]})
     */
    public int getHigh() {
        return high;
    }

    /**
     * @return The second index of a range, or null for a single bit
     */
    public Integer getLow() {
        return low;
    }

    public boolean isRange() {
        return low != null;
    }

    /**
     * @return Every index covered by this bus, in ascending order. The two
     * endpoints of a range may be written in either order.
     */
    public List<Integer> getIndices() {
        List<Integer> indices = new ArrayList<>();
        if (low == null) {
            indices.add(high);
            return indices;
        }
        int from = Math.min(high, low);
        int to = Math.max(high, low);
        for (int i = from; i <= to; i++) {
            indices.add(i);
        }
        return indices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFBus other = (SDFBus) o;
        return high == other.high && Objects.equals(low, other.low);
    }

    @Override
    public int hashCode() {
        return Objects.hash(high, low);
    }

    @Override
    public String toString() {
        return low == null ? "[" + high + "]" : "[" + high + ":" + low + "]";
    }
}
