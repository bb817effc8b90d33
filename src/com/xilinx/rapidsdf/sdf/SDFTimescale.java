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

import java.util.Objects;

/**
 * The TIMESCALE header entry, e.g. {@code 100 ps}. All delay values in the
 * file are multiples of this quantity.
 */
public final class SDFTimescale {

    private final double magnitude;

    private final SDFTimeUnit unit;

    public SDFTimescale(double magnitude, SDFTimeUnit unit) {
        this.magnitude = magnitude;
        this.unit = Objects.requireNonNull(unit);
    }

    public double getMagnitude() {
        return magnitude;
    }

    public SDFTimeUnit getUnit() {
        return unit;
    }

    public double getSeconds() {
        return magnitude * unit.getSeconds();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFTimescale other = (SDFTimescale) o;
        return Double.compare(magnitude, other.magnitude) == 0 && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(magnitude, unit);
    }

    @Override
    public String toString() {
        return magnitude + unit.toString();
    }
}
