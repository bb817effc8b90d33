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
 * One SDF value (rvalue), either a single number or a min:typ:max triple.
 * Every number is optional: null means the value is not specified for that
 * corner, which is different from zero. A single value applies to all three
 * corners.
 */
public final class SDFValue {

    private final boolean triple;

    private final Double min;

    private final Double typ;

    private final Double max;

    private SDFValue(boolean triple, Double min, Double typ, Double max) {
        this.triple = triple;
        this.min = min;
        this.typ = typ;
        this.max = max;
    }

    /**
     * @param value The number, or null for an empty value such as {@code ()}
     * @return A single (non-triple) value
     */
    public static SDFValue single(Double value) {
        return new SDFValue(false, value, value, value);
    }

    public static SDFValue triple(Double min, Double typ, Double max) {
        return new SDFValue(true, min, typ, max);
    }

    public boolean isTriple() {
        return triple;
    }

    /**
     * @return The number of a single value, or null if unspecified
     * @throws IllegalStateException if this value is a triple
     */
    public Double getValue() {
        if (triple) {
            throw new IllegalStateException("getValue() called on min:typ:max triple " + this);
        }
        return typ;
    }

    public Double getMin() {
        return min;
    }

    public Double getTyp() {
        return typ;
    }

    public Double getMax() {
        return max;
    }

    public Double get(SDFCorner corner) {
        switch (corner) {
            case MIN:
                return min;
            case TYP:
                return typ;
            case MAX:
                return max;
            default:
                throw new IllegalArgumentException("Unknown corner " + corner);
        }
    }

    /**
     * @return True if no number at all was given
     */
    public boolean isEmpty() {
        return min == null && typ == null && max == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFValue other = (SDFValue) o;
        return triple == other.triple && Objects.equals(min, other.min)
                && Objects.equals(typ, other.typ) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(triple, min, typ, max);
    }

    private static String str(Double d) {
        return d == null ? "" : d.toString();
    }

    @Override
    public String toString() {
        if (!triple) {
            return "(" + str(typ) + ")";
        }
        return "(" + str(min) + ":" + str(typ) + ":" + str(max) + ")";
    }
}
