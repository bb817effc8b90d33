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

import java.util.List;
import java.util.Objects;

/**
 * A net delay between an output pin and an input pin, both given as full
 * hierarchical paths.
 */
public final class SDFInterconnect extends SDFDelayDef {

    private final SDFPath from;

    private final SDFPath to;

    private final List<SDFValue> values;

    public SDFInterconnect(SDFPath from, SDFPath to, List<SDFValue> values) {
        this.from = Objects.requireNonNull(from);
        this.to = Objects.requireNonNull(to);
        this.values = checkValueList(values);
    }

    @Override
    public Type getType() {
        return Type.INTERCONNECT;
    }

    @Override
    public SDFIOPath getIOPath() {
        return null;
    }

    public SDFPath getFrom() {
        return from;
    }

    public SDFPath getTo() {
        return to;
    }

    public List<SDFValue> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFInterconnect other = (SDFInterconnect) o;
        return from.equals(other.from) && to.equals(other.to) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, values);
    }

    @Override
    public String toString() {
        return "(INTERCONNECT " + from + " " + to + valuesToString(values) + ")";
    }
}
