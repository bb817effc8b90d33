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
 * A cell-internal delay from an input port (optionally edge qualified) to an
 * output port.
 */
public final class SDFIOPath extends SDFDelayDef {

    private final SDFPortSpec input;

    private final SDFPort output;

    private final List<SDFValue> retain;

    private final List<SDFValue> values;

    /**
     * @param input Input port, with an optional edge
     * @param output Output port
     * @param retain RETAIN value list, or null if the IOPATH has none
     * @param values Delay value list
     */
    public SDFIOPath(SDFPortSpec input, SDFPort output, List<SDFValue> retain, List<SDFValue> values) {
        this.input = Objects.requireNonNull(input);
        this.output = Objects.requireNonNull(output);
        this.retain = retain == null ? null : checkValueList(retain);
        this.values = checkValueList(values);
    }

    @Override
    public Type getType() {
        return Type.IOPATH;
    }

    @Override
    public SDFIOPath getIOPath() {
        return this;
    }

    public SDFPortSpec getInput() {
        return input;
    }

    public SDFPort getOutput() {
        return output;
    }

    /**
     * @return The RETAIN value list, or null if none was given
     */
    public List<SDFValue> getRetain() {
        return retain;
    }

    public List<SDFValue> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFIOPath other = (SDFIOPath) o;
        return input.equals(other.input) && output.equals(other.output)
                && Objects.equals(retain, other.retain) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, output, retain, values);
    }

    @Override
    public String toString() {
        String r = retain == null ? "" : " (RETAIN" + valuesToString(retain) + ")";
        return "(IOPATH " + input + " " + output + r + valuesToString(values) + ")";
    }
}
