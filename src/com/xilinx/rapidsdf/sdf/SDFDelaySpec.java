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
 * A DELAY block. The definitions of all its ABSOLUTE sections are kept in one
 * list, in file order.
 */
public final class SDFDelaySpec extends SDFTimingSpec {

    private final List<SDFDelayDef> delayDefs;

    public SDFDelaySpec(List<SDFDelayDef> delayDefs) {
        this.delayDefs = Collections.unmodifiableList(new ArrayList<>(delayDefs));
    }

    @Override
    public Type getType() {
        return Type.DELAY;
    }

    public List<SDFDelayDef> getDelayDefs() {
        return delayDefs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return delayDefs.equals(((SDFDelaySpec) o).delayDefs);
    }

    @Override
    public int hashCode() {
        return delayDefs.hashCode();
    }

    @Override
    public String toString() {
        return "(DELAY (ABSOLUTE " + delayDefs.size() + " defs))";
    }
}
