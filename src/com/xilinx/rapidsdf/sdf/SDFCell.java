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
import java.util.Objects;

/**
 * One CELL entry: a cell type, the instance it annotates and its timing
 * specs. A cell without an instance applies to every instance of its type.
 */
public final class SDFCell {

    private final String cellType;

    private final SDFPath instance;

    private final List<SDFTimingSpec> timingSpecs;

    public SDFCell(String cellType, SDFPath instance, List<SDFTimingSpec> timingSpecs) {
        this.cellType = Objects.requireNonNull(cellType);
        this.instance = instance;
        this.timingSpecs = Collections.unmodifiableList(new ArrayList<>(timingSpecs));
    }

    public String getCellType() {
        return cellType;
    }

    /**
     * @return The instance path, or null for a wildcard cell
     */
    public SDFPath getInstance() {
        return instance;
    }

    public boolean isWildcard() {
        return instance == null;
    }

    public List<SDFTimingSpec> getTimingSpecs() {
        return timingSpecs;
    }

    /**
     * @return The delay definitions of all DELAY blocks of this cell, in file order
     */
    public List<SDFDelayDef> getDelayDefs() {
        List<SDFDelayDef> defs = new ArrayList<>();
        for (SDFTimingSpec spec : timingSpecs) {
            if (spec.getType() == SDFTimingSpec.Type.DELAY) {
                defs.addAll(((SDFDelaySpec) spec).getDelayDefs());
            }
        }
        return defs;
    }

    /**
     * @return The checks of all TIMINGCHECK blocks of this cell, in file order
     */
    public List<SDFTimingCheck> getTimingChecks() {
        List<SDFTimingCheck> checks = new ArrayList<>();
        for (SDFTimingSpec spec : timingSpecs) {
            if (spec.getType() == SDFTimingSpec.Type.TIMINGCHECK) {
                checks.addAll(((SDFTimingCheckSpec) spec).getChecks());
            }
        }
        return checks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFCell other = (SDFCell) o;
        return cellType.equals(other.cellType) && Objects.equals(instance, other.instance)
                && timingSpecs.equals(other.timingSpecs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellType, instance, timingSpecs);
    }

    @Override
    public String toString() {
        return "(CELL \"" + cellType + "\" " + (instance == null ? "*" : instance.toString()) + ")";
    }
}
