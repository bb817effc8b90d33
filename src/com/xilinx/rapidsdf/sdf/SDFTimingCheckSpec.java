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
 * A TIMINGCHECK block. Its checks are captured as written and not validated.
 */
public final class SDFTimingCheckSpec extends SDFTimingSpec {

    private final List<SDFTimingCheck> checks;

    public SDFTimingCheckSpec(List<SDFTimingCheck> checks) {
        this.checks = Collections.unmodifiableList(new ArrayList<>(checks));
    }

    @Override
    public Type getType() {
        return Type.TIMINGCHECK;
    }

    public List<SDFTimingCheck> getChecks() {
        return checks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return checks.equals(((SDFTimingCheckSpec) o).checks);
    }

    @Override
    public int hashCode() {
        return checks.hashCode();
    }

    @Override
    public String toString() {
        return "(TIMINGCHECK " + checks.size() + " checks)";
    }
}
