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
 * One check of a TIMINGCHECK block: its kind and its raw arguments.
 */
public final class SDFTimingCheck {

    private final SDFTimingCheckType type;

    private final List<SDFCheckTerm> terms;

    public SDFTimingCheck(SDFTimingCheckType type, List<SDFCheckTerm> terms) {
        this.type = Objects.requireNonNull(type);
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public SDFTimingCheckType getType() {
        return type;
    }

    public List<SDFCheckTerm> getTerms() {
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFTimingCheck other = (SDFTimingCheck) o;
        return type == other.type && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, terms);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(").append(type);
        for (SDFCheckTerm t : terms) {
            sb.append(' ').append(t);
        }
        return sb.append(')').toString();
    }
}
