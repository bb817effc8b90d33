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
 * An IOPATH that only applies while its condition holds.
 */
public final class SDFCondIOPath extends SDFDelayDef {

    private final String label;

    private final SDFCondition condition;

    private final SDFIOPath ioPath;

    public SDFCondIOPath(String label, SDFCondition condition, SDFIOPath ioPath) {
        this.label = label;
        this.condition = Objects.requireNonNull(condition);
        this.ioPath = Objects.requireNonNull(ioPath);
    }

    public SDFCondIOPath(SDFCondition condition, SDFIOPath ioPath) {
        this(null, condition, ioPath);
    }

    @Override
    public Type getType() {
        return Type.COND_IOPATH;
    }

    /**
     * @return The optional quoted name written after COND, or null
     */
    public String getLabel() {
        return label;
    }

    public SDFCondition getCondition() {
        return condition;
    }

    @Override
    public SDFIOPath getIOPath() {
        return ioPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFCondIOPath other = (SDFCondIOPath) o;
        return Objects.equals(label, other.label) && condition.equals(other.condition) && ioPath.equals(other.ioPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, condition, ioPath);
    }

    @Override
    public String toString() {
        String l = label == null ? "" : " \"" + label + "\"";
        return "(COND" + l + " " + condition + " " + ioPath + ")";
    }
}
