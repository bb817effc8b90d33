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
 * The default IOPATH used when none of the COND IOPATHs of the same arc hold.
 */
public final class SDFCondElseIOPath extends SDFDelayDef {

    private final SDFIOPath ioPath;

    public SDFCondElseIOPath(SDFIOPath ioPath) {
        this.ioPath = Objects.requireNonNull(ioPath);
    }

    @Override
    public Type getType() {
        return Type.CONDELSE_IOPATH;
    }

    @Override
    public SDFIOPath getIOPath() {
        return ioPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ioPath.equals(((SDFCondElseIOPath) o).ioPath);
    }

    @Override
    public int hashCode() {
        return ioPath.hashCode();
    }

    @Override
    public String toString() {
        return "(CONDELSE " + ioPath + ")";
    }
}
