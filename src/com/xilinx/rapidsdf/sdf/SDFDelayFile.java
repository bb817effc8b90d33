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
 * Root of a parsed SDF document: its header followed by its cells in file
 * order. Instances are immutable and may be shared between threads.
 */
public final class SDFDelayFile {

    private final SDFHeader header;

    private final List<SDFCell> cells;

    public SDFDelayFile(SDFHeader header, List<SDFCell> cells) {
        this.header = Objects.requireNonNull(header);
        this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public SDFHeader getHeader() {
        return header;
    }

    public List<SDFCell> getCells() {
        return cells;
    }

    public char getDivider() {
        return header.getDivider();
    }

    /**
     * @param cellType Cell type name as written in CELLTYPE
     * @return All cells of that type, in file order
     */
    public List<SDFCell> getCellsByType(String cellType) {
        List<SDFCell> matches = new ArrayList<>();
        for (SDFCell cell : cells) {
            if (cell.getCellType().equals(cellType)) {
                matches.add(cell);
            }
        }
        return matches;
    }

    /**
     * @param instanceName Full instance path joined with this file's divider
     * and escaped as {@link SDFPath#toString()} renders it, e.g. "top/u1" or "top\/u1"
     * @return The first cell annotating that instance, or null if there is none
     */
    public SDFCell getCellByInstance(String instanceName) {
        for (SDFCell cell : cells) {
            SDFPath inst = cell.getInstance();
            if (inst != null && inst.toString().equals(instanceName)) {
                return cell;
            }
        }
        return null;
    }

    /**
     * @return The first cell whose instance path equals the given one, or null
     */
    public SDFCell getCellByInstance(SDFPath instance) {
        for (SDFCell cell : cells) {
            if (instance.equals(cell.getInstance())) {
                return cell;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFDelayFile other = (SDFDelayFile) o;
        return header.equals(other.header) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, cells);
    }

    @Override
    public String toString() {
        return "SDFDelayFile{design=" + header.getDesignName() + ", cells=" + cells.size() + "}";
    }
}
