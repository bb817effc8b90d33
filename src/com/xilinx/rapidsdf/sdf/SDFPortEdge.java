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

/**
 * Edge qualifiers that can be put on an input port of an IOPATH or a timing
 * check.
 */
public enum SDFPortEdge {
    POSEDGE("posedge"),
    NEGEDGE("negedge"),
    T01("01"),
    T10("10"),
    T0Z("0z"),
    TZ1("z1"),
    T1Z("1z"),
    TZ0("z0");

    private final String sdfName;

    SDFPortEdge(String sdfName) {
        this.sdfName = sdfName;
    }

    /**
     * @return The spelling used in SDF files
     */
    public String getSDFName() {
        return sdfName;
    }

    /**
     * Looks up an edge by its SDF spelling, ignoring case.
     * @param s Text such as "posedge" or "0Z"
     * @return The matching edge, or null if s is not an edge keyword
     */
    public static SDFPortEdge getEnum(String s) {
        for (SDFPortEdge e : values()) {
            if (e.sdfName.equalsIgnoreCase(s)) {
                return e;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return sdfName;
    }
}
