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
 * Units allowed in the TIMESCALE header entry.
 */
public enum SDFTimeUnit {
    US(1e-6),
    NS(1e-9),
    PS(1e-12);

    private final double seconds;

    SDFTimeUnit(double seconds) {
        this.seconds = seconds;
    }

    /**
     * @return Length of one unit in seconds
     */
    public double getSeconds() {
        return seconds;
    }

    public static SDFTimeUnit getEnum(String s) {
        for (SDFTimeUnit u : values()) {
            if (u.name().equalsIgnoreCase(s)) {
                return u;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
