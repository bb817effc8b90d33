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
 * Timing check kinds accepted inside a TIMINGCHECK block. SETUPHOLD is not
 * among them; the parser rejects it as an unsupported construct.
 */
public enum SDFTimingCheckType {
    SETUP,
    HOLD,
    RECOVERY,
    REMOVAL,
    WIDTH,
    RECREM,
    SKEW,
    PERIOD;

    /**
     * Looks up a check kind by its SDF keyword, ignoring case.
     * @param s Keyword as read from the file
     * @return The matching kind, or null if s is not a supported check keyword
     */
    public static SDFTimingCheckType getEnum(String s) {
        for (SDFTimingCheckType t : values()) {
            if (t.name().equalsIgnoreCase(s)) {
                return t;
            }
        }
        return null;
    }
}
