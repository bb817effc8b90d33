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
 * Entries of the DELAYFILE header in the only order they may appear.
 */
public enum SDFHeaderField {
    SDFVERSION,
    DESIGN,
    DATE,
    VENDOR,
    PROGRAM,
    VERSION,
    DIVIDER,
    VOLTAGE,
    PROCESS,
    TEMPERATURE,
    TIMESCALE;

    public static SDFHeaderField getEnum(String keyword) {
        for (SDFHeaderField f : values()) {
            if (f.name().equalsIgnoreCase(keyword)) {
                return f;
            }
        }
        return null;
    }
}
