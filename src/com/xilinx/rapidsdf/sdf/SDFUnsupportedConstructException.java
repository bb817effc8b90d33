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
 * Thrown for SDF that is well-formed but uses a construct RapidSDF does not
 * support: INCREMENT, PATHPULSE, PATHPULSEPERCENT, PORT and DEVICE delays,
 * TIMINGENV, SETUPHOLD, and condition operators other than conjunction.
 */
public class SDFUnsupportedConstructException extends SDFParseException {

    private static final long serialVersionUID = -2270183658710454390L;

    private final String construct;

    public SDFUnsupportedConstructException(SDFErrorKind kind, String construct, int offset, int line, int column) {
        super(kind, "Unsupported SDF construct: " + construct, offset, line, column);
        this.construct = construct;
    }

    /**
     * @return The keyword or operator that was rejected, as it appeared in the input
     */
    public String getConstruct() {
        return construct;
    }
}
