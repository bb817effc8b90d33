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
 * A port optionally qualified with an edge, e.g. {@code (posedge CLK)}.
 */
public final class SDFPortSpec {

    private final SDFPortEdge edge;

    private final SDFPort port;

    public SDFPortSpec(SDFPortEdge edge, SDFPort port) {
        this.edge = edge;
        this.port = Objects.requireNonNull(port);
    }

    public SDFPortSpec(SDFPort port) {
        this(null, port);
    }

    /**
     * @return The edge qualifier, or null for a plain port
     */
    public SDFPortEdge getEdge() {
        return edge;
    }

    public SDFPort getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFPortSpec other = (SDFPortSpec) o;
        return edge == other.edge && port.equals(other.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(edge, port);
    }

    @Override
    public String toString() {
        return edge == null ? port.toString() : "(" + edge + " " + port + ")";
    }
}
