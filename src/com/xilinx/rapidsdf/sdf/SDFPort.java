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
 * A cell port name with an optional bus suffix, e.g. {@code Q[9]}.
 */
public final class SDFPort {

    private final String name;

    private final SDFBus bus;

    public SDFPort(String name, SDFBus bus) {
        this.name = Objects.requireNonNull(name);
        this.bus = bus;
    }

    public SDFPort(String name) {
        this(name, null);
    }

    public String getName() {
        return name;
    }

    /**
     * @return The bus suffix, or null if there is none
     */
    public SDFBus getBus() {
        return bus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFPort other = (SDFPort) o;
        return name.equals(other.name) && Objects.equals(bus, other.bus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, bus);
    }

    @Override
    public String toString() {
        return bus == null ? name : name + bus;
    }
}
