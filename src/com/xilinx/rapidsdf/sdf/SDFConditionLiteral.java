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
 * One term of a condition: a port that must be 1 (positive) or 0 (negated).
 */
public final class SDFConditionLiteral {

    private final SDFPort port;

    private final boolean positive;

    public SDFConditionLiteral(SDFPort port, boolean positive) {
        this.port = Objects.requireNonNull(port);
        this.positive = positive;
    }

    public SDFPort getPort() {
        return port;
    }

    /**
     * @return True for {@code A} or {@code A == 1'b1}, false for {@code !A},
     * {@code ~A} or {@code A == 1'b0}
     */
    public boolean isPositive() {
        return positive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFConditionLiteral other = (SDFConditionLiteral) o;
        return positive == other.positive && port.equals(other.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(port, positive);
    }

    @Override
    public String toString() {
        return positive ? port.toString() : "!" + port;
    }
}
