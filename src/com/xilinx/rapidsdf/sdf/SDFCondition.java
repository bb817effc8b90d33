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
import java.util.stream.Collectors;

/**
 * A conjunction of port literals guarding a conditional delay or timing
 * check, e.g. {@code (A == 1'b0 && B == 1'b1)}. Literal order is kept as
 * written.
 */
public final class SDFCondition {

    private final List<SDFConditionLiteral> literals;

    public SDFCondition(List<SDFConditionLiteral> literals) {
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("A condition needs at least one literal");
        }
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
    }

    public List<SDFConditionLiteral> getLiterals() {
        return literals;
    }

    /**
     * Looks up the value the condition requires on a port, matching by name
     * only. For bus bits such as {@code SEL[1]} this returns the first literal
     * on any bit of {@code SEL}; use {@link #getRequiredValue(SDFPort)} to pick one.
     * @param portName Name of the port
     * @return TRUE or FALSE if the port appears in the condition, null otherwise
     */
    public Boolean getRequiredValue(String portName) {
        for (SDFConditionLiteral literal : literals) {
            if (literal.getPort().getName().equals(portName)) {
                return literal.isPositive();
            }
        }
        return null;
    }

    /**
     * @param port Port including its bus suffix, if any
     * @return TRUE or FALSE if exactly that port appears in the condition, null otherwise
     */
    public Boolean getRequiredValue(SDFPort port) {
        for (SDFConditionLiteral literal : literals) {
            if (literal.getPort().equals(port)) {
                return literal.isPositive();
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return literals.equals(((SDFCondition) o).literals);
    }

    @Override
    public int hashCode() {
        return literals.hashCode();
    }

    @Override
    public String toString() {
        return literals.stream().map(Object::toString).collect(Collectors.joining(" && ", "(", ")"));
    }
}
