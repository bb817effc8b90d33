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
 * One argument of a timing check, kept as parsed: a port, a port guarded by
 * a condition, or a value.
 */
public final class SDFCheckTerm {

    public enum Kind {
        PORT,
        CONDITIONAL_PORT,
        VALUE
    }

    private final Kind kind;

    private final SDFPortSpec portSpec;

    private final SDFCondition condition;

    private final String label;

    private final SDFValue value;

    private SDFCheckTerm(Kind kind, SDFPortSpec portSpec, SDFCondition condition, String label, SDFValue value) {
        this.kind = kind;
        this.portSpec = portSpec;
        this.condition = condition;
        this.label = label;
        this.value = value;
    }

    public static SDFCheckTerm port(SDFPortSpec portSpec) {
        return new SDFCheckTerm(Kind.PORT, Objects.requireNonNull(portSpec), null, null, null);
    }

    public static SDFCheckTerm conditionalPort(String label, SDFCondition condition, SDFPortSpec portSpec) {
        return new SDFCheckTerm(Kind.CONDITIONAL_PORT, Objects.requireNonNull(portSpec),
                Objects.requireNonNull(condition), label, null);
    }

    public static SDFCheckTerm value(SDFValue value) {
        return new SDFCheckTerm(Kind.VALUE, null, null, null, Objects.requireNonNull(value));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return The port of a PORT or CONDITIONAL_PORT term, null for a VALUE
     */
    public SDFPortSpec getPortSpec() {
        return portSpec;
    }

    /**
     * @return The condition of a CONDITIONAL_PORT term, null otherwise
     */
    public SDFCondition getCondition() {
        return condition;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return The value of a VALUE term, null otherwise
     */
    public SDFValue getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFCheckTerm other = (SDFCheckTerm) o;
        return kind == other.kind && Objects.equals(portSpec, other.portSpec)
                && Objects.equals(condition, other.condition) && Objects.equals(label, other.label)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, portSpec, condition, label, value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case PORT:
                return portSpec.toString();
            case CONDITIONAL_PORT:
                return "(COND " + (label == null ? "" : "\"" + label + "\" ") + condition + " " + portSpec + ")";
            default:
                return value.toString();
        }
    }
}
