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
import java.util.Objects;

/**
 * A hierarchical instance or pin path such as {@code top/u1/A[3]}. The
 * segments are stored without the divider; the divider the document declared
 * in its header is kept alongside so the path can be rendered again.
 */
public final class SDFPath {

    private final List<String> segments;

    private final SDFBus bus;

    private final char divider;

    public SDFPath(List<String> segments, SDFBus bus, char divider) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least one segment");
        }
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        this.bus = bus;
        this.divider = divider;
    }

    public List<String> getSegments() {
        return segments;
    }

    /**
     * @return The trailing bus suffix, or null if there is none
     */
    public SDFBus getBus() {
        return bus;
    }

    public char getDivider() {
        return divider;
    }

    /**
     * @return The last segment, the pin name when this path denotes a pin
     */
    public String getLeafName() {
        return segments.get(segments.size() - 1);
    }

    /**
     * @return All segments but the last, the instance hierarchy of a pin path
     */
    public List<String> getHierarchy() {
        return segments.subList(0, segments.size() - 1);
    }

    /**
     * Gets the segments joined with the divider, without the bus suffix.
     * Characters other than letters, digits and underscores are escaped with a
     * backslash, as they would be written in an SDF file, so {@code top\/a}
     * (one segment) and {@code top/a} (two segments) render differently.
     * @return The joined name
     */
    public String getName() {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (sb.length() > 0) {
                sb.append(divider);
            }
            appendEscaped(sb, segment);
        }
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, String segment) {
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (!SDFTokenizer.isKeywordChar(c)) {
                sb.append('\\');
            }
            sb.append(c);
        }
    }

    /**
     * Expands the bus suffix into one name per bit, lowest index first. A path
     * without a bus yields its own name.
     * @return Names such as {@code u1/A[0]}, {@code u1/A[1]}
     */
    public List<String> getBitNames() {
        List<String> names = new ArrayList<>();
        String name = getName();
        if (bus == null) {
            names.add(name);
            return names;
        }
        for (int i : bus.getIndices()) {
            names.add(name + "[" + i + "]");
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SDFPath other = (SDFPath) o;
        return divider == other.divider && segments.equals(other.segments) && Objects.equals(bus, other.bus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments, bus, divider);
    }

    @Override
    public String toString() {
        return bus == null ? getName() : getName() + bus;
    }
}
