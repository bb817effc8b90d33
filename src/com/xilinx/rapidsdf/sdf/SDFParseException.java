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
 * Thrown when an SDF document cannot be parsed. Parsing stops at the first
 * error; the exception records where in the input it was found.
 */
public class SDFParseException extends RuntimeException {

    private static final long serialVersionUID = 4839250158302211977L;

    private final SDFErrorKind kind;

    private final int offset;

    private final int line;

    private final int column;

    public SDFParseException(SDFErrorKind kind, String message, int offset, int line, int column) {
        super(message + " at line " + line + ", column " + column + " (offset " + offset + ").");
        this.kind = kind;
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public SDFErrorKind getKind() {
        return kind;
    }

    /**
     * @return Character offset into the input where the error was detected
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return 1-based line number
     */
    public int getLine() {
        return line;
    }

    /**
     * @return 1-based column number
     */
    public int getColumn() {
        return column;
    }
}
