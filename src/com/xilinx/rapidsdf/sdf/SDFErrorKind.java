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
 * Every reason an SDF parse can fail, grouped by the part of the grammar that
 * detects it.
 */
public enum SDFErrorKind {
    UNTERMINATED_STRING(Category.LEX),
    UNTERMINATED_COMMENT(Category.LEX),
    INVALID_NUMBER(Category.LEX),

    MISSING_VERSION(Category.HEADER),
    MISSING_DIVIDER(Category.HEADER),
    HEADER_OUT_OF_ORDER(Category.HEADER),
    INVALID_DIVIDER(Category.HEADER),
    INVALID_TIMESCALE_UNIT(Category.HEADER),

    VALUE_LIST_BOUNDS(Category.DELAY),
    /** INCREMENT, PATHPULSE, PATHPULSEPERCENT, PORT and DEVICE delays */
    UNSUPPORTED_DELAY(Category.DELAY, true),

    UNSUPPORTED_EXPR(Category.COND, true),

    /** SETUPHOLD */
    UNSUPPORTED_CHECK(Category.CHECK, true),
    UNKNOWN_CHECK_TYPE(Category.CHECK),

    UNEXPECTED_TOKEN(Category.PARSE),
    UNEXPECTED_EOF(Category.PARSE),
    DIVIDER_MISMATCH(Category.PARSE),
    TRAILING_INPUT(Category.PARSE),
    UNSUPPORTED_TIMINGENV(Category.PARSE, true),
    /** Hierarchical wildcards inside an instance path, e.g. {@code top/*} */
    UNSUPPORTED_WILDCARD(Category.PARSE, true);

    /**
     * The grammar component that reports an error.
     */
    public enum Category {
        /** Malformed literal */
        LEX,
        /** Missing or misordered header fields */
        HEADER,
        /** Delay value lists and delay shapes */
        DELAY,
        /** Delay or timing check conditions */
        COND,
        /** Timing check kinds */
        CHECK,
        /** Structural mismatch anywhere else */
        PARSE
    }

    private final Category category;

    private final boolean unsupportedConstruct;

    SDFErrorKind(Category category) {
        this(category, false);
    }

    SDFErrorKind(Category category, boolean unsupportedConstruct) {
        this.category = category;
        this.unsupportedConstruct = unsupportedConstruct;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * @return True if this kind marks valid SDF that this parser deliberately
     * does not handle, false if it marks malformed SDF.
     */
    public boolean isUnsupportedConstruct() {
        return unsupportedConstruct;
    }
}
