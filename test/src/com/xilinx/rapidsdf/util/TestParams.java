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

package com.xilinx.rapidsdf.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestParams {

    @ParameterizedTest
    @CsvSource({
            "1, true",
            "true, true",
            "yes, true",
            "0, false",
            "false, false",
            "FALSE, false",
            "'', false"
    })
    public void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    public void testIsSetNull() {
        Assertions.assertFalse(Params.isSet(null));
    }

    @Test
    public void testJVMPropertyIntValue() {
        String key = "RSDF_TEST_INT_PARAM";
        try {
            Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(key, 7));
            System.setProperty(key, " 42 ");
            Assertions.assertEquals(42, Params.getParamIntValue(key));
            Assertions.assertTrue(Params.isParamSet(key));
            System.setProperty(key, "many");
            Assertions.assertNull(Params.getParamIntValue(key));
            Assertions.assertEquals(7, Params.getParamOrDefaultIntSetting(key, 7));
        } finally {
            System.clearProperty(key);
        }
        Assertions.assertNull(Params.getParamValue(key));
    }
}
