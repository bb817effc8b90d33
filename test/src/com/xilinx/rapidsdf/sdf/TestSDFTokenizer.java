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

import com.xilinx.rapidsdf.util.Params;
import com.xilinx.rapidsdf.util.StringPool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

public class TestSDFTokenizer {

    @Test
    public void testSkipsComments() {
        SDFTokenizer t = new SDFTokenizer("  // line comment\n /* block\n comment */\t(");
        Assertions.assertEquals('(', t.peek());
        Assertions.assertTrue(t.tryConsume('('));
        Assertions.assertTrue(t.isEOF());
    }

    @Test
    public void testUnterminatedComment() {
        SDFTokenizer t = new SDFTokenizer("( /* never closed");
        t.expect('(');
        SDFParseException e = Assertions.assertThrows(SDFParseException.class, t::peek);
        Assertions.assertEquals(SDFErrorKind.UNTERMINATED_COMMENT, e.getKind());
        Assertions.assertEquals(2, e.getOffset());
    }

    @ParameterizedTest
    @CsvSource({
            "1.5, 1.5",
            "-2, -2.0",
            "1.0e-3, 0.001",
            "2E+2, 200.0",
            "3., 3.0",
            "0.000, 0.0"
    })
    public void testReadReal(String text, double expected) {
        Assertions.assertEquals(expected, new SDFTokenizer(text).readReal());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1e3", "1.0E", "-x", "2.5e+", "1e+999", "-1.5e+400"})
    public void testInvalidNumber(String text) {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> new SDFTokenizer(text).readReal());
        Assertions.assertEquals(SDFErrorKind.INVALID_NUMBER, e.getKind());
        Assertions.assertEquals(SDFErrorKind.Category.LEX, e.getKind().getCategory());
    }

    @Test
    public void testReadOptionalReal() {
        SDFTokenizer t = new SDFTokenizer(":5");
        Assertions.assertNull(t.readOptionalReal());
        Assertions.assertTrue(t.tryConsume(':'));
        Assertions.assertEquals(5.0, t.readOptionalReal());
    }

    @Test
    public void testQuotedString() {
        SDFTokenizer t = new SDFTokenizer(" \"Wed Oct 13 \\\"19:52\\\"\" ");
        Assertions.assertEquals("Wed Oct 13 \"19:52\"", t.readQuotedString());
        Assertions.assertTrue(t.isEOF());
    }

    @Test
    public void testUnterminatedString() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> new SDFTokenizer("\"3.0)").readQuotedString());
        Assertions.assertEquals(SDFErrorKind.UNTERMINATED_STRING, e.getKind());
    }

    @Test
    public void testEscapedIdentifier() {
        SDFTokenizer t = new SDFTokenizer("data\\[3\\]_reg\\/Q ");
        Assertions.assertEquals("data[3]_reg/Q", t.readIdentifier());
    }

    @Test
    public void testIdentifiersArePooled() {
        StringPool pool = StringPool.singleThreadedPool();
        SDFTokenizer t = new SDFTokenizer("clk_buf clk_buf", pool);
        String first = t.readIdentifier();
        String second = t.readIdentifier();
        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, pool.size());
    }

    @ParameterizedTest
    @CsvSource(quoteCharacter = '"', value = {
            "1'b0, false",
            "1'b1, true",
            "1'B1, true",
            "'b0, false",
            "'b1, true",
            "0, false",
            "1, true"
    })
    public void testScalarConstant(String text, boolean expected) {
        Assertions.assertEquals(expected, new SDFTokenizer(text).readScalarConstant());
    }

    @Test
    public void testInvalidScalarConstant() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> new SDFTokenizer("2'b10").readScalarConstant());
        Assertions.assertEquals(SDFErrorKind.UNEXPECTED_TOKEN, e.getKind());
    }

    @Test
    public void testErrorPosition() {
        SDFTokenizer t = new SDFTokenizer("\n\n   x");
        SDFParseException e = Assertions.assertThrows(SDFParseException.class, () -> t.expect('('));
        Assertions.assertEquals(SDFErrorKind.UNEXPECTED_TOKEN, e.getKind());
        Assertions.assertEquals(5, e.getOffset());
        Assertions.assertEquals(3, e.getLine());
        Assertions.assertEquals(4, e.getColumn());
        Assertions.assertTrue(e.getMessage().startsWith("Parsing Error: Expected '(', encountered: x"));
    }

    @Test
    public void testUnexpectedEOF() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> new SDFTokenizer("  // only a comment").expect('('));
        Assertions.assertEquals(SDFErrorKind.UNEXPECTED_EOF, e.getKind());
    }

    @Test
    public void testErrorContextLength() {
        int saved = Params.RSDF_ERROR_CONTEXT_LENGTH;
        try {
            Params.RSDF_ERROR_CONTEXT_LENGTH = 4;
            SDFTokenizer t = new SDFTokenizer("abcdefgh ijk");
            Assertions.assertEquals("abcd...", t.describe(0));
            Assertions.assertEquals("ijk", t.describe(9));
            Assertions.assertEquals("end of input", t.describe(12));
        } finally {
            Params.RSDF_ERROR_CONTEXT_LENGTH = saved;
        }
    }
}
