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

import com.xilinx.rapidsdf.support.SDFTestFiles;
import com.xilinx.rapidsdf.util.StringPool;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

public class TestSDFParser {

    private static final String BUF = "(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER .) (CELL (CELLTYPE \"BUF\") "
            + "(INSTANCE top.u1) (DELAY (ABSOLUTE (IOPATH A Y (0.1:0.2:0.3))))))";

    @Test
    public void testSingleBuffer() {
        SDFDelayFile sdf = new SDFParser(BUF).parseSDF();
        Assertions.assertEquals("3.0", sdf.getHeader().getSDFVersion());
        Assertions.assertEquals('.', sdf.getDivider());
        Assertions.assertEquals(1, sdf.getCells().size());

        SDFCell cell = sdf.getCells().get(0);
        Assertions.assertEquals("BUF", cell.getCellType());
        Assertions.assertEquals(Arrays.asList("top", "u1"), cell.getInstance().getSegments());
        Assertions.assertNull(cell.getInstance().getBus());
        Assertions.assertEquals(1, cell.getTimingSpecs().size());
        Assertions.assertEquals(SDFTimingSpec.Type.DELAY, cell.getTimingSpecs().get(0).getType());

        SDFDelaySpec delay = (SDFDelaySpec) cell.getTimingSpecs().get(0);
        Assertions.assertEquals(1, delay.getDelayDefs().size());
        SDFDelayDef def = delay.getDelayDefs().get(0);
        Assertions.assertEquals(SDFDelayDef.Type.IOPATH, def.getType());
        SDFIOPath ioPath = (SDFIOPath) def;
        Assertions.assertEquals(new SDFPortSpec(new SDFPort("A")), ioPath.getInput());
        Assertions.assertNull(ioPath.getInput().getEdge());
        Assertions.assertEquals(new SDFPort("Y"), ioPath.getOutput());
        Assertions.assertNull(ioPath.getRetain());
        Assertions.assertEquals(Collections.singletonList(SDFValue.triple(0.1, 0.2, 0.3)), ioPath.getValues());
    }

    @Test
    public void testParseIsDeterministic() {
        SDFDelayFile first = new SDFParser(BUF).parseSDF();
        SDFDelayFile second = SDFTools.parseSDF(BUF);
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    public void testKeywordsIgnoreCase() {
        String lower = "(delayfile (sdfversion \"3.0\") (divider .) (cell (celltype \"BUF\") "
                + "(instance top.u1) (delay (absolute (iopath A Y (0.1:0.2:0.3))))))";
        Assertions.assertEquals(SDFTools.parseSDF(BUF), SDFTools.parseSDF(lower));
    }

    @Test
    public void testTrailingInput() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> SDFTools.parseSDF(BUF + "\n(CELL)"));
        Assertions.assertEquals(SDFErrorKind.TRAILING_INPUT, e.getKind());
        Assertions.assertEquals(SDFErrorKind.Category.PARSE, e.getKind().getCategory());
        Assertions.assertFalse(e.getKind().isUnsupportedConstruct());
        Assertions.assertEquals(2, e.getLine());
    }

    @Test
    public void testTrailingCommentsAllowed() {
        SDFDelayFile sdf = SDFTools.parseSDF(BUF + "\n// generated\n/* end */  \n");
        Assertions.assertEquals(1, sdf.getCells().size());
    }

    @Test
    public void testTruncatedInput() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> SDFTools.parseSDF(BUF.substring(0, BUF.length() - 2)));
        Assertions.assertEquals(SDFErrorKind.UNEXPECTED_EOF, e.getKind());
    }

    @Test
    public void testNoCells() {
        SDFDelayFile sdf = SDFTools.parseSDF("(DELAYFILE (SDFVERSION \"2.1\") (DIVIDER /))");
        Assertions.assertTrue(sdf.getCells().isEmpty());
        Assertions.assertEquals('/', sdf.getDivider());
    }

    @Test
    public void testFullHeader() {
        SDFDelayFile sdf = SDFTools.parseSDF("(DELAYFILE\n"
                + " (SDFVERSION \"3.0\")\n"
                + " (DESIGN \"top\")\n"
                + " (DATE \"Mon Jan 5 2026\")\n"
                + " (VENDOR \"AMD\")\n"
                + " (PROGRAM \"Vivado\")\n"
                + " (VERSION \"2026.1\")\n"
                + " (DIVIDER /)\n"
                + " (VOLTAGE 0.85)\n"
                + " (PROCESS \"typical\")\n"
                + " (TEMPERATURE 0:25:100)\n"
                + " (TIMESCALE 100 ps)\n"
                + ")");
        SDFHeader header = sdf.getHeader();
        Assertions.assertEquals("top", header.getDesignName());
        Assertions.assertEquals("Mon Jan 5 2026", header.getDate());
        Assertions.assertEquals("AMD", header.getVendor());
        Assertions.assertEquals("Vivado", header.getProgram());
        Assertions.assertEquals("2026.1", header.getProgramVersion());
        Assertions.assertEquals(SDFValue.single(0.85), header.getVoltage());
        Assertions.assertEquals("typical", header.getProcess());
        Assertions.assertEquals(SDFValue.triple(0.0, 25.0, 100.0), header.getTemperature());
        Assertions.assertEquals(new SDFTimescale(100, SDFTimeUnit.PS), header.getTimescale());
        Assertions.assertEquals(1e-10, header.getTimescaleInSeconds(), 1e-22);
    }

    @Test
    public void testDefaultTimescale() {
        SDFHeader header = SDFTools.parseSDF(BUF).getHeader();
        Assertions.assertNull(header.getTimescale());
        Assertions.assertNull(header.getDesignName());
        Assertions.assertEquals(SDFHeader.DEFAULT_TIMESCALE_SECONDS, header.getTimescaleInSeconds());
    }

    public static Stream<Arguments> testHeaderErrorArgs() {
        return Stream.of(
                Arguments.of("(DELAYFILE (DIVIDER .))", SDFErrorKind.MISSING_VERSION),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0\") (DESIGN \"top\"))", SDFErrorKind.MISSING_DIVIDER),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER .) (DESIGN \"top\"))",
                        SDFErrorKind.HEADER_OUT_OF_ORDER),
                Arguments.of("(DELAYFILE (DIVIDER .) (SDFVERSION \"3.0\"))", SDFErrorKind.HEADER_OUT_OF_ORDER),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER /) (TIMESCALE 1ns) (VOLTAGE 1.0))",
                        SDFErrorKind.HEADER_OUT_OF_ORDER),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER :))", SDFErrorKind.INVALID_DIVIDER),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER .) (TIMESCALE 1 fs))",
                        SDFErrorKind.INVALID_TIMESCALE_UNIT),
                Arguments.of("(DELAYFILE (SDFVERSION \"3.0) (DIVIDER .))", SDFErrorKind.UNTERMINATED_STRING),
                Arguments.of("(DELAYFILE (SDFVERSION 3.0) (DIVIDER .))", SDFErrorKind.UNEXPECTED_TOKEN),
                Arguments.of("(DELAYFIL (SDFVERSION \"3.0\") (DIVIDER .))", SDFErrorKind.UNEXPECTED_TOKEN)
        );
    }

    @ParameterizedTest
    @MethodSource("testHeaderErrorArgs")
    public void testHeaderError(String text, SDFErrorKind expected) {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class, () -> SDFTools.parseSDF(text));
        Assertions.assertEquals(expected, e.getKind());
    }

    @Test
    public void testDividerMismatch() {
        SDFParseException dot = Assertions.assertThrows(SDFParseException.class,
                () -> SDFTools.parseSDF(SDFTestFiles.makeCell('.', "top/u1", "")));
        Assertions.assertEquals(SDFErrorKind.DIVIDER_MISMATCH, dot.getKind());

        SDFParseException slash = Assertions.assertThrows(SDFParseException.class,
                () -> SDFTools.parseSDF(SDFTestFiles.makeAbsoluteDelay(
                        "(INTERCONNECT u1/Y top.u2/A (0.01))")));
        Assertions.assertEquals(SDFErrorKind.DIVIDER_MISMATCH, slash.getKind());
    }

    @Test
    public void testWildcardInstance() {
        for (String instance : Arrays.asList("", "*")) {
            SDFCell cell = SDFTools.parseSDF(SDFTestFiles.makeCell('.', instance, "")).getCells().get(0);
            Assertions.assertTrue(cell.isWildcard());
            Assertions.assertNull(cell.getInstance());
            Assertions.assertTrue(cell.getTimingSpecs().isEmpty());
        }
    }

    @Test
    public void testCellLookup() {
        String text = "(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER .)\n"
                + " (CELL (CELLTYPE \"BUF\") (INSTANCE top.u1) (DELAY (ABSOLUTE (IOPATH A Y (1)))))\n"
                + " (CELL (CELLTYPE \"BUF\") (INSTANCE top.u2) (DELAY (ABSOLUTE (IOPATH A Y (2)))))\n"
                + " (CELL (CELLTYPE \"INV\") (INSTANCE top.u3[0]) (DELAY (ABSOLUTE (IOPATH A Y (3)))))\n"
                + ")";
        SDFDelayFile sdf = SDFTools.parseSDF(text);
        Assertions.assertEquals(2, sdf.getCellsByType("BUF").size());
        Assertions.assertEquals(1, sdf.getCellsByType("INV").size());
        Assertions.assertTrue(sdf.getCellsByType("AND2").isEmpty());
        Assertions.assertEquals("INV", sdf.getCellByInstance("top.u3[0]").getCellType());
        Assertions.assertSame(sdf.getCells().get(1), sdf.getCellByInstance("top.u2"));
        Assertions.assertNull(sdf.getCellByInstance("top.u4"));
    }

    @Test
    public void testCellTypesArePooled() {
        String text = "(DELAYFILE (SDFVERSION \"3.0\") (DIVIDER .)\n"
                + " (CELL (CELLTYPE \"BUF\") (INSTANCE u1))\n"
                + " (CELL (CELLTYPE \"BUF\") (INSTANCE u2))\n"
                + ")";
        SDFDelayFile sdf = new SDFParser(text, StringPool.singleThreadedPool()).parseSDF();
        Assertions.assertSame(sdf.getCells().get(0).getCellType(), sdf.getCells().get(1).getCellType());
    }

    @Test
    public void testUnknownTimingSpec() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> SDFTools.parseSDF(SDFTestFiles.makeCell('.', "u1", "(LABEL (1))")));
        Assertions.assertEquals(SDFErrorKind.UNEXPECTED_TOKEN, e.getKind());
    }
}
