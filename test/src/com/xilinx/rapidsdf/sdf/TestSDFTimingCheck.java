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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

public class TestSDFTimingCheck {

    private static List<SDFTimingCheck> parseChecks(String checks) {
        String text = SDFTestFiles.makeCell('/', "ff", "(TIMINGCHECK " + checks + ")");
        return SDFTools.parseSDF(text).getCells().get(0).getTimingChecks();
    }

    @ParameterizedTest
    @EnumSource(SDFTimingCheckType.class)
    public void testCheckTypes(SDFTimingCheckType type) {
        List<SDFTimingCheck> checks = parseChecks("(" + type.name().toLowerCase() + " D (posedge CLK) (0.1))");
        Assertions.assertEquals(1, checks.size());
        Assertions.assertEquals(type, checks.get(0).getType());
        Assertions.assertEquals(3, checks.get(0).getTerms().size());
    }

    @Test
    public void testTerms() {
        SDFTimingCheck setup = parseChecks("(SETUP (negedge D[2]) (posedge CLK) (-0.05:0.01:0.07))").get(0);
        List<SDFCheckTerm> terms = setup.getTerms();

        Assertions.assertEquals(SDFCheckTerm.Kind.PORT, terms.get(0).getKind());
        Assertions.assertEquals(new SDFPortSpec(SDFPortEdge.NEGEDGE, new SDFPort("D", new SDFBus(2))),
                terms.get(0).getPortSpec());
        Assertions.assertEquals(SDFPortEdge.POSEDGE, terms.get(1).getPortSpec().getEdge());
        Assertions.assertEquals(SDFCheckTerm.Kind.VALUE, terms.get(2).getKind());
        Assertions.assertEquals(SDFValue.triple(-0.05, 0.01, 0.07), terms.get(2).getValue());
        Assertions.assertNull(terms.get(2).getPortSpec());
    }

    @Test
    public void testNumericEdgeVersusValue() {
        List<SDFCheckTerm> terms = parseChecks("(WIDTH (10 CLK) (10))").get(0).getTerms();
        Assertions.assertEquals(SDFPortEdge.T10, terms.get(0).getPortSpec().getEdge());
        Assertions.assertEquals(SDFValue.single(10.0), terms.get(1).getValue());
    }

    @Test
    public void testConditionalPort() {
        List<SDFCheckTerm> terms = parseChecks(
                "(HOLD (COND \"en\" EN==1'b1 (posedge D)) (COND (RST && !SCAN) CLK) (0.02))").get(0).getTerms();
        SDFCheckTerm first = terms.get(0);
        Assertions.assertEquals(SDFCheckTerm.Kind.CONDITIONAL_PORT, first.getKind());
        Assertions.assertEquals("en", first.getLabel());
        Assertions.assertEquals(Boolean.TRUE, first.getCondition().getRequiredValue("EN"));
        Assertions.assertEquals(SDFPortEdge.POSEDGE, first.getPortSpec().getEdge());

        SDFCheckTerm second = terms.get(1);
        Assertions.assertNull(second.getLabel());
        Assertions.assertEquals(2, second.getCondition().getLiterals().size());
        Assertions.assertEquals(new SDFPortSpec(new SDFPort("CLK")), second.getPortSpec());
    }

    @Test
    public void testMixedTimingSpecs() {
        String text = SDFTestFiles.makeCell('/', "ff",
                "(DELAY (ABSOLUTE (IOPATH (posedge CLK) Q (0.3))))\n"
                + "(TIMINGCHECK (SETUP D (posedge CLK) (0.1)) (HOLD D (posedge CLK) (0.05)))");
        SDFCell cell = SDFTools.parseSDF(text).getCells().get(0);
        Assertions.assertEquals(SDFTimingSpec.Type.TIMINGCHECK, cell.getTimingSpecs().get(1).getType());
        Assertions.assertEquals(1, cell.getDelayDefs().size());
        Assertions.assertEquals(2, cell.getTimingChecks().size());
    }

    @Test
    public void testSetupHoldUnsupported() {
        SDFUnsupportedConstructException e = Assertions.assertThrows(SDFUnsupportedConstructException.class,
                () -> parseChecks("(SETUPHOLD D (posedge CLK) (0.1) (0.05))"));
        Assertions.assertEquals(SDFErrorKind.UNSUPPORTED_CHECK, e.getKind());
        Assertions.assertEquals("SETUPHOLD", e.getConstruct());
    }

    @Test
    public void testUnknownCheck() {
        SDFParseException e = Assertions.assertThrows(SDFParseException.class,
                () -> parseChecks("(NOCHANGE D (posedge CLK) (0.1) (0.05))"));
        Assertions.assertEquals(SDFErrorKind.UNKNOWN_CHECK_TYPE, e.getKind());
        Assertions.assertFalse(e.getKind().isUnsupportedConstruct());
    }

    @Test
    public void testTimingEnvUnsupported() {
        String text = SDFTestFiles.makeCell('/', "ff", "(TIMINGENV (PATHCONSTRAINT A Y (1)))");
        SDFUnsupportedConstructException e = Assertions.assertThrows(SDFUnsupportedConstructException.class,
                () -> SDFTools.parseSDF(text));
        Assertions.assertEquals(SDFErrorKind.UNSUPPORTED_TIMINGENV, e.getKind());
        Assertions.assertEquals(SDFErrorKind.Category.PARSE, e.getKind().getCategory());
    }
}
