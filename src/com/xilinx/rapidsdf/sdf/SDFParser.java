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
import java.util.List;

import com.xilinx.rapidsdf.tests.CodePerfTracker;
import com.xilinx.rapidsdf.util.MessageGenerator;
import com.xilinx.rapidsdf.util.StringPool;

/**
 * Recursive descent parser for Standard Delay Format (SDF) files. The whole
 * document is held in memory; parsing either produces a complete
 * {@link SDFDelayFile} or stops at the first problem with an
 * {@link SDFParseException}.
 *
 * A parser instance reads exactly one document and is not thread safe. To
 * parse several files concurrently use one parser per file, see
 * {@link SDFTools#parseSDFFiles(java.util.List)}.
 */
public class SDFParser extends AbstractSDFParserWorker {

    public SDFParser(String text) {
        this(text, StringPool.defaultParserPool());
    }

    public SDFParser(String text, StringPool uniquifier) {
        super(text, uniquifier);
    }

    public SDFDelayFile parseSDF() {
        expect(LEFT_PAREN);
        expectKeyword(DELAYFILE);
        SDFHeader header = parseHeader();
        char divider = header.getDivider();

        List<SDFCell> cells = new ArrayList<>();
        while (tokenizer.tryConsume(LEFT_PAREN)) {
            expectKeyword(CELL);
            cells.add(parseCell(divider));
        }
        expect(RIGHT_PAREN);

        if (!tokenizer.isEOF()) {
            int at = tokenizer.tokenStart();
            throw tokenizer.error(SDFErrorKind.TRAILING_INPUT, "Parsing Error: Expected end of input, encountered: "
                    + tokenizer.describe(at), at);
        }
        return new SDFDelayFile(header, cells);
    }

    private SDFHeader parseHeader() {
        int start = tokenizer.tokenStart();
        String sdfVersion = null;
        if (tryOpen(SDFHeaderField.SDFVERSION.name())) {
            sdfVersion = readQuotedFieldValue();
        }
        String designName = tryOpen(SDFHeaderField.DESIGN.name()) ? readQuotedFieldValue() : null;
        String date = tryOpen(SDFHeaderField.DATE.name()) ? readQuotedFieldValue() : null;
        String vendor = tryOpen(SDFHeaderField.VENDOR.name()) ? readQuotedFieldValue() : null;
        String program = tryOpen(SDFHeaderField.PROGRAM.name()) ? readQuotedFieldValue() : null;
        String programVersion = tryOpen(SDFHeaderField.VERSION.name()) ? readQuotedFieldValue() : null;
        Character divider = null;
        if (tryOpen(SDFHeaderField.DIVIDER.name())) {
            divider = parseDividerChar();
            expect(RIGHT_PAREN);
        }
        SDFValue voltage = null;
        if (tryOpen(SDFHeaderField.VOLTAGE.name())) {
            voltage = parseValue();
            expect(RIGHT_PAREN);
        }
        String process = tryOpen(SDFHeaderField.PROCESS.name()) ? readQuotedFieldValue() : null;
        SDFValue temperature = null;
        if (tryOpen(SDFHeaderField.TEMPERATURE.name())) {
            temperature = parseValue();
            expect(RIGHT_PAREN);
        }
        SDFTimescale timescale = null;
        if (tryOpen(SDFHeaderField.TIMESCALE.name())) {
            timescale = parseTimescale();
            expect(RIGHT_PAREN);
        }

        // Any header entry still ahead was skipped over by the fixed sequence above
        int at = tokenizer.tokenStart();
        SDFHeaderField misplaced = SDFHeaderField.getEnum(peekKeyword());
        if (misplaced != null) {
            throw tokenizer.error(SDFErrorKind.HEADER_OUT_OF_ORDER, "Header entry " + misplaced
                    + " is out of order, entries must follow the order SDFVERSION, DESIGN, DATE, VENDOR,"
                    + " PROGRAM, VERSION, DIVIDER, VOLTAGE, PROCESS, TEMPERATURE, TIMESCALE", at);
        }
        if (sdfVersion == null) {
            throw tokenizer.error(SDFErrorKind.MISSING_VERSION, "Header is missing the mandatory SDFVERSION entry",
                    start);
        }
        if (divider == null) {
            throw tokenizer.error(SDFErrorKind.MISSING_DIVIDER, "Header is missing the mandatory DIVIDER entry",
                    start);
        }
        return new SDFHeader(sdfVersion, designName, date, vendor, program, programVersion, divider,
                voltage, process, temperature, timescale);
    }

    private String readQuotedFieldValue() {
        String value = tokenizer.readQuotedString();
        expect(RIGHT_PAREN);
        return value;
    }

    private char parseDividerChar() {
        int at = tokenizer.tokenStart();
        int c = tokenizer.peek();
        if (c == '.' || c == '/') {
            tokenizer.expect((char) c);
            return (char) c;
        }
        if (c == SDFTokenizer.EOF) {
            throw tokenizer.unexpected("divider '.' or '/'");
        }
        throw tokenizer.error(SDFErrorKind.INVALID_DIVIDER, "Invalid hierarchy divider '" + (char) c
                + "', expected '.' or '/'", at);
    }

    private SDFTimescale parseTimescale() {
        double magnitude = tokenizer.readReal();
        int at = tokenizer.tokenStart();
        String unitName = SDFTokenizer.isKeywordChar(tokenizer.peek()) ? tokenizer.readKeyword() : "";
        SDFTimeUnit unit = SDFTimeUnit.getEnum(unitName);
        if (unit == null) {
            throw tokenizer.error(SDFErrorKind.INVALID_TIMESCALE_UNIT, "Invalid timescale unit '" + unitName
                    + "', expected us, ns or ps", at);
        }
        return new SDFTimescale(magnitude, unit);
    }

    private SDFCell parseCell(char divider) {
        expect(LEFT_PAREN);
        expectKeyword(CELLTYPE);
        String cellType = tokenizer.getUniquifier().uniquifyName(tokenizer.readQuotedString());
        expect(RIGHT_PAREN);

        expect(LEFT_PAREN);
        expectKeyword(INSTANCE);
        SDFPath instance = null;
        if (!tokenizer.tryConsume(WILDCARD) && tokenizer.peek() != RIGHT_PAREN) {
            instance = parsePath(divider);
        }
        expect(RIGHT_PAREN);

        List<SDFTimingSpec> timingSpecs = new ArrayList<>();
        while (tokenizer.peek() == LEFT_PAREN) {
            int at = tokenizer.tokenStart();
            String keyword = peekKeyword();
            if (DELAY.equalsIgnoreCase(keyword)) {
                tryOpen(DELAY);
                timingSpecs.add(parseDelaySpec(divider));
            } else if (TIMINGCHECK.equalsIgnoreCase(keyword)) {
                tryOpen(TIMINGCHECK);
                timingSpecs.add(parseTimingCheckSpec());
            } else if (TIMINGENV.equalsIgnoreCase(keyword)) {
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_TIMINGENV, TIMINGENV, at);
            } else {
                tokenizer.expect(LEFT_PAREN);
                throw tokenizer.unexpected(DELAY + " | " + TIMINGCHECK);
            }
        }
        expect(RIGHT_PAREN);
        return new SDFCell(cellType, instance, timingSpecs);
    }

    private SDFDelaySpec parseDelaySpec(char divider) {
        List<SDFDelayDef> delayDefs = new ArrayList<>();
        while (tokenizer.peek() == LEFT_PAREN) {
            int at = tokenizer.tokenStart();
            String keyword = peekKeyword();
            if (ABSOLUTE.equalsIgnoreCase(keyword)) {
                tryOpen(ABSOLUTE);
                while (tokenizer.peek() == LEFT_PAREN) {
                    delayDefs.add(parseDelayDef(divider));
                }
                expect(RIGHT_PAREN);
            } else if (INCREMENT.equalsIgnoreCase(keyword) || PATHPULSE.equalsIgnoreCase(keyword)
                    || PATHPULSEPERCENT.equalsIgnoreCase(keyword)) {
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_DELAY, keyword.toUpperCase(), at);
            } else {
                tokenizer.expect(LEFT_PAREN);
                throw tokenizer.unexpected(ABSOLUTE);
            }
        }
        expect(RIGHT_PAREN);
        return new SDFDelaySpec(delayDefs);
    }

    private SDFDelayDef parseDelayDef(char divider) {
        int at = tokenizer.tokenStart();
        String keyword = peekKeyword();
        if (INTERCONNECT.equalsIgnoreCase(keyword)) {
            tryOpen(INTERCONNECT);
            SDFPath from = parsePath(divider);
            SDFPath to = parsePath(divider);
            List<SDFValue> values = parseValueList();
            expect(RIGHT_PAREN);
            return new SDFInterconnect(from, to, values);
        } else if (IOPATH.equalsIgnoreCase(keyword)) {
            tryOpen(IOPATH);
            return parseIOPathBody();
        } else if (COND.equalsIgnoreCase(keyword)) {
            tryOpen(COND);
            String label = tokenizer.peek() == '"' ? tokenizer.readQuotedString() : null;
            SDFCondition condition = parseCondition();
            SDFIOPath ioPath = parseNestedIOPath();
            expect(RIGHT_PAREN);
            return new SDFCondIOPath(label, condition, ioPath);
        } else if (CONDELSE.equalsIgnoreCase(keyword)) {
            tryOpen(CONDELSE);
            SDFIOPath ioPath = parseNestedIOPath();
            expect(RIGHT_PAREN);
            return new SDFCondElseIOPath(ioPath);
        } else if (PORT.equalsIgnoreCase(keyword) || DEVICE.equalsIgnoreCase(keyword)
                || PATHPULSE.equalsIgnoreCase(keyword) || PATHPULSEPERCENT.equalsIgnoreCase(keyword)) {
            throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_DELAY, keyword.toUpperCase(), at);
        }
        tokenizer.expect(LEFT_PAREN);
        throw tokenizer.unexpected(INTERCONNECT + " | " + IOPATH + " | " + COND + " | " + CONDELSE);
    }

    private SDFIOPath parseNestedIOPath() {
        int at = tokenizer.tokenStart();
        String keyword = peekKeyword();
        if (!IOPATH.equalsIgnoreCase(keyword)) {
            if (PORT.equalsIgnoreCase(keyword) || DEVICE.equalsIgnoreCase(keyword)) {
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_DELAY, keyword.toUpperCase(), at);
            }
            if (tokenizer.peek() == LEFT_PAREN) {
                tokenizer.expect(LEFT_PAREN);
            }
            throw tokenizer.unexpected(IOPATH);
        }
        tryOpen(IOPATH);
        return parseIOPathBody();
    }

    /**
     * Parses what follows the IOPATH keyword up to and including the closing
     * parenthesis: input port spec, output port, optional RETAIN, values.
     */
    private SDFIOPath parseIOPathBody() {
        SDFPortSpec input = parsePortSpec();
        SDFPort output = parsePort();
        List<SDFValue> retain = null;
        if (tryOpen(RETAIN)) {
            retain = parseValueList();
            expect(RIGHT_PAREN);
        }
        List<SDFValue> values = parseValueList();
        expect(RIGHT_PAREN);
        return new SDFIOPath(input, output, retain, values);
    }

    private SDFTimingCheckSpec parseTimingCheckSpec() {
        List<SDFTimingCheck> checks = new ArrayList<>();
        while (tokenizer.tryConsume(LEFT_PAREN)) {
            int at = tokenizer.tokenStart();
            String keyword = tokenizer.readKeyword();
            if (SETUPHOLD.equalsIgnoreCase(keyword)) {
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_CHECK, SETUPHOLD, at);
            }
            SDFTimingCheckType type = SDFTimingCheckType.getEnum(keyword);
            if (type == null) {
                throw tokenizer.error(SDFErrorKind.UNKNOWN_CHECK_TYPE, "Unknown timing check " + keyword, at);
            }
            List<SDFCheckTerm> terms = new ArrayList<>();
            while (tokenizer.peek() != RIGHT_PAREN) {
                terms.add(parseCheckTerm());
            }
            expect(RIGHT_PAREN);
            checks.add(new SDFTimingCheck(type, terms));
        }
        expect(RIGHT_PAREN);
        return new SDFTimingCheckSpec(checks);
    }

    private SDFCheckTerm parseCheckTerm() {
        int c = tokenizer.peek();
        if (c != LEFT_PAREN) {
            if (!SDFTokenizer.isIdentifierStart(c)) {
                throw tokenizer.unexpected("port or value");
            }
            return SDFCheckTerm.port(new SDFPortSpec(parsePort()));
        }
        if (tryOpen(COND)) {
            String label = tokenizer.peek() == '"' ? tokenizer.readQuotedString() : null;
            SDFCondition condition = parseCondition();
            SDFPortSpec portSpec = parsePortSpec();
            expect(RIGHT_PAREN);
            return SDFCheckTerm.conditionalPort(label, condition, portSpec);
        }
        int mark = tokenizer.mark();
        tokenizer.expect(LEFT_PAREN);
        if (SDFTokenizer.isKeywordChar(tokenizer.peek())) {
            SDFPortEdge edge = SDFPortEdge.getEnum(tokenizer.readKeyword());
            if (edge != null && SDFTokenizer.isIdentifierStart(tokenizer.peek())) {
                tokenizer.reset(mark);
                return SDFCheckTerm.port(parsePortSpec());
            }
        }
        tokenizer.reset(mark);
        return SDFCheckTerm.value(parseParenthesizedValue());
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            MessageGenerator.briefErrorAndExit("USAGE: <input.sdf>");
        }
        CodePerfTracker t = new CodePerfTracker("Parse SDF", true);
        t.start("Read File");
        String text = SDFTools.readSDFFile(args[0]);
        t.stop().start("Parse");
        SDFDelayFile delayFile = new SDFParser(text).parseSDF();
        t.stop();
        t.printSummary();
        MessageGenerator.briefMessage("Parsed " + delayFile.getCells().size() + " cells from " + args[0]);
    }
}
