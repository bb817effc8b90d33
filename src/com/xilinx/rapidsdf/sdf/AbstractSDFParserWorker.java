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

import com.xilinx.rapidsdf.util.StringPool;

/**
 * Keyword constants and the productions shared by the whole SDF grammar:
 * values, value lists, buses, paths, ports and conditions.
 */
public abstract class AbstractSDFParserWorker {

    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';
    public static final String DELAYFILE = "DELAYFILE";
    public static final String CELL = "CELL";
    public static final String CELLTYPE = "CELLTYPE";
    public static final String INSTANCE = "INSTANCE";
    public static final String WILDCARD = "*";
    public static final String DELAY = "DELAY";
    public static final String ABSOLUTE = "ABSOLUTE";
    public static final String INCREMENT = "INCREMENT";
    public static final String PATHPULSE = "PATHPULSE";
    public static final String PATHPULSEPERCENT = "PATHPULSEPERCENT";
    public static final String INTERCONNECT = "INTERCONNECT";
    public static final String IOPATH = "IOPATH";
    public static final String RETAIN = "RETAIN";
    public static final String COND = "COND";
    public static final String CONDELSE = "CONDELSE";
    public static final String PORT = "PORT";
    public static final String DEVICE = "DEVICE";
    public static final String TIMINGCHECK = "TIMINGCHECK";
    public static final String TIMINGENV = "TIMINGENV";
    public static final String SETUPHOLD = "SETUPHOLD";

    protected final SDFTokenizer tokenizer;

    protected AbstractSDFParserWorker(String text, StringPool uniquifier) {
        this.tokenizer = new SDFTokenizer(text, uniquifier);
    }

    protected void expect(char c) {
        tokenizer.expect(c);
    }

    protected void expectKeyword(String expectedKeyword) {
        int at = tokenizer.tokenStart();
        if (!SDFTokenizer.isKeywordChar(tokenizer.peek())) {
            throw tokenizer.unexpected(expectedKeyword);
        }
        String keyword = tokenizer.readKeyword();
        if (!expectedKeyword.equalsIgnoreCase(keyword)) {
            throw tokenizer.error(SDFErrorKind.UNEXPECTED_TOKEN, "Parsing Error: Expected " + expectedKeyword
                    + ", encountered: " + keyword, at);
        }
    }

    /**
     * Looks ahead for {@code ( KEYWORD} without consuming anything.
     * @return The keyword following the next '(' or null if the input does not
     * continue with a parenthesized keyword
     */
    protected String peekKeyword() {
        int mark = tokenizer.mark();
        String keyword = null;
        if (tokenizer.tryConsume(LEFT_PAREN) && SDFTokenizer.isKeywordChar(tokenizer.peek())) {
            keyword = tokenizer.readKeyword();
        }
        tokenizer.reset(mark);
        return keyword;
    }

    /**
     * Consumes {@code ( keyword} if that is what comes next.
     * @param keyword Keyword to look for, compared ignoring case
     * @return True if consumed, false if the input was left untouched
     */
    protected boolean tryOpen(String keyword) {
        if (keyword.equalsIgnoreCase(peekKeyword())) {
            expect(LEFT_PAREN);
            tokenizer.readKeyword();
            return true;
        }
        return false;
    }

    /**
     * Parses a bare value: {@code 1.0}, {@code 1.0:1.2:1.5}, {@code ::1.5} or
     * nothing. The triple form is tried first; without a ':' the value is a
     * single number.
     * @return The value
     */
    protected SDFValue parseValue() {
        Double first = tokenizer.readOptionalReal();
        if (tokenizer.tryConsume(':')) {
            Double typ = tokenizer.readOptionalReal();
            expect(':');
            Double max = tokenizer.readOptionalReal();
            return SDFValue.triple(first, typ, max);
        }
        return SDFValue.single(first);
    }

    protected SDFValue parseParenthesizedValue() {
        expect(LEFT_PAREN);
        SDFValue value = parseValue();
        expect(RIGHT_PAREN);
        return value;
    }

    /**
     * Parses the parenthesized values of a delay, e.g. {@code (1:2:3) (4:5:6)},
     * stopping before the first character that does not open another value.
     * @return Between {@link SDFDelayDef#MIN_VALUES} and {@link SDFDelayDef#MAX_VALUES} values
     */
    protected List<SDFValue> parseValueList() {
        int start = tokenizer.tokenStart();
        List<SDFValue> values = new ArrayList<>();
        while (tokenizer.peek() == LEFT_PAREN) {
            if (values.size() == SDFDelayDef.MAX_VALUES) {
                throw tokenizer.error(SDFErrorKind.VALUE_LIST_BOUNDS, "Delay value list has more than "
                        + SDFDelayDef.MAX_VALUES + " values", tokenizer.tokenStart());
            }
            values.add(parseParenthesizedValue());
        }
        if (values.isEmpty()) {
            throw tokenizer.error(SDFErrorKind.VALUE_LIST_BOUNDS, "Delay value list is empty, expected at least "
                    + SDFDelayDef.MIN_VALUES + " value", start);
        }
        return values;
    }

    /**
     * @return The bus suffix {@code [3]} or {@code [3:0]}, or null if the input
     * does not continue with '['
     */
    protected SDFBus parseBus() {
        if (!tokenizer.tryConsume('[')) {
            return null;
        }
        int high = tokenizer.readUnsignedInt();
        Integer low = null;
        if (tokenizer.tryConsume(':')) {
            low = tokenizer.readUnsignedInt();
        }
        expect(']');
        return new SDFBus(high, low);
    }

    /**
     * Parses a hierarchical path whose segments are joined by the divider the
     * header declared. Meeting the other divider character is an error, and
     * so is a wildcard segment directly after a divider.
     * @param divider '.' or '/'
     * @return The path
     */
    protected SDFPath parsePath(char divider) {
        char other = divider == '.' ? '/' : '.';
        List<String> segments = new ArrayList<>();
        segments.add(tokenizer.readIdentifier());
        while (true) {
            if (tokenizer.startsWithAdjacent(divider + "*")) {
                // peek() would read "/*" as the start of a comment
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_WILDCARD,
                        String.join(String.valueOf(divider), segments) + divider + "*", tokenizer.getOffset());
            }
            int c = tokenizer.peek();
            if (c == divider) {
                tokenizer.expect(divider);
                segments.add(tokenizer.readIdentifier());
            } else if (c == other) {
                throw tokenizer.error(SDFErrorKind.DIVIDER_MISMATCH, "Path " + String.join(String.valueOf(divider),
                        segments) + " continues with '" + other + "' but the header declared divider '"
                        + divider + "'", tokenizer.getOffset());
            } else {
                break;
            }
        }
        return new SDFPath(segments, parseBus(), divider);
    }

    protected SDFPort parsePort() {
        String name = tokenizer.readIdentifier();
        return new SDFPort(name, parseBus());
    }

    /**
     * @return A plain port {@code A} or an edge-qualified port {@code (posedge CLK)}
     */
    protected SDFPortSpec parsePortSpec() {
        if (!tokenizer.tryConsume(LEFT_PAREN)) {
            return new SDFPortSpec(parsePort());
        }
        int at = tokenizer.tokenStart();
        String edgeName = tokenizer.readKeyword();
        SDFPortEdge edge = SDFPortEdge.getEnum(edgeName);
        if (edge == null) {
            throw tokenizer.error(SDFErrorKind.UNEXPECTED_TOKEN, "Parsing Error: Expected port edge "
                    + "(posedge | negedge | 01 | 10 | 0z | z1 | 1z | z0), encountered: " + edgeName, at);
        }
        SDFPort port = parsePort();
        expect(RIGHT_PAREN);
        return new SDFPortSpec(edge, port);
    }

    /**
     * Parses a condition: a conjunction of port literals joined by
     * {@code &&} or {@code &}, normally enclosed in parentheses. The bare form
     * without parentheses is accepted as well. Any other operator is rejected.
     * @return The condition
     */
    protected SDFCondition parseCondition() {
        boolean parenthesized = tokenizer.tryConsume(LEFT_PAREN);
        List<SDFConditionLiteral> literals = new ArrayList<>();
        literals.add(parseConditionLiteral());
        while (tokenizer.tryConsume("&&") || tokenizer.tryConsume('&')) {
            literals.add(parseConditionLiteral());
        }
        rejectOperator(parenthesized);
        if (parenthesized) {
            expect(RIGHT_PAREN);
            // (A) || (B) and (A) & (B)
            int c = tokenizer.peek();
            if (c == '|' || c == '&' || c == '^') {
                throw unsupportedOperator();
            }
        }
        return new SDFCondition(literals);
    }

    private SDFConditionLiteral parseConditionLiteral() {
        boolean negated = tokenizer.tryConsume('!') || tokenizer.tryConsume('~');
        if (tokenizer.peek() == LEFT_PAREN) {
            throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_EXPR, negated ? "negated sub-expression"
                    : "nested parentheses", tokenizer.tokenStart());
        }
        SDFPort port = parsePort();
        if (tokenizer.startsWith("===") || tokenizer.startsWith("!=")) {
            throw unsupportedOperator();
        }
        if (tokenizer.tryConsume("==")) {
            if (negated) {
                throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_EXPR, "negated comparison",
                        tokenizer.tokenStart());
            }
            return new SDFConditionLiteral(port, tokenizer.readScalarConstant());
        }
        return new SDFConditionLiteral(port, !negated);
    }

    private void rejectOperator(boolean parenthesized) {
        int c = tokenizer.peek();
        if (c == '|' || c == '^' || c == '=' || c == '!' || c == '<' || c == '>') {
            throw unsupportedOperator();
        }
        if (parenthesized && c == LEFT_PAREN) {
            throw tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_EXPR, "nested parentheses", tokenizer.tokenStart());
        }
    }

    private SDFUnsupportedConstructException unsupportedOperator() {
        int at = tokenizer.tokenStart();
        String op = tokenizer.describe(at);
        int end = 0;
        while (end < op.length() && "|&^=!<>~".indexOf(op.charAt(end)) >= 0) {
            end++;
        }
        return tokenizer.unsupported(SDFErrorKind.UNSUPPORTED_EXPR, end == 0 ? op : op.substring(0, end), at);
    }
}
