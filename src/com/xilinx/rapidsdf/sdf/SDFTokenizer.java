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

/**
 * Reads the lexical elements of an SDF document out of an in-memory string.
 *
 * SDF cannot be split into tokens without knowing the grammar context: a
 * {@code .} is part of a real number in one place and a hierarchy divider in
 * another, and identifiers may start with digits. The parser therefore asks
 * for the element it expects next (keyword, identifier, real, quoted string)
 * instead of pulling generic tokens. Whitespace, line comments starting with
 * two slashes and non-nesting slash-star block comments are skipped before
 * every element.
 */
public class SDFTokenizer {

    /** Returned by {@link #peek()} at the end of the input */
    public static final int EOF = -1;

    private final String text;

    private final int length;

    private final StringPool uniquifier;

    private int offset = 0;

    public SDFTokenizer(String text, StringPool uniquifier) {
        this.text = text;
        this.length = text.length();
        this.uniquifier = uniquifier;
    }

    public SDFTokenizer(String text) {
        this(text, StringPool.defaultParserPool());
    }

    /**
     * Skips spaces, tabs, line breaks and comments.
     */
    public void skipWhitespace() {
        while (offset < length) {
            char c = text.charAt(offset);
            switch (c) {
                case ' ':
                case '\t':
                case '\n':
                case '\r':
                case '\f':
                    offset++;
                    break;
                case '/':
                    if (offset + 1 >= length) {
                        return;
                    }
                    char next = text.charAt(offset + 1);
                    if (next == '/') {
                        int eol = text.indexOf('\n', offset + 2);
                        offset = eol == -1 ? length : eol + 1;
                    } else if (next == '*') {
                        int end = text.indexOf("*/", offset + 2);
                        if (end == -1) {
                            throw error(SDFErrorKind.UNTERMINATED_COMMENT, "Unterminated block comment", offset);
                        }
                        offset = end + 2;
                    } else {
                        return;
                    }
                    break;
                default:
                    return;
            }
        }
    }

    /**
     * @return The next significant character without consuming it, or {@link #EOF}
     */
    public int peek() {
        skipWhitespace();
        return offset < length ? text.charAt(offset) : EOF;
    }

    public boolean isEOF() {
        return peek() == EOF;
    }

    /**
     * Consumes the next significant character if it is c.
     * @param c Expected character
     * @return True if it was consumed
     */
    public boolean tryConsume(char c) {
        if (peek() == c) {
            offset++;
            return true;
        }
        return false;
    }

    /**
     * Consumes s if the next significant characters spell it.
     * @param s Expected text, e.g. an operator such as "&amp;&amp;"
     * @return True if it was consumed
     */
    public boolean tryConsume(String s) {
        if (startsWith(s)) {
            offset += s.length();
            return true;
        }
        return false;
    }

    public boolean startsWith(String s) {
        skipWhitespace();
        return text.startsWith(s, offset);
    }

    /**
     * Like {@link #startsWith(String)} but without skipping whitespace or comments.
     */
    public boolean startsWithAdjacent(String s) {
        return text.startsWith(s, offset);
    }

    public void expect(char c) {
        if (!tryConsume(c)) {
            throw unexpected("'" + c + "'");
        }
    }

    /**
     * @return Offset of the next significant character (whitespace is skipped first)
     */
    public int tokenStart() {
        skipWhitespace();
        return offset;
    }

    public int mark() {
        return offset;
    }

    public void reset(int mark) {
        offset = mark;
    }

    public int getOffset() {
        return offset;
    }

    public StringPool getUniquifier() {
        return uniquifier;
    }

    public static boolean isKeywordChar(int c) {
        return c != EOF && (Character.isLetterOrDigit(c) || c == '_');
    }

    public static boolean isIdentifierStart(int c) {
        return isKeywordChar(c) || c == '\\';
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Reads a keyword such as DELAYFILE, IOPATH or posedge. Keywords consist of
     * letters, digits and underscores and are returned as written.
     * @return The keyword text
     */
    public String readKeyword() {
        skipWhitespace();
        int start = offset;
        while (offset < length && isKeywordChar(text.charAt(offset))) {
            offset++;
        }
        if (start == offset) {
            throw unexpected("keyword");
        }
        return text.substring(start, offset);
    }

    /**
     * Reads an identifier: letters, digits, underscores and backslash-escaped
     * characters. The backslash is dropped and the escaped character kept, so
     * {@code a\.b} yields the single name "a.b".
     * @return The identifier, deduplicated through this tokenizer's pool
     */
    public String readIdentifier() {
        skipWhitespace();
        int start = offset;
        StringBuilder sb = null;
        while (offset < length) {
            char c = text.charAt(offset);
            if (c == '\\') {
                if (offset + 1 >= length) {
                    throw error(SDFErrorKind.UNEXPECTED_EOF, "Escape character at end of input", offset);
                }
                if (sb == null) {
                    sb = new StringBuilder(text.substring(start, offset));
                }
                sb.append(text.charAt(offset + 1));
                offset += 2;
            } else if (isKeywordChar(c)) {
                if (sb != null) {
                    sb.append(c);
                }
                offset++;
            } else {
                break;
            }
        }
        if (start == offset) {
            throw unexpected("identifier");
        }
        return uniquifier.uniquifyName(sb == null ? text.substring(start, offset) : sb.toString());
    }

    /**
     * Reads a double-quoted string. A backslash makes the character after it
     * literal and is itself dropped.
     * @return The string contents without the quotes
     */
    public String readQuotedString() {
        skipWhitespace();
        if (offset >= length || text.charAt(offset) != '"') {
            throw unexpected("quoted string");
        }
        int start = offset;
        offset++;
        StringBuilder sb = new StringBuilder();
        while (offset < length) {
            char c = text.charAt(offset);
            if (c == '"') {
                offset++;
                return sb.toString();
            }
            if (c == '\\') {
                if (offset + 1 >= length) {
                    break;
                }
                sb.append(text.charAt(offset + 1));
                offset += 2;
            } else {
                sb.append(c);
                offset++;
            }
        }
        throw error(SDFErrorKind.UNTERMINATED_STRING, "Unterminated quoted string", start);
    }

    /**
     * Reads a real number: an optional '-', one or more digits, an optional
     * fraction and an optional exponent whose sign is mandatory
     * (e.g. {@code -1.5e-3}).
     * @return The parsed number
     */
    public double readReal() {
        skipWhitespace();
        int start = offset;
        if (offset < length && text.charAt(offset) == '-') {
            offset++;
        }
        if (!skipDigits()) {
            throw error(SDFErrorKind.INVALID_NUMBER, "Invalid number, expected digits after '"
                    + text.substring(start, offset) + "'", start);
        }
        if (offset < length && text.charAt(offset) == '.') {
            offset++;
            skipDigits();
        }
        if (offset < length && (text.charAt(offset) == 'e' || text.charAt(offset) == 'E')) {
            offset++;
            if (offset < length && (text.charAt(offset) == '+' || text.charAt(offset) == '-')) {
                offset++;
            } else {
                throw error(SDFErrorKind.INVALID_NUMBER, "Invalid number "
                        + text.substring(start, offset) + ", exponent requires a sign", start);
            }
            if (!skipDigits()) {
                throw error(SDFErrorKind.INVALID_NUMBER, "Invalid number "
                        + text.substring(start, offset) + ", exponent requires digits", start);
            }
        }
        double value = Double.parseDouble(text.substring(start, offset));
        if (Double.isInfinite(value)) {
            throw error(SDFErrorKind.INVALID_NUMBER, "Number out of range: "
                    + text.substring(start, offset), start);
        }
        return value;
    }

    /**
     * @return A real number if one starts here, null otherwise (nothing is consumed then)
     */
    public Double readOptionalReal() {
        int c = peek();
        if (c == '-' || isDigit(c)) {
            return readReal();
        }
        return null;
    }

    public int readUnsignedInt() {
        skipWhitespace();
        int start = offset;
        if (!skipDigits()) {
            throw unexpected("integer");
        }
        String digits = text.substring(start, offset);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw error(SDFErrorKind.INVALID_NUMBER, "Integer out of range: " + digits, start);
        }
    }

    private boolean skipDigits() {
        int start = offset;
        while (offset < length && isDigit(text.charAt(offset))) {
            offset++;
        }
        return offset > start;
    }

    /**
     * Reads a one bit scalar constant: {@code 1'b0}, {@code 1'b1}, {@code 'b0},
     * {@code 'b1}, {@code 0} or {@code 1} (the base letter in either case).
     * @return The value of the constant
     */
    public boolean readScalarConstant() {
        skipWhitespace();
        int start = offset;
        while (offset < length) {
            char c = text.charAt(offset);
            if (isDigit(c) || c == '\'' || c == 'b' || c == 'B') {
                offset++;
            } else {
                break;
            }
        }
        String constant = text.substring(start, offset).toLowerCase();
        switch (constant) {
            case "1'b0":
            case "'b0":
            case "0":
                return false;
            case "1'b1":
            case "'b1":
            case "1":
                return true;
            default:
                offset = start;
                throw unexpected("scalar constant 1'b0 or 1'b1");
        }
    }

    /**
     * Describes the input at the given offset for an error message: a single
     * delimiter character, or the following run of non-delimiters (shortened to
     * {@link Params#RSDF_ERROR_CONTEXT_LENGTH} characters).
     * @param at Offset into the input
     * @return Text to quote back to the user
     */
    public String describe(int at) {
        if (at >= length) {
            return "end of input";
        }
        char c = text.charAt(at);
        if (c == '(' || c == ')' || c == '"') {
            return String.valueOf(c);
        }
        int end = at;
        while (end < length && end - at < Params.RSDF_ERROR_CONTEXT_LENGTH) {
            char e = text.charAt(end);
            if (Character.isWhitespace(e) || e == '(' || e == ')') {
                break;
            }
            end++;
        }
        String s = text.substring(at, Math.max(end, at + 1));
        return end < length && end - at >= Params.RSDF_ERROR_CONTEXT_LENGTH ? s + "..." : s;
    }

    public int getLine(int at) {
        int line = 1;
        int limit = Math.min(at, length);
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    public int getColumn(int at) {
        int limit = Math.min(at, length);
        int lineStart = text.lastIndexOf('\n', limit - 1) + 1;
        return limit - lineStart + 1;
    }

    public SDFParseException error(SDFErrorKind kind, String message, int at) {
        return new SDFParseException(kind, message, at, getLine(at), getColumn(at));
    }

    public SDFParseException error(SDFErrorKind kind, String message) {
        return error(kind, message, offset);
    }

    public SDFUnsupportedConstructException unsupported(SDFErrorKind kind, String construct, int at) {
        return new SDFUnsupportedConstructException(kind, construct, at, getLine(at), getColumn(at));
    }

    /**
     * Creates the error for finding something other than what the grammar
     * requires at the next significant character.
     * @param expected Description of what was expected
     * @return UNEXPECTED_EOF at the end of the input, UNEXPECTED_TOKEN otherwise
     */
    public SDFParseException unexpected(String expected) {
        int at = tokenStart();
        if (at >= length) {
            return error(SDFErrorKind.UNEXPECTED_EOF, "Parsing Error: Expected " + expected
                    + ", encountered end of input", at);
        }
        return error(SDFErrorKind.UNEXPECTED_TOKEN, "Parsing Error: Expected " + expected
                + ", encountered: " + describe(at), at);
    }
}
