/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rugo.registry.bridge;

/**
 * Recursive descent over Go type syntax. Input must already have comments and string
 * contents blanked by {@link GoSourceScanner}.
 */
final class GoTypeParser {

    private final String src;

    private int pos;

    GoTypeParser(final String src, final int pos) {
        this.src = src;
        this.pos = pos;
    }

    /**
     * Parse a complete type expression.
     *
     * @throws IllegalArgumentException when {@code text} is not exactly one type
     */
    static GoType parse(final String text) {
        GoTypeParser parser = new GoTypeParser(text, 0);
        GoType type = parser.parseType();
        parser.skipWhitespace();
        if (parser.pos != text.length()) {
            throw new IllegalArgumentException("unexpected '" + text.substring(parser.pos).trim() + "' after type " + type);
        }
        return type;
    }

    int position() {
        return pos;
    }

    GoType parseType() {
        skipWhitespace();
        if (pos >= src.length()) {
            throw new IllegalArgumentException("missing type");
        }
        char c = src.charAt(pos);
        if (c == '*') {
            pos++;
            return GoType.pointer(parseType());
        }
        if (c == '(') {
            pos++;
            GoType inner = parseType();
            skipWhitespace();
            expect(')');
            return inner;
        }
        if (src.startsWith("[]", pos)) {
            pos += 2;
            return GoType.slice(parseType());
        }
        if (c == '[') {
            int close = matching(pos, '[', ']');
            String length = src.substring(pos + 1, close).trim();
            pos = close + 1;
            return GoType.array(length, parseType());
        }
        if (src.startsWith("<-", pos)) {
            pos += 2;
            skipWhitespace();
            if (!"chan".equals(readIdent())) {
                throw new IllegalArgumentException("expected chan after <-");
            }
            return GoType.chan("<-chan", parseType());
        }
        int start = pos;
        String word = readIdent();
        if (word.isEmpty()) {
            throw new IllegalArgumentException("unexpected '" + c + "' in type");
        }
        switch (word) {
            case "map":
                skipWhitespace();
                expect('[');
                GoType key = parseType();
                skipWhitespace();
                expect(']');
                return GoType.map(key, parseType());
            case "chan":
                skipBlanks();
                if (src.startsWith("<-", pos)) {
                    pos += 2;
                    return GoType.chan("chan<-", parseType());
                }
                return GoType.chan("chan", parseType());
            case "func":
                skipSignature();
                return GoType.func(normalize(src.substring(start, pos)));
            case "interface":
                return GoType.iface(countMembers(body()), normalize(src.substring(start, pos)));
            case "struct":
                return GoType.struct(countMembers(body()), normalize(src.substring(start, pos)));
            default:
                break;
        }
        String name = word;
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            name = word + "." + readIdent();
        }
        if (pos < src.length() && src.charAt(pos) == '[') {
            int close = matching(pos, '[', ']');
            pos = close + 1;
            return GoType.instantiated(name, normalize(src.substring(start, pos)));
        }
        return name.contains(".") ? GoType.qualified(name) : GoType.name(name);
    }

    /**
     * Skip {@code (params) results} of a function type; the results may be absent.
     */
    void skipSignature() {
        skipWhitespace();
        expect('(');
        pos = matching(pos - 1, '(', ')') + 1;
        skipBlanks();
        if (pos >= src.length()) {
            return;
        }
        char c = src.charAt(pos);
        if (c == '(') {
            pos = matching(pos, '(', ')') + 1;
        } else if (startsType(c)) {
            parseType();
        }
    }

    private boolean startsType(final char c) {
        return c == '*' || c == '[' || Character.isLetter(c) || c == '_' || src.startsWith("<-", pos);
    }

    private String body() {
        skipWhitespace();
        expect('{');
        int close = matching(pos - 1, '{', '}');
        String body = src.substring(pos, close);
        pos = close + 1;
        return body;
    }

    /**
     * One member per line or {@code ;}-separated entry; {@code a, b int} declares two.
     */
    static int countMembers(final String body) {
        int count = 0;
        int depth = 0;
        StringBuilder entry = new StringBuilder();
        for (int i = 0; i <= body.length(); i++) {
            char c = i < body.length() ? body.charAt(i) : '\n';
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            }
            if (depth == 0 && (c == '\n' || c == ';')) {
                String trimmed = entry.toString().trim();
                if (!trimmed.isEmpty()) {
                    count += namesInEntry(trimmed);
                }
                entry.setLength(0);
                continue;
            }
            entry.append(c);
        }
        return count;
    }

    private static int namesInEntry(final String entry) {
        int paren = indexOfAny(entry, "([{");
        String head = paren < 0 ? entry : entry.substring(0, paren);
        int commas = 0;
        for (int i = 0; i < head.length(); i++) {
            if (head.charAt(i) == ',') {
                commas++;
            }
        }
        return commas + 1;
    }

    private static int indexOfAny(final String s, final String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return the index of the bracket closing the one at {@code open}
     */
    int matching(final int open, final char openChar, final char closeChar) {
        int depth = 0;
        for (int i = open; i < src.length(); i++) {
            char c = src.charAt(i);
            if (c == openChar) {
                depth++;
            } else if (c == closeChar) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalArgumentException("unbalanced '" + openChar + "'");
    }

    private String readIdent() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        return src.substring(start, pos);
    }

    private void expect(final char c) {
        if (pos >= src.length() || src.charAt(pos) != c) {
            throw new IllegalArgumentException("expected '" + c + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    /** Spaces and tabs only; a newline ends a result type. */
    private void skipBlanks() {
        while (pos < src.length() && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
            pos++;
        }
    }

    private static String normalize(final String text) {
        return text.replaceAll("\\s+", " ").trim();
    }
}
