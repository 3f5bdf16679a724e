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

package org.rugo.frontend.preprocess;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands {@code "a #{expr} b"} into {@code ("a " + __to_s(expr) + " b")}. Single-quoted
 * literals are never interpolated. Nested literals inside the braces are expanded too. An
 * unclosed interpolation leaves the literal unchanged.
 */
final class Interpolator {

    MappedLines expand(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            out.add(expandLine(in.text(i)), in.origin(i));
        }
        return out;
    }

    static String expandLine(final String line) {
        if (!line.contains("#{")) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length() + 16);
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\'') {
                int end = literalEnd(line, i);
                sb.append(line, i, end);
                i = end;
                continue;
            }
            if (c == '"') {
                int end = literalEnd(line, i);
                sb.append(expandLiteral(line.substring(i, end)));
                i = end;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * @return the index just past the literal opened at {@code start}, or the line length
     */
    private static int literalEnd(final String line, final int start) {
        char quote = line.charAt(start);
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (quote == '"' && line.startsWith("#{", i)) {
                int close = SourceText.matchingBrace(line, i + 1);
                if (close < 0) {
                    return line.length();
                }
                i = close + 1;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return line.length();
    }

    /**
     * @param literal a complete double-quoted literal including its quotes
     */
    static String expandLiteral(final String literal) {
        if (literal.length() < 2 || !literal.endsWith("\"") || !literal.contains("#{")) {
            return literal;
        }
        String body = literal.substring(1, literal.length() - 1);
        List<String> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                text.append(c).append(body.charAt(i + 1));
                i += 2;
                continue;
            }
            if (body.startsWith("#{", i)) {
                int close = SourceText.matchingBrace(body, i + 1);
                if (close < 0) {
                    return literal;
                }
                if (text.length() > 0) {
                    parts.add("\"" + text + "\"");
                    text.setLength(0);
                }
                String expr = body.substring(i + 2, close).trim();
                parts.add("__to_s(" + expandLine(expr) + ")");
                i = close + 1;
                continue;
            }
            text.append(c);
            i++;
        }
        if (text.length() > 0) {
            parts.add("\"" + text + "\"");
        }
        return "(" + String.join(" + ", parts) + ")";
    }
}
