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
import lombok.RequiredArgsConstructor;

/**
 * Replaces heredocs with one-line string expressions. Openers are recognised after an
 * assignment {@code =} or a leading {@code return}:
 * <pre>
 *   x = &lt;&lt;DELIM       interpolating
 *   x = &lt;&lt;~DELIM      interpolating, common indentation stripped
 *   x = &lt;&lt;'DELIM'     raw
 *   return &lt;&lt;~'DELIM' raw, indentation stripped
 * </pre>
 * The body lines become blank so that later line numbers are unchanged. A heredoc without its
 * closing delimiter is left as written for the parser to reject.
 */
final class HeredocExpander {

    private static final int TAB_WIDTH = 4;

    MappedLines expand(final MappedLines in) {
        MappedLines out = new MappedLines();
        int i = 0;
        while (i < in.size()) {
            String line = in.text(i);
            Opener opener = findOpener(line);
            int close = opener == null ? -1 : findClose(in, i + 1, opener.delimiter);
            if (close < 0) {
                out.add(line, in.origin(i));
                i++;
                continue;
            }
            List<String> bodyLines = new ArrayList<>();
            for (int j = i + 1; j < close; j++) {
                bodyLines.add(in.text(j));
            }
            out.add(line.substring(0, opener.start) + replacement(opener, bodyLines), in.origin(i));
            for (int j = i + 1; j <= close; j++) {
                out.add("", in.origin(j));
            }
            i = close + 1;
        }
        return out;
    }

    private static int findClose(final MappedLines in, final int from, final String delimiter) {
        for (int j = from; j < in.size(); j++) {
            if (in.text(j).trim().equals(delimiter)) {
                return j;
            }
        }
        return -1;
    }

    static Opener findOpener(final String line) {
        String trimmed = line.stripLeading();
        if (trimmed.startsWith("return ") || trimmed.startsWith("return\t")) {
            int j = line.indexOf("return") + "return".length();
            while (j < line.length() && (line.charAt(j) == ' ' || line.charAt(j) == '\t')) {
                j++;
            }
            Opener opener = parseOpener(line, j);
            if (opener != null && line.substring(opener.end).trim().isEmpty()) {
                return opener;
            }
        }
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != '=') {
                continue;
            }
            if (i + 1 < line.length() && line.charAt(i + 1) == '=') {
                i++;
                continue;
            }
            if (i > 0 && "!<>".indexOf(line.charAt(i - 1)) >= 0) {
                continue;
            }
            int j = i + 1;
            while (j < line.length() && (line.charAt(j) == ' ' || line.charAt(j) == '\t')) {
                j++;
            }
            Opener opener = parseOpener(line, j);
            if (opener != null && line.substring(opener.end).trim().isEmpty()) {
                return opener;
            }
        }
        return null;
    }

    private static Opener parseOpener(final String line, final int pos) {
        if (!line.startsWith("<<", pos)) {
            return null;
        }
        int i = pos + 2;
        boolean squiggly = false;
        boolean raw = false;
        if (i < line.length() && line.charAt(i) == '~') {
            squiggly = true;
            i++;
        }
        if (i < line.length() && line.charAt(i) == '\'') {
            raw = true;
            i++;
        }
        int start = i;
        if (i >= line.length() || !isDelimiterStart(line.charAt(i))) {
            return null;
        }
        while (i < line.length() && (isDelimiterStart(line.charAt(i)) || Character.isDigit(line.charAt(i)))) {
            i++;
        }
        String delimiter = line.substring(start, i);
        if (raw) {
            if (i >= line.length() || line.charAt(i) != '\'') {
                return null;
            }
            i++;
        }
        return new Opener(delimiter, squiggly, raw, pos, i);
    }

    private static boolean isDelimiterStart(final char c) {
        return c >= 'A' && c <= 'Z' || c == '_';
    }

    static String replacement(final Opener opener, final List<String> bodyLines) {
        List<String> lines = opener.squiggly ? stripCommonIndent(bodyLines) : bodyLines;
        if (opener.raw) {
            if (lines.isEmpty()) {
                return "''";
            }
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                parts.add("'" + lines.get(i).replace("\\", "\\\\").replace("'", "\\'") + "'");
                if (i < lines.size() - 1) {
                    parts.add("\"\\n\"");
                }
            }
            return "(" + String.join(" + ", parts) + ")";
        }
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < lines.size(); i++) {
            sb.append(lines.get(i).replace("\\", "\\\\").replace("\"", "\\\""));
            if (i < lines.size() - 1) {
                sb.append("\\n");
            }
        }
        return sb.append('"').toString();
    }

    static List<String> stripCommonIndent(final List<String> lines) {
        int min = Integer.MAX_VALUE;
        for (String l : lines) {
            if (!l.trim().isEmpty()) {
                min = Math.min(min, indentWidth(l));
            }
        }
        if (min == 0 || min == Integer.MAX_VALUE) {
            return lines;
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String l : lines) {
            if (l.trim().isEmpty()) {
                result.add("");
                continue;
            }
            int stripped = 0;
            int j = 0;
            while (j < l.length() && stripped < min) {
                stripped += l.charAt(j) == '\t' ? TAB_WIDTH : 1;
                j++;
            }
            result.add(l.substring(j));
        }
        return result;
    }

    private static int indentWidth(final String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    @RequiredArgsConstructor
    static final class Opener {

        private final String delimiter;

        private final boolean squiggly;

        private final boolean raw;

        private final int start;

        private final int end;
    }
}
