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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Lexical helpers shared by the preprocessor passes. All scanning is string-aware: double
 * quotes, single quotes and backticks open literals, and a backslash escapes the next
 * character inside them.
 */
final class SourceText {

    static final Set<String> KEYWORDS = ImmutableSet.of(
        "if", "elsif", "else", "end", "while", "for", "in", "def", "return", "require", "break",
        "next", "true", "false", "nil", "import", "use", "rats", "try", "or", "spawn", "parallel",
        "bench", "fn", "struct", "as");

    static final Set<String> BUILTINS = ImmutableSet.of(
        "puts", "print", "len", "append", "raise", "type_of", "exit");

    /** Keywords whose line opens a block closed by {@code end}. */
    static final Set<String> BLOCK_OPENERS = ImmutableSet.of(
        "def", "if", "while", "for", "try", "spawn", "parallel", "fn", "rats", "bench");

    private SourceText() {
    }

    static boolean isIdent(final String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        char first = s.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    /** {@code ident.ident}, e.g. {@code str.upper}. */
    static boolean isDottedIdent(final String s) {
        int dot = s.indexOf('.');
        return dot > 0 && isIdent(s.substring(0, dot)) && isIdent(s.substring(dot + 1));
    }

    /** A plain identifier, or an identifier followed by index or field access. */
    static boolean isAssignTarget(final String s) {
        if (isIdent(s)) {
            return true;
        }
        int bracket = s.indexOf('[');
        if (bracket > 0) {
            return isIdent(s.substring(0, bracket));
        }
        int dot = s.indexOf('.');
        return dot > 0 && isIdent(s.substring(0, dot));
    }

    /** {@code docker-compose}, {@code apt-get}: hyphens never occur in identifiers. */
    static boolean isHyphenatedCommand(final String s) {
        if (s.isEmpty() || !Character.isLetter(s.charAt(0)) && s.charAt(0) != '_') {
            return false;
        }
        boolean hyphen = false;
        for (int i = 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '-') {
                hyphen = true;
            } else if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return hyphen;
    }

    static boolean isPathCommand(final String s) {
        return s.startsWith("./") || s.startsWith("../") || s.startsWith("/");
    }

    static boolean isOperatorStart(final char c) {
        switch (c) {
            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
            case '<':
            case '>':
            case '!':
            case '&':
            case '|':
            case '=':
                return true;
            default:
                return false;
        }
    }

    static String shellEscape(final String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Like {@link #shellEscape(String)} but copies {@code #{...}} segments verbatim so they are
     * still interpolated later.
     */
    static String shellEscapeKeepingInterpolation(final String s) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < s.length()) {
            if (s.startsWith("#{", i)) {
                int close = matchingBrace(s, i + 1);
                if (close < 0) {
                    sb.append(s.substring(i));
                    break;
                }
                sb.append(s, i, close + 1);
                i = close + 1;
                continue;
            }
            char c = s.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\');
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    static String indentOf(final String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Split off the first token: everything up to whitespace, {@code (}, {@code [} or {@code =}.
     *
     * @return {token, rest}; token is empty when the line starts with a delimiter
     */
    static String[] firstToken(final String s) {
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == '[' || c == '=') {
                break;
            }
            i++;
        }
        return new String[] {s.substring(0, i), s.substring(i)};
    }

    /**
     * @return index of the first position at bracket depth 0 outside literals where the
     * predicate holds, or -1
     */
    static int findTopLevel(final String s, final IntPredicate at) {
        List<Integer> all = findAllTopLevel(s, at, true);
        return all.isEmpty() ? -1 : all.get(0);
    }

    static List<Integer> findAllTopLevel(final String s, final IntPredicate at) {
        return findAllTopLevel(s, at, false);
    }

    private static List<Integer> findAllTopLevel(final String s, final IntPredicate at, final boolean firstOnly) {
        List<Integer> found = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
                continue;
            }
            if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (depth == 0 && at.test(i)) {
                found.add(i);
                if (firstOnly) {
                    break;
                }
            }
        }
        return found;
    }

    /**
     * Count whole-word occurrences of any of {@code words} outside literals.
     */
    static int countWords(final String line, final Set<String> words) {
        int count = 0;
        char quote = 0;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
                i++;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
                    i++;
                }
                if (words.contains(line.substring(start, i))) {
                    count++;
                }
                continue;
            }
            i++;
        }
        return count;
    }

    /**
     * Find the brace closing the one at {@code open}, skipping nested braces and string literals.
     *
     * @return the index of the closing brace, or -1 when unbalanced
     */
    static int matchingBrace(final String s, final int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
