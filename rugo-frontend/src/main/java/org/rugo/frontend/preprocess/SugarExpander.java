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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/**
 * Line-local syntactic sugar, each rewrite producing the canonical form the grammar accepts.
 * Every method is one pass over the whole unit; {@link Preprocessor} fixes their order.
 */
final class SugarExpander {

    private static final List<String> COMPOUND_OPS = ImmutableList.of("+=", "-=", "*=", "/=", "%=");

    /** Lines starting with these are never a postfix {@code if}. */
    private static final Set<String> STATEMENT_KEYWORDS = ImmutableSet.of(
        "if", "elsif", "else", "end", "while", "for", "def", "return", "require", "import", "use",
        "rats", "try", "spawn", "parallel", "bench", "fn", "struct");

    /** {@code {name: v}} → {@code {"name" => v}}. */
    MappedLines hashColonKeys(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            out.add(hashColonLine(in.text(i)), in.origin(i));
        }
        return out;
    }

    static String hashColonLine(final String line) {
        StringBuilder sb = new StringBuilder(line.length() + 8);
        char quote = 0;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quote != 0) {
                sb.append(c);
                if (c == '\\' && quote != '`' && i + 1 < line.length()) {
                    sb.append(line.charAt(i + 1));
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }
            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
                sb.append(c);
                i++;
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) {
                    i++;
                }
                String ident = line.substring(start, i);
                boolean keyPosition = start == 0 || !Character.isLetterOrDigit(line.charAt(start - 1));
                if (keyPosition && i + 1 < line.length() && line.charAt(i) == ':'
                    && (line.charAt(i + 1) == ' ' || line.charAt(i + 1) == '\t')) {
                    sb.append('"').append(ident).append("\" =>");
                    i++;
                } else {
                    sb.append(ident);
                }
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /** {@code x op= y} → {@code x = x op y}, for any assignable left side. */
    MappedLines compoundAssignment(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            out.add(compoundLine(in.text(i)), in.origin(i));
        }
        return out;
    }

    static String compoundLine(final String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return line;
        }
        for (String op : COMPOUND_OPS) {
            int idx = SourceText.findTopLevel(trimmed, pos -> trimmed.startsWith(op, pos));
            if (idx <= 0) {
                continue;
            }
            String lhs = trimmed.substring(0, idx).trim();
            String rhs = trimmed.substring(idx + op.length()).trim();
            return SourceText.indentOf(line) + lhs + " = " + lhs + " " + op.charAt(0) + " " + rhs;
        }
        return line;
    }

    /** {@code a, b = expr} → a temporary plus one indexed assignment per target. */
    MappedLines destructuring(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            String trimmed = line.trim();
            String first = SourceText.firstToken(trimmed)[0];
            int eq = SourceText.KEYWORDS.contains(first) ? -1 : findPlainAssign(trimmed);
            List<String> targets = eq < 0 ? null : destructTargets(trimmed.substring(0, eq));
            if (targets == null) {
                out.add(line, in.origin(i));
                continue;
            }
            String indent = SourceText.indentOf(line);
            out.add(indent + "__destr__ = " + trimmed.substring(eq + 1).trim(), in.origin(i));
            for (int t = 0; t < targets.size(); t++) {
                out.add(indent + targets.get(t) + " = __destr__[" + t + "]", in.origin(i));
            }
        }
        return out;
    }

    private static List<String> destructTargets(final String lhs) {
        if (!lhs.contains(",")) {
            return null;
        }
        ImmutableList.Builder<String> targets = ImmutableList.builder();
        for (String part : lhs.split(",")) {
            String target = part.trim();
            if (!SourceText.isIdent(target)) {
                return null;
            }
            targets.add(target);
        }
        return targets.build();
    }

    /** Index of a top-level {@code =} that is not part of {@code == != <= >= =>}. */
    static int findPlainAssign(final String s) {
        return SourceText.findTopLevel(s, pos -> {
            if (s.charAt(pos) != '=') {
                return false;
            }
            if (pos + 1 < s.length() && (s.charAt(pos + 1) == '=' || s.charAt(pos + 1) == '>')) {
                return false;
            }
            return pos == 0 || "!<>=+-*/%".indexOf(s.charAt(pos - 1)) < 0;
        });
    }

    /** {@code def name} → {@code def name()}. */
    MappedLines defParens(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            String trimmed = line.trim();
            if (trimmed.startsWith("def ") && !trimmed.contains("(")) {
                String name = trimmed.substring(4).trim();
                if (SourceText.isIdent(name)) {
                    line = SourceText.indentOf(line) + "def " + name + "()";
                }
            }
            out.add(line, in.origin(i));
        }
        return out;
    }

    /** {@code STMT if COND} → {@code if COND} / {@code STMT} / {@code end}. */
    MappedLines postfixIf(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            String trimmed = line.trim();
            String first = SourceText.firstToken(trimmed)[0];
            List<Integer> ifs = trimmed.isEmpty() || STATEMENT_KEYWORDS.contains(first)
                ? ImmutableList.of()
                : SourceText.findAllTopLevel(trimmed, pos -> trimmed.startsWith(" if ", pos));
            if (ifs.isEmpty()) {
                out.add(line, in.origin(i));
                continue;
            }
            int at = ifs.get(ifs.size() - 1);
            String stmt = trimmed.substring(0, at).trim();
            String cond = trimmed.substring(at + 4).trim();
            if (stmt.isEmpty() || cond.isEmpty()) {
                out.add(line, in.origin(i));
                continue;
            }
            String indent = SourceText.indentOf(line);
            out.add(indent + "if " + cond, in.origin(i));
            out.add(indent + "  " + stmt, in.origin(i));
            out.add(indent + "end", in.origin(i));
        }
        return out;
    }

    /**
     * {@code `cmd`} → {@code __capture__("cmd")}. An unterminated backtick is left for the
     * parser to reject.
     */
    MappedLines backticks(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            out.add(backtickLine(in.text(i)), in.origin(i));
        }
        return out;
    }

    static String backtickLine(final String line) {
        if (line.indexOf('`') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                sb.append(c);
                if (c == '\\' && i + 1 < line.length()) {
                    sb.append(line.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
                sb.append(c);
                continue;
            }
            int close = c == '`' ? line.indexOf('`', i + 1) : -1;
            if (close > 0) {
                sb.append("__capture__(\"")
                  .append(SourceText.shellEscapeKeepingInterpolation(line.substring(i + 1, close)))
                  .append("\")");
                i = close;
                continue;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * One-line {@code try} forms to block form:
     * <pre>
     *   try EXPR             → try / EXPR / or _err / nil / end
     *   try EXPR or DEFAULT  → try / EXPR / or _err / DEFAULT / end
     *   try EXPR or err      → try / EXPR / or err   (a handler body and end follow)
     * </pre>
     */
    MappedLines trySugar(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            int origin = in.origin(i);
            String[] split = splitAssignedKeyword(line.trim(), "try");
            if (split == null) {
                out.add(line, origin);
                continue;
            }
            String prefix = split[0];
            String rest = split[1];
            String restFirst = SourceText.firstToken(rest)[0];
            if (restFirst.equals("spawn") || restFirst.equals("parallel")) {
                out.add(line, origin);
                continue;
            }
            String indent = SourceText.indentOf(line);
            int or = SourceText.findTopLevel(rest, pos -> isOrAt(rest, pos));
            String expr = protectDotted(or < 0 ? rest : rest.substring(0, or).trim());
            out.add(indent + prefix + "try", origin);
            out.add(indent + "  " + expr, origin);
            if (or >= 0) {
                String after = rest.substring(or + 2).trim();
                if (SourceText.isIdent(after) && !SourceText.KEYWORDS.contains(after) && handlerBlockFollows(in, i + 1)) {
                    out.add(indent + "or " + after, origin);
                    continue;
                }
                out.add(indent + "or _err", origin);
                out.add(indent + "  " + (after.isEmpty() ? "nil" : after), origin);
            } else {
                out.add(indent + "or _err", origin);
                out.add(indent + "  nil", origin);
            }
            out.add(indent + "end", origin);
        }
        return out;
    }

    /** {@code spawn EXPR} and {@code x = spawn EXPR} → {@code spawn} / {@code EXPR} / {@code end}. */
    MappedLines spawnSugar(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            int origin = in.origin(i);
            String[] split = splitAssignedKeyword(line.trim(), "spawn");
            if (split == null) {
                out.add(line, origin);
                continue;
            }
            String indent = SourceText.indentOf(line);
            out.add(indent + split[0] + "spawn", origin);
            out.add(indent + "  " + split[1], origin);
            out.add(indent + "end", origin);
        }
        return out;
    }

    /**
     * Match {@code KEYWORD rest} or {@code target = KEYWORD rest} with a non-empty rest.
     *
     * @return {assignment prefix, rest}, or null
     */
    private static String[] splitAssignedKeyword(final String trimmed, final String keyword) {
        String prefix = "";
        String part = trimmed;
        int eq = findPlainAssign(trimmed);
        if (eq > 0 && trimmed.substring(eq + 1).trim().startsWith(keyword + " ")) {
            prefix = trimmed.substring(0, eq).trim() + " = ";
            part = trimmed.substring(eq + 1).trim();
        }
        if (!part.startsWith(keyword + " ")) {
            return null;
        }
        String rest = part.substring(keyword.length()).trim();
        return rest.isEmpty() ? null : new String[] {prefix, rest};
    }

    private static boolean isOrAt(final String s, final int pos) {
        if (!s.startsWith("or", pos)) {
            return false;
        }
        boolean before = pos == 0 || s.charAt(pos - 1) == ' ' || s.charAt(pos - 1) == '\t';
        boolean after = pos + 2 == s.length() || s.charAt(pos + 2) == ' ' || s.charAt(pos + 2) == '\t';
        return before && after;
    }

    /** A non-empty body followed by a bare {@code end} line. */
    private static boolean handlerBlockFollows(final MappedLines in, final int start) {
        boolean body = false;
        for (int j = start; j < in.size(); j++) {
            String trimmed = in.text(j).trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.equals("end")) {
                return body;
            }
            body = true;
        }
        return false;
    }

    /** Keeps {@code h.x} from being read as a paren-free call once it sits on its own line. */
    private static String protectDotted(final String expr) {
        return SourceText.isDottedIdent(expr) ? "(" + expr + ")" : expr;
    }

    /** {@code append(x, v)} as a statement → {@code x = append(x, v)}. */
    MappedLines bareAppend(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            String trimmed = line.trim();
            if (trimmed.startsWith("append(")) {
                String inner = trimmed.substring("append(".length());
                int comma = SourceText.findTopLevel(inner, pos -> inner.charAt(pos) == ',');
                String first = comma < 0 ? "" : inner.substring(0, comma).trim();
                if (SourceText.isAssignTarget(first)) {
                    line = SourceText.indentOf(line) + first + " = " + trimmed;
                }
            }
            out.add(line, in.origin(i));
        }
        return out;
    }
}
