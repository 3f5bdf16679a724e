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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Rewrites paren-free calls and falls back to shell execution for unknown commands, one
 * line at a time.
 *
 * <p>Name resolution is positional. At top level a function is callable only once its
 * {@code def} line has been processed; inside a function body every function of the unit is
 * callable, so bodies may reference functions defined further down. Block depth is tracked
 * with an explicit stack of the keyword openers, popped on {@code end}.
 */
@Slf4j
final class CallResolver {

    private static final Set<String> INLINE_OPENERS = ImmutableSet.of("fn", "spawn", "parallel", "try");

    private static final Set<String> END = ImmutableSet.of("end");

    private final Set<String> allFunctions;

    private final Set<String> topLevelFunctions = new HashSet<>();

    private final Set<String> knownVars = new HashSet<>();

    private final Deque<String> blocks = new ArrayDeque<>();

    private int defDepth;

    CallResolver(final Set<String> allFunctions) {
        this.allFunctions = allFunctions;
    }

    /**
     * Collect every {@code def name} of the unit.
     */
    static Set<String> scanFunctionNames(final MappedLines in) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < in.size(); i++) {
            String trimmed = in.text(i).trim();
            if (trimmed.startsWith("def ")) {
                String name = SourceText.firstToken(trimmed.substring(4).trim())[0];
                int paren = name.indexOf('(');
                name = paren >= 0 ? name.substring(0, paren) : name;
                if (SourceText.isIdent(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    MappedLines resolve(final MappedLines in) {
        MappedLines out = new MappedLines();
        for (int i = 0; i < in.size(); i++) {
            String line = in.text(i);
            String trimmed = line.trim();
            String first = SourceText.firstToken(trimmed)[0];
            trackVariables(trimmed, first);
            Set<String> callable = defDepth > 0 ? allFunctions : topLevelFunctions;
            String processed = resolveLine(line, callable);
            if (!processed.equals(line) && log.isDebugEnabled()) {
                log.debug("line {}: '{}' -> '{}'", in.origin(i), trimmed, processed.trim());
            }
            out.add(processed, in.origin(i));
            trackBlocks(trimmed, first);
        }
        return out;
    }

    private void trackVariables(final String trimmed, final String first) {
        if (SourceText.isIdent(first)) {
            String rest = trimmed.substring(first.length()).trim();
            if (rest.startsWith("=") && !rest.startsWith("==") && !rest.startsWith("=>")) {
                knownVars.add(first);
            }
        }
        if (first.equals("def")) {
            addParams(trimmed, trimmed.indexOf('('));
        } else if (first.equals("for")) {
            String vars = trimmed.substring(3).trim();
            int in = vars.indexOf(" in ");
            if (in >= 0) {
                for (String v : vars.substring(0, in).split(",")) {
                    if (SourceText.isIdent(v.trim())) {
                        knownVars.add(v.trim());
                    }
                }
            }
        } else if (first.equals("or")) {
            String var = trimmed.substring(2).trim();
            if (SourceText.isIdent(var)) {
                knownVars.add(var);
            }
        }
        int from = 0;
        while (true) {
            int fn = trimmed.indexOf("fn(", from);
            if (fn < 0) {
                break;
            }
            if (fn == 0 || !Character.isLetterOrDigit(trimmed.charAt(fn - 1)) && trimmed.charAt(fn - 1) != '_') {
                addParams(trimmed, fn + 2);
            }
            from = fn + 3;
        }
    }

    private void addParams(final String trimmed, final int open) {
        if (open < 0) {
            return;
        }
        int close = trimmed.indexOf(')', open);
        if (close < 0) {
            return;
        }
        for (String p : trimmed.substring(open + 1, close).split(",")) {
            String param = p.trim();
            int eq = param.indexOf('=');
            if (eq >= 0) {
                param = param.substring(0, eq).trim();
            }
            if (SourceText.isIdent(param)) {
                knownVars.add(param);
            }
        }
    }

    private void trackBlocks(final String trimmed, final String first) {
        if (first.equals("def")) {
            blocks.push(first);
            defDepth++;
            String name = SourceText.firstToken(trimmed.substring(3).trim())[0];
            int paren = name.indexOf('(');
            name = paren >= 0 ? name.substring(0, paren) : name;
            if (SourceText.isIdent(name)) {
                topLevelFunctions.add(name);
            }
            return;
        }
        if (SourceText.BLOCK_OPENERS.contains(first)) {
            blocks.push(first);
            return;
        }
        // inline openers such as "x = spawn" or "f = fn(a)", net of any "end" on the same line
        int opened = SourceText.countWords(trimmed, INLINE_OPENERS) - SourceText.countWords(trimmed, END);
        for (int i = 0; i < opened; i++) {
            blocks.push("fn");
        }
        if (first.equals("end") || first.startsWith("end") && !SourceText.isIdent(first)) {
            for (int i = 0; i < Math.max(1, -opened) && !blocks.isEmpty(); i++) {
                if (blocks.pop().equals("def")) {
                    defDepth--;
                }
            }
        }
    }

    String resolveLine(final String line, final Set<String> callable) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return line;
        }
        String indent = SourceText.indentOf(line);
        String[] split = SourceText.firstToken(trimmed);
        String first = split[0];
        String rest = split[1].trim();
        if (first.isEmpty() || SourceText.KEYWORDS.contains(first)) {
            return line;
        }

        if (!SourceText.isIdent(first)) {
            if (SourceText.isDottedIdent(first)) {
                String object = first.substring(0, first.indexOf('.'));
                if (knownVars.contains(object)) {
                    return line;
                }
                if (rest.isEmpty()) {
                    return indent + first + "()";
                }
                if (rest.charAt(0) != '(' && rest.charAt(0) != '=' && !SourceText.isOperatorStart(rest.charAt(0))) {
                    return indent + first + "(" + rest + ")";
                }
            }
            if (SourceText.isHyphenatedCommand(first) || SourceText.isPathCommand(first)) {
                return indent + shell(trimmed);
            }
            return line;
        }

        if (rest.startsWith("=") && !rest.startsWith("==") && !rest.startsWith("=>")) {
            return resolveAssignment(line, indent, first, rest.substring(1).trim(), callable);
        }
        if (!rest.isEmpty() && (rest.charAt(0) == '(' || rest.charAt(0) == '.' || rest.charAt(0) == '[')) {
            return line;
        }
        if (!rest.isEmpty() && SourceText.isOperatorStart(rest.charAt(0))) {
            if (isKnown(first, callable) || knownVars.contains(first)) {
                return line;
            }
            return indent + shell(trimmed);
        }
        if (rest.isEmpty()) {
            if (knownVars.contains(first)) {
                return line;
            }
            if (isKnown(first, callable)) {
                return indent + first + "()";
            }
            return indent + shell(first);
        }
        if (isKnown(first, callable)) {
            return indent + first + "(" + rest + ")";
        }
        return indent + shell(trimmed);
    }

    private String resolveAssignment(final String line, final String indent, final String target,
                                     final String rhs, final Set<String> callable) {
        String[] split = SourceText.firstToken(rhs);
        String rhsFirst = split[0];
        String rhsRest = split[1].trim();
        if (!rhsFirst.isEmpty() && SourceText.isIdent(rhsFirst) && !SourceText.KEYWORDS.contains(rhsFirst)
            && !isKnown(rhsFirst, callable) && !knownVars.contains(rhsFirst) && !rhsRest.isEmpty()) {
            char next = rhsRest.charAt(0);
            if (SourceText.isOperatorStart(next) || next != '(' && next != '[' && next != '.') {
                return indent + target + " = " + shell(rhs);
            }
        }
        if (SourceText.isPathCommand(rhsFirst) || SourceText.isHyphenatedCommand(rhsFirst)) {
            return indent + target + " = " + shell(rhs);
        }
        return line;
    }

    private static boolean isKnown(final String name, final Set<String> callable) {
        return SourceText.BUILTINS.contains(name) || callable.contains(name);
    }

    private static String shell(final String command) {
        return "__shell__(\"" + SourceText.shellEscapeKeepingInterpolation(command) + "\")";
    }
}
