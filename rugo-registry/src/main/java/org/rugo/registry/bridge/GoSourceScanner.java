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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the top-level declarations of Go source files without a Go toolchain. Function
 * bodies are skipped by brace matching after comments and literal contents are blanked, so
 * only declaration syntax has to be understood.
 */
@Slf4j
public class GoSourceScanner {

    private static final Set<String> TYPE_KEYWORDS = ImmutableSet.of("chan", "func", "map", "interface", "struct");

    /**
     * Scan every {@code *.go} file of {@code dir} except tests.
     *
     * @throws BridgeException when the directory holds no Go files or more than one package
     */
    public GoPackage scanDirectory(final Path dir) throws IOException {
        Preconditions.checkArgument(Files.isDirectory(dir), "not a directory: %s", dir);
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".go"))
                           .filter(p -> !p.getFileName().toString().endsWith("_test.go"))
                           .sorted()
                           .collect(Collectors.toList());
        }
        if (files.isEmpty()) {
            throw new BridgeException(dir.toString(), "no Go source files in " + dir, ImmutableList.of());
        }

        String packageName = null;
        List<GoFuncDecl> funcs = new ArrayList<>();
        Map<String, GoTypeDecl> types = new LinkedHashMap<>();
        for (Path file : files) {
            GoPackage scanned = scanSource(Files.readString(file, StandardCharsets.UTF_8));
            if (packageName != null && !packageName.equals(scanned.getName())) {
                throw new BridgeException(dir.toString(), "found packages " + packageName + " and "
                    + scanned.getName() + " in " + dir, ImmutableList.of());
            }
            packageName = scanned.getName();
            funcs.addAll(scanned.getFuncs());
            types.putAll(scanned.getTypes());
            log.debug("Scanned {}: {} funcs, {} types", file.getFileName(), scanned.getFuncs().size(),
                      scanned.getTypes().size());
        }
        return new GoPackage(packageName, funcs, types);
    }

    /**
     * Scan one Go source file.
     */
    public GoPackage scanSource(final String source) {
        String src = source.replace("\r\n", "\n");
        String clean = blank(src);
        String packageName = "";
        List<GoFuncDecl> funcs = new ArrayList<>();
        Map<String, GoTypeDecl> types = new LinkedHashMap<>();

        int i = 0;
        while (i < clean.length()) {
            char c = clean.charAt(i);
            if (Character.isWhitespace(c) || c == ';') {
                i++;
                continue;
            }
            String word = identAt(clean, i);
            switch (word) {
                case "package":
                    int nameStart = skipBlanks(clean, i + word.length());
                    packageName = identAt(clean, nameStart);
                    i = endOfStatement(clean, nameStart);
                    break;
                case "func":
                    i = scanFunc(src, clean, i, funcs);
                    break;
                case "type":
                    i = scanTypes(clean, i + word.length(), types);
                    break;
                default:
                    // import, var, const
                    i = endOfStatement(clean, i + Math.max(1, word.length()));
                    break;
            }
        }
        return new GoPackage(packageName, funcs, types);
    }

    // ---- functions ----

    private int scanFunc(final String src, final String clean, final int start, final List<GoFuncDecl> out) {
        String doc = docAbove(src, start);
        int j = skipWhitespace(clean, start + "func".length());
        String receiverType = null;
        boolean pointerReceiver = false;
        String name = "";
        try {
            if (charAt(clean, j) == '(') {
                int close = new GoTypeParser(clean, j).matching(j, '(', ')');
                String receiver = clean.substring(j + 1, close).trim();
                String typeText = receiver.contains(" ") ? receiver.substring(receiver.lastIndexOf(' ') + 1) : receiver;
                pointerReceiver = typeText.startsWith("*");
                receiverType = stripTypeArgs(typeText.replace("*", ""));
                j = skipWhitespace(clean, close + 1);
            }
            name = identAt(clean, j);
            j = skipWhitespace(clean, j + name.length());
            boolean generic = false;
            if (charAt(clean, j) == '[') {
                generic = true;
                j = skipWhitespace(clean, new GoTypeParser(clean, j).matching(j, '[', ']') + 1);
            }
            if (charAt(clean, j) != '(') {
                throw new IllegalArgumentException("expected parameter list");
            }
            int paramsClose = new GoTypeParser(clean, j).matching(j, '(', ')');
            List<GoParam> params = parseParams(clean.substring(j + 1, paramsClose));
            j = skipBlanks(clean, paramsClose + 1);

            List<GoType> results = new ArrayList<>();
            char next = charAt(clean, j);
            if (next == '(') {
                int close = new GoTypeParser(clean, j).matching(j, '(', ')');
                for (GoParam result : parseParams(clean.substring(j + 1, close))) {
                    results.add(result.getType());
                }
                j = close + 1;
            } else if (next != '{' && next != '\n' && next != 0) {
                GoTypeParser parser = new GoTypeParser(clean, j);
                results.add(parser.parseType());
                j = parser.position();
            }
            j = skipBlanks(clean, j);
            if (charAt(clean, j) == '{') {
                j = new GoTypeParser(clean, j).matching(j, '{', '}') + 1;
            }
            out.add(new GoFuncDecl(name, receiverType, pointerReceiver, generic, params, results, doc, null));
            return j;
        } catch (IllegalArgumentException e) {
            log.debug("Cannot read signature of func {}: {}", name, e.getMessage());
            out.add(new GoFuncDecl(name, receiverType, pointerReceiver, false, Collections.emptyList(),
                                   Collections.emptyList(), doc, e.getMessage()));
            return endOfStatement(clean, start + "func".length());
        }
    }

    /**
     * Parse a parameter or result list body, expanding grouped names such as
     * {@code a, b string}.
     */
    static List<GoParam> parseParams(final String text) {
        List<String> parts = new ArrayList<>();
        for (String part : splitTopLevel(text, ',')) {
            if (!part.trim().isEmpty()) {
                parts.add(part.trim().replaceAll("\\s+", " "));
            }
        }
        boolean named = parts.stream().anyMatch(GoSourceScanner::hasNameAndType);
        List<GoParam> params = new ArrayList<>();
        if (!named) {
            for (String part : parts) {
                params.add(param("", part));
            }
            return params;
        }
        GoParam pending = null;
        for (int i = parts.size() - 1; i >= 0; i--) {
            String part = parts.get(i);
            if (hasNameAndType(part)) {
                int space = part.indexOf(' ');
                pending = param(part.substring(0, space), part.substring(space + 1).trim());
                params.add(pending);
            } else {
                if (pending == null) {
                    throw new IllegalArgumentException("parameter " + part + " has no type");
                }
                params.add(new GoParam(part, pending.getType(), pending.isVariadic()));
            }
        }
        Collections.reverse(params);
        return params;
    }

    private static GoParam param(final String name, final String typeText) {
        if (typeText.startsWith("...")) {
            return new GoParam(name, GoTypeParser.parse(typeText.substring(3)), true);
        }
        return new GoParam(name, GoTypeParser.parse(typeText), false);
    }

    private static boolean hasNameAndType(final String part) {
        String first = identAt(part, 0);
        return !first.isEmpty() && !TYPE_KEYWORDS.contains(first)
            && first.length() < part.length() && part.charAt(first.length()) == ' ';
    }

    // ---- types ----

    private int scanTypes(final String clean, final int from, final Map<String, GoTypeDecl> out) {
        int j = skipWhitespace(clean, from);
        if (charAt(clean, j) == '(') {
            int close = new GoTypeParser(clean, j).matching(j, '(', ')');
            for (String spec : splitTopLevel(clean.substring(j + 1, close), '\n')) {
                typeSpec(spec, out);
            }
            return close + 1;
        }
        int end = endOfStatement(clean, j);
        typeSpec(clean.substring(j, end), out);
        return end;
    }

    private void typeSpec(final String spec, final Map<String, GoTypeDecl> out) {
        String text = spec.trim();
        String name = identAt(text, 0);
        if (name.isEmpty()) {
            return;
        }
        String rest = text.substring(name.length()).trim();
        boolean generic = false;
        if (rest.startsWith("[")) {
            int close = new GoTypeParser(rest, 0).matching(0, '[', ']');
            String inside = rest.substring(1, close).trim();
            if (inside.contains(" ")) {
                generic = true;
                rest = rest.substring(close + 1).trim();
            }
        }
        boolean alias = rest.startsWith("=");
        if (alias) {
            rest = rest.substring(1).trim();
        }
        try {
            out.put(name, new GoTypeDecl(name, GoTypeParser.parse(rest), alias, generic));
        } catch (IllegalArgumentException e) {
            log.debug("Skipping type {}: {}", name, e.getMessage());
        }
    }

    // ---- text helpers ----

    /**
     * Replace comments and the contents of string, raw string and rune literals with spaces,
     * keeping newlines and every offset.
     */
    static String blank(final String src) {
        StringBuilder sb = new StringBuilder(src);
        int i = 0;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (src.startsWith("//", i)) {
                while (i < src.length() && src.charAt(i) != '\n') {
                    sb.setCharAt(i++, ' ');
                }
            } else if (src.startsWith("/*", i)) {
                int end = src.indexOf("*/", i + 2);
                end = end < 0 ? src.length() : end + 2;
                for (; i < end; i++) {
                    if (src.charAt(i) != '\n') {
                        sb.setCharAt(i, ' ');
                    }
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                i++;
                while (i < src.length() && src.charAt(i) != c) {
                    if (c != '`' && src.charAt(i) == '\n') {
                        break;
                    }
                    if (c != '`' && src.charAt(i) == '\\' && i + 1 < src.length()) {
                        sb.setCharAt(i++, ' ');
                    }
                    if (src.charAt(i) != '\n') {
                        sb.setCharAt(i, ' ');
                    }
                    i++;
                }
                i++;
            } else {
                i++;
            }
        }
        return sb.toString();
    }

    private static String docAbove(final String src, final int declStart) {
        int lineStart = src.lastIndexOf('\n', declStart - 1) + 1;
        List<String> lines = new ArrayList<>();
        int end = lineStart - 1;
        while (end > 0) {
            int start = src.lastIndexOf('\n', end - 1) + 1;
            String line = src.substring(start, end).trim();
            if (!line.startsWith("//")) {
                break;
            }
            if (!line.startsWith("//go:")) {
                lines.add(0, line.substring(2).trim());
            }
            end = start - 1;
        }
        return lines.isEmpty() ? null : String.join(" ", lines);
    }

    /**
     * @return the index just past the newline ending the statement at {@code from}, treating
     * newlines inside brackets as part of it
     */
    private static int endOfStatement(final String s, final int from) {
        int depth = 0;
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '\n' && depth == 0) {
                return i + 1;
            }
        }
        return s.length();
    }

    static List<String> splitTopLevel(final String s, final char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    private static String stripTypeArgs(final String typeName) {
        int bracket = typeName.indexOf('[');
        return bracket < 0 ? typeName : typeName.substring(0, bracket);
    }

    private static String identAt(final String s, final int from) {
        int i = from;
        while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
            i++;
        }
        return s.substring(from, i);
    }

    private static char charAt(final String s, final int i) {
        return i < s.length() ? s.charAt(i) : 0;
    }

    private static int skipWhitespace(final String s, final int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int skipBlanks(final String s, final int from) {
        int i = from;
        while (i < s.length() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }
}
