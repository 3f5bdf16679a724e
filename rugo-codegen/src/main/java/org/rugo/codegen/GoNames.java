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

package org.rugo.codegen;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Go spelling of Rugo identifiers and literals.
 */
final class GoNames {

    private static final Set<String> RESERVED = ImmutableSet.of(
        "break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for",
        "func", "go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select",
        "struct", "switch", "type", "var",
        "any", "bool", "byte", "comparable", "complex64", "complex128", "error", "float32", "float64",
        "int", "int8", "int16", "int32", "int64", "rune", "string", "uint", "uint8", "uint16", "uint32",
        "uint64", "uintptr", "true", "false", "iota", "nil",
        "append", "cap", "clear", "close", "complex", "copy", "delete", "imag", "len", "make", "max",
        "min", "new", "panic", "print", "println", "real", "recover", "main", "init"
    );

    private GoNames() {
    }

    /**
     * @param packageNames identifiers of the packages the generated file imports
     * @return a Go identifier for a Rugo variable or parameter that cannot shadow a keyword, a
     * predeclared name, an imported package or a runtime helper
     */
    static String local(final String name, final Set<String> packageNames) {
        if (name.startsWith("_") || name.startsWith("rugo")) {
            return "v" + name;
        }
        if (RESERVED.contains(name) || packageNames.contains(name)) {
            return name + "_";
        }
        return name;
    }

    /**
     * @return {@code s} as an interpreted Go string literal
     */
    static String quote(final String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else if (Character.isSurrogate(c)) {
                        int cp = s.codePointAt(i);
                        if (Character.isValidCodePoint(cp) && Character.charCount(cp) == 2) {
                            sb.appendCodePoint(cp);
                            i++;
                        } else {
                            sb.append("\\uFFFD");
                        }
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }
}
