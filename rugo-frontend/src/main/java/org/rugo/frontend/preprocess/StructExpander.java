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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.rugo.frontend.ast.StructDecl;

/**
 * Expands struct declarations into constructor functions and struct methods into plain
 * functions taking {@code self}:
 * <pre>
 *   struct Dog            def Dog(name, breed)
 *     name          →       return {"__type__" =&gt; "Dog", "name" =&gt; name, "breed" =&gt; breed}
 *     breed               end
 *   end
 *
 *   def Dog.bark(loud)  → def bark(self, loud)
 * </pre>
 * When a unit declares exactly one struct, a {@code new(...)} alias of its constructor is
 * also emitted.
 */
final class StructExpander {

    private final List<StructDecl> structs = new ArrayList<>();

    MappedLines expand(final MappedLines in) {
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < in.size(); i++) {
            String name = structName(in.text(i).trim());
            if (name != null) {
                names.add(name);
            }
        }
        boolean single = names.size() == 1;

        MappedLines out = new MappedLines();
        int i = 0;
        while (i < in.size()) {
            String trimmed = in.text(i).trim();
            String name = structName(trimmed);
            int origin = in.origin(i);
            if (name != null) {
                List<String> fields = new ArrayList<>();
                i++;
                while (i < in.size()) {
                    String field = in.text(i).trim();
                    i++;
                    if (field.equals("end")) {
                        break;
                    }
                    if (SourceText.isIdent(field)) {
                        fields.add(field);
                    }
                }
                structs.add(new StructDecl(name, ImmutableList.copyOf(fields), origin));
                String params = String.join(", ", fields);
                String hash = constructorHash(name, fields);
                emitFunction(out, name, params, hash, origin);
                if (single) {
                    emitFunction(out, "new", params, hash, origin);
                }
                continue;
            }
            String method = methodDef(trimmed, names);
            out.add(method == null ? in.text(i) : SourceText.indentOf(in.text(i)) + method, origin);
            i++;
        }
        return out;
    }

    List<StructDecl> getStructs() {
        return ImmutableList.copyOf(structs);
    }

    private static String structName(final String trimmed) {
        if (!trimmed.startsWith("struct ")) {
            return null;
        }
        String name = trimmed.substring("struct ".length()).trim();
        return SourceText.isIdent(name) ? name : null;
    }

    private static String constructorHash(final String name, final List<String> fields) {
        StringBuilder sb = new StringBuilder("{\"__type__\" => \"").append(name).append('"');
        for (String field : fields) {
            sb.append(", \"").append(field).append("\" => ").append(field);
        }
        return sb.append('}').toString();
    }

    private static void emitFunction(final MappedLines out, final String name, final String params,
                                     final String hash, final int origin) {
        out.add("def " + name + "(" + params + ")", origin);
        out.add("  return " + hash, origin);
        out.add("end", origin);
    }

    /**
     * @return the rewritten {@code def} line for {@code def Struct.method(...)}, or null
     */
    private static String methodDef(final String trimmed, final Set<String> structNames) {
        if (!trimmed.startsWith("def ")) {
            return null;
        }
        String rest = trimmed.substring(4).trim();
        int dot = rest.indexOf('.');
        if (dot <= 0 || !structNames.contains(rest.substring(0, dot))) {
            return null;
        }
        String afterDot = rest.substring(dot + 1);
        int paren = afterDot.indexOf('(');
        String method = paren >= 0 ? afterDot.substring(0, paren).trim() : afterDot.trim();
        if (!SourceText.isIdent(method)) {
            return null;
        }
        String params = "";
        if (paren >= 0) {
            int close = afterDot.indexOf(')', paren);
            params = (close >= 0 ? afterDot.substring(paren + 1, close) : afterDot.substring(paren + 1)).trim();
        }
        return "def " + method + "(" + (params.isEmpty() ? "self" : "self, " + params) + ")";
    }
}
