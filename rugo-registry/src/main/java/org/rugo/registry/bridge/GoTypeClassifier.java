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

import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link TypeClassifier} over Go declarations read by {@link GoSourceScanner}. Local named
 * types resolve to their underlying type; types from other packages are unknown except
 * {@code time.Duration}.
 */
public class GoTypeClassifier implements TypeClassifier {

    private static final Map<String, BridgeKind> BASIC = ImmutableMap.<String, BridgeKind>builder()
        .put("string", BridgeKind.STRING)
        .put("int", BridgeKind.INT)
        .put("float64", BridgeKind.FLOAT64)
        .put("bool", BridgeKind.BOOL)
        .put("byte", BridgeKind.BYTE)
        .put("uint8", BridgeKind.BYTE)
        .put("rune", BridgeKind.RUNE)
        .put("int8", BridgeKind.INT8)
        .put("int16", BridgeKind.INT16)
        .put("int32", BridgeKind.INT32)
        .put("int64", BridgeKind.INT64)
        .put("uint", BridgeKind.UINT)
        .put("uint16", BridgeKind.UINT16)
        .put("uint32", BridgeKind.UINT32)
        .put("uint64", BridgeKind.UINT64)
        .put("uintptr", BridgeKind.UINTPTR)
        .put("float32", BridgeKind.FLOAT32)
        .put("any", BridgeKind.ANY)
        .put("error", BridgeKind.ERROR)
        .build();

    @Override
    public TypeClassification classify(final GoType type, final boolean param, final GoPackage pkg) {
        return classify(type, param, pkg, new HashSet<>());
    }

    private TypeClassification classify(final GoType type, final boolean param, final GoPackage pkg,
                                        final Set<String> resolving) {
        switch (type.getKind()) {
            case NAME:
                return classifyName(type.getName(), param, pkg, resolving);
            case QUALIFIED:
                if ("time.Duration".equals(type.getName())) {
                    return TypeClassification.of(BridgeKind.DURATION);
                }
                return TypeClassification.blocked("external type " + type.getName());
            case INSTANTIATED:
                return TypeClassification.blocked("generic type " + type.getText());
            case POINTER:
                return TypeClassification.blocked("pointer to " + type.getElem().getText());
            case SLICE:
                return classifySlice(type, pkg);
            case ARRAY:
                if (isByte(type.getElem(), pkg)) {
                    if (param) {
                        return TypeClassification.blocked("array param type " + type.getText());
                    }
                    return TypeClassification.of(BridgeKind.BYTE_ARRAY);
                }
                return TypeClassification.blocked("array type " + type.getText());
            case MAP:
                return TypeClassification.blocked("map type");
            case CHAN:
                return TypeClassification.blocked("channel type");
            case FUNC:
                return TypeClassification.blocked(param ? "function parameter" : "function result");
            case INTERFACE:
                if (type.getMemberCount() == 0) {
                    return TypeClassification.of(BridgeKind.ANY);
                }
                return TypeClassification.blocked("interface type");
            case STRUCT:
                return TypeClassification.blocked("struct type");
            default:
                throw new IllegalStateException("unhandled Go type kind " + type.getKind());
        }
    }

    private TypeClassification classifyName(final String name, final boolean param, final GoPackage pkg,
                                            final Set<String> resolving) {
        Optional<GoTypeDecl> local = pkg.type(name);
        if (!local.isPresent()) {
            BridgeKind basic = BASIC.get(name);
            if (basic == null) {
                return TypeClassification.blocked("unsupported type " + name);
            }
            return TypeClassification.of(basic);
        }
        GoTypeDecl decl = local.get();
        if (decl.isGeneric()) {
            return TypeClassification.blocked("generic type " + name);
        }
        if (!resolving.add(name)) {
            return TypeClassification.blocked("recursive type " + name);
        }
        GoType underlying = decl.getUnderlying();
        if (underlying.getKind() == GoType.Kind.STRUCT) {
            return classifyStruct(decl, param, pkg);
        }
        TypeClassification resolved = classify(underlying, param, pkg, resolving);
        if (decl.isAlias() || resolved.isBlocked()) {
            return resolved;
        }
        if (resolved.getKind() == BridgeKind.STRING_VIEW) {
            return TypeClassification.blocked("struct type " + pkg.getName() + "." + name);
        }
        return TypeClassification.named(resolved, pkg.getName() + "." + name);
    }

    /**
     * A struct crosses the boundary only as a string view: one field and a
     * {@code String() string} method, plus a {@code New<Name>...(string)} constructor when
     * it is a parameter.
     */
    private TypeClassification classifyStruct(final GoTypeDecl decl, final boolean param, final GoPackage pkg) {
        String name = decl.getName();
        String qualified = pkg.getName() + "." + name;
        if (decl.getUnderlying().getMemberCount() != 1 || !hasStringAccessor(name, pkg)) {
            return TypeClassification.blocked("struct type " + qualified);
        }
        if (!param) {
            return TypeClassification.stringView(qualified, null, false);
        }
        for (GoFuncDecl fn : pkg.getFuncs()) {
            if (fn.isMethod() || !fn.getName().startsWith("New" + name) || fn.getParseError() != null) {
                continue;
            }
            if (fn.getParams().size() != 1 || !fn.getParams().get(0).getType().isNamed("string")
                || fn.getParams().get(0).isVariadic() || fn.getResults().size() != 1) {
                continue;
            }
            GoType result = fn.getResults().get(0);
            if (result.isNamed(name)) {
                return TypeClassification.stringView(qualified, pkg.getName() + "." + fn.getName(), false);
            }
            if (result.getKind() == GoType.Kind.POINTER && result.getElem().isNamed(name)) {
                return TypeClassification.stringView(qualified, pkg.getName() + "." + fn.getName(), true);
            }
        }
        return TypeClassification.blocked("struct type " + qualified + " has no New" + name + "(string) constructor");
    }

    private static boolean hasStringAccessor(final String typeName, final GoPackage pkg) {
        return pkg.method(typeName, "String")
                  .filter(m -> m.getParams().isEmpty())
                  .map(GoFuncDecl::getResults)
                  .filter(results -> results.size() == 1 && results.get(0).isNamed("string"))
                  .isPresent();
    }

    private TypeClassification classifySlice(final GoType type, final GoPackage pkg) {
        GoType elem = type.getElem();
        if (elem.isNamed("string")) {
            return TypeClassification.of(BridgeKind.STRING_SLICE);
        }
        if (isByte(elem, pkg)) {
            return TypeClassification.of(BridgeKind.BYTE_SLICE);
        }
        return TypeClassification.blocked("unsupported slice type " + type.getText());
    }

    private static boolean isByte(final GoType type, final GoPackage pkg) {
        return (type.isNamed("byte") || type.isNamed("uint8")) && !pkg.type(type.getName()).isPresent();
    }
}
