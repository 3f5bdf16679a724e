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
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link BridgeModule} from the Go sources of one package directory. Only exported
 * top-level functions are considered; each is classified parameter by parameter and the
 * first blocked type rejects it.
 */
@Slf4j
@RequiredArgsConstructor
public class GoBridgeIntrospector {

    private final GoSourceScanner scanner;

    private final TypeClassifier classifier;

    public GoBridgeIntrospector() {
        this(new GoSourceScanner(), new GoTypeClassifier());
    }

    /**
     * @param dir        directory holding the package's {@code .go} files
     * @param importPath path Rugo programs import the package by
     * @throws BridgeException when no function of the package can be bridged
     */
    public BridgeModule introspect(final Path dir, final String importPath) throws IOException {
        Preconditions.checkNotNull(importPath, "importPath");
        return introspect(scanner.scanDirectory(dir), importPath);
    }

    public BridgeModule introspect(final GoPackage pkg, final String importPath) {
        List<BridgeFunction> functions = new ArrayList<>();
        Map<String, String> rugoNames = new LinkedHashMap<>();
        for (GoFuncDecl decl : pkg.getFuncs()) {
            if (decl.isMethod() || !decl.isExported()) {
                continue;
            }
            String rugoName = NameConverter.toSnakeCase(decl.getName());
            BridgeFunction fn = classify(decl, rugoName, pkg);
            if (fn.isBridgeable() && rugoNames.containsKey(rugoName)) {
                fn = BridgeFunction.rejected(decl.getName(), rugoName,
                    "rugo name " + rugoName + " already used by " + rugoNames.get(rugoName), decl.getDoc());
            }
            if (fn.isBridgeable()) {
                rugoNames.put(rugoName, decl.getName());
            } else {
                log.warn("Skipping {}.{}: {}", importPath, decl.getName(), fn.getReason());
            }
            functions.add(fn);
        }

        BridgeModule module = new BridgeModule(importPath, pkg.getName(), functions);
        if (module.bridged().isEmpty()) {
            List<String> reasons = new ArrayList<>();
            for (BridgeFunction fn : functions) {
                reasons.add(fn.getGoName() + ": " + fn.getReason());
            }
            throw new BridgeException(importPath, "no bridgeable functions in " + importPath, reasons);
        }
        log.info("Bridged {} of {} exported functions from {}", module.bridged().size(), functions.size(), importPath);
        return module;
    }

    private BridgeFunction classify(final GoFuncDecl decl, final String rugoName, final GoPackage pkg) {
        String goName = decl.getName();
        if (decl.getParseError() != null) {
            return BridgeFunction.rejected(goName, rugoName, "unreadable signature: " + decl.getParseError(),
                                           decl.getDoc());
        }
        if (decl.isGeneric()) {
            return BridgeFunction.rejected(goName, rugoName, "generic function", decl.getDoc());
        }

        List<TypeClassification> params = new ArrayList<>();
        for (int i = 0; i < decl.getParams().size(); i++) {
            TypeClassification t = classifier.classify(decl.getParams().get(i).getType(), true, pkg);
            if (t.isBlocked()) {
                return BridgeFunction.rejected(goName, rugoName, "param " + i + ": " + t.getReason(), decl.getDoc());
            }
            params.add(t);
        }

        List<GoType> results = decl.getResults();
        List<TypeClassification> returns = new ArrayList<>();
        boolean errorReturn = false;
        for (int i = 0; i < results.size(); i++) {
            TypeClassification t = classifier.classify(results.get(i), false, pkg);
            if (t.isBlocked()) {
                return BridgeFunction.rejected(goName, rugoName, "return " + i + ": " + t.getReason(), decl.getDoc());
            }
            if (t.getKind() == BridgeKind.ERROR) {
                if (i != results.size() - 1) {
                    return BridgeFunction.rejected(goName, rugoName, "return " + i + ": error before the last result",
                                                   decl.getDoc());
                }
                errorReturn = true;
                continue;
            }
            returns.add(t);
        }
        return BridgeFunction.bridged(goName, rugoName, params, decl.isVariadic(), returns, errorReturn, decl.getDoc());
    }
}
