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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * A Go package made callable from Rugo through {@code import "path"}.
 */
@Getter
public class BridgeModule {

    private final String importPath;

    /** Name from the Go package clause, used to qualify calls. */
    private final String packageName;

    /** Every exported function, bridged or not, in source order. */
    private final List<BridgeFunction> functions;

    public BridgeModule(final String importPath, final String packageName, final List<BridgeFunction> functions) {
        this.importPath = importPath;
        this.packageName = packageName;
        this.functions = ImmutableList.copyOf(functions);
    }

    public List<BridgeFunction> bridged() {
        return functions.stream().filter(BridgeFunction::isBridgeable).collect(Collectors.toList());
    }

    /**
     * Look up a bridged function by its Rugo name or its Go name.
     */
    public Optional<BridgeFunction> function(final String name) {
        return functions.stream()
                        .filter(BridgeFunction::isBridgeable)
                        .filter(f -> f.getRugoName().equals(name) || f.getGoName().equals(name))
                        .findFirst();
    }

    /**
     * @return the namespace Rugo code uses when the import has no alias: the last path
     * segment, skipping a major version suffix such as {@code /v2}
     */
    public String defaultAlias() {
        return defaultAlias(importPath);
    }

    public static String defaultAlias(final String importPath) {
        String[] parts = importPath.split("/");
        String last = parts[parts.length - 1];
        if (parts.length >= 2 && last.length() >= 2 && last.charAt(0) == 'v' && Character.isDigit(last.charAt(1))) {
            return parts[parts.length - 2];
        }
        return last;
    }

    /** Generated wrapper for {@code fn} under the alias the program imported it as. */
    public static String wrapperName(final String alias, final BridgeFunction fn) {
        return "rugo_bridge_" + alias + "_" + fn.getRugoName();
    }
}
