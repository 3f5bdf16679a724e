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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Top-level declarations of one Go package directory.
 */
@Getter
public class GoPackage {

    private final String name;

    /** Plain functions and methods in file order. */
    private final List<GoFuncDecl> funcs;

    private final Map<String, GoTypeDecl> types;

    public GoPackage(final String name, final List<GoFuncDecl> funcs, final Map<String, GoTypeDecl> types) {
        this.name = name;
        this.funcs = ImmutableList.copyOf(funcs);
        this.types = ImmutableMap.copyOf(types);
    }

    public Optional<GoTypeDecl> type(final String typeName) {
        return Optional.ofNullable(types.get(typeName));
    }

    public Optional<GoFuncDecl> function(final String funcName) {
        return funcs.stream().filter(f -> !f.isMethod() && f.getName().equals(funcName)).findFirst();
    }

    public Optional<GoFuncDecl> method(final String typeName, final String methodName) {
        return funcs.stream()
                    .filter(f -> typeName.equals(f.getReceiverType()) && f.getName().equals(methodName))
                    .findFirst();
    }
}
