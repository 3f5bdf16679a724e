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

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A top-level {@code func} declaration: a package function, or a method when
 * {@link #receiverType} is set.
 */
@Getter
@RequiredArgsConstructor
public class GoFuncDecl {

    private final String name;

    /** Receiver base type name without {@code *}, null for plain functions. */
    private final String receiverType;

    private final boolean pointerReceiver;

    /** Declared with type parameters. */
    private final boolean generic;

    private final List<GoParam> params;

    private final List<GoType> results;

    /** Comment block directly above the declaration, without the {@code //} markers. */
    private final String doc;

    /** Set when the signature could not be read; params and results are then empty. */
    private final String parseError;

    public boolean isMethod() {
        return receiverType != null;
    }

    public boolean isExported() {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    public boolean isVariadic() {
        return !params.isEmpty() && params.get(params.size() - 1).isVariadic();
    }
}
