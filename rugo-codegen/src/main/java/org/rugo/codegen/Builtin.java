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

import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Global functions every program can call, and the runtime helper each maps to. The
 * double-underscore names are produced by the preprocessor.
 */
@Getter
@RequiredArgsConstructor
enum Builtin {
    PUTS("puts", "rugo_puts", 0, -1, true),
    PRINT("print", "rugo_print", 0, -1, true),
    LEN("len", "rugo_len", 1, 1, true),
    APPEND("append", "rugo_append", 2, 2, true),
    RAISE("raise", "rugo_raise", 1, 1, true),
    TYPE_OF("type_of", "rugo_type_of", 1, 1, false),
    EXIT("exit", "rugo_exit", 0, 1, true),
    SHELL("__shell__", "rugo_shell", 1, 1, true),
    CAPTURE("__capture__", "rugo_capture", 1, 1, true),
    TO_S("__to_s", "rugo_to_s", 1, 1, true);

    private static final Map<String, Builtin> BY_NAME = new HashMap<>();

    static {
        for (Builtin b : values()) {
            BY_NAME.put(b.rugoName, b);
        }
    }

    private final String rugoName;

    private final String helper;

    private final int minArgs;

    /** -1 when unbounded. */
    private final int maxArgs;

    /** The helper already returns {@code interface{}}. */
    private final boolean boxed;

    static Builtin of(final String name) {
        return BY_NAME.get(name);
    }

    /**
     * @return the arity error for a call with {@code given} arguments, or null when it is accepted
     */
    String arityError(final int given) {
        if (given >= minArgs && (maxArgs < 0 || given <= maxArgs)) {
            return null;
        }
        if (minArgs == maxArgs) {
            return rugoName + "() takes " + minArgs + " argument(s) but " + given + " given";
        }
        return rugoName + "() takes " + minArgs + " to " + maxArgs + " argument(s) but " + given + " given";
    }
}
