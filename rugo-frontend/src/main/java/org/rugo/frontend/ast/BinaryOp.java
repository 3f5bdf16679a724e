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

package org.rugo.frontend.ast;

import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Binary operators and the runtime helper each one lowers to. {@code &&} and {@code ||}
 * short-circuit and have no helper.
 */
@Getter
@RequiredArgsConstructor
public enum BinaryOp {
    ADD("+", "rugo_add"),
    SUB("-", "rugo_sub"),
    MUL("*", "rugo_mul"),
    DIV("/", "rugo_div"),
    MOD("%", "rugo_mod"),
    EQ("==", "rugo_eq"),
    NEQ("!=", "rugo_neq"),
    LT("<", "rugo_lt"),
    GT(">", "rugo_gt"),
    LE("<=", "rugo_le"),
    GE(">=", "rugo_ge"),
    AND("&&", null),
    OR("||", null);

    private static final Map<String, BinaryOp> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryOp op : values()) {
            BY_SYMBOL.put(op.symbol, op);
        }
    }

    private final String symbol;

    private final String runtimeHelper;

    /**
     * @return the operator for a source symbol, or null when there is none
     */
    public static BinaryOp fromSymbol(final String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
