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
import lombok.Getter;

/**
 * One exported Go function and the decision whether Rugo code may call it.
 */
@Getter
public class BridgeFunction {

    /**
     * How the Go results map onto the single Rugo value of the call, after a trailing
     * {@code error} has been split off.
     */
    public enum ReturnShape {
        /** No value: the call yields nil. */
        NONE,
        SINGLE,
        /** {@code (T, bool)}: the value, or nil when the flag is false. */
        VALUE_OK,
        /** Several values, returned as an array. */
        MULTI
    }

    private final String goName;

    private final String rugoName;

    /** Fixed parameters followed by the variadic element type when {@link #variadic}. */
    private final List<TypeClassification> params;

    private final boolean variadic;

    /** Results without the trailing error. */
    private final List<TypeClassification> returns;

    private final boolean errorReturn;

    private final Tier tier;

    /** Why the function is not bridged, null when it is. */
    private final String reason;

    private final String doc;

    private BridgeFunction(final String goName, final String rugoName, final List<TypeClassification> params,
                           final boolean variadic, final List<TypeClassification> returns, final boolean errorReturn,
                           final Tier tier, final String reason, final String doc) {
        this.goName = goName;
        this.rugoName = rugoName;
        this.params = ImmutableList.copyOf(params);
        this.variadic = variadic;
        this.returns = ImmutableList.copyOf(returns);
        this.errorReturn = errorReturn;
        this.tier = tier;
        this.reason = reason;
        this.doc = doc;
    }

    public static BridgeFunction bridged(final String goName, final String rugoName,
                                         final List<TypeClassification> params, final boolean variadic,
                                         final List<TypeClassification> returns, final boolean errorReturn,
                                         final String doc) {
        Tier tier = Tier.AUTO;
        for (TypeClassification t : params) {
            tier = tier.max(t.getTier());
        }
        for (TypeClassification t : returns) {
            tier = tier.max(t.getTier());
        }
        return new BridgeFunction(goName, rugoName, params, variadic, returns, errorReturn, tier, null, doc);
    }

    public static BridgeFunction rejected(final String goName, final String rugoName, final String reason,
                                          final String doc) {
        return new BridgeFunction(goName, rugoName, ImmutableList.of(), false, ImmutableList.of(), false,
                                  Tier.BLOCKED, reason, doc);
    }

    public boolean isBridgeable() {
        return reason == null;
    }

    /**
     * @return the number of arguments a call must pass at least; exactly this many unless
     * variadic
     */
    public int fixedArity() {
        return variadic ? params.size() - 1 : params.size();
    }

    public ReturnShape returnShape() {
        switch (returns.size()) {
            case 0:
                return ReturnShape.NONE;
            case 1:
                return ReturnShape.SINGLE;
            case 2:
                if (!errorReturn && returns.get(1).getKind() == BridgeKind.BOOL && returns.get(1).getCast() == null) {
                    return ReturnShape.VALUE_OK;
                }
                return ReturnShape.MULTI;
            default:
                return ReturnShape.MULTI;
        }
    }

    /**
     * @return a Go-like signature line, e.g. {@code (string, int) string, error}
     */
    public String signature() {
        if (!isBridgeable()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (variadic && i == params.size() - 1) {
                sb.append("...");
            }
            sb.append(params.get(i).goTypeName());
        }
        sb.append(')');
        for (int i = 0; i < returns.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(returns.get(i).goTypeName());
        }
        if (errorReturn) {
            sb.append(returns.isEmpty() ? " " : ", ").append("error");
        }
        return sb.toString();
    }
}
