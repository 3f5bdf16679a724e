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

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of classifying one Go parameter or result type.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class TypeClassification {

    /** Null when blocked. */
    private final BridgeKind kind;

    private final Tier tier;

    /** Why the type is blocked, null otherwise. */
    private final String reason;

    /** Qualified named type wrapped around the kind's conversion, e.g. {@code temp.Celsius}. */
    private final String cast;

    /** {@code pkg.NewName} building a string view parameter, null for results. */
    private final String viewConstructor;

    /** The view constructor returns a pointer that must be dereferenced. */
    private final boolean viewPointer;

    public static TypeClassification of(final BridgeKind kind) {
        return new TypeClassification(kind, kind.getTier(), null, null, null, false);
    }

    public static TypeClassification blocked(final String reason) {
        return new TypeClassification(null, Tier.BLOCKED, reason, null, null, false);
    }

    /**
     * A named type whose underlying type converts as {@code underlying}.
     */
    public static TypeClassification named(final TypeClassification underlying, final String cast) {
        return new TypeClassification(underlying.kind, underlying.tier.max(Tier.CASTABLE), null, cast, null, false);
    }

    public static TypeClassification stringView(final String typeName, final String constructor, final boolean pointer) {
        return new TypeClassification(BridgeKind.STRING_VIEW, Tier.CASTABLE, null, typeName, constructor, pointer);
    }

    public boolean isBlocked() {
        return tier == Tier.BLOCKED;
    }

    /**
     * @return Go spelling of the declared type, as used in generated variable declarations
     */
    public String goTypeName() {
        return cast != null ? cast : kind.getGoType();
    }

    /**
     * @return the Go expression converting the dynamic {@code arg} to the declared type
     */
    public String toGo(final String arg) {
        String converted = kind.toGo(arg);
        if (kind == BridgeKind.STRING_VIEW) {
            return (viewPointer ? "*" : "") + viewConstructor + "(" + converted + ")";
        }
        return cast == null ? converted : cast + "(" + converted + ")";
    }

    /**
     * @return the Go expression boxing the declared-type value {@code expr}
     */
    public String fromGo(final String expr) {
        if (cast == null || kind == BridgeKind.STRING_VIEW || kind == BridgeKind.ANY) {
            return kind.fromGo(expr);
        }
        return kind.fromGo(kind.getGoType() + "(" + expr + ")");
    }

    @Override
    public String toString() {
        return isBlocked() ? "blocked: " + reason : goTypeName();
    }
}
