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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A Go type expression as written in source. Only the shape matters for bridging, so
 * function, interface and struct bodies are kept as text plus a member count.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GoType {

    public enum Kind {
        /** Predeclared or package-local identifier, e.g. {@code string}, {@code Celsius}. */
        NAME,
        /** {@code pkg.Name} from another package. */
        QUALIFIED,
        /** Named type with type arguments, e.g. {@code List[int]}. */
        INSTANTIATED,
        POINTER,
        SLICE,
        ARRAY,
        MAP,
        CHAN,
        FUNC,
        INTERFACE,
        STRUCT
    }

    private final Kind kind;

    /** Identifier for NAME/QUALIFIED/INSTANTIATED, length text for ARRAY. */
    private final String name;

    /** Element type for POINTER, SLICE, ARRAY, CHAN and the value type of MAP. */
    private final GoType elem;

    /** Fields of a STRUCT, methods of an INTERFACE. */
    private final int memberCount;

    /** Source spelling with whitespace normalized. */
    private final String text;

    static GoType name(final String name) {
        return new GoType(Kind.NAME, name, null, 0, name);
    }

    static GoType qualified(final String name) {
        return new GoType(Kind.QUALIFIED, name, null, 0, name);
    }

    static GoType instantiated(final String name, final String text) {
        return new GoType(Kind.INSTANTIATED, name, null, 0, text);
    }

    static GoType pointer(final GoType elem) {
        return new GoType(Kind.POINTER, null, elem, 0, "*" + elem.text);
    }

    static GoType slice(final GoType elem) {
        return new GoType(Kind.SLICE, null, elem, 0, "[]" + elem.text);
    }

    static GoType array(final String length, final GoType elem) {
        return new GoType(Kind.ARRAY, length, elem, 0, "[" + length + "]" + elem.text);
    }

    static GoType map(final GoType key, final GoType value) {
        return new GoType(Kind.MAP, null, value, 0, "map[" + key.text + "]" + value.text);
    }

    static GoType chan(final String direction, final GoType elem) {
        return new GoType(Kind.CHAN, null, elem, 0, direction + " " + elem.text);
    }

    static GoType func(final String text) {
        return new GoType(Kind.FUNC, null, null, 0, text);
    }

    static GoType iface(final int methods, final String text) {
        return new GoType(Kind.INTERFACE, null, null, methods, text);
    }

    static GoType struct(final int fields, final String text) {
        return new GoType(Kind.STRUCT, null, null, fields, text);
    }

    public boolean isNamed(final String identifier) {
        return kind == Kind.NAME && identifier.equals(name);
    }

    @Override
    public String toString() {
        return text;
    }
}
