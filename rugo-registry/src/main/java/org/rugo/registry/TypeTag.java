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

package org.rugo.registry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Declared parameter type of a curated module function. Decides which runtime coercion the
 * generated wrapper applies to the dynamic argument.
 */
@Getter
@RequiredArgsConstructor
public enum TypeTag {
    STRING("string", "rugo_to_string"),
    INT("int", "rugo_to_int"),
    FLOAT("float", "rugo_to_float"),
    BOOL("bool", "rugo_to_bool"),
    ANY("any", null);

    private final String yamlName;

    private final String coercion;

    /**
     * @return the Go expression converting {@code argument} to this type
     */
    public String coerce(final String argument) {
        return coercion == null ? argument : coercion + "(" + argument + ")";
    }

    public static TypeTag fromYamlName(final String name) {
        for (TypeTag tag : values()) {
            if (tag.yamlName.equalsIgnoreCase(name)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("unknown argument type: " + name);
    }
}
