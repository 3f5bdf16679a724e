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

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Go types the bridge can move across the dynamic value boundary, with the Go expressions
 * converting an {@code interface{}} argument into the type and a result back out of it.
 */
@Getter
@RequiredArgsConstructor
public enum BridgeKind {
    STRING("string", Tier.AUTO),
    INT("int", Tier.AUTO),
    FLOAT64("float64", Tier.AUTO),
    BOOL("bool", Tier.AUTO),
    BYTE("byte", Tier.CASTABLE),
    RUNE("rune", Tier.CASTABLE),
    INT8("int8", Tier.CASTABLE),
    INT16("int16", Tier.CASTABLE),
    INT32("int32", Tier.CASTABLE),
    INT64("int64", Tier.CASTABLE),
    UINT("uint", Tier.CASTABLE),
    UINT16("uint16", Tier.CASTABLE),
    UINT32("uint32", Tier.CASTABLE),
    UINT64("uint64", Tier.CASTABLE),
    UINTPTR("uintptr", Tier.CASTABLE),
    FLOAT32("float32", Tier.CASTABLE),
    /** {@code time.Duration}, exchanged as whole milliseconds. */
    DURATION("time.Duration", Tier.CASTABLE),
    STRING_SLICE("[]string", Tier.AUTO),
    /** {@code []byte}, exchanged as a string. */
    BYTE_SLICE("[]byte", Tier.CASTABLE),
    /** Fixed-size byte array result such as a digest, returned as a string. */
    BYTE_ARRAY("[]byte", Tier.CASTABLE),
    ERROR("error", Tier.AUTO),
    /** Empty interface, passed through unchanged. */
    ANY("interface{}", Tier.AUTO),
    /** Single-field struct exchanged through its {@code String()} accessor. */
    STRING_VIEW("string", Tier.CASTABLE);

    private final String goType;

    private final Tier tier;

    /**
     * @return the Go expression converting the dynamic {@code arg} to this type
     */
    public String toGo(final String arg) {
        switch (this) {
            case STRING:
            case STRING_VIEW:
                return "rugo_to_string(" + arg + ")";
            case INT:
                return "rugo_to_int(" + arg + ")";
            case FLOAT64:
                return "rugo_to_float(" + arg + ")";
            case BOOL:
                return "rugo_to_bool(" + arg + ")";
            case RUNE:
                return "rugo_first_rune(rugo_to_string(" + arg + "))";
            case FLOAT32:
                return "float32(rugo_to_float(" + arg + "))";
            case DURATION:
                return "time.Duration(rugo_to_int(" + arg + ")) * time.Millisecond";
            case STRING_SLICE:
                return "rugo_go_to_string_slice(" + arg + ")";
            case BYTE_SLICE:
            case BYTE_ARRAY:
                return "[]byte(rugo_to_string(" + arg + "))";
            case ERROR:
                return "rugo_to_error(" + arg + ")";
            case ANY:
                return arg;
            default:
                return goType + "(rugo_to_int(" + arg + "))";
        }
    }

    /**
     * @return the Go expression boxing the Go value {@code expr} of this type
     */
    public String fromGo(final String expr) {
        switch (this) {
            case STRING:
            case FLOAT64:
            case BOOL:
            case INT:
            case ANY:
                return "interface{}(" + expr + ")";
            case RUNE:
                return "rugo_from_rune(" + expr + ")";
            case FLOAT32:
                return "interface{}(float64(" + expr + "))";
            case DURATION:
                return "interface{}(int(" + expr + " / time.Millisecond))";
            case STRING_SLICE:
                return "rugo_go_from_string_slice(" + expr + ")";
            case BYTE_SLICE:
                return "interface{}(string(" + expr + "))";
            case BYTE_ARRAY:
                return "func() interface{} { _b := " + expr + "; return interface{}(string(_b[:])) }()";
            case ERROR:
                return "rugo_from_error(" + expr + ")";
            case STRING_VIEW:
                return "interface{}(" + expr + ".String())";
            default:
                return "interface{}(int(" + expr + "))";
        }
    }

    /**
     * @return the Go import the conversions need, or null
     */
    public String requiredImport() {
        return this == DURATION ? "time" : null;
    }
}
