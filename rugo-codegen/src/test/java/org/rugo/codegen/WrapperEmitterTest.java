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

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.rugo.registry.CuratedModule;
import org.rugo.registry.CuratedModuleLoader;
import org.rugo.registry.bridge.BridgeFunction;
import org.rugo.registry.bridge.BridgeKind;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.TypeClassification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WrapperEmitterTest {

    private static final TypeClassification STRING = TypeClassification.of(BridgeKind.STRING);

    private static final TypeClassification INT = TypeClassification.of(BridgeKind.INT);

    private static final TypeClassification BOOL = TypeClassification.of(BridgeKind.BOOL);

    @Test
    void curatedWrapperCoercesEachArgument() {
        CuratedModule str = new CuratedModuleLoader().load("str");
        String wrapper = WrapperEmitter.curated(str, str.function("upper").get());
        assertEquals(
            "func rugo_str_upper(args ...interface{}) interface{} {\n"
                + "\tif len(args) < 1 {\n"
                + "\t\trugo_fail(\"str.upper: requires at least 1 argument(s)\")\n"
                + "\t}\n"
                + "\treturn _str.Upper(rugo_to_string(args[0]))\n"
                + "}\n",
            wrapper);
    }

    @Test
    void bridgeWrapperWithSingleResult() {
        BridgeFunction repeat = BridgeFunction.bridged("Repeat", "repeat", ImmutableList.of(STRING, INT), false,
                                                       ImmutableList.of(STRING), false, null);
        BridgeModule module = new BridgeModule("example.com/strutil", "strutil", ImmutableList.of(repeat));
        String wrapper = WrapperEmitter.bridge("strutil", module, repeat);
        assertEquals(
            "func rugo_bridge_strutil_repeat(args ...interface{}) interface{} {\n"
                + "\tif len(args) != 2 {\n"
                + "\t\trugo_fail(\"strutil.repeat() takes 2 argument(s) but %d given\", len(args))\n"
                + "\t}\n"
                + "\t_r0 := strutil.Repeat(rugo_to_string(args[0]), rugo_to_int(args[1]))\n"
                + "\treturn interface{}(_r0)\n"
                + "}\n",
            wrapper);
    }

    @Test
    void bridgeWrapperRaisesGoErrors() {
        BridgeFunction parse = BridgeFunction.bridged("Parse", "parse", ImmutableList.of(STRING), false,
                                                      ImmutableList.of(INT), true, null);
        BridgeModule module = new BridgeModule("example.com/num", "num", ImmutableList.of(parse));
        String wrapper = WrapperEmitter.bridge("num", module, parse);
        assertTrue(wrapper.contains("\t_r0, _err := num.Parse(rugo_to_string(args[0]))\n"), wrapper);
        assertTrue(wrapper.contains("\t\tpanic(rugo_bridge_err(\"num.parse\", _err))\n"), wrapper);
    }

    @Test
    void bridgeWrapperCollectsVariadicTail() {
        BridgeFunction join = BridgeFunction.bridged("Join", "join", ImmutableList.of(STRING, STRING), true,
                                                     ImmutableList.of(STRING), false, null);
        BridgeModule module = new BridgeModule("example.com/strutil", "strutil", ImmutableList.of(join));
        String wrapper = WrapperEmitter.bridge("strutil", module, join);
        assertTrue(wrapper.contains("takes at least 1 argument(s) but %d given"), wrapper);
        assertTrue(wrapper.contains("\t_va := make([]string, 0, len(args)-1)\n"), wrapper);
        assertTrue(wrapper.contains("\t\t_va = append(_va, rugo_to_string(_a))\n"), wrapper);
        assertTrue(wrapper.contains("strutil.Join(rugo_to_string(args[0]), _va...)"), wrapper);
    }

    @Test
    void bridgeWrapperMapsCommaOkToNil() {
        BridgeFunction lookup = BridgeFunction.bridged("Lookup", "lookup", ImmutableList.of(STRING), false,
                                                       ImmutableList.of(STRING, BOOL), false, null);
        BridgeModule module = new BridgeModule("example.com/env", "env", ImmutableList.of(lookup));
        String wrapper = WrapperEmitter.bridge("env", module, lookup);
        assertTrue(wrapper.contains("\t_r0, _ok := env.Lookup(rugo_to_string(args[0]))\n"), wrapper);
        assertTrue(wrapper.contains("\tif !_ok {\n\t\treturn nil\n\t}\n"), wrapper);
    }

    @Test
    void bridgeWrapperWithoutResults() {
        BridgeFunction setenv = BridgeFunction.bridged("Setenv", "setenv", ImmutableList.of(STRING, STRING), false,
                                                       ImmutableList.of(), true, null);
        BridgeModule module = new BridgeModule("example.com/env", "env", ImmutableList.of(setenv));
        String wrapper = WrapperEmitter.bridge("env", module, setenv);
        assertTrue(wrapper.contains(
            "\tif _err := env.Setenv(rugo_to_string(args[0]), rugo_to_string(args[1])); _err != nil {\n"), wrapper);
        assertTrue(wrapper.endsWith("\treturn nil\n}\n"), wrapper);
    }
}
