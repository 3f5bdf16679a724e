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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoTypeClassifierTest {

    private static final GoPackage PKG = new GoSourceScanner().scanSource(
        "package temp\n"
            + "type Celsius float64\n"
            + "type Label = string\n"
            + "type Names []string\n"
            + "type Box[T any] struct { v T }\n"
            + "type Pair struct { A, B int }\n"
            + "type View struct { s string }\n"
            + "func (v View) String() string { return v.s }\n"
            + "func NewView(s string) View { return View{s} }\n"
            + "type Raw struct { s string }\n"
            + "func (r Raw) String() string { return r.s }\n");

    private final GoTypeClassifier classifier = new GoTypeClassifier();

    private TypeClassification param(final String type) {
        return classifier.classify(GoTypeParser.parse(type), true, PKG);
    }

    private TypeClassification result(final String type) {
        return classifier.classify(GoTypeParser.parse(type), false, PKG);
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "string, STRING, AUTO",
        "int, INT, AUTO",
        "float64, FLOAT64, AUTO",
        "bool, BOOL, AUTO",
        "int64, INT64, CASTABLE",
        "uint8, BYTE, CASTABLE",
        "rune, RUNE, CASTABLE",
        "float32, FLOAT32, CASTABLE",
        "[]string, STRING_SLICE, AUTO",
        "[]byte, BYTE_SLICE, CASTABLE",
        "interface{}, ANY, AUTO",
        "any, ANY, AUTO",
        "time.Duration, DURATION, CASTABLE"
    })
    void bridgeableTypes(final String type, final BridgeKind kind, final Tier tier) {
        TypeClassification t = param(type);
        assertEquals(kind, t.getKind());
        assertEquals(tier, t.getTier());
        assertNull(t.getReason());
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
        "*int | pointer to int",
        "chan int | channel type",
        "<-chan string | channel type",
        "map[string]int | map type",
        "struct{ a int } | struct type",
        "interface{ Close() error } | interface type",
        "func(string) bool | function parameter",
        "[]int | unsupported slice type []int",
        "[4]int | array type [4]int",
        "[32]byte | array param type [32]byte",
        "complex128 | unsupported type complex128",
        "io.Reader | external type io.Reader",
        "Box[int] | generic type Box[int]",
        "Box | generic type Box",
        "Pair | struct type temp.Pair",
        "Raw | struct type temp.Raw has no NewRaw(string) constructor"
    })
    void blockedParams(final String type, final String reason) {
        TypeClassification t = param(type);
        assertTrue(t.isBlocked(), type);
        assertEquals(reason, t.getReason());
    }

    @Test
    void byteArrayResultBecomesString() {
        TypeClassification t = result("[32]byte");
        assertEquals(BridgeKind.BYTE_ARRAY, t.getKind());
        assertEquals("func() interface{} { _b := x; return interface{}(string(_b[:])) }()", t.fromGo("x"));
    }

    @Test
    void localNamedTypeIsCast() {
        TypeClassification t = param("Celsius");
        assertEquals(BridgeKind.FLOAT64, t.getKind());
        assertEquals(Tier.CASTABLE, t.getTier());
        assertEquals("temp.Celsius(rugo_to_float(a))", t.toGo("a"));
        assertEquals("interface{}(float64(r))", t.fromGo("r"));

        TypeClassification names = param("Names");
        assertEquals("temp.Names(rugo_go_to_string_slice(a))", names.toGo("a"));
    }

    @Test
    void aliasNeedsNoCast() {
        TypeClassification t = param("Label");
        assertEquals(BridgeKind.STRING, t.getKind());
        assertNull(t.getCast());
        assertEquals("rugo_to_string(a)", t.toGo("a"));
    }

    @Test
    void stringView() {
        TypeClassification p = param("View");
        assertEquals(BridgeKind.STRING_VIEW, p.getKind());
        assertEquals("temp.NewView(rugo_to_string(a))", p.toGo("a"));

        TypeClassification r = result("Raw");
        assertEquals(BridgeKind.STRING_VIEW, r.getKind(), "results only need the accessor");
        assertEquals("interface{}(r.String())", r.fromGo("r"));
    }

    @Test
    void castableConversions() {
        assertEquals("int64(rugo_to_int(a))", param("int64").toGo("a"));
        assertEquals("interface{}(int(r))", param("int64").fromGo("r"));
        assertEquals("time.Duration(rugo_to_int(a)) * time.Millisecond", param("time.Duration").toGo("a"));
        assertEquals("time", BridgeKind.DURATION.requiredImport());
    }
}
