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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoSourceScannerTest {

    private final GoSourceScanner scanner = new GoSourceScanner();

    @Test
    void readsPackageFunctionsAndDocs() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "\n"
                + "import \"strings\"\n"
                + "\n"
                + "// Upper returns s\n"
                + "// in upper case.\n"
                + "func Upper(s string) string {\n"
                + "\treturn strings.ToUpper(s)\n"
                + "}\n");
        assertEquals("demo", pkg.getName());
        GoFuncDecl upper = pkg.function("Upper").orElseThrow();
        assertEquals("Upper returns s in upper case.", upper.getDoc());
        assertEquals(1, upper.getParams().size());
        assertEquals("s", upper.getParams().get(0).getName());
        assertTrue(upper.getParams().get(0).getType().isNamed("string"));
        assertEquals(1, upper.getResults().size());
        assertNull(upper.getParseError());
    }

    @Test
    void groupedParamsAndResults() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "func Pair(a, b int, names ...string) (x int, err error) { return 0, nil }\n");
        GoFuncDecl pair = pkg.function("Pair").orElseThrow();
        List<GoParam> params = pair.getParams();
        assertEquals(3, params.size());
        assertTrue(params.get(0).getType().isNamed("int"), "a takes the type of b");
        assertTrue(params.get(2).isVariadic());
        assertTrue(params.get(2).getType().isNamed("string"));
        assertTrue(pair.isVariadic());
        assertEquals(2, pair.getResults().size());
        assertTrue(pair.getResults().get(1).isNamed("error"));
    }

    @Test
    void bracesInsideLiteralsAndCommentsDoNotEndBodies() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "func A() string {\n"
                + "\ts := \"}\" + `{{` + string('}')\n"
                + "\t// }\n"
                + "\t/* func B() {} */\n"
                + "\treturn s\n"
                + "}\n"
                + "func C() {}\n");
        assertEquals(2, pkg.getFuncs().size());
        assertTrue(pkg.function("C").isPresent());
        assertFalse(pkg.function("B").isPresent());
    }

    @Test
    void methodsAndGenerics() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "type List[T any] struct { items []T }\n"
                + "func (l *List[T]) Len() int { return len(l.items) }\n"
                + "func Map[T, U any](in []T, f func(T) U) []U { return nil }\n");
        GoFuncDecl len = pkg.method("List", "Len").orElseThrow();
        assertTrue(len.isPointerReceiver());
        assertTrue(len.isMethod());
        assertTrue(pkg.function("Map").orElseThrow().isGeneric());
        assertTrue(pkg.type("List").orElseThrow().isGeneric());
    }

    @Test
    void typeDeclarations() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "type (\n"
                + "\tCelsius float64\n"
                + "\tAlias = string\n"
                + "\tPoint struct {\n"
                + "\t\tX, Y int\n"
                + "\t}\n"
                + ")\n"
                + "type Buf [16]byte\n"
                + "type Handler func(string) error\n");
        assertEquals(GoType.Kind.NAME, pkg.type("Celsius").orElseThrow().getUnderlying().getKind());
        assertTrue(pkg.type("Alias").orElseThrow().isAlias());
        assertEquals(2, pkg.type("Point").orElseThrow().getUnderlying().getMemberCount());
        GoTypeDecl buf = pkg.type("Buf").orElseThrow();
        assertFalse(buf.isGeneric(), "[16] is an array length, not a type parameter list");
        assertEquals(GoType.Kind.ARRAY, buf.getUnderlying().getKind());
        assertEquals(GoType.Kind.FUNC, pkg.type("Handler").orElseThrow().getUnderlying().getKind());
    }

    @Test
    void unreadableSignatureIsRecordedNotThrown() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "func Broken(a int, b) {}\n"
                + "func Fine() {}\n");
        GoFuncDecl broken = pkg.function("Broken").orElseThrow();
        assertNotNull(broken.getParseError());
        assertTrue(pkg.function("Fine").isPresent());
    }

    @Test
    void resultTypeOnItsOwn() {
        GoPackage pkg = scanner.scanSource(
            "package demo\n"
                + "func Ch() <-chan int { return nil }\n"
                + "func Fn() func(int) (string, error) { return nil }\n");
        assertEquals(GoType.Kind.CHAN, pkg.function("Ch").orElseThrow().getResults().get(0).getKind());
        assertEquals(GoType.Kind.FUNC, pkg.function("Fn").orElseThrow().getResults().get(0).getKind());
    }
}
