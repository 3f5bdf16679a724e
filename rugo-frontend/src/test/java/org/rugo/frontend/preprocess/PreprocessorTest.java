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

package org.rugo.frontend.preprocess;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.rugo.frontend.ast.StructDecl;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PreprocessorTest {

    private final Preprocessor preprocessor = new Preprocessor();

    private List<String> lines(final String source) {
        return Arrays.asList(preprocessor.preprocess(source).getText().split("\n", -1));
    }

    @Test
    void compoundAssignmentExpands() {
        List<String> out = lines("x = 1\nx += 2\nputs x\n");
        assertEquals("x = x + 2", out.get(1));
        assertEquals("puts(x)", out.get(2));
    }

    @Test
    void topLevelCallsResolveOnlyAfterTheirDefinition() {
        List<String> out = lines("greet\ndef greet()\n  puts \"hi\"\nend\ngreet\n");
        assertEquals("__shell__(\"greet\")", out.get(0), "greet is not defined yet on line 1");
        assertEquals("  puts(\"hi\")", out.get(2));
        assertEquals("greet()", out.get(4));
    }

    @Test
    void functionBodiesSeeLaterFunctions() {
        List<String> out = lines("def a()\n  b\nend\ndef b()\n  return 1\nend\n");
        assertEquals("  b()", out.get(1));
    }

    @Test
    void unknownCommandsFallBackToShell() {
        List<String> out = lines("ls -la\nout = hostname -f\nn = 1\nm = n + 1\n");
        assertEquals("__shell__(\"ls -la\")", out.get(0));
        assertEquals("out = __shell__(\"hostname -f\")", out.get(1));
        assertEquals("m = n + 1", out.get(3), "known variables are never shell commands");
    }

    @Test
    void dottedCallsGetParentheses() {
        List<String> out = lines("use \"str\"\nstr.upper \"x\"\n");
        assertEquals("str.upper(\"x\")", out.get(1));
    }

    @Test
    void heredocKeepsLineNumbers() {
        PreprocessResult result = preprocessor.preprocess("text = <<~EOS\n  hello\n    world\nEOS\nputs text\n");
        List<String> out = Arrays.asList(result.getText().split("\n", -1));
        assertEquals("text = \"hello\\n  world\"", out.get(0));
        assertEquals("", out.get(1));
        assertEquals("", out.get(3));
        assertEquals("puts(text)", out.get(4));
        assertEquals(5, result.originalLine(5));
    }

    @Test
    void rawHeredocIsNotInterpolated() {
        List<String> out = lines("s = <<'EOS'\na#{b}\nEOS\n");
        assertEquals("s = ('a#{b}')", out.get(0));
    }

    @Test
    void unterminatedHeredocIsLeftAlone() {
        List<String> out = lines("s = <<EOS\nabc\n");
        assertEquals("s = <<EOS", out.get(0));
    }

    @Test
    void structBecomesConstructorFunction() {
        PreprocessResult result = preprocessor.preprocess("struct Point\n  x\n  y\nend\np = Point(1, 2)\n");
        assertEquals(1, result.getStructs().size());
        StructDecl point = result.getStructs().get(0);
        assertEquals("Point", point.getName());
        assertEquals(Arrays.asList("x", "y"), point.getFields());
        assertEquals(1, point.getLine());

        List<String> out = Arrays.asList(result.getText().split("\n", -1));
        assertTrue(out.contains("def Point(x, y)"), result.getText());
        assertTrue(out.contains("  return {\"__type__\" => \"Point\", \"x\" => x, \"y\" => y}"), result.getText());
        assertTrue(out.contains("def new(x, y)"), "a single struct also gets new()");
        int call = out.indexOf("p = Point(1, 2)");
        assertEquals(5, result.originalLine(call + 1));
    }

    @Test
    void structMethodsTakeSelf() {
        List<String> out = lines("struct Dog\n  name\nend\ndef Dog.bark(loud)\n  return self.name\nend\n");
        assertTrue(out.contains("def bark(self, loud)"), String.join("\n", out));
    }

    @Test
    void interpolationBecomesConcatenation() {
        List<String> out = lines("name = \"bob\"\nputs \"hi #{name}!\"\n");
        assertEquals("puts((\"hi \" + __to_s(name) + \"!\"))", out.get(1));
    }

    @Test
    void oneLineTryExpandsToBlock() {
        PreprocessResult result = preprocessor.preprocess("v = try risky() or 0\n");
        List<String> out = Arrays.asList(result.getText().split("\n", -1));
        assertEquals(Arrays.asList("v = try", "  risky()", "or _err", "  0", "end"), out.subList(0, 5));
        for (int i = 1; i <= 5; i++) {
            assertEquals(1, result.originalLine(i), "expanded line " + i);
        }
    }

    @Test
    void oneLineSpawnExpandsToBlock() {
        List<String> out = lines("t = spawn work()\n");
        assertEquals(Arrays.asList("t = spawn", "  work()", "end"), out.subList(0, 3));
    }

    @Test
    void postfixIfExpandsToBlock() {
        List<String> out = lines("ok = true\nputs \"yes\" if ok\n");
        assertEquals(Arrays.asList("ok = true", "if ok", "  puts(\"yes\")", "end"), out.subList(0, 4));
    }

    @Test
    void smallSugar() {
        assertEquals("d = __capture__(\"date\")", lines("d = `date`\n").get(0));
        assertEquals("x = \"a # b\"", lines("x = \"a # b\" # note\n").get(0));
        assertEquals("h = {\"name\" => \"x\", \"age\" => 3}", lines("h = {name: \"x\", age: 3}\n").get(0));
        assertEquals("xs = append(xs, 1)", lines("xs = []\nappend xs, 1\n").get(1));
    }

    @Test
    void destructuringUsesTemporary() {
        List<String> out = lines("a, b = pair()\n");
        assertEquals(Arrays.asList("__destr__ = pair()", "a = __destr__[0]", "b = __destr__[1]"), out.subList(0, 3));
    }

    @Test
    void malformedInputPassesThrough() {
        assertDoesNotThrow(() -> preprocessor.preprocess("def (\n  ))) \"unterminated\nend end end\n`\n#{\n"));
        assertDoesNotThrow(() -> preprocessor.preprocess(""));
    }
}
