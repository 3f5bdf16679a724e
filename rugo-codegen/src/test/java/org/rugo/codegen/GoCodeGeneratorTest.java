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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.rugo.frontend.ast.Program;
import org.rugo.frontend.error.CompileException;
import org.rugo.frontend.parser.SourceParser;
import org.rugo.frontend.preprocess.PreprocessResult;
import org.rugo.frontend.preprocess.Preprocessor;
import org.rugo.frontend.walker.AstWalker;
import org.rugo.registry.CuratedModuleLoader;
import org.rugo.registry.ModuleRegistry;
import org.rugo.registry.bridge.BridgeFunction;
import org.rugo.registry.bridge.BridgeKind;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.TypeClassification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoCodeGeneratorTest {

    private ModuleRegistry registry;

    @BeforeEach
    void setUp() {
        TypeClassification string = TypeClassification.of(BridgeKind.STRING);
        TypeClassification integer = TypeClassification.of(BridgeKind.INT);
        BridgeModule strutil = new BridgeModule("example.com/strutil", "strutil", ImmutableList.of(
            BridgeFunction.bridged("Repeat", "repeat", ImmutableList.of(string, integer), false,
                                   ImmutableList.of(string), false, null),
            BridgeFunction.rejected("Walk", "walk", "parameter fn has unsupported type func(string)", null)));
        registry = ModuleRegistry.builder()
                                 .curated(new CuratedModuleLoader().loadAll(ImmutableList.of("str")))
                                 .bridge(strutil)
                                 .build();
    }

    private static Program walk(final String source) {
        PreprocessResult preprocessed = new Preprocessor().preprocess(source);
        return AstWalker.walk(new SourceParser().parse("test.rugo", preprocessed), preprocessed, "test.rugo");
    }

    private String generate(final String source) {
        return new GoCodeGenerator().generate(walk(source), registry).getSource();
    }

    private CompileException failure(final String source) {
        return assertThrows(CompileException.class, () -> generate(source));
    }

    @Test
    void helloWorld() {
        GeneratedProgram program = new GoCodeGenerator().generate(walk("puts \"hello\"\n"), registry);
        String go = program.getSource();
        assertTrue(go.contains("// Code generated by rugoc from test.rugo. DO NOT EDIT."), go);
        assertTrue(go.contains("package main"), go);
        assertTrue(go.contains("func main() {"), go);
        assertTrue(go.contains("\n//line test.rugo:1\n\t_ = rugo_puts(interface{}(\"hello\"))\n"), go);
        assertTrue(program.getImports().contains("fmt"));
        assertFalse(program.getImports().contains("sync"), "no tasks, no sync");
        assertFalse(go.contains("func rugo_spawn("), go);
    }

    @Test
    void outputIsDeterministic() {
        String source = "use \"str\"\n"
            + "def greet(name)\n"
            + "  return \"hi \" + name\n"
            + "end\n"
            + "h = {\"b\" => 1, \"a\" => 2}\n"
            + "for k, v in h\n"
            + "  puts greet(k), str.upper(k), v\n"
            + "end\n";
        GoCodeGenerator generator = new GoCodeGenerator();
        String first = generator.generate(walk(source), registry).getSource();
        assertEquals(first, generator.generate(walk(source), registry).getSource());
        assertEquals(first, new GoCodeGenerator().generate(walk(source), registry).getSource());
    }

    @Test
    void lineComments() {
        String go = new GoCodeGenerator(new RuntimeTemplates(), true, "main")
            .generate(walk("x = 1\nputs x\n"), registry).getSource();
        assertTrue(go.contains("\t// line 2\n//line test.rugo:2\n\t_ = rugo_puts(x)\n"), go);
    }

    @Test
    void functionsHaveFixedArityAndReturnTheirLastValue() {
        String go = generate("def add(a, b)\n  a + b\nend\nputs add(1, 2)\n");
        assertTrue(go.contains("func rugofn_add(a interface{}, b interface{}) interface{} {\n"
                                   + "//line test.rugo:2\n"
                                   + "\treturn rugo_add(a, b)\n"
                                   + "\treturn nil\n"
                                   + "}\n"), go);
        assertTrue(go.contains("rugo_puts(rugofn_add(interface{}(1), interface{}(2)))"), go);
    }

    @Test
    void wrongArityIsACompileError() {
        CompileException e = failure("def add(a, b)\n  return a\nend\nadd(1)\n");
        assertEquals(4, e.getLine());
        assertEquals("add() takes 2 argument(s) but 1 given", e.getMessage());
        assertEquals("test.rugo:4: add() takes 2 argument(s) but 1 given", e.toUserMessage());
    }

    @Test
    void builtinArity() {
        CompileException e = failure("puts len(1, 2)\n");
        assertEquals("len() takes 1 argument(s) but 2 given", e.getMessage());
    }

    @Test
    void duplicateFunction() {
        CompileException e = failure("def f()\n  return 1\nend\ndef f()\n  return 2\nend\n");
        assertEquals(4, e.getLine());
        assertEquals("function \"f\" already defined at line 1", e.getMessage());
    }

    @Test
    void nestedDefinition() {
        CompileException e = failure("if true\n  def f()\n    return 1\n  end\nend\n");
        assertEquals(2, e.getLine());
        assertEquals("definitions are only allowed at the top level", e.getMessage());
    }

    @Test
    void firstAssignmentDeclares() {
        String go = generate("x = 1\nx = x + 2\nputs x\n");
        assertTrue(go.contains("\tx := interface{}(1)\n\t_ = x\n"), go);
        assertTrue(go.contains("\tx = rugo_add(x, interface{}(2))\n"), go);
    }

    @Test
    void variablesFirstSetInABlockAreHoisted() {
        String go = generate("if true\n  y = 1\nelse\n  y = 2\nend\nputs y\n");
        assertTrue(go.contains("\tvar y interface{}\n\t_ = y\n"), go);
        assertTrue(go.contains("\t\ty = interface{}(1)\n\t} else {\n//line test.rugo:4\n\t\ty = interface{}(2)\n\t}\n"),
                   go);
        assertTrue(go.contains("rugo_puts(y)"), go);
    }

    @Test
    void constantsCannotBeReassigned() {
        CompileException e = failure("MAX = 1\nputs MAX\nMAX = 2\n");
        assertEquals(3, e.getLine());
        assertEquals("cannot reassign constant MAX (first assigned at line 1)", e.getMessage());

        CompileException nested = failure("LIMIT = 1\nif true\n  LIMIT = 2\nend\n");
        assertEquals(3, nested.getLine());
        assertEquals("cannot reassign constant LIMIT (first assigned at line 1)", nested.getMessage());
    }

    @Test
    void promotedConstantsCannotBeReassignedFromFunctions() {
        CompileException e = failure("LIMIT = 10\ndef grow()\n  LIMIT = 20\nend\ngrow()\n");
        assertEquals(3, e.getLine());
        assertEquals("cannot reassign constant LIMIT (first assigned at line 1)", e.getMessage());
    }

    @Test
    void constantsAreScopedAndLowercaseNamesAreNot() {
        String go = generate("def a()\n  N = 1\n  return N\nend\ndef b()\n  N = 2\n  return N\nend\n"
                                 + "puts a(), b()\nx = 1\nx = 2\n");
        assertTrue(go.contains("\tN := interface{}(1)\n"), go);
        assertTrue(go.contains("\tN := interface{}(2)\n"), go);
        assertTrue(go.contains("\tx = interface{}(2)\n"), go);
    }

    @Test
    void sliceGoesThroughTheRuntime() {
        String go = generate("a = [1, 2, 3]\nputs a[0, 2]\nputs a[1]\n");
        assertTrue(go.contains("rugo_puts(rugo_slice(a, interface{}(0), interface{}(2)))"), go);
        assertTrue(go.contains("rugo_puts(rugo_index(a, interface{}(1)))"), go);
        assertTrue(go.contains("func rugo_slice(obj, start, length interface{}) interface{} {"), go);
    }

    @Test
    void topLevelVariablesUsedByFunctionsArePromoted() {
        String go = generate("count = 0\ndef bump()\n  count = count + 1\nend\nbump()\nputs count\n");
        assertTrue(go.contains("var count interface{}\n"), go);
        assertTrue(go.contains("\tcount = interface{}(0)\n"), go);
        assertFalse(go.contains("count := "), go);
        assertTrue(go.contains("\tcount = rugo_add(count, interface{}(1))\n"), go);
    }

    @Test
    void namesThatClashWithGoArePrefixedOrSuffixed() {
        String go = generate("type = 1\n_tmp = 2\nputs type, _tmp\n");
        assertTrue(go.contains("\ttype_ := interface{}(1)\n"), go);
        assertTrue(go.contains("\tv_tmp := interface{}(2)\n"), go);
    }

    @Test
    void forLoopWithIndex() {
        String go = generate("for i, v in [10, 20]\n  puts i, v\nend\n");
        assertTrue(go.contains("for _, _it1 := range rugo_iterable(interface{}([]interface{}{interface{}(10), "
                                   + "interface{}(20)})) {\n"), go);
        assertTrue(go.contains("\t\ti = _it1.key\n"), go);
        assertTrue(go.contains("\t\tv = _it1.value\n"), go);
    }

    @Test
    void breakInsideAndOutsideLoops() {
        String go = generate("i = 0\nwhile i < 3\n  i = i + 1\n  break\nend\n");
        assertTrue(go.contains("\tfor rugo_truthy(rugo_lt(i, interface{}(3))) {\n"), go);
        assertTrue(go.contains("\t\tbreak\n"), go);

        CompileException e = failure("break\n");
        assertEquals("break outside of a loop", e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    void logicalOperatorsShortCircuit() {
        String go = generate("a = nil\nb = a || 5\nputs b\n");
        assertTrue(go.contains("rugo_or(a, func() interface{} { return interface{}(5) })"), go);
    }

    @Test
    void undefinedIdentifier() {
        CompileException e = failure("puts nope\n");
        assertEquals("undefined: nope", e.getMessage());
        assertEquals(1, e.getLine());
    }

    @Test
    void curatedModuleCallGoesThroughAWrapper() {
        String go = generate("use \"str\"\nputs str.upper(\"hi\")\n");
        assertTrue(go.contains("func rugo_str_upper(args ...interface{}) interface{} {"), go);
        assertTrue(go.contains("rugo_puts(rugo_str_upper(interface{}(\"hi\")))"), go);
        assertTrue(go.contains("var _str = &Str{}"), go);
        assertTrue(go.contains("\"unicode/utf8\""), go);
        assertFalse(go.contains("func rugo_str_lower("), "only called functions get wrappers");
    }

    @Test
    void curatedModuleErrors() {
        assertEquals("unknown module \"nope\"", failure("use \"nope\"\n").getMessage());
        assertEquals("str.upper() takes 1 argument(s) but 2 given",
                     failure("use \"str\"\nputs str.upper(\"a\", \"b\")\n").getMessage());
        assertEquals("undefined: str.shout", failure("use \"str\"\nputs str.shout(\"a\")\n").getMessage());
        assertEquals("undefined: str", failure("puts str.upper(\"a\")\n").getMessage());
    }

    @Test
    void bridgedGoCall() {
        GeneratedProgram program = new GoCodeGenerator().generate(
            walk("import \"example.com/strutil\"\nputs strutil.repeat(\"ab\", 3)\n"), registry);
        String go = program.getSource();
        assertTrue(program.getImports().contains("example.com/strutil"));
        assertTrue(go.contains("var _ = strutil.Repeat\n"), go);
        assertTrue(go.contains("rugo_puts(rugo_bridge_strutil_repeat(interface{}(\"ab\"), interface{}(3)))"), go);
        assertTrue(go.contains("func rugo_bridge_strutil_repeat(args ...interface{}) interface{} {"), go);
        assertTrue(go.contains("func rugo_to_error("), "bridge conversions are included");
    }

    @Test
    void bridgeErrors() {
        assertEquals("Go package \"example.com/missing\" is not registered for bridging",
                     failure("import \"example.com/missing\"\n").getMessage());
        assertEquals("strutil.walk cannot be called from Rugo: parameter fn has unsupported type func(string)",
                     failure("import \"example.com/strutil\"\nstrutil.walk(\"x\")\n").getMessage());
        assertEquals("strutil.repeat() takes 2 argument(s) but 1 given",
                     failure("import \"example.com/strutil\"\nputs strutil.repeat(\"ab\")\n").getMessage());
    }

    @Test
    void parallelKeepsStatementOrder() {
        GeneratedProgram program = new GoCodeGenerator().generate(
            walk("r = parallel\n  1 + 2\n  3\nend\nputs r\n"), registry);
        String go = program.getSource();
        int first = go.indexOf("return rugo_add(interface{}(1), interface{}(2))");
        int second = go.indexOf("return interface{}(3)");
        assertTrue(go.contains("r := rugo_parallel(func() interface{} {"), go);
        assertTrue(first > 0 && second > first, go);
        assertTrue(program.getImports().contains("sync"));
        assertTrue(go.contains("func rugo_parallel("), go);
    }

    @Test
    void spawnRunsItsBodyInAClosure() {
        String go = generate("t = spawn\n  x = 1\n  x + 1\nend\nputs t.value\n");
        assertTrue(go.contains("t := interface{}(rugo_spawn(func() interface{} {"), go);
        assertTrue(go.contains("\t\tx := interface{}(1)\n"), go);
        assertTrue(go.contains("\t\treturn rugo_add(x, interface{}(1))\n"), go);
        assertTrue(go.contains("rugo_puts(rugo_dot_get(t, \"value\"))"), go);
    }

    @Test
    void functionsCalledFromTasksKeepLinesOutOfSharedState() {
        String go = generate("def work(n)\n  x = n * 2\n  return x\nend\nt = spawn work(1)\nputs t.value\n");
        assertFalse(go.contains("rugo_line"), go);
        assertTrue(go.contains("func rugofn_work(n interface{}) interface{} {\n"
                                   + "//line test.rugo:2\n"
                                   + "\tx := rugo_mul(n, interface{}(2))\n"), go);
        assertTrue(go.contains("//line test.rugo:3\n\treturn x\n"), go);
        assertTrue(go.contains("t := interface{}(rugo_spawn(func() interface{} {\n"
                                   + "//line test.rugo:5\n"
                                   + "\t\treturn rugofn_work(interface{}(1))\n"
                                   + "\t\treturn nil\n"
                                   + "\t}/*line test.rugo:5:1*/))\n"), go);
        assertTrue(go.contains("//line test.rugo:6\n\t_ = rugo_puts(rugo_dot_get(t, \"value\"))\n"), go);
    }

    @Test
    void taskMethodsDispatchAtRuntime() {
        String go = generate("t = spawn\n  1\nend\nputs t.done\nputs t.wait(2)\nputs t.value\n");
        assertTrue(go.contains("rugo_puts(rugo_dot_get(t, \"done\"))"), go);
        assertTrue(go.contains("rugo_puts(rugo_dot_call(t, \"wait\", interface{}(2)))"), go);
        assertTrue(go.contains("rugo_puts(rugo_dot_get(t, \"value\"))"), go);
        assertTrue(go.contains("func (t *rugoTask) rugoCallMethod("), go);
    }

    @Test
    void emptySpawnIsAlreadyResolved() {
        String go = generate("t = spawn\nend\nputs t.value()\n");
        assertTrue(go.contains("t := interface{}(rugo_task_resolved())"), go);
        assertTrue(go.contains("rugo_dot_call(t, \"value\")"), go);
    }

    @Test
    void tryRecoversIntoTheHandler() {
        String go = generate("def risky()\n  raise \"boom\"\nend\nv = try risky() or 0\nputs v\n");
        assertTrue(go.contains("func() (_res interface{}) {"), go);
        assertTrue(go.contains("(rugo_error_of(_r).msg)"), go);
        assertTrue(go.contains("return rugofn_risky()"), go);
        assertTrue(go.contains("return interface{}(0)"), go);
    }

    @Test
    void lambdasCheckTheirArity() {
        String go = generate("f = fn(x)\n  x * 2\nend\nputs f(3)\n");
        assertTrue(go.contains("f := interface{}(func(_args ...interface{}) interface{} {"), go);
        assertTrue(go.contains("rugo_check_arity(\"fn\", 1, len(_args))"), go);
        assertTrue(go.contains("rugo_puts(rugo_call(f, interface{}(3)))"), go);
    }

    @Test
    void methodsDispatchThroughSelf() {
        String go = generate("def area(self)\n  return self.w * self.h\nend\n"
                                 + "r = {\"w\" => 2, \"h\" => 3}\nputs r.area()\n");
        assertTrue(go.contains("return rugo_mul(rugo_dot_get(self, \"w\"), rugo_dot_get(self, \"h\"))"), go);
        assertTrue(go.contains("rugo_puts(rugofn_area(r))"), go);
    }

    @Test
    void testsAndBenchesAreTabulated() {
        String go = generate("rats \"adds\"\n  puts 1 + 1\nend\nbench \"loop\"\n  puts 2\nend\n");
        assertTrue(go.contains("\t{\"adds\", rugotest_1},\n"), go);
        assertTrue(go.contains("\t{\"loop\", rugobench_1},\n"), go);
        assertTrue(go.contains("func rugotest_1() {\n"), go);
        assertTrue(go.contains("func rugobench_1() {\n"), go);
    }

    @Test
    void emptyProgram() {
        GeneratedProgram program = new GoCodeGenerator().generate(walk(""), ModuleRegistry.empty());
        assertTrue(program.getSource().contains("func main() {"));
        assertTrue(program.getImports().contains("fmt"));
        assertTrue(program.getSource().trim().endsWith("\t}()\n}"), "main holds only the recover handler");
    }
}
