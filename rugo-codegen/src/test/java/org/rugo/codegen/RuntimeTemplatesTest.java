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
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeTemplatesTest {

    private final RuntimeTemplates templates = new RuntimeTemplates();

    @Test
    void coreRuntimeAlone() {
        String runtime = templates.runtime(false, false);
        assertTrue(runtime.contains("func rugo_iterable("));
        assertTrue(runtime.contains("func rugo_truthy("));
        assertTrue(runtime.contains("func rugo_fail("));
        assertFalse(runtime.contains("func rugo_spawn("));
        assertFalse(runtime.contains("func rugo_to_error("));
        assertFalse(runtime.contains("Licensed to"), "template comments must not reach the output");
    }

    @Test
    void optionalParts() {
        String runtime = templates.runtime(true, true);
        assertTrue(runtime.contains("func rugo_spawn("));
        assertTrue(runtime.contains("func rugo_parallel("));
        assertTrue(runtime.contains("func rugo_to_error("));
    }

    @Test
    void failuresTakeTheirLineFromTheCallingGoroutine() {
        String runtime = templates.runtime(true, true);
        assertFalse(runtime.contains("rugo_line"), "no package-level line tracker");
        assertTrue(runtime.contains("func rugo_source_line(recovering bool) int {"));
        assertTrue(runtime.contains("runtime.Callers("));
        assertTrue(runtime.contains("line: rugo_source_line(false)"));
        assertTrue(runtime.contains("recovering = f.Function != \"runtime.gopanic\""));
    }

    @Test
    void taskMethods() {
        String runtime = templates.runtime(true, false);
        assertTrue(runtime.contains("func (t *rugoTask) rugoCallMethod(name string, args []interface{}) "
                                        + "(interface{}, bool) {"));
        assertTrue(runtime.contains("\tcase \"value\":\n\t\trugo_check_arity(\"value\", 0, len(args))\n"
                                        + "\t\treturn t.value(), true\n"), runtime);
        assertTrue(runtime.contains("\tcase \"done\":\n\t\trugo_check_arity(\"done\", 0, len(args))\n"
                                        + "\t\treturn t.isDone(), true\n"), runtime);
        assertTrue(runtime.contains("\tcase \"wait\":\n\t\trugo_check_arity(\"wait\", 1, len(args))\n"
                                        + "\t\treturn t.wait(args[0]), true\n"), runtime);
    }

    @Test
    void waitChecksCompletionBeforeTheTimer() {
        String runtime = templates.runtime(true, false);
        int start = runtime.indexOf("func (t *rugoTask) wait(");
        String wait = runtime.substring(start, runtime.indexOf("\n}\n", start));
        assertTrue(wait.indexOf("if t.isDone() {") < wait.indexOf("time.NewTimer("), wait);
        assertTrue(wait.contains("defer timer.Stop()"), wait);
        assertTrue(wait.contains("rugo_fail(\"timeout after %ss\", rugo_to_string(seconds))"), wait);
    }

    @Test
    void parallelFillsPresizedSlotsAndKeepsTheFirstFailure() {
        String runtime = templates.runtime(true, false);
        int start = runtime.indexOf("func rugo_parallel(");
        String parallel = runtime.substring(start, runtime.indexOf("\n}\n", start));
        assertTrue(parallel.contains("results := make([]interface{}, len(branches))"), parallel);
        assertTrue(parallel.contains("results[slot] = run()"), parallel);
        assertTrue(parallel.contains("var once sync.Once"), parallel);
        assertTrue(parallel.contains("once.Do(func() {\n\t\t\t\t\t\tfailure = e\n"), parallel);
        assertTrue(parallel.indexOf("wg.Wait()") < parallel.indexOf("panic(failure)"), parallel);
    }

    @Test
    void programSkeleton() {
        Map<String, Object> model = new HashMap<>();
        model.put("sourceName", "hello.rugo");
        model.put("sourceLiteral", "\"hello.rugo\"");
        model.put("goPackage", "main");
        model.put("imports", ImmutableList.of("\"fmt\"", "\"os\""));
        model.put("silencers", ImmutableList.of());
        model.put("runtime", "");
        model.put("moduleRuntimes", ImmutableList.of());
        model.put("moduleVars", ImmutableList.of());
        model.put("globals", ImmutableList.of("counter"));
        model.put("tests", ImmutableList.of());
        model.put("benches", ImmutableList.of());
        model.put("declarations", "");
        model.put("mainBody", "\trugo_puts(interface{}(\"hi\"))\n");
        String program = templates.program(model);
        assertTrue(program.contains("// Code generated by rugoc from hello.rugo. DO NOT EDIT."), program);
        assertTrue(program.contains("package main"), program);
        assertTrue(program.contains("var counter interface{}"), program);
        assertTrue(program.contains("func main() {"), program);
        assertTrue(program.contains("\trugo_puts(interface{}(\"hi\"))"), program);
    }

    @Test
    void missingTemplate() {
        assertThrows(IllegalStateException.class, () -> templates.render("absent.ftl", new HashMap<>()));
    }
}
