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

import java.util.ArrayList;
import java.util.List;
import org.rugo.registry.CuratedModule;
import org.rugo.registry.ModuleFunction;
import org.rugo.registry.TypeTag;
import org.rugo.registry.bridge.BridgeFunction;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.TypeClassification;

/**
 * Go wrapper functions adapting dynamic arguments to module and bridged Go signatures. Each
 * wrapper takes {@code ...interface{}} and returns one dynamic value.
 */
final class WrapperEmitter {

    private WrapperEmitter() {
    }

    static String curated(final CuratedModule module, final ModuleFunction function) {
        List<TypeTag> types = function.argTypes();
        GoWriter w = new GoWriter(0);
        w.open("func " + module.wrapperName(function) + "(args ...interface{}) interface{} {");
        if (function.minArgs() > 0) {
            w.open("if len(args) < " + function.minArgs() + " {");
            w.line("rugo_fail(" + GoNames.quote(module.getName() + "." + function.getName()
                + ": requires at least " + function.minArgs() + " argument(s)") + ")");
            w.close("}");
        }
        List<String> callArgs = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            callArgs.add(types.get(i).coerce("args[" + i + "]"));
        }
        if (function.isVariadic()) {
            callArgs.add("args[" + types.size() + ":]...");
        }
        w.line("return " + module.instanceVar() + "." + function.goMethodName() + "(" + String.join(", ", callArgs) + ")");
        w.close("}");
        return w.toString();
    }

    static String bridge(final String alias, final BridgeModule module, final BridgeFunction fn) {
        String label = alias + "." + fn.getRugoName();
        int fixed = fn.fixedArity();
        GoWriter w = new GoWriter(0);
        w.open("func " + BridgeModule.wrapperName(alias, fn) + "(args ...interface{}) interface{} {");
        if (fn.isVariadic()) {
            w.open("if len(args) < " + fixed + " {");
            w.line("rugo_fail(" + GoNames.quote(label + "() takes at least " + fixed + " argument(s) but %d given")
                + ", len(args))");
        } else {
            w.open("if len(args) != " + fixed + " {");
            w.line("rugo_fail(" + GoNames.quote(label + "() takes " + fixed + " argument(s) but %d given")
                + ", len(args))");
        }
        w.close("}");

        List<String> callArgs = new ArrayList<>();
        for (int i = 0; i < fixed; i++) {
            callArgs.add(fn.getParams().get(i).toGo("args[" + i + "]"));
        }
        if (fn.isVariadic()) {
            TypeClassification elem = fn.getParams().get(fixed);
            w.line("_va := make([]" + elem.goTypeName() + ", 0, len(args)-" + fixed + ")");
            w.open("for _, _a := range args[" + fixed + ":] {");
            w.line("_va = append(_va, " + elem.toGo("_a") + ")");
            w.close("}");
            callArgs.add("_va...");
        }
        String call = module.getPackageName() + "." + fn.getGoName() + "(" + String.join(", ", callArgs) + ")";
        String raise = "panic(rugo_bridge_err(" + GoNames.quote(label) + ", _err))";

        List<TypeClassification> returns = fn.getReturns();
        switch (fn.returnShape()) {
            case NONE:
                if (fn.isErrorReturn()) {
                    w.open("if _err := " + call + "; _err != nil {");
                    w.line(raise);
                    w.close("}");
                } else {
                    w.line(call);
                }
                w.line("return nil");
                break;
            case VALUE_OK:
                w.line("_r0, _ok := " + call);
                w.open("if !_ok {");
                w.line("return nil");
                w.close("}");
                w.line("return " + returns.get(0).fromGo("_r0"));
                break;
            case SINGLE:
            case MULTI:
            default:
                List<String> names = new ArrayList<>();
                for (int i = 0; i < returns.size(); i++) {
                    names.add("_r" + i);
                }
                if (fn.isErrorReturn()) {
                    names.add("_err");
                }
                w.line(String.join(", ", names) + " := " + call);
                if (fn.isErrorReturn()) {
                    w.open("if _err != nil {");
                    w.line(raise);
                    w.close("}");
                }
                if (returns.size() == 1) {
                    w.line("return " + returns.get(0).fromGo("_r0"));
                } else {
                    List<String> boxed = new ArrayList<>();
                    for (int i = 0; i < returns.size(); i++) {
                        boxed.add(returns.get(i).fromGo("_r" + i));
                    }
                    w.line("return []interface{}{" + String.join(", ", boxed) + "}");
                }
        }
        w.close("}");
        return w.toString();
    }
}
