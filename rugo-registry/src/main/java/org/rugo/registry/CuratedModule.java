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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;

/**
 * A module shipped with the compiler and enabled with {@code use "name"}. The Go runtime text
 * declares {@link #type} and one method per function; calls go through generated wrappers
 * named {@code rugo_<module>_<fn>}.
 */
@Data
public class CuratedModule {

    private String name;

    /** Go receiver type declared by the runtime text. */
    private String type;

    private String doc;

    private List<String> goImports = new ArrayList<>();

    private List<ModuleFunction> functions = new ArrayList<>();

    /** Go source of the receiver type and its methods, without package clause or imports. */
    private String runtime;

    public Optional<ModuleFunction> function(final String fnName) {
        return functions.stream().filter(f -> f.getName().equals(fnName)).findFirst();
    }

    public String wrapperName(final ModuleFunction function) {
        return "rugo_" + name + "_" + function.getName();
    }

    /** Go variable holding the receiver instance. */
    public String instanceVar() {
        return "_" + name;
    }
}
