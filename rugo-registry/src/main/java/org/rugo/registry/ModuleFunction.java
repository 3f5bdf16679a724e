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
import java.util.stream.Collectors;
import lombok.Data;
import org.rugo.registry.bridge.NameConverter;

/**
 * One function of a curated module, as declared in {@code modules/<name>.yml}.
 */
@Data
public class ModuleFunction {

    private String name;

    /** Type names of the required arguments, see {@link TypeTag}. */
    private List<String> args = new ArrayList<>();

    /** Extra untyped arguments after {@link #args} are passed through. */
    private boolean variadic;

    private String doc;

    public List<TypeTag> argTypes() {
        return args.stream().map(TypeTag::fromYamlName).collect(Collectors.toList());
    }

    public int minArgs() {
        return args.size();
    }

    /**
     * @return the receiver method implementing this function, {@code to_s} → {@code ToS}
     */
    public String goMethodName() {
        return NameConverter.toPascalCase(name);
    }
}
