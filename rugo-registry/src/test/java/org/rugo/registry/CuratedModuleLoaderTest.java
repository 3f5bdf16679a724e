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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CuratedModuleLoaderTest {

    private final CuratedModuleLoader loader = new CuratedModuleLoader();

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"str", "conv", "math", "base64", "os"})
    void shippedModulesLoad(final String name) {
        CuratedModule module = loader.load(name);
        assertEquals(name, module.getName());
        assertFalse(module.getFunctions().isEmpty());
        assertTrue(module.getRuntime().contains("type " + module.getType() + " struct{}"), module.getRuntime());
        for (ModuleFunction fn : module.getFunctions()) {
            assertTrue(module.getRuntime().contains(") " + fn.goMethodName() + "("),
                name + " runtime lacks method " + fn.goMethodName());
        }
        for (String goImport : module.getGoImports()) {
            String pkg = goImport.substring(goImport.lastIndexOf('/') + 1);
            assertTrue(module.getRuntime().contains(pkg + "."), name + " never uses import " + goImport);
        }
    }

    @Test
    void functionSignatures() {
        CuratedModule str = loader.load("str");
        ModuleFunction padLeft = str.function("pad_left").orElseThrow();
        assertTrue(padLeft.isVariadic());
        assertEquals(2, padLeft.minArgs());
        assertEquals(Arrays.asList(TypeTag.STRING, TypeTag.INT), padLeft.argTypes());
        assertEquals("PadLeft", padLeft.goMethodName());
        assertEquals("rugo_str_pad_left", str.wrapperName(padLeft));
        assertEquals("_str", str.instanceVar());

        ModuleFunction pi = loader.load("math").function("pi").orElseThrow();
        assertEquals(0, pi.minArgs());
    }

    @Test
    void loadAllKeepsOrder() {
        List<CuratedModule> modules = loader.loadAll(Arrays.asList("os", "str"));
        assertEquals("os", modules.get(0).getName());
        assertEquals("str", modules.get(1).getName());
    }

    @Test
    void unknownModule() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load("nope"));
        assertTrue(e.getMessage().contains("modules/nope.yml"), e.getMessage());
    }

    @Test
    void typeTagCoercion() {
        assertEquals("rugo_to_int(args[1])", TypeTag.INT.coerce("args[1]"));
        assertEquals("args[0]", TypeTag.ANY.coerce("args[0]"));
        assertEquals(TypeTag.FLOAT, TypeTag.fromYamlName("Float"));
        assertThrows(IllegalArgumentException.class, () -> TypeTag.fromYamlName("long"));
    }
}
