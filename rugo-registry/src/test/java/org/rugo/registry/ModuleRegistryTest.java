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

import java.util.Collections;
import org.junit.jupiter.api.Test;
import org.rugo.registry.bridge.BridgeFunction;
import org.rugo.registry.bridge.BridgeKind;
import org.rugo.registry.bridge.BridgeModule;
import org.rugo.registry.bridge.TypeClassification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleRegistryTest {

    private static BridgeModule bridge(final String importPath) {
        BridgeFunction fn = BridgeFunction.bridged("Echo", "echo",
            Collections.singletonList(TypeClassification.of(BridgeKind.STRING)), false,
            Collections.singletonList(TypeClassification.of(BridgeKind.STRING)), false, null);
        return new BridgeModule(importPath, "echo", Collections.singletonList(fn));
    }

    @Test
    void curatedFunctionsByModule() {
        ModuleRegistry registry = ModuleRegistry.builder()
                                                .curated(new CuratedModuleLoader().load("str"))
                                                .build();
        CuratedModule str = registry.curatedModule("str").orElseThrow();
        assertEquals("rugo_str_upper", str.wrapperName(str.function("upper").orElseThrow()));
        assertFalse(str.function("shout").isPresent());
        assertFalse(registry.curatedModule("nope").isPresent());
    }

    @Test
    void bridgesByImportPath() {
        BridgeModule echo = bridge("example.com/echo");
        ModuleRegistry registry = ModuleRegistry.builder().bridge(echo).build();
        assertSame(echo, registry.bridgeModule("example.com/echo").orElseThrow());
        assertEquals(1, registry.bridgeModules().size());
        assertTrue(registry.curatedModules().isEmpty());
    }

    @Test
    void duplicatesAreRejected() {
        CuratedModuleLoader loader = new CuratedModuleLoader();
        assertThrows(IllegalArgumentException.class,
            () -> ModuleRegistry.builder().curated(loader.load("os")).curated(loader.load("os")));
        assertThrows(IllegalArgumentException.class,
            () -> ModuleRegistry.builder().bridge(bridge("a/echo")).bridge(bridge("a/echo")));
    }

    @Test
    void registryIsASnapshot() {
        ModuleRegistry.Builder builder = ModuleRegistry.builder();
        ModuleRegistry before = builder.build();
        builder.bridge(bridge("late/echo"));
        assertFalse(before.bridgeModule("late/echo").isPresent());
        assertTrue(ModuleRegistry.empty().curatedModules().isEmpty());
    }
}
