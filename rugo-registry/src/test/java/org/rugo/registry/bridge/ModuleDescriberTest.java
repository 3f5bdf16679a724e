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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleDescriberTest {

    private static final String SOURCE = "package text\n"
        + "// Title capitalizes words.\n"
        + "func Title(s string) string { return s }\n"
        + "func Watch(c chan string) {}\n";

    private final ModuleDescriber describer = new ModuleDescriber();

    private BridgeModule module() {
        return new GoBridgeIntrospector().introspect(new GoSourceScanner().scanSource(SOURCE), "example.com/text");
    }

    @Test
    void reportsEveryFunction() {
        ModuleDescriber.ModuleDescription description = describer.describe(module());
        assertEquals("example.com/text", description.getImportPath());
        assertEquals(2, description.getFunctions().size());

        ModuleDescriber.FunctionDescription title = description.getFunctions().get(0);
        assertTrue(title.isBridged());
        assertEquals("title", title.getRugoName());
        assertEquals("(string) string", title.getSignature());
        assertEquals("Title capitalizes words.", title.getDoc());

        ModuleDescriber.FunctionDescription watch = description.getFunctions().get(1);
        assertFalse(watch.isBridged());
        assertEquals("blocked", watch.getTier());
        assertEquals("param 0: channel type", watch.getReason());
    }

    @Test
    void rendersJson() throws Exception {
        String json = describer.toJson(module());
        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("text", root.get("packageName").asText());
        assertEquals("Watch", root.get("functions").get(1).get("goName").asText());
        assertFalse(root.get("functions").get(1).get("bridged").asBoolean());
        assertTrue(json.contains("\n"), "indented output");
    }
}
