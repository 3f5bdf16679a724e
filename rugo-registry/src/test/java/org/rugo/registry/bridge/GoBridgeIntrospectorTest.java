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

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoBridgeIntrospectorTest {

    private static BridgeModule module;

    private static Map<String, BridgeFunction> byGoName;

    static Path fixture(final String name) throws URISyntaxException {
        return Paths.get(GoBridgeIntrospectorTest.class.getClassLoader().getResource("gofixtures/" + name).toURI());
    }

    @BeforeAll
    static void introspect() throws Exception {
        module = new GoBridgeIntrospector().introspect(fixture("strutil"), "example.com/strutil");
        byGoName = module.getFunctions().stream()
                         .collect(Collectors.toMap(BridgeFunction::getGoName, Function.identity()));
    }

    @Test
    void onlyExportedPackageFunctions() {
        assertEquals("strutil", module.getPackageName());
        assertFalse(byGoName.containsKey("helper"));
        assertFalse(byGoName.containsKey("String"), "methods are not bridged");
        assertFalse(byGoName.containsKey("TestShout"), "_test.go files are skipped");
        assertFalse(byGoName.containsKey("Fake"), "declarations inside strings are ignored");
        assertEquals("Shout", module.getFunctions().get(0).getGoName(), "source order is kept");
    }

    @Test
    void stringToString() {
        BridgeFunction shout = module.function("shout").orElseThrow();
        assertTrue(shout.isBridgeable());
        assertEquals(Tier.AUTO, shout.getTier());
        assertEquals(BridgeKind.STRING, shout.getParams().get(0).getKind());
        assertEquals(BridgeFunction.ReturnShape.SINGLE, shout.returnShape());
        assertEquals("Shout upper-cases s. It also appends \"!\".", shout.getDoc());
        assertEquals("(string) string", shout.signature());
    }

    @Test
    void returnShapes() {
        BridgeFunction repeat = byGoName.get("Repeat");
        assertTrue(repeat.isErrorReturn());
        assertEquals(BridgeFunction.ReturnShape.SINGLE, repeat.returnShape());
        assertEquals("(string, int) string, error", repeat.signature());

        assertEquals(BridgeFunction.ReturnShape.VALUE_OK, byGoName.get("Lookup").returnShape());
        assertEquals(BridgeFunction.ReturnShape.NONE, byGoName.get("Log").returnShape());

        BridgeFunction validate = byGoName.get("Validate");
        assertEquals(BridgeFunction.ReturnShape.NONE, validate.returnShape());
        assertTrue(validate.isErrorReturn());
    }

    @Test
    void variadicParams() {
        BridgeFunction sum = byGoName.get("Sum");
        assertTrue(sum.isVariadic());
        assertEquals(0, sum.fixedArity());
        BridgeFunction join = byGoName.get("Join");
        assertEquals(1, join.fixedArity());
        assertEquals("(string, ...string) string", join.signature());
    }

    @Test
    void castableFunctions() {
        assertEquals(Tier.CASTABLE, byGoName.get("Trim").getTier());
        assertEquals(Tier.CASTABLE, byGoName.get("Warmer").getTier());
        assertEquals("strutil.Celsius", byGoName.get("Warmer").getParams().get(0).getCast());
        assertEquals(BridgeKind.DURATION, byGoName.get("Pause").getParams().get(0).getKind());
        assertEquals(BridgeKind.BYTE_ARRAY, byGoName.get("Digest").getReturns().get(0).getKind());
        assertEquals(Tier.AUTO, byGoName.get("Words").getTier());
    }

    @Test
    void acronymNames() {
        assertEquals("http_get", byGoName.get("HTTPGet").getRugoName());
        assertTrue(module.function("http_get").isPresent());
        assertTrue(module.function("HTTPGet").isPresent(), "Go names resolve too");
    }

    @Test
    void stringViewParam() {
        BridgeFunction greet = byGoName.get("Greet");
        assertTrue(greet.isBridgeable(), String.valueOf(greet.getReason()));
        assertEquals("*strutil.NewNameView(rugo_to_string(args[0]))", greet.getParams().get(0).toGo("args[0]"));
        assertEquals("interface{}(r.String())", greet.getReturns().get(0).fromGo("r"));
    }

    @Test
    void rejectionsNameTheCategory() {
        assertEquals("param 0: pointer to Thing", byGoName.get("Describe").getReason());
        assertEquals("param 0: channel type", byGoName.get("Drain").getReason());
        assertEquals("param 0: map type", byGoName.get("Keys").getReason());
        assertEquals("param 1: function parameter", byGoName.get("Apply").getReason());
        assertEquals("return 0: pointer to NameView", byGoName.get("NewNameView").getReason());
        assertEquals("generic function", byGoName.get("Identity").getReason());
        assertFalse(module.function("drain").isPresent());
        assertNull(byGoName.get("Shout").getReason());
    }

    @Test
    void packageWithNothingBridgeable() {
        BridgeException e = assertThrows(BridgeException.class,
            () -> new GoBridgeIntrospector().introspect(fixture("blocked"), "example.com/blocked"));
        assertEquals("example.com/blocked", e.getImportPath());
        assertEquals(3, e.getReasons().size());
        assertEquals("Open: return 0: pointer to Conn", e.getReasons().get(0));
        assertTrue(e.getMessage().contains("Stream: param 0: channel type"), e.getMessage());
        assertTrue(e.getMessage().contains("Config: return 0: map type"), e.getMessage());
    }

    @Test
    void rugoNameCollision() {
        GoPackage pkg = new GoSourceScanner().scanSource(
            "package clash\n"
                + "func GetURL() string { return \"\" }\n"
                + "func GetUrl() string { return \"\" }\n");
        BridgeModule clash = new GoBridgeIntrospector().introspect(pkg, "clash");
        assertEquals(1, clash.bridged().size());
        assertEquals("rugo name get_url already used by GetURL", clash.getFunctions().get(1).getReason());
    }

    @Test
    void directoryWithoutGoFiles(@TempDir final Path dir) throws IOException {
        Files.writeString(dir.resolve("README.md"), "nothing here");
        assertThrows(BridgeException.class, () -> new GoBridgeIntrospector().introspect(dir, "empty"));
    }

    @Test
    void defaultAliasSkipsVersionSuffix() {
        assertEquals("rand", BridgeModule.defaultAlias("math/rand/v2"));
        assertEquals("strutil", module.defaultAlias());
        assertEquals("rugo_bridge_su_shout", BridgeModule.wrapperName("su", byGoName.get("Shout")));
    }
}
